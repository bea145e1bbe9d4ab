/*
 * Copyright 2024-2025, The Eligian Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package eligian.lsp.util;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;

/**
 * Read client settings, which arrive as untyped JSON.
 */
public class JsonUtils {

    public static Boolean getBoolean(Object json, String path) {
        var value = getObjectPath(json, path);
        if( value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isBoolean() )
            return null;
        return value.getAsBoolean();
    }

    public static Integer getInteger(Object json, String path) {
        var value = getObjectPath(json, path);
        if( value == null || !value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber() )
            return null;
        return value.getAsInt();
    }

    public static String getString(Object json, String path) {
        var value = getObjectPath(json, path);
        if( value == null || !value.isJsonPrimitive() )
            return null;
        return value.getAsString();
    }

    /**
     * Resolve a dotted path such as {@code eligian.completion.maxItems}.
     *
     * @param json
     * @param path
     */
    private static JsonElement getObjectPath(Object json, String path) {
        if( !(json instanceof JsonObject) )
            return null;

        var object = (JsonObject) json;
        var names = path.split("\\.");
        for( int i = 0; i < names.length - 1; i++ ) {
            var scope = names[i];
            if( !object.has(scope) || !object.get(scope).isJsonObject() )
                return null;
            object = object.getAsJsonObject(scope);
        }

        var property = names[names.length - 1];
        if( !object.has(property) )
            return null;
        return object.get(property);
    }

}
