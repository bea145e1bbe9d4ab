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
package eligian.script.ir;

import java.util.List;
import java.util.Map;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonNull;
import com.google.gson.JsonObject;
import com.google.gson.JsonPrimitive;

/**
 * Conversions between compile-time values and JSON.
 */
public class JsonValues {

    /**
     * Convert a value to JSON. Integral numbers are written
     * without a fraction.
     *
     * @param value a String, Number, Boolean, List, Map or null
     */
    public static JsonElement asJson(Object value) {
        if( value == null )
            return JsonNull.INSTANCE;
        if( value instanceof JsonElement je )
            return je;
        if( value instanceof Boolean b )
            return new JsonPrimitive(b);
        if( value instanceof Number n )
            return asJsonNumber(n.doubleValue());
        if( value instanceof String s )
            return new JsonPrimitive(s);
        if( value instanceof List<?> list ) {
            var result = new JsonArray();
            for( var item : list )
                result.add(asJson(item));
            return result;
        }
        if( value instanceof Map<?,?> map ) {
            var result = new JsonObject();
            for( var entry : map.entrySet() )
                result.add(String.valueOf(entry.getKey()), asJson(entry.getValue()));
            return result;
        }
        return new JsonPrimitive(value.toString());
    }

    /**
     * Convert a number to JSON. NaN and infinite values have no
     * JSON representation and are written as null.
     *
     * @param value
     */
    public static JsonElement asJsonNumber(double value) {
        if( Double.isNaN(value) || Double.isInfinite(value) )
            return JsonNull.INSTANCE;
        if( value == Math.rint(value) && Math.abs(value) < 1e15 )
            return new JsonPrimitive((long) value);
        return new JsonPrimitive(value);
    }

}
