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
package eligian.script.dsl;

import java.io.IOException;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;
import com.google.gson.JsonPrimitive;

/**
 * Load operation signatures from the engine metadata.
 *
 * The metadata is generated from the engine's operation
 * declarations and bundled as {@code spec/operations.json}.
 */
public class OperationSpecFactory {

    private static final String RESOURCE = "spec/operations.json";

    private static Map<String,OperationSignature> defaultOperations = null;

    /**
     * Load the built-in operations from the bundled metadata.
     */
    public static Map<String,OperationSignature> defaultOperations() {
        if( defaultOperations == null )
            defaultOperations = fromCoreDefinitions();
        return defaultOperations;
    }

    private static Map<String,OperationSignature> fromCoreDefinitions() {
        var classLoader = OperationSpecFactory.class.getClassLoader();
        try( var resource = classLoader.getResourceAsStream(RESOURCE) ) {
            if( resource == null )
                throw new IOException("resource not found: " + RESOURCE);
            return fromJson(new InputStreamReader(resource, StandardCharsets.UTF_8));
        }
        catch( IOException e ) {
            System.err.println("Failed to read operation definitions: " + e.toString());
            return Collections.emptyMap();
        }
    }

    /**
     * Parse operation signatures from a metadata document.
     *
     * @param reader
     */
    public static Map<String,OperationSignature> fromJson(Reader reader) {
        var root = JsonParser.parseReader(reader).getAsJsonObject();
        var result = new LinkedHashMap<String,OperationSignature>();
        for( var element : root.getAsJsonArray("operations") ) {
            var signature = fromOperation(element.getAsJsonObject());
            result.put(signature.systemName(), signature);
        }
        return Collections.unmodifiableMap(result);
    }

    private static OperationSignature fromOperation(JsonObject node) {
        var systemName = getString(node, "systemName");
        var description = getString(node, "description");
        var category = getString(node, "category");

        var parameters = new ArrayList<OperationParameter>();
        for( var param : getArray(node, "parameters") )
            parameters.add(fromParameter(param.getAsJsonObject()));
        // required parameters come first so that positional arguments line up
        parameters.sort(Comparator.comparing((OperationParameter p) -> !p.required()));

        var dependencies = new ArrayList<DependencyInfo>();
        for( var dep : getArray(node, "dependencies") ) {
            var obj = dep.getAsJsonObject();
            dependencies.add(new DependencyInfo(getString(obj, "name"), fromTag(obj, "type")));
        }

        var outputs = new ArrayList<OutputInfo>();
        for( var output : getArray(node, "outputs") ) {
            var obj = output.getAsJsonObject();
            outputs.add(new OutputInfo(getString(obj, "name"), fromTag(obj, "type"), getBoolean(obj, "erased")));
        }

        return new OperationSignature(systemName, description, category, parameters, dependencies, outputs);
    }

    private static OperationParameter fromParameter(JsonObject node) {
        var name = getString(node, "name");
        var kind = node.has("constantValues")
            ? fromConstantValues(node.getAsJsonArray("constantValues"))
            : fromTypes(node.getAsJsonArray("type"));
        var required = getBoolean(node, "required");
        var defaultValue = fromPrimitive(node.get("defaultValue"));
        var erased = getBoolean(node, "erased");
        var description = getString(node, "description");
        return new OperationParameter(name, kind, required, defaultValue, erased, description);
    }

    private static ParameterKind fromTypes(JsonArray tags) {
        var types = new ArrayList<ParameterType>();
        if( tags != null ) {
            for( var tag : tags ) {
                var type = ParameterType.fromTag(tag.getAsString());
                if( type == null )
                    throw new IllegalStateException("Unknown parameter type: " + tag.getAsString());
                types.add(type);
            }
        }
        return new ParameterKind.SemanticTypes(types);
    }

    private static ParameterKind fromConstantValues(JsonArray values) {
        var options = new ArrayList<ConstantOption>();
        for( var value : values ) {
            var obj = value.getAsJsonObject();
            options.add(new ConstantOption(getString(obj, "value"), getBoolean(obj, "default"), getString(obj, "description")));
        }
        return new ParameterKind.ConstantValues(options);
    }

    private static ParameterType fromTag(JsonObject node, String key) {
        var tag = getString(node, key);
        if( tag == null )
            return ParameterType.OBJECT;
        var type = ParameterType.fromTag(tag);
        if( type == null )
            throw new IllegalStateException("Unknown parameter type: " + tag);
        return type;
    }

    private static Object fromPrimitive(JsonElement value) {
        if( value == null || !value.isJsonPrimitive() )
            return null;
        var primitive = (JsonPrimitive) value;
        if( primitive.isBoolean() )
            return primitive.getAsBoolean();
        if( primitive.isNumber() )
            return primitive.getAsDouble();
        return primitive.getAsString();
    }

    private static String getString(JsonObject node, String key) {
        var value = node.get(key);
        return value != null && value.isJsonPrimitive() ? value.getAsString() : null;
    }

    private static boolean getBoolean(JsonObject node, String key) {
        var value = node.get(key);
        return value != null && value.isJsonPrimitive() && value.getAsBoolean();
    }

    private static List<JsonElement> getArray(JsonObject node, String key) {
        var value = node.get(key);
        if( value == null || !value.isJsonArray() )
            return Collections.emptyList();
        return value.getAsJsonArray().asList();
    }

}
