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

import java.util.ArrayList;
import java.util.List;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import eligian.script.dsl.OperationSignature;
import eligian.script.dsl.ParameterKind;

public class ParameterMapper {

    public static final String MAPPING_ERROR = "MAPPING_ERROR";

    /**
     * Map positional arguments to the named operation data of an
     * operation.
     *
     * Missing optional arguments take the parameter's default value
     * when there is one and are omitted otherwise.
     *
     * @param signature
     * @param args the arguments, already converted to JSON
     */
    public static MappingResult mapParameters(OperationSignature signature, List<JsonElement> args) {
        var operationData = new JsonObject();
        var errors = new ArrayList<MappingResult.MappingError>();

        var parameters = signature.parameters();
        for( int i = 0; i < parameters.size(); i++ ) {
            var param = parameters.get(i);
            if( i < args.size() ) {
                operationData.add(param.name(), args.get(i));
                continue;
            }
            var defaultValue = getDefaultValue(param.defaultValue(), param.type());
            if( defaultValue != null ) {
                operationData.add(param.name(), JsonValues.asJson(defaultValue));
            }
            else if( param.required() ) {
                errors.add(new MappingResult.MappingError(
                    MAPPING_ERROR,
                    param.name(),
                    "Required parameter '" + param.name() + "' is missing",
                    "Provide value for parameter '" + param.name() + "'"));
            }
        }

        return new MappingResult(operationData, errors);
    }

    private static Object getDefaultValue(Object defaultValue, ParameterKind kind) {
        if( defaultValue != null )
            return defaultValue;
        if( kind instanceof ParameterKind.ConstantValues cv ) {
            for( var option : cv.options() ) {
                if( option.isDefault() )
                    return option.value();
            }
        }
        return null;
    }

}
