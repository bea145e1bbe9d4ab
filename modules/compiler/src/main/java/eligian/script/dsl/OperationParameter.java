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

/**
 * Positional parameter of an operation.
 *
 * @param defaultValue the default value (string, number or boolean), or null
 * @param erased whether the engine removes the parameter from
 *   the operation data after the operation runs
 */
public record OperationParameter(
    String name,
    ParameterKind type,
    boolean required,
    Object defaultValue,
    boolean erased,
    String description
) {

    public boolean isConstantValued() {
        return type instanceof ParameterKind.ConstantValues;
    }
}
