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

import java.util.List;
import java.util.stream.Collectors;

/**
 * The type of an operation parameter: either a list of semantic
 * type tags, or a closed list of literal values.
 */
public sealed interface ParameterKind {

    record SemanticTypes(List<ParameterType> types) implements ParameterKind {
        public SemanticTypes {
            types = List.copyOf(types);
        }

        @Override
        public String describe() {
            return types.stream()
                .map(ParameterType::tag)
                .collect(Collectors.joining(" | "));
        }
    }

    record ConstantValues(List<ConstantOption> options) implements ParameterKind {
        public ConstantValues {
            options = List.copyOf(options);
        }

        public List<String> values() {
            return options.stream()
                .map(ConstantOption::value)
                .toList();
        }

        /**
         * Get the default option, or the first option if none
         * is marked as the default.
         */
        public String getDefaultValue() {
            for( var option : options ) {
                if( option.isDefault() )
                    return option.value();
            }
            return options.isEmpty() ? null : options.get(0).value();
        }

        @Override
        public String describe() {
            return options.stream()
                .map((option) -> "'" + option.value() + "'")
                .collect(Collectors.joining(" | "));
        }
    }

    String describe();

}
