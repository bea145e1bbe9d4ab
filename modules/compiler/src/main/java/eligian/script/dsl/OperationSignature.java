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
 * Static description of a built-in operation.
 */
public record OperationSignature(
    String systemName,
    String description,
    String category,
    List<OperationParameter> parameters,
    List<DependencyInfo> dependencies,
    List<OutputInfo> outputs
) {

    public OperationSignature {
        parameters = List.copyOf(parameters);
        dependencies = List.copyOf(dependencies);
        outputs = List.copyOf(outputs);
    }

    public int getRequiredParameterCount() {
        return (int) parameters.stream().filter(OperationParameter::required).count();
    }

    public OperationParameter getParameter(String name) {
        for( var param : parameters ) {
            if( param.name().equals(name) )
                return param;
        }
        return null;
    }

    public List<String> getErasedParameterNames() {
        return parameters.stream()
            .filter(OperationParameter::erased)
            .map(OperationParameter::name)
            .toList();
    }

    public boolean hasOutput(String name) {
        return outputs.stream().anyMatch((output) -> output.name().equals(name));
    }

    public boolean hasDependency(String name) {
        return dependencies.stream().anyMatch((dep) -> dep.name().equals(name));
    }

    /**
     * Render the call shape of the operation, with optional
     * parameters in brackets, e.g. {@code selectElement(selector, [useSelectedElementAsRoot])}.
     */
    public String toCallString() {
        var params = parameters.stream()
            .map((param) -> param.required() ? param.name() : "[" + param.name() + "]")
            .collect(Collectors.joining(", "));
        return systemName + "(" + params + ")";
    }
}
