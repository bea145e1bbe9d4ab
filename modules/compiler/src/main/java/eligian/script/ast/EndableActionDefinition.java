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
package eligian.script.ast;

import java.util.List;

/**
 * Action with a start sequence (run when the action starts)
 * and an end sequence (run when the action ends).
 */
public record EndableActionDefinition(
    String name,
    List<Parameter> parameters,
    List<Statement> startOperations,
    List<Statement> endOperations,
    SourceLocation location
) implements ActionDefinition {

    public EndableActionDefinition {
        parameters = List.copyOf(parameters);
        startOperations = List.copyOf(startOperations);
        endOperations = List.copyOf(endOperations);
    }

    @Override
    public List<List<Statement>> getBodies() {
        return List.of(startOperations, endOperations);
    }
}
