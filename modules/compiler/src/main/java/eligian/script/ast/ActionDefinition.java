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

public sealed interface ActionDefinition extends ProgramElement
    permits RegularActionDefinition, EndableActionDefinition {

    String name();

    List<Parameter> parameters();

    /**
     * Get every operation sequence of the action body. Regular
     * actions have one sequence, endable actions have a start
     * sequence and an end sequence.
     */
    List<List<Statement>> getBodies();

}
