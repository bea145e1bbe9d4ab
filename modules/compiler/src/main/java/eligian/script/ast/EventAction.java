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

public sealed interface EventAction extends ASTNode {

    /**
     * Invocation of a declared action, e.g. {@code at 0s..5s fadeIn("#title", 500)}.
     */
    record NamedActionInvocation(String actionName, List<Expression> args, SourceLocation location) implements EventAction {
        public NamedActionInvocation {
            args = List.copyOf(args);
        }
    }

    /**
     * Anonymous endable action written in place, e.g. {@code at 0s..5s [ ... ] [ ... ]}.
     */
    record InlineEndableAction(List<Statement> startOperations, List<Statement> endOperations, SourceLocation location) implements EventAction {
        public InlineEndableAction {
            startOperations = List.copyOf(startOperations);
            endOperations = List.copyOf(endOperations);
        }
    }

}
