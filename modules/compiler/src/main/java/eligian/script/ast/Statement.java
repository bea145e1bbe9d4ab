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
 * A step in an operation sequence.
 */
public sealed interface Statement extends ASTNode {

    /**
     * A call to a built-in operation (or a custom action),
     * e.g. {@code selectElement("#title")}.
     */
    record OperationCall(String operationName, List<Expression> args, SourceLocation location) implements Statement {
        public OperationCall {
            args = List.copyOf(args);
        }
    }

    record IfStatement(Expression condition, List<Statement> thenOperations, List<Statement> elseOperations, SourceLocation location) implements Statement {
        public IfStatement {
            thenOperations = List.copyOf(thenOperations);
            elseOperations = List.copyOf(elseOperations);
        }

        public boolean hasElse() {
            return !elseOperations.isEmpty();
        }
    }

    record ForStatement(String itemName, Expression collection, List<Statement> body, SourceLocation location) implements Statement {
        public ForStatement {
            body = List.copyOf(body);
        }
    }

    record BreakStatement(SourceLocation location) implements Statement {
    }

    record ContinueStatement(SourceLocation location) implements Statement {
    }

}
