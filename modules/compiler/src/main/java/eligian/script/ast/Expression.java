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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public sealed interface Expression extends ASTNode {

    record StringLiteral(String value, SourceLocation location) implements Expression {
    }

    record NumberLiteral(double value, SourceLocation location) implements Expression {
    }

    record BooleanLiteral(boolean value, SourceLocation location) implements Expression {
    }

    record NullLiteral(SourceLocation location) implements Expression {
    }

    record ObjectLiteral(Map<String,Expression> properties, SourceLocation location) implements Expression {
        public ObjectLiteral {
            properties = Collections.unmodifiableMap(new LinkedHashMap<>(properties));
        }
    }

    record ArrayLiteral(List<Expression> elements, SourceLocation location) implements Expression {
        public ArrayLiteral {
            elements = List.copyOf(elements);
        }
    }

    /**
     * Bare reference to an action parameter.
     */
    record ParameterReference(String name, SourceLocation location) implements Expression {
    }

    /**
     * Bare reference to a global constant or a loop variable.
     */
    record VariableReference(String name, SourceLocation location) implements Expression {
    }

    /**
     * System property chain such as {@code $operationdata.selectedElement}.
     *
     * @param scope the scope name without the leading {@code $}
     */
    record PropertyChainReference(String scope, List<String> properties, SourceLocation location) implements Expression {
        public PropertyChainReference {
            properties = List.copyOf(properties);
        }
    }

    record BinaryExpression(String operator, Expression left, Expression right, SourceLocation location) implements Expression {
    }

    record UnaryExpression(String operator, Expression operand, SourceLocation location) implements Expression {
    }

}
