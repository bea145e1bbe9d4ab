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

import java.util.stream.Collectors;

import eligian.script.ast.Expression.*;

/**
 * Render expressions back to source text.
 */
public class ASTNodeStringUtils {

    public static String toString(Expression node) {
        if( node instanceof StringLiteral sl )
            return "\"" + sl.value().replace("\"", "\\\"") + "\"";
        if( node instanceof NumberLiteral nl )
            return formatNumber(nl.value());
        if( node instanceof BooleanLiteral bl )
            return String.valueOf(bl.value());
        if( node instanceof NullLiteral )
            return "null";
        if( node instanceof ObjectLiteral ol ) {
            return ol.properties().entrySet().stream()
                .map((entry) -> entry.getKey() + ": " + toString(entry.getValue()))
                .collect(Collectors.joining(", ", "{", "}"));
        }
        if( node instanceof ArrayLiteral al ) {
            return al.elements().stream()
                .map(ASTNodeStringUtils::toString)
                .collect(Collectors.joining(", ", "[", "]"));
        }
        if( node instanceof ParameterReference pr )
            return pr.name();
        if( node instanceof VariableReference vr )
            return vr.name();
        if( node instanceof PropertyChainReference pcr )
            return "$" + pcr.scope() + "." + String.join(".", pcr.properties());
        if( node instanceof BinaryExpression be )
            return toString(be.left()) + " " + be.operator() + " " + toString(be.right());
        if( node instanceof UnaryExpression ue )
            return ue.operator() + toString(ue.operand());
        return "?";
    }

    /**
     * Format a number the way the engine expects it, i.e. without
     * a fraction when the value is integral.
     *
     * @param value
     */
    public static String formatNumber(double value) {
        if( value == Math.rint(value) && !Double.isInfinite(value) && Math.abs(value) < 1e15 )
            return String.valueOf((long) value);
        return String.valueOf(value);
    }

}
