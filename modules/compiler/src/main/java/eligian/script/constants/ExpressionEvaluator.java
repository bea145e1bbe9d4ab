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
package eligian.script.constants;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

import eligian.script.ast.ASTNodeStringUtils;
import eligian.script.ast.Expression;
import eligian.script.ast.Expression.*;

/**
 * Evaluate constant expressions at compile time.
 *
 * Supports literals, references to constants that were already
 * folded, and the arithmetic, logical and comparison operators.
 * Numeric results must be finite.
 */
public class ExpressionEvaluator {

    public static EvaluationResult evaluate(Expression node, Map<String,ConstantValue> constants) {
        return evaluate(node, constants, Collections.emptySet());
    }

    /**
     * Evaluate an expression.
     *
     * @param node
     * @param constants the constants that can be referenced
     * @param evaluating the constants currently being evaluated
     */
    public static EvaluationResult evaluate(Expression node, Map<String,ConstantValue> constants, Set<String> evaluating) {
        try {
            var value = evaluate0(node, constants, evaluating);
            if( value instanceof Double d && (d.isNaN() || d.isInfinite()) )
                throw new EvaluationException("Constant expression does not evaluate to a finite number");
            return new EvaluationResult.Success(value);
        }
        catch( EvaluationException e ) {
            var error = new EvaluationError(e.getMessage(), ASTNodeStringUtils.toString(node), node.location());
            return new EvaluationResult.Failure(error);
        }
    }

    private static Object evaluate0(Expression node, Map<String,ConstantValue> constants, Set<String> evaluating) {
        if( node instanceof StringLiteral sl )
            return sl.value();

        if( node instanceof NumberLiteral nl )
            return nl.value();

        if( node instanceof BooleanLiteral bl )
            return bl.value();

        if( node instanceof BinaryExpression be ) {
            var left = evaluate0(be.left(), constants, evaluating);
            var right = evaluate0(be.right(), constants, evaluating);
            return applyBinaryOperator(be.operator(), left, right);
        }

        if( node instanceof UnaryExpression ue ) {
            var operand = evaluate0(ue.operand(), constants, evaluating);
            return applyUnaryOperator(ue.operator(), operand);
        }

        if( node instanceof VariableReference vr ) {
            var name = vr.name();
            if( evaluating.contains(name) )
                throw new EvaluationException("Circular dependency detected: " + name);
            var constant = constants.get(name);
            if( constant == null )
                throw new EvaluationException("Undefined constant: " + name);
            return constant.value();
        }

        throw new EvaluationException("Cannot evaluate expression type: " + node.getClass().getSimpleName());
    }

    private static Object applyBinaryOperator(String op, Object left, Object right) {
        switch( op ) {
            case "+":
                if( left instanceof String || right instanceof String )
                    return asString(left) + asString(right);
                return asNumber(op, left) + asNumber(op, right);
            case "-":
                return asNumber(op, left) - asNumber(op, right);
            case "*":
                return asNumber(op, left) * asNumber(op, right);
            case "/":
                var divisor = asNumber(op, right);
                if( divisor == 0 )
                    throw new EvaluationException("Division by zero in constant expression");
                return asNumber(op, left) / divisor;
            case "%":
                return asNumber(op, left) % asNumber(op, right);
            case "&&":
                return asBoolean(left) && asBoolean(right);
            case "||":
                return asBoolean(left) || asBoolean(right);
            case "==":
                return Objects.equals(left, right);
            case "!=":
                return !Objects.equals(left, right);
            case "<":
                return asNumber(op, left) < asNumber(op, right);
            case ">":
                return asNumber(op, left) > asNumber(op, right);
            case "<=":
                return asNumber(op, left) <= asNumber(op, right);
            case ">=":
                return asNumber(op, left) >= asNumber(op, right);
            default:
                throw new EvaluationException("Unsupported binary operator: " + op);
        }
    }

    private static Object applyUnaryOperator(String op, Object operand) {
        switch( op ) {
            case "!":
                return !asBoolean(operand);
            case "-":
                return -asNumber(op, operand);
            default:
                throw new EvaluationException("Unsupported unary operator: " + op);
        }
    }

    private static double asNumber(String op, Object value) {
        if( value instanceof Double d )
            return d;
        throw new EvaluationException("Operator '" + op + "' requires numeric operands");
    }

    private static boolean asBoolean(Object value) {
        if( value instanceof Boolean b )
            return b;
        if( value instanceof Double d )
            return d != 0 && !d.isNaN();
        if( value instanceof String s )
            return !s.isEmpty();
        return false;
    }

    /**
     * Convert a constant value to a string the way string
     * concatenation does.
     *
     * @param value
     */
    public static String asString(Object value) {
        if( value instanceof Double d )
            return ASTNodeStringUtils.formatNumber(d);
        return String.valueOf(value);
    }

    private static class EvaluationException extends RuntimeException {

        EvaluationException(String message) {
            super(message);
        }
    }

}
