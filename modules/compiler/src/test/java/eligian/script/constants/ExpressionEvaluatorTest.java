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

import java.util.Map;
import java.util.Set;

import eligian.script.ast.SourceLocation;
import eligian.script.types.EligianType;
import org.junit.jupiter.api.Test;

import static eligian.script.ast.ASTHelpers.*;
import static org.junit.jupiter.api.Assertions.*;

class ExpressionEvaluatorTest {

    private static final Map<String,ConstantValue> NO_CONSTANTS = Map.of();

    private static Object valueOf(EvaluationResult result) {
        assertTrue(result.canEvaluate(), () -> "expected success but got " + result);
        return ((EvaluationResult.Success) result).value();
    }

    private static String reasonOf(EvaluationResult result) {
        assertFalse(result.canEvaluate());
        return ((EvaluationResult.Failure) result).error().reason();
    }

    @Test
    void shouldEvaluateLiterals() {
        assertEquals("hello", valueOf(ExpressionEvaluator.evaluate(str("hello"), NO_CONSTANTS)));
        assertEquals(42.0, valueOf(ExpressionEvaluator.evaluate(num(42), NO_CONSTANTS)));
        assertEquals(true, valueOf(ExpressionEvaluator.evaluate(bool(true), NO_CONSTANTS)));
    }

    @Test
    void shouldEvaluateArithmetic() {
        var expr = binX(num(2), "*", binX(num(3), "+", num(4)));

        assertEquals(14.0, valueOf(ExpressionEvaluator.evaluate(expr, NO_CONSTANTS)));
        assertEquals(1.0, valueOf(ExpressionEvaluator.evaluate(binX(num(7), "%", num(3)), NO_CONSTANTS)));
        assertEquals(-5.0, valueOf(ExpressionEvaluator.evaluate(unaryX("-", num(5)), NO_CONSTANTS)));
    }

    @Test
    void shouldConcatenateStrings() {
        var expr = binX(str("item-"), "+", num(3));

        assertEquals("item-3", valueOf(ExpressionEvaluator.evaluate(expr, NO_CONSTANTS)));
    }

    @Test
    void shouldEvaluateLogicAndComparison() {
        assertEquals(false, valueOf(ExpressionEvaluator.evaluate(binX(bool(true), "&&", bool(false)), NO_CONSTANTS)));
        assertEquals(true, valueOf(ExpressionEvaluator.evaluate(unaryX("!", bool(false)), NO_CONSTANTS)));
        assertEquals(true, valueOf(ExpressionEvaluator.evaluate(binX(num(1), "<", num(2)), NO_CONSTANTS)));
        assertEquals(true, valueOf(ExpressionEvaluator.evaluate(binX(str("a"), "==", str("a")), NO_CONSTANTS)));
    }

    @Test
    void shouldResolveKnownConstants() {
        var constants = Map.of("base", new ConstantValue("base", 100.0, EligianType.NUMBER, SourceLocation.NONE));

        var result = ExpressionEvaluator.evaluate(binX(varRef("base"), "/", num(4)), constants);

        assertEquals(25.0, valueOf(result));
    }

    @Test
    void shouldFailOnUndefinedConstant() {
        assertEquals("Undefined constant: missing", reasonOf(ExpressionEvaluator.evaluate(varRef("missing"), NO_CONSTANTS)));
    }

    @Test
    void shouldFailOnCircularReference() {
        var result = ExpressionEvaluator.evaluate(binX(varRef("self"), "+", num(1)), NO_CONSTANTS, Set.of("self"));

        assertEquals("Circular dependency detected: self", reasonOf(result));
    }

    @Test
    void shouldFailOnDivisionByZero() {
        var result = ExpressionEvaluator.evaluate(binX(num(1), "/", num(0)), NO_CONSTANTS);

        assertEquals("Division by zero in constant expression", reasonOf(result));
        assertEquals("1 / 0", ((EvaluationResult.Failure) result).error().expression());
    }

    @Test
    void shouldFailOnNonNumericOperands() {
        var result = ExpressionEvaluator.evaluate(binX(str("a"), "-", num(1)), NO_CONSTANTS);

        assertEquals("Operator '-' requires numeric operands", reasonOf(result));
    }

    @Test
    void shouldNotEvaluateCompositeValues() {
        var result = ExpressionEvaluator.evaluate(obj("a", num(1)), NO_CONSTANTS);

        assertEquals("Cannot evaluate expression type: ObjectLiteral", reasonOf(result));
    }

    @Test
    void shouldFormatIntegralNumbersWithoutFraction() {
        assertEquals("3", ExpressionEvaluator.asString(3.0));
        assertEquals("2.5", ExpressionEvaluator.asString(2.5));
        assertEquals("true", ExpressionEvaluator.asString(true));
    }

    @Test
    void shouldRejectNonFiniteResults() {
        var message = "Constant expression does not evaluate to a finite number";

        assertEquals(message, reasonOf(ExpressionEvaluator.evaluate(binX(num(1), "%", num(0)), NO_CONSTANTS)));
        assertEquals(message, reasonOf(ExpressionEvaluator.evaluate(binX(num(1e308), "*", num(10)), NO_CONSTANTS)));
    }

}
