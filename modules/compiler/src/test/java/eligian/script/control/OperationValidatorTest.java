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
package eligian.script.control;

import java.util.List;
import java.util.Set;

import eligian.script.dsl.OperationRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OperationValidatorTest {

    private OperationRegistry registry;

    private OperationValidator validator;

    @BeforeEach
    void setUp() {
        registry = OperationRegistry.getDefault();
        validator = new OperationValidator(registry);
    }

    @Test
    void shouldAcceptKnownOperation() {
        assertNull(validator.validateOperationExists("selectElement"));
    }

    @Test
    void shouldSuggestSimilarOperation() {
        var error = validator.validateOperationExists("selectElemnt");

        assertEquals(OperationValidationError.UNKNOWN_OPERATION, error.code());
        assertEquals("Unknown operation: \"selectElemnt\"", error.message());
        assertEquals("Did you mean: selectElement?", error.hint());
    }

    @Test
    void shouldListOperationsWhenNothingIsSimilar() {
        var error = validator.validateOperationExists("teleport");

        assertEquals("Available operations: addClass, addController, addControllerToElement, addGlobalsToOperation, animate, ...", error.hint());
    }

    @Test
    void shouldValidateParameterCountRange() {
        var signature = registry.getOperationSignature("selectElement");

        assertNull(validator.validateParameterCount(signature, 1));
        assertNull(validator.validateParameterCount(signature, 3));

        var error = validator.validateParameterCount(signature, 0);
        assertEquals(OperationValidationError.PARAMETER_COUNT, error.code());
        assertEquals("Operation \"selectElement\" expects 1-3 parameter(s), but got 0", error.message());
        assertEquals("Expected: selectElement(selector, [useSelectedElementAsRoot], [propertyName])", error.hint());
    }

    @Test
    void shouldValidateExactParameterCount() {
        var error = validator.validateParameterCount(registry.getOperationSignature("wait"), 2);

        assertEquals("Operation \"wait\" expects 1 parameter(s), but got 2", error.message());
    }

    @Test
    void shouldReportMissingDependencies() {
        var signature = registry.getOperationSignature("addControllerToElement");

        var errors = validator.validateDependencies(signature, Set.of("selectedElement"));

        assertEquals(1, errors.size());
        var error = errors.get(0);
        assertEquals(OperationValidationError.MISSING_DEPENDENCY, error.code());
        assertEquals("Operation 'addControllerToElement' requires 'controllerInstance' but it is not available", error.message());
        assertEquals("Call getControllerInstance or getControllerFromElement first to provide 'controllerInstance'", error.hint());
    }

    @Test
    void shouldExplainDependencyWithoutProvider() {
        var error = validator.missingDependency("custom", "nothingProvidesThis");

        assertEquals("No operation in the registry provides 'nothingProvidesThis'", error.hint());
    }

    @Test
    void shouldAcceptBalancedBlocks() {
        var ops = List.of("when", "forEach", "log", "endForEach", "otherwise", "log", "endWhen");

        assertTrue(OperationValidator.validateControlFlowPairing(ops).isEmpty());
    }

    @Test
    void shouldReportUnmatchedEnd() {
        var errors = OperationValidator.validateControlFlowPairing(List.of("log", "endWhen"));

        assertEquals(1, errors.size());
        assertEquals("Unmatched 'endWhen' at position 1: no corresponding 'when' found", errors.get(0).message());
    }

    @Test
    void shouldReportOtherwiseOutsideWhen() {
        var errors = OperationValidator.validateControlFlowPairing(List.of("otherwise"));

        assertEquals("'otherwise' at position 0 appears outside a 'when' block", errors.get(0).message());
    }

    @Test
    void shouldReportUnclosedBlocksInSourceOrder() {
        // Given
        var ops = List.of("when", "when", "forEach", "endWhen");

        // When
        var errors = OperationValidator.validateControlFlowPairing(ops);

        // Then
        var messages = errors.stream().map(OperationValidationError::message).toList();
        assertEquals(List.of(
            "Unclosed 'when' block starting at position 0: missing 'endWhen'",
            "Unclosed 'forEach' block starting at position 2: missing 'endForEach'"
        ), messages);
    }

}
