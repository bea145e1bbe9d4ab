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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.Set;

import eligian.script.dsl.OperationRegistry;
import eligian.script.dsl.OperationSignature;

import static eligian.script.control.OperationValidationError.*;

/**
 * Validate operation calls against the registry.
 */
public class OperationValidator {

    private final OperationRegistry registry;

    public OperationValidator(OperationRegistry registry) {
        this.registry = registry;
    }

    /**
     * Check that an operation exists, suggesting similar names
     * when it does not.
     *
     * @param name
     */
    public OperationValidationError validateOperationExists(String name) {
        if( registry.hasOperation(name) )
            return null;

        var suggestions = registry.suggestSimilarOperations(name);
        var hint = !suggestions.isEmpty()
            ? "Did you mean: " + String.join(", ", suggestions) + "?"
            : "Available operations: " + String.join(", ", registry.getAllOperationNames().stream().limit(5).toList()) + ", ...";
        return new OperationValidationError(UNKNOWN_OPERATION, name, "Unknown operation: \"" + name + "\"", hint);
    }

    public OperationValidationError validateParameterCount(OperationSignature signature, int argumentCount) {
        var required = signature.getRequiredParameterCount();
        var total = signature.parameters().size();
        if( argumentCount >= required && argumentCount <= total )
            return null;

        var expected = required == total ? String.valueOf(required) : required + "-" + total;
        var message = String.format("Operation \"%s\" expects %s parameter(s), but got %d", signature.systemName(), expected, argumentCount);
        return new OperationValidationError(PARAMETER_COUNT, signature.systemName(), message, "Expected: " + signature.toCallString());
    }

    /**
     * Check that the dependencies of an operation are available.
     *
     * @param signature
     * @param available the properties currently on the operation data
     */
    public List<OperationValidationError> validateDependencies(OperationSignature signature, Set<String> available) {
        var result = new ArrayList<OperationValidationError>();
        for( var dep : signature.dependencies() ) {
            if( !available.contains(dep.name()) )
                result.add(missingDependency(signature.systemName(), dep.name()));
        }
        return result;
    }

    public OperationValidationError missingDependency(String operation, String dependency) {
        var providers = registry.findOperationsWithOutput(dependency);
        var hint = !providers.isEmpty()
            ? "Call " + String.join(" or ", providers.stream().limit(3).toList()) + " first to provide '" + dependency + "'"
            : "No operation in the registry provides '" + dependency + "'";
        var message = "Operation '" + operation + "' requires '" + dependency + "' but it is not available";
        return new OperationValidationError(MISSING_DEPENDENCY, operation, message, hint);
    }

    /**
     * Check that the block operations of a sequence are balanced:
     * {@code when}/{@code endWhen} and {@code forEach}/{@code endForEach}
     * are paired and {@code otherwise} only appears inside a
     * {@code when} block.
     *
     * @param operations the operation names in sequence
     */
    public static List<OperationValidationError> validateControlFlowPairing(List<String> operations) {
        var result = new ArrayList<OperationValidationError>();
        Deque<Integer> whenStack = new ArrayDeque<>();
        Deque<Integer> forEachStack = new ArrayDeque<>();

        for( int i = 0; i < operations.size(); i++ ) {
            var op = operations.get(i);
            if( "when".equals(op) ) {
                whenStack.push(i);
            }
            else if( "endWhen".equals(op) ) {
                if( whenStack.isEmpty() ) {
                    result.add(new OperationValidationError(
                        CONTROL_FLOW, op,
                        "Unmatched 'endWhen' at position " + i + ": no corresponding 'when' found",
                        "Add a 'when' operation before this 'endWhen'"));
                }
                else {
                    whenStack.pop();
                }
            }
            else if( "otherwise".equals(op) ) {
                if( whenStack.isEmpty() ) {
                    result.add(new OperationValidationError(
                        CONTROL_FLOW, op,
                        "'otherwise' at position " + i + " appears outside a 'when' block",
                        "'otherwise' can only appear between 'when' and 'endWhen'"));
                }
            }
            else if( "forEach".equals(op) ) {
                forEachStack.push(i);
            }
            else if( "endForEach".equals(op) ) {
                if( forEachStack.isEmpty() ) {
                    result.add(new OperationValidationError(
                        CONTROL_FLOW, op,
                        "Unmatched 'endForEach' at position " + i + ": no corresponding 'forEach' found",
                        "Add a 'forEach' operation before this 'endForEach'"));
                }
                else {
                    forEachStack.pop();
                }
            }
        }

        // report unclosed blocks in source order
        var unclosedWhen = new ArrayList<>(whenStack);
        Collections.reverse(unclosedWhen);
        for( var index : unclosedWhen ) {
            result.add(new OperationValidationError(
                CONTROL_FLOW, "when",
                "Unclosed 'when' block starting at position " + index + ": missing 'endWhen'",
                "Add 'endWhen' to close this 'when' block"));
        }
        var unclosedForEach = new ArrayList<>(forEachStack);
        Collections.reverse(unclosedForEach);
        for( var index : unclosedForEach ) {
            result.add(new OperationValidationError(
                CONTROL_FLOW, "forEach",
                "Unclosed 'forEach' block starting at position " + index + ": missing 'endForEach'",
                "Add 'endForEach' to close this 'forEach' block"));
        }

        return result;
    }

}
