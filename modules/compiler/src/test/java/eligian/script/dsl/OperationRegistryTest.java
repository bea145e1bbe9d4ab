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
package eligian.script.dsl;

import java.io.StringReader;
import java.util.List;
import java.util.Map;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OperationRegistryTest {

    private OperationRegistry registry;

    @BeforeEach
    void setUp() {
        registry = OperationRegistry.getDefault();
    }

    @Test
    void shouldLoadAllBuiltInOperations() {
        assertEquals(48, registry.getAllOperations().size());
        assertTrue(registry.hasOperation("selectElement"));
        assertTrue(registry.hasOperation("addController"));
        assertFalse(registry.hasOperation("resizeAction"));
        assertNull(registry.getOperationSignature("doesNotExist"));
    }

    @Test
    void shouldPassConsistencyCheck() {
        assertDoesNotThrow(() -> registry.validateRegistry());
    }

    @Test
    void shouldDescribeSelectElement() {
        var signature = registry.getOperationSignature("selectElement");

        assertEquals("selectElement", signature.systemName());
        assertEquals("DOM", signature.category());
        assertEquals("selector", signature.parameters().get(0).name());
        assertTrue(signature.parameters().get(0).required());
        assertEquals(1, signature.getRequiredParameterCount());
        assertTrue(signature.hasOutput("selectedElement"));
        assertTrue(signature.dependencies().isEmpty());
    }

    @Test
    void shouldMarkClassNameAsErased() {
        var signature = registry.getOperationSignature("addClass");

        assertEquals(List.of("className"), signature.getErasedParameterNames());
        assertTrue(signature.hasDependency("selectedElement"));
    }

    @Test
    void shouldExposeConstantValuedParameters() {
        var param = registry.getOperationSignature("setElementContent").getParameter("insertionType");

        assertTrue(param.isConstantValued());
        var values = (ParameterKind.ConstantValues) param.type();
        assertEquals(List.of("overwrite", "append", "prepend"), values.values());
        assertEquals("overwrite", values.getDefaultValue());
    }

    @Test
    void shouldGroupOperationsByCategory() {
        var categories = registry.getOperationsByCategory();

        var controlFlow = categories.get("Control Flow").stream()
            .map(OperationSignature::systemName)
            .toList();
        assertEquals(List.of("breakForEach", "continueForEach", "endForEach", "endWhen", "forEach", "otherwise", "when"), controlFlow);
        var total = categories.values().stream().mapToInt(List::size).sum();
        assertEquals(48, total);
    }

    @Test
    void shouldFindProvidersAndConsumers() {
        assertEquals(List.of("selectElement"), registry.findOperationsWithOutput("selectedElement"));
        assertTrue(registry.findOperationsWithDependency("actionInstance").containsAll(List.of("startAction", "endAction")));
        assertEquals(List.of("getControllerInstance", "getControllerFromElement"), registry.findOperationsWithOutput("controllerInstance"));
    }

    @Test
    void shouldSearchOperationsByName() {
        var results = registry.searchOperations("class");

        assertEquals(List.of("addClass", "removeClass", "toggleClass", "animateWithClass"), results);
    }

    @Test
    void shouldSuggestSimilarOperations() {
        var suggestions = registry.suggestSimilarOperations("adClass");

        assertEquals("addClass", suggestions.get(0));
        assertTrue(suggestions.size() <= 3);
        assertTrue(registry.suggestSimilarOperations("completelyDifferent").isEmpty());
    }

    @Test
    void shouldRejectMismatchedRegistryKey() {
        var signature = registry.getOperationSignature("wait");
        var broken = new OperationRegistry(Map.of("pause", signature));

        var e = assertThrows(IllegalStateException.class, broken::validateRegistry);
        assertTrue(e.getMessage().contains("pause"));
    }

    @Test
    void shouldRejectMissingDescription() {
        var signature = new OperationSignature("noop", " ", "Utilities", List.of(), List.of(), List.of());
        var broken = new OperationRegistry(Map.of("noop", signature));

        assertThrows(IllegalStateException.class, broken::validateRegistry);
    }

    @Test
    void shouldRejectParameterWithoutType() {
        var param = new OperationParameter("value", new ParameterKind.SemanticTypes(List.of()), true, null, false, null);
        var signature = new OperationSignature("noop", "Does nothing", "Utilities", List.of(param), List.of(), List.of());
        var broken = new OperationRegistry(Map.of("noop", signature));

        assertThrows(IllegalStateException.class, broken::validateRegistry);
    }

    @Test
    void shouldSortRequiredParametersFirst() {
        var json = """
            {"operations": [{
              "systemName": "example",
              "description": "Example operation",
              "category": "Utilities",
              "parameters": [
                {"name": "optional", "type": ["string"], "required": false},
                {"name": "mandatory", "type": ["number"], "required": true, "erased": true}
              ],
              "dependencies": [{"name": "selectedElement"}],
              "outputs": []
            }]}
            """;

        var operations = OperationSpecFactory.fromJson(new StringReader(json));
        var signature = operations.get("example");

        assertEquals(List.of("mandatory", "optional"), signature.parameters().stream().map(OperationParameter::name).toList());
        assertEquals(ParameterType.OBJECT, signature.dependencies().get(0).type());
    }

    @Test
    void shouldRejectUnknownTypeTag() {
        var json = """
            {"operations": [{
              "systemName": "example",
              "description": "Example operation",
              "category": "Utilities",
              "parameters": [{"name": "value", "type": ["widget"], "required": true}]
            }]}
            """;

        assertThrows(IllegalStateException.class, () -> OperationSpecFactory.fromJson(new StringReader(json)));
    }

}
