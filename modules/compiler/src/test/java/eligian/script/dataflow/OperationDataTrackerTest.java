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
package eligian.script.dataflow;

import java.util.List;
import java.util.Set;

import eligian.script.dsl.OperationRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OperationDataTrackerTest {

    private OperationRegistry registry;

    @BeforeEach
    void setUp() {
        registry = OperationRegistry.getDefault();
    }

    @Test
    void shouldSatisfyDependencyFromEarlierOutput() {
        var tracker = new OperationDataTracker(registry);

        assertTrue(tracker.processOperation("selectElement").isEmpty());
        assertTrue(tracker.processOperation("addClass").isEmpty());
        assertTrue(tracker.processOperation("removeClass").isEmpty());

        assertTrue(tracker.hasProperty("selectedElement"));
        assertTrue(tracker.hasProperty("selector"));
    }

    @Test
    void shouldReportMissingDependencyAndContinue() {
        var tracker = new OperationDataTracker(registry);

        var missing = tracker.processOperation("addControllerToElement");

        assertEquals(List.of("selectedElement", "controllerInstance"), missing);
        assertTrue(tracker.getAvailableProperties().isEmpty());
    }

    @Test
    void shouldNotLeakErasedParameters() {
        var tracker = new OperationDataTracker(registry);

        tracker.processOperation("selectElement");
        tracker.processOperation("addClass");

        assertFalse(tracker.hasProperty("className"));
        assertFalse(tracker.hasProperty("propertyName"));
        assertTrue(tracker.hasProperty("useSelectedElementAsRoot"));
    }

    @Test
    void shouldIgnoreUnknownOperations() {
        var tracker = new OperationDataTracker(registry, List.of("a"));

        assertTrue(tracker.processOperation("doesNotExist").isEmpty());
        assertEquals(List.of("a"), tracker.getAvailableProperties());
    }

    @Test
    void shouldRecordHistoryOnlyForChanges() {
        var tracker = new OperationDataTracker(registry);

        tracker.processOperation("selectElement");
        tracker.processOperation("selectElement");
        tracker.removeProperty("clearOperationData", "missing");

        var added = tracker.getHistory().stream()
            .filter((entry) -> entry.action() == HistoryEntry.Action.ADDED)
            .map(HistoryEntry::property)
            .toList();
        assertEquals(List.of("selector", "useSelectedElementAsRoot", "selectedElement"), added);
        assertEquals(3, tracker.getHistory().size());
    }

    @Test
    void shouldFindLatestErasurePoint() {
        var tracker = new OperationDataTracker(registry);
        tracker.processOperation("selectElement");
        tracker.removeProperty("removePropertiesFromOperationData", "selectedElement");
        tracker.processOperation("selectElement");
        tracker.clear("clearOperationData");

        assertEquals("clearOperationData", tracker.findErasurePoint("selectedElement"));
        assertNull(tracker.findErasurePoint("neverRemoved"));
    }

    @Test
    void shouldCloneIndependently() {
        var tracker = new OperationDataTracker(registry, List.of("a"));

        var copy = tracker.clone();
        copy.addProperty("setOperationData", "b");
        tracker.removeProperty("clearOperationData", "a");

        assertEquals(List.of("a", "b"), copy.getAvailableProperties());
        assertTrue(tracker.getAvailableProperties().isEmpty());
        assertEquals(1, copy.getHistory().size());
    }

    @Test
    void shouldKeepOnlyCommonPropertiesOnMerge() {
        // Given
        var left = new OperationDataTracker(registry, List.of("a", "b", "c"));
        var right = new OperationDataTracker(registry, List.of("b", "c", "d"));
        var leftCopy = left.clone();
        var rightCopy = right.clone();

        // When
        left.merge(right);
        rightCopy.merge(leftCopy);

        // Then
        assertEquals(List.of("b", "c"), left.getAvailableProperties());
        assertEquals(
            Set.copyOf(left.getAvailableProperties()),
            Set.copyOf(rightCopy.getAvailableProperties()));
    }

    @Test
    void shouldReportFirstErasurePoint() {
        var tracker = new OperationDataTracker(registry, List.of("a"));

        tracker.removeProperty("clearOperationData", "a");
        tracker.addProperty("setOperationData", "a");
        tracker.removeProperty("removePropertiesFromOperationData", "a");

        assertEquals("clearOperationData", tracker.findErasurePoint("a"));
    }

}
