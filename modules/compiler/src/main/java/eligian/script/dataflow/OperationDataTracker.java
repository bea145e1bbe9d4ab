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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

import eligian.script.dsl.OperationRegistry;

/**
 * Simulate the shape of the operation data as a sequence of
 * operations runs.
 *
 * The tracker only knows property names, not values. Clone the
 * tracker before each branch of a conditional and merge the
 * branches afterwards: a property is available after the join
 * only if it is available on every branch.
 */
public class OperationDataTracker {

    private final OperationRegistry registry;

    private Set<String> available = new LinkedHashSet<>();

    private List<HistoryEntry> history = new ArrayList<>();

    public OperationDataTracker(OperationRegistry registry) {
        this.registry = registry;
    }

    public OperationDataTracker(OperationRegistry registry, Collection<String> initialProperties) {
        this(registry);
        available.addAll(initialProperties);
    }

    /**
     * Apply an operation to the operation data.
     *
     * Missing dependencies are reported but do not stop the
     * operation from being applied. Non-erased parameters and
     * all outputs are added to the operation data, erased
     * parameters are not.
     *
     * @param name
     * @return the dependencies that were not available
     */
    public List<String> processOperation(String name) {
        var signature = registry.getOperationSignature(name);
        if( signature == null )
            return Collections.emptyList();

        var missing = new ArrayList<String>();
        for( var dep : signature.dependencies() ) {
            if( !available.contains(dep.name()) )
                missing.add(dep.name());
        }

        for( var param : signature.parameters() ) {
            if( !param.erased() )
                add(name, param.name());
        }

        for( var output : signature.outputs() )
            add(name, output.name());

        return missing;
    }

    public void addProperty(String operation, String property) {
        add(operation, property);
    }

    /**
     * Remove a property from the operation data.
     *
     * @param operation the operation that removes the property
     * @param property
     */
    public void removeProperty(String operation, String property) {
        if( available.remove(property) )
            history.add(new HistoryEntry(operation, HistoryEntry.Action.REMOVED, property));
    }

    /**
     * Remove every property from the operation data.
     *
     * @param operation
     */
    public void clear(String operation) {
        for( var property : List.copyOf(available) )
            removeProperty(operation, property);
    }

    private void add(String operation, String property) {
        if( available.add(property) )
            history.add(new HistoryEntry(operation, HistoryEntry.Action.ADDED, property));
    }

    public boolean hasProperty(String name) {
        return available.contains(name);
    }

    public List<String> getAvailableProperties() {
        return List.copyOf(available);
    }

    public List<HistoryEntry> getHistory() {
        return Collections.unmodifiableList(history);
    }

    /**
     * Find the first operation that removed a property.
     *
     * @param name
     * @return the operation name, or null if the property was never removed
     */
    public String findErasurePoint(String name) {
        for( var entry : history ) {
            if( entry.action() == HistoryEntry.Action.REMOVED && entry.property().equals(name) )
                return entry.operation();
        }
        return null;
    }

    public OperationDataTracker clone() {
        var result = new OperationDataTracker(registry);
        result.available = new LinkedHashSet<>(available);
        result.history = new ArrayList<>(history);
        return result;
    }

    /**
     * Join this tracker with another branch.
     *
     * @param other
     */
    public void merge(OperationDataTracker other) {
        available.retainAll(other.available);
        history.addAll(other.history);
    }

}
