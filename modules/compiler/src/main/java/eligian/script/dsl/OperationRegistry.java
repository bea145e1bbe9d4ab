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

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import eligian.script.util.StringSimilarity;

/**
 * Catalog of the built-in operations.
 *
 * The registry is immutable once constructed. Use {@link #getDefault()}
 * for the operations bundled with the compiler.
 */
public class OperationRegistry {

    private static OperationRegistry defaultRegistry;

    private final Map<String,OperationSignature> operations;

    public OperationRegistry(Map<String,OperationSignature> operations) {
        this.operations = Collections.unmodifiableMap(new LinkedHashMap<>(operations));
    }

    public static OperationRegistry getDefault() {
        if( defaultRegistry == null )
            defaultRegistry = new OperationRegistry(OperationSpecFactory.defaultOperations());
        return defaultRegistry;
    }

    public OperationSignature getOperationSignature(String name) {
        return operations.get(name);
    }

    public boolean hasOperation(String name) {
        return operations.containsKey(name);
    }

    public List<OperationSignature> getAllOperations() {
        return List.copyOf(operations.values());
    }

    public List<String> getAllOperationNames() {
        var names = new ArrayList<>(operations.keySet());
        Collections.sort(names);
        return names;
    }

    /**
     * Group the operations by category. Categories and the
     * operations within each category are sorted by name.
     */
    public Map<String,List<OperationSignature>> getOperationsByCategory() {
        var sorted = new ArrayList<>(operations.values());
        sorted.sort(Comparator.comparing(OperationSignature::category).thenComparing(OperationSignature::systemName));
        var result = new LinkedHashMap<String,List<OperationSignature>>();
        for( var signature : sorted )
            result.computeIfAbsent(signature.category(), (k) -> new ArrayList<>()).add(signature);
        return result;
    }

    public List<String> findOperationsWithDependency(String name) {
        return operations.values().stream()
            .filter((signature) -> signature.hasDependency(name))
            .map(OperationSignature::systemName)
            .toList();
    }

    public List<String> findOperationsWithOutput(String name) {
        return operations.values().stream()
            .filter((signature) -> signature.hasOutput(name))
            .map(OperationSignature::systemName)
            .toList();
    }

    /**
     * Find operations whose name contains the given query,
     * ignoring case. Earlier matches are ranked first.
     *
     * @param query
     */
    public List<String> searchOperations(String query) {
        var lower = query.toLowerCase();
        return operations.keySet().stream()
            .filter((name) -> name.toLowerCase().contains(lower))
            .sorted(Comparator.comparingInt((String name) -> name.toLowerCase().indexOf(lower)).thenComparing(Comparator.naturalOrder()))
            .toList();
    }

    public List<String> suggestSimilarOperations(String name) {
        return StringSimilarity.findSimilar(name, operations.keySet());
    }

    /**
     * Check the internal consistency of the registry.
     *
     * @throws IllegalStateException if any signature is malformed
     */
    public void validateRegistry() {
        for( var entry : operations.entrySet() ) {
            var name = entry.getKey();
            var signature = entry.getValue();
            if( !name.equals(signature.systemName()) )
                throw new IllegalStateException("Registry key '" + name + "' does not match system name '" + signature.systemName() + "'");
            if( isBlank(signature.description()) )
                throw new IllegalStateException("Operation '" + name + "' is missing a description");
            for( var param : signature.parameters() ) {
                if( isBlank(param.name()) )
                    throw new IllegalStateException("Operation '" + name + "' has a parameter without a name");
                if( param.type() instanceof ParameterKind.SemanticTypes st && st.types().isEmpty() )
                    throw new IllegalStateException("Parameter '" + param.name() + "' of operation '" + name + "' has no type");
                if( param.type() instanceof ParameterKind.ConstantValues cv && cv.options().isEmpty() )
                    throw new IllegalStateException("Parameter '" + param.name() + "' of operation '" + name + "' has no allowed values");
            }
            for( var dep : signature.dependencies() ) {
                if( isBlank(dep.name()) )
                    throw new IllegalStateException("Operation '" + name + "' has a dependency without a name");
            }
            for( var output : signature.outputs() ) {
                if( isBlank(output.name()) )
                    throw new IllegalStateException("Operation '" + name + "' has an output without a name");
            }
        }
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }

}
