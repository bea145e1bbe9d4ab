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
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Folded global constants of a program, together with the
 * declarations that could not be folded.
 */
public class ConstantMap {

    private final Map<String,ConstantValue> constants;

    private final Map<String,EvaluationError> unfoldable;

    public ConstantMap(Map<String,ConstantValue> constants, Map<String,EvaluationError> unfoldable) {
        this.constants = Collections.unmodifiableMap(new LinkedHashMap<>(constants));
        this.unfoldable = Collections.unmodifiableMap(new LinkedHashMap<>(unfoldable));
    }

    public static ConstantMap empty() {
        return new ConstantMap(Collections.emptyMap(), Collections.emptyMap());
    }

    public ConstantValue get(String name) {
        return constants.get(name);
    }

    public boolean has(String name) {
        return constants.containsKey(name);
    }

    public Map<String,ConstantValue> asMap() {
        return constants;
    }

    public List<String> getUnfoldableNames() {
        return List.copyOf(unfoldable.keySet());
    }

    public boolean isUnfoldable(String name) {
        return unfoldable.containsKey(name);
    }

    public EvaluationError getError(String name) {
        return unfoldable.get(name);
    }

    public int size() {
        return constants.size();
    }

}
