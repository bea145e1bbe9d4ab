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
package eligian.script.types;

import java.util.List;
import java.util.Map;

/**
 * Resolved parameter types of an action.
 *
 * Every parameter has an entry in {@code types}: parameters whose
 * constraints conflict resolve to {@code unknown} and the conflict
 * is reported in {@code errors}.
 */
public record InferenceResult(Map<String,EligianType> types, List<TypeError> errors) {

    public boolean hasErrors() {
        return !errors.isEmpty();
    }

    public EligianType getType(String name) {
        return types.getOrDefault(name, EligianType.UNKNOWN);
    }
}
