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

import java.util.HashMap;
import java.util.Map;

/**
 * Known types of the names visible in an action body.
 */
public class TypeEnvironment {

    private Map<String,EligianType> types = new HashMap<>();

    public void addVariable(String name, EligianType type) {
        types.put(name, type);
    }

    public EligianType getVariableType(String name) {
        return types.get(name);
    }

    public boolean hasVariable(String name) {
        return types.containsKey(name);
    }

    public TypeEnvironment clone() {
        var result = new TypeEnvironment();
        result.types = new HashMap<>(types);
        return result;
    }

}
