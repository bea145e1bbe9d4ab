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

/**
 * The primitive types of the Eligian type system.
 *
 * {@code unknown} is compatible with every type.
 */
public enum EligianType {
    STRING("string"),
    NUMBER("number"),
    BOOLEAN("boolean"),
    OBJECT("object"),
    ARRAY("array"),
    UNKNOWN("unknown");

    private final String displayName;

    EligianType(String displayName) {
        this.displayName = displayName;
    }

    public String displayName() {
        return displayName;
    }

    /**
     * Resolve a type annotation, or return null if the name
     * is not a type.
     *
     * @param name
     */
    public static EligianType fromName(String name) {
        for( var type : values() ) {
            if( type.displayName.equals(name) )
                return type;
        }
        return null;
    }

    @Override
    public String toString() {
        return displayName;
    }
}
