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

import java.util.Collection;
import java.util.stream.Collectors;

import eligian.script.ast.SourceLocation;

public class TypeCompatibility {

    public static boolean isCompatible(EligianType actual, EligianType expected) {
        return actual == EligianType.UNKNOWN
            || expected == EligianType.UNKNOWN
            || actual == expected;
    }

    /**
     * Check that a value of type {@code actual} can be used where
     * {@code expected} is required.
     *
     * @param actual
     * @param expected
     * @param location
     * @return a TYPE_MISMATCH error, or null if the types are compatible
     */
    public static TypeError validateTypeCompatibility(EligianType actual, EligianType expected, SourceLocation location) {
        if( isCompatible(actual, expected) )
            return null;
        return new TypeError(
            TypeError.TYPE_MISMATCH,
            "Cannot use '" + actual + "' where '" + expected + "' is expected",
            "Provide a " + expected + " value",
            location);
    }

    /**
     * Check a value against a parameter that accepts several types.
     * The value is compatible if it is compatible with any of them.
     *
     * @param actual
     * @param expected
     * @param location
     */
    public static TypeError validateTypeCompatibility(EligianType actual, Collection<EligianType> expected, SourceLocation location) {
        if( expected.isEmpty() )
            return null;
        for( var type : expected ) {
            if( isCompatible(actual, type) )
                return null;
        }
        if( expected.size() == 1 )
            return validateTypeCompatibility(actual, expected.iterator().next(), location);
        var names = expected.stream()
            .map(EligianType::displayName)
            .collect(Collectors.joining(" | "));
        return new TypeError(
            TypeError.TYPE_MISMATCH,
            "Cannot use '" + actual + "' where '" + names + "' is expected",
            "Provide one of: " + names,
            location);
    }

}
