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
package eligian.script.util;

import java.util.List;
import java.util.Set;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class StringSimilarityTest {

    @Test
    void shouldComputeEditDistance() {
        assertEquals(0, StringSimilarity.levenshtein("same", "same"));
        assertEquals(3, StringSimilarity.levenshtein("", "abc"));
        assertEquals(1, StringSimilarity.levenshtein("primry", "primary"));
        assertEquals(3, StringSimilarity.levenshtein("kitten", "sitting"));
    }

    @Test
    void shouldSuggestCloseMatches() {
        var classes = Set.of("primary", "secondary", "button");

        var suggestions = StringSimilarity.findSimilar("primry", classes);

        assertEquals(List.of("primary"), suggestions);
        assertTrue(StringSimilarity.findSimilar("xyz-nonexistent", classes).isEmpty());
    }

    @Test
    void shouldOrderByDistanceThenName() {
        var candidates = List.of("abd", "abc", "xbc", "ab");

        var suggestions = StringSimilarity.findSimilar("abc", candidates);

        // exact match first, then distance 1 in alphabetical order
        assertEquals(List.of("abc", "ab", "abd"), suggestions);
    }

    @Test
    void shouldIgnoreCase() {
        assertEquals(List.of("addClass"), StringSimilarity.findSimilar("ADDCLASS", List.of("addClass")));
    }

}
