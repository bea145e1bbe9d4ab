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

import java.util.ArrayList;
import java.util.Collection;
import java.util.Comparator;
import java.util.List;

/**
 * Edit-distance helpers for "did you mean" suggestions.
 */
public class StringSimilarity {

    public static final int DEFAULT_MAX_DISTANCE = 2;

    public static final int DEFAULT_MAX_SUGGESTIONS = 3;

    /**
     * Compute the Levenshtein distance between two strings.
     *
     * @param a
     * @param b
     */
    public static int levenshtein(String a, String b) {
        if( a.equals(b) )
            return 0;
        if( a.isEmpty() )
            return b.length();
        if( b.isEmpty() )
            return a.length();

        var previous = new int[b.length() + 1];
        var current = new int[b.length() + 1];
        for( int j = 0; j <= b.length(); j++ )
            previous[j] = j;

        for( int i = 1; i <= a.length(); i++ ) {
            current[0] = i;
            for( int j = 1; j <= b.length(); j++ ) {
                var cost = a.charAt(i - 1) == b.charAt(j - 1) ? 0 : 1;
                current[j] = Math.min(
                    Math.min(current[j - 1] + 1, previous[j] + 1),
                    previous[j - 1] + cost);
            }
            var tmp = previous;
            previous = current;
            current = tmp;
        }
        return previous[b.length()];
    }

    public static List<String> findSimilar(String name, Collection<String> candidates) {
        return findSimilar(name, candidates, DEFAULT_MAX_DISTANCE, DEFAULT_MAX_SUGGESTIONS);
    }

    /**
     * Find the candidates closest to a given name.
     *
     * Matches are compared case-insensitively, limited to
     * {@code maxDistance} edits, and sorted by distance and then
     * alphabetically.
     *
     * @param name
     * @param candidates
     * @param maxDistance
     * @param maxSuggestions
     */
    public static List<String> findSimilar(String name, Collection<String> candidates, int maxDistance, int maxSuggestions) {
        var target = name.toLowerCase();
        var matches = new ArrayList<Match>();
        for( var candidate : candidates ) {
            var distance = levenshtein(target, candidate.toLowerCase());
            if( distance <= maxDistance )
                matches.add(new Match(candidate, distance));
        }
        matches.sort(Comparator.comparingInt(Match::distance).thenComparing(Match::name));
        return matches.stream()
            .limit(maxSuggestions)
            .map(Match::name)
            .toList();
    }

    private static record Match(String name, int distance) {
    }

}
