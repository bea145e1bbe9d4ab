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
package eligian.lsp.util;

import eligian.script.ast.SourceLocation;
import org.eclipse.lsp4j.Position;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class LanguageServerUtilsTest {

    @Test
    void shouldConvertToZeroBasedRange() {
        var range = LanguageServerUtils.locationToRange(new SourceLocation(4, 3, 10));

        assertEquals(new Position(3, 2), range.getStart());
        assertEquals(new Position(3, 12), range.getEnd());
    }

    @Test
    void shouldMapSyntheticLocationToDocumentStart() {
        var range = LanguageServerUtils.locationToRange(SourceLocation.NONE);

        assertEquals(new Position(0, 0), range.getStart());
        assertEquals(new Position(0, 0), range.getEnd());
    }

    @Test
    void shouldFindIdentifiers() {
        var text = "first line\r\n  log(value_1)";

        assertEquals("log", LanguageServerUtils.getIdentifierAt(text, new Position(1, 3)));
        assertEquals("value_1", LanguageServerUtils.getIdentifierAt(text, new Position(1, 12)));
        assertNull(LanguageServerUtils.getIdentifierAt(text, new Position(1, 0)));
        assertEquals("lo", LanguageServerUtils.getIdentifierPrefix(text, new Position(1, 4)));
        assertEquals("", LanguageServerUtils.getIdentifierPrefix(text, new Position(9, 0)));
    }

}
