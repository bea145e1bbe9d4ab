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
package eligian.lsp.services;

import eligian.script.dsl.OperationRegistry;
import org.eclipse.lsp4j.MarkupKind;
import org.eclipse.lsp4j.Position;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

class OperationHoverProviderTest {

    private OperationHoverProvider provider;

    @BeforeEach
    void setUp() {
        provider = new OperationHoverProvider(OperationRegistry.getDefault());
    }

    @Test
    void shouldDescribeOperation() {
        // When
        var hover = provider.hover("addClass");

        // Then
        var content = hover.getContents().getRight();
        assertEquals(MarkupKind.MARKDOWN, content.getKind());
        var value = content.getValue();
        assertTrue(value.startsWith("```eligian\naddClass(className)\n```"));
        assertTrue(value.contains("- `className`: className (required, erased)"));
        assertTrue(value.contains("**Requires:** `selectedElement`"));
        assertFalse(value.contains("**Provides:**"));
    }

    @Test
    void shouldListOutputsAndConstantValues() {
        var value = provider.hover("calc").getContents().getRight().getValue();

        assertTrue(value.contains("`operator`: '+' | '-' | '*' | '/' | '%' | '**'"));
        assertTrue(value.contains("**Provides:** `calculationResult`"));
    }

    @Test
    void shouldIgnoreUnknownNames() {
        assertNull(provider.hover("notAnOperation"));
    }

    @Test
    void shouldFindIdentifierAtPosition() {
        var text = "action fadeIn(selector) [\n  selectElement(selector)\n]";

        assertNotNull(provider.hover(text, new Position(1, 2)));
        assertNotNull(provider.hover(text, new Position(1, 15)));
        assertNull(provider.hover(text, new Position(0, 8)));
        assertNull(provider.hover(text, new Position(5, 0)));
    }

}
