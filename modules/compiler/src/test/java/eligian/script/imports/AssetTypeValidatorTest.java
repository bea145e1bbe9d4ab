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
package eligian.script.imports;

import org.junit.jupiter.api.Test;

import static eligian.script.ast.ASTHelpers.*;
import static org.junit.jupiter.api.Assertions.*;

class AssetTypeValidatorTest {

    @Test
    void shouldExtractExtension() {
        assertEquals("html", AssetTypes.extractExtension("./layout.HTML"));
        assertEquals("mp4", AssetTypes.extractExtension("../media/intro.final.mp4"));
        assertEquals("", AssetTypes.extractExtension("./v1.2/README"));
        assertEquals("", AssetTypes.extractExtension("./noext."));
    }

    @Test
    void shouldInferKnownTypes() {
        assertEquals(AssetType.HTML, AssetTypes.inferAssetType("./tooltip.html"));
        assertEquals(AssetType.CSS, AssetTypes.inferAssetType("./theme.css"));
        assertEquals(AssetType.MEDIA, AssetTypes.inferAssetType("./clip.webm"));
        assertNull(AssetTypes.inferAssetType("./audio.ogg"));
    }

    @Test
    void shouldAcceptInferableImport() {
        assertNull(AssetTypeValidator.validateAssetType(namedImport("tooltip", "./tooltip.html", null)));
    }

    @Test
    void shouldPreferExplicitType() {
        assertNull(AssetTypeValidator.validateAssetType(namedImport("data", "./data.json", "html")));
        assertNull(AssetTypeValidator.validateAssetType(namedImport("sound", "./sound.ogg", "media")));
    }

    @Test
    void shouldRejectUnknownExtension() {
        var error = AssetTypeValidator.validateAssetType(namedImport("data", "./data.json", null));

        assertEquals(ImportErrorCode.UNKNOWN_EXTENSION, error.code());
        assertEquals("json", error.extension());
        assertEquals("Unknown file extension '.json', please specify type: import foo from './file.json' as html|css|media", error.message());
    }

    @Test
    void shouldRejectAmbiguousExtension() {
        var error = AssetTypeValidator.validateAssetType(namedImport("sound", "./sound.ogg", null));

        assertEquals(ImportErrorCode.AMBIGUOUS_EXTENSION, error.code());
        assertEquals("Ambiguous file extension '.ogg', please specify type explicitly", error.message());
    }

}
