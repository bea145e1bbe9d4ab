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
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import static org.junit.jupiter.api.Assertions.*;

class ImportPathValidatorTest {

    @Test
    void shouldAcceptRelativePaths() {
        assertNull(ImportPathValidator.validateImportPath("./layout.html"));
        assertNull(ImportPathValidator.validateImportPath("../shared/styles.css"));
    }

    @Test
    void shouldSkipEmptyPath() {
        assertNull(ImportPathValidator.validateImportPath(""));
    }

    @Test
    void shouldRejectUnixAbsolutePath() {
        var error = ImportPathValidator.validateImportPath("/layout.html");

        assertNotNull(error);
        assertEquals(ImportErrorCode.ABSOLUTE_PATH, error.code());
        assertEquals(ErrorMessages.ABSOLUTE_PATH.message(), error.message());
        assertEquals(ErrorMessages.ABSOLUTE_PATH.hint(), error.hint());
    }

    @ParameterizedTest
    @ValueSource(strings = {
        "C:\\assets\\layout.html",
        "\\\\server\\share\\layout.html",
        "https://example.com/layout.html",
        "file:///tmp/layout.html",
        "layout.html"
    })
    void shouldRejectPathsNotRelativeToDocument(String path) {
        var error = ImportPathValidator.validateImportPath(path);

        assertNotNull(error);
        assertEquals(ImportErrorCode.ABSOLUTE_PATH, error.code());
    }

}
