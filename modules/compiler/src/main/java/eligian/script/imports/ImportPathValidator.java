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

public class ImportPathValidator {

    /**
     * Check that an import path is relative to the importing document.
     *
     * Empty paths are skipped since the parser reports them.
     *
     * @param path
     * @return an ABSOLUTE_PATH error, or null if the path is valid
     */
    public static ImportValidationError.PathError validateImportPath(String path) {
        if( path == null || path.isEmpty() )
            return null;
        if( isRelativePath(path) )
            return null;
        var msg = ErrorMessages.ABSOLUTE_PATH;
        return new ImportValidationError.PathError(ImportErrorCode.ABSOLUTE_PATH, msg.message(), msg.hint());
    }

    private static boolean isRelativePath(String path) {
        return path.startsWith("./") || path.startsWith("../");
    }

}
