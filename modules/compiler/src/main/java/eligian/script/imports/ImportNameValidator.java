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

import java.util.Set;

import static eligian.script.imports.ImportValidationError.ImportNameError;

public class ImportNameValidator {

    /**
     * Check that an import name is unique and does not shadow a
     * keyword or an operation.
     *
     * Only the first applicable error is reported, in the order:
     * duplicate name, reserved keyword, operation name.
     *
     * @param name
     * @param existingNames names of the imports declared before this one
     * @param reservedKeywords
     * @param operationNames
     */
    public static ImportNameError validateImportName(String name, Set<String> existingNames, Set<String> reservedKeywords, Set<String> operationNames) {
        if( existingNames.contains(name) ) {
            var msg = ErrorMessages.duplicateImportName(name);
            return new ImportNameError(ImportErrorCode.DUPLICATE_IMPORT_NAME, msg.message(), msg.hint());
        }
        if( reservedKeywords.contains(name) ) {
            var msg = ErrorMessages.reservedKeyword(name, reservedKeywords);
            return new ImportNameError(ImportErrorCode.RESERVED_KEYWORD, msg.message(), msg.hint());
        }
        if( operationNames.contains(name) ) {
            var msg = ErrorMessages.operationNameConflict(name);
            return new ImportNameError(ImportErrorCode.OPERATION_NAME_CONFLICT, msg.message(), msg.hint());
        }
        return null;
    }

}
