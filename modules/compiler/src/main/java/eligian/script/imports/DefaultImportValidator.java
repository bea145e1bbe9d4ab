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

import java.util.HashSet;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import eligian.script.ast.DefaultImport;

import static eligian.script.imports.ImportValidationError.DuplicateDefaultImportError;

public class DefaultImportValidator {

    /**
     * Find repeated default imports. The first import of each kind
     * is always accepted, every later import of the same kind is
     * reported.
     *
     * @param imports
     * @return the error for each rejected import node
     */
    public static Map<DefaultImport,DuplicateDefaultImportError> validateDefaultImports(List<DefaultImport> imports) {
        var errors = new IdentityHashMap<DefaultImport,DuplicateDefaultImportError>();
        var seen = new HashSet<DefaultImport.Kind>();
        for( var node : imports ) {
            if( seen.add(node.kind()) )
                continue;
            var type = node.kind().keyword();
            var msg = ErrorMessages.duplicateDefaultImport(type);
            errors.put(node, new DuplicateDefaultImportError(ImportErrorCode.DUPLICATE_DEFAULT_IMPORT, msg.message(), msg.hint(), type));
        }
        return errors;
    }

}
