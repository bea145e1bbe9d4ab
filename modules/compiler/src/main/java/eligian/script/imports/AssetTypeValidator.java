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

import eligian.script.ast.NamedImport;

import static eligian.script.imports.ImportValidationError.TypeInferenceError;

public class AssetTypeValidator {

    /**
     * Check that the asset type of a named import is known.
     *
     * An explicit type always wins. Otherwise the type is inferred
     * from the extension, which must be known and unambiguous.
     *
     * @param node
     */
    public static TypeInferenceError validateAssetType(NamedImport node) {
        if( node.assetType() != null )
            return null;

        var extension = AssetTypes.extractExtension(node.path());
        if( ValidationConstants.AMBIGUOUS_EXTENSIONS.contains(extension) ) {
            var msg = ErrorMessages.ambiguousExtension(extension);
            return new TypeInferenceError(ImportErrorCode.AMBIGUOUS_EXTENSION, msg.message(), msg.hint(), extension);
        }

        if( AssetTypes.inferAssetType(node.path()) == null ) {
            var msg = ErrorMessages.unknownExtension(extension);
            return new TypeInferenceError(ImportErrorCode.UNKNOWN_EXTENSION, msg.message(), msg.hint(), extension);
        }

        return null;
    }

}
