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

public class AssetTypes {

    /**
     * Get the lower-cased extension of the last path segment,
     * or an empty string if there is none.
     *
     * @param path
     */
    public static String extractExtension(String path) {
        if( path == null || path.isEmpty() )
            return "";
        var slash = Math.max(path.lastIndexOf('/'), path.lastIndexOf('\\'));
        var fileName = path.substring(slash + 1);
        var dot = fileName.lastIndexOf('.');
        if( dot < 0 || dot == fileName.length() - 1 )
            return "";
        return fileName.substring(dot + 1).toLowerCase();
    }

    /**
     * Infer the asset type of a path from its extension.
     *
     * @param path
     * @return the asset type, or null if the extension is unknown or ambiguous
     */
    public static AssetType inferAssetType(String path) {
        return ValidationConstants.EXTENSION_MAP.get(extractExtension(path));
    }

}
