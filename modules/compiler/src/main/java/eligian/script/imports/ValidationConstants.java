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

import java.util.Map;
import java.util.Set;

public class ValidationConstants {

    public static final Set<String> RESERVED_KEYWORDS = Set.of(
        "if",
        "else",
        "for",
        "break",
        "continue",
        "at",
        "action",
        "timeline",
        "layout",
        "styles",
        "provider",
        "import",
        "from",
        "as",
        "true",
        "false"
    );

    public static final Map<String,AssetType> EXTENSION_MAP = Map.ofEntries(
        Map.entry("html", AssetType.HTML),
        Map.entry("css", AssetType.CSS),
        Map.entry("mp4", AssetType.MEDIA),
        Map.entry("webm", AssetType.MEDIA),
        Map.entry("mp3", AssetType.MEDIA),
        Map.entry("wav", AssetType.MEDIA)
    );

    /**
     * Extensions that could be more than one kind of asset
     * (e.g. ogg audio or ogg video).
     */
    public static final Set<String> AMBIGUOUS_EXTENSIONS = Set.of("ogg");

}
