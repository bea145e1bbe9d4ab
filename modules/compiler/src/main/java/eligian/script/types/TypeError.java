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
package eligian.script.types;

import eligian.script.ast.SourceLocation;

public record TypeError(String code, String message, String hint, SourceLocation location) {

    public static final String TYPE_MISMATCH = "TYPE_MISMATCH";

    public static final String TYPE_CONFLICT = "TYPE_CONFLICT";

    public static final String INVALID_TYPE_ANNOTATION = "INVALID_TYPE_ANNOTATION";

}
