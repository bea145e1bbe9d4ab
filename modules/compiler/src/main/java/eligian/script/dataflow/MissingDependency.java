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
package eligian.script.dataflow;

import eligian.script.ast.SourceLocation;

/**
 * Operation call whose dependency is not on the operation data.
 *
 * @param removedBy the operation that removed the property earlier in the sequence, or null
 */
public record MissingDependency(String operation, String dependency, String removedBy, SourceLocation location) {
}
