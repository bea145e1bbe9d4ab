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

/**
 * Type requirement on an action parameter, derived from one usage site.
 *
 * @param source the usage site, e.g. {@code selectElement(arg 1: selector)}
 */
public record TypeConstraint(String parameter, EligianType expectedType, String source, SourceLocation location) {
}
