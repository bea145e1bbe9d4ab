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
package eligian.script.control;

public record OperationValidationError(String code, String operationName, String message, String hint) {

    public static final String UNKNOWN_OPERATION = "UNKNOWN_OPERATION";

    public static final String PARAMETER_COUNT = "PARAMETER_COUNT";

    public static final String MISSING_DEPENDENCY = "MISSING_DEPENDENCY";

    public static final String CONTROL_FLOW = "CONTROL_FLOW";

}
