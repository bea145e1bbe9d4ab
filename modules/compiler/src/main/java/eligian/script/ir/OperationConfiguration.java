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
package eligian.script.ir;

import java.util.List;

import com.google.gson.JsonObject;
import eligian.script.ast.SourceLocation;

/**
 * Operation as consumed by the engine.
 *
 * @param erasedParameters parameters that the engine removes from
 *   the operation data after the operation runs (not emitted)
 */
public record OperationConfiguration(
    String id,
    String systemName,
    JsonObject operationData,
    List<String> erasedParameters,
    SourceLocation location
) {

    public OperationConfiguration {
        erasedParameters = List.copyOf(erasedParameters);
    }
}
