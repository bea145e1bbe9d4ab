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

import java.util.List;

import eligian.script.constants.ConstantMap;
import eligian.script.ir.EngineConfiguration;

/**
 * Outcome of compiling a program.
 *
 * @param configuration the engine configuration, or null if the program has errors
 * @param json the emitted configuration, or null if the program has errors
 */
public record CompilationResult(
    EngineConfiguration configuration,
    String json,
    List<CompilerDiagnostic> diagnostics,
    ConstantMap constants
) {

    public CompilationResult {
        diagnostics = List.copyOf(diagnostics);
    }

    public boolean isSuccess() {
        return configuration != null;
    }

    public List<CompilerDiagnostic> getErrors() {
        return diagnostics.stream()
            .filter(CompilerDiagnostic::isError)
            .toList();
    }
}
