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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import eligian.script.ast.SourceLocation;

import static eligian.script.control.CompilerDiagnostic.Phase;
import static eligian.script.control.CompilerDiagnostic.Severity;

/**
 * Collect the diagnostics of every compiler phase so that they
 * can be reported together.
 */
public class DiagnosticCollector {

    private final List<CompilerDiagnostic> diagnostics = new ArrayList<>();

    public void add(CompilerDiagnostic diagnostic) {
        diagnostics.add(diagnostic);
    }

    public void addError(Phase phase, String code, String message, String hint, SourceLocation location) {
        add(new CompilerDiagnostic(Severity.ERROR, phase, code, message, hint, location));
    }

    public void addWarning(Phase phase, String code, String message, String hint, SourceLocation location) {
        add(new CompilerDiagnostic(Severity.WARNING, phase, code, message, hint, location));
    }

    public List<CompilerDiagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    public List<CompilerDiagnostic> getErrors() {
        return diagnostics.stream()
            .filter(CompilerDiagnostic::isError)
            .toList();
    }

    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(CompilerDiagnostic::isError);
    }

}
