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
package eligian.lsp.services;

import eligian.script.control.CompilerDiagnostic;

/**
 * Minimum severity of the diagnostics published to the client.
 */
public enum ErrorReportingMode {
    OFF,
    ERRORS,
    WARNINGS,
    INFO;

    public boolean isRelevant(CompilerDiagnostic diagnostic) {
        switch( this ) {
            case OFF:
                return false;
            case ERRORS:
                return diagnostic.severity() == CompilerDiagnostic.Severity.ERROR;
            case WARNINGS:
                return diagnostic.severity() != CompilerDiagnostic.Severity.INFO;
            default:
                return true;
        }
    }
}
