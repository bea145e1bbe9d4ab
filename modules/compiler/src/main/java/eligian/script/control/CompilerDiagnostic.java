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

import eligian.script.ast.SourceLocation;

/**
 * Problem reported by one of the compiler phases.
 *
 * @param hint a suggestion for fixing the problem, or null
 */
public record CompilerDiagnostic(
    Severity severity,
    Phase phase,
    String code,
    String message,
    String hint,
    SourceLocation location
) {

    public enum Severity {
        ERROR,
        WARNING,
        INFO
    }

    public enum Phase {
        IMPORTS,
        OPERATIONS,
        TYPE_CHECKING,
        DATA_FLOW,
        TRANSFORM
    }

    public boolean isError() {
        return severity == Severity.ERROR;
    }

    @Override
    public String toString() {
        var result = new StringBuilder();
        result.append(location).append(' ').append(severity).append(' ').append(code).append(": ").append(message);
        if( hint != null )
            result.append(" (").append(hint).append(')');
        return result.toString();
    }
}
