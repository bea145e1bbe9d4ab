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

import eligian.script.ast.SourceLocation;

/**
 * Syntax error reported by a {@link ProgramParser}.
 */
public class ParseException extends Exception {

    private final SourceLocation location;

    public ParseException(String message, SourceLocation location) {
        super(message);
        this.location = location != null ? location : SourceLocation.NONE;
    }

    public SourceLocation getLocation() {
        return location;
    }

}
