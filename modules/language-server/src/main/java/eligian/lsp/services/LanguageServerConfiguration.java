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

import eligian.lsp.util.JsonUtils;

public record LanguageServerConfiguration(
    ErrorReportingMode errorReportingMode,
    int maxCompletionItems,
    boolean typeChecking,
    boolean debug
) {

    public static LanguageServerConfiguration defaults() {
        return new LanguageServerConfiguration(
            ErrorReportingMode.WARNINGS,
            100,
            true,
            false
        );
    }

    /**
     * Apply the {@code eligian.*} client settings on top of this
     * configuration. Settings that are missing or malformed keep
     * their current value.
     *
     * @param settings
     */
    public LanguageServerConfiguration withSettings(Object settings) {
        return new LanguageServerConfiguration(
            withDefault(errorReportingMode(settings), errorReportingMode),
            withDefault(JsonUtils.getInteger(settings, "eligian.completion.maxItems"), maxCompletionItems),
            withDefault(JsonUtils.getBoolean(settings, "eligian.typeChecking"), typeChecking),
            withDefault(JsonUtils.getBoolean(settings, "eligian.debug"), debug)
        );
    }

    private static ErrorReportingMode errorReportingMode(Object settings) {
        var string = JsonUtils.getString(settings, "eligian.errorReportingMode");
        if( string == null )
            return null;
        try {
            return ErrorReportingMode.valueOf(string.toUpperCase());
        }
        catch( IllegalArgumentException e ) {
            return null;
        }
    }

    private static <T> T withDefault(T value, T defaultValue) {
        return value != null ? value : defaultValue;
    }
}
