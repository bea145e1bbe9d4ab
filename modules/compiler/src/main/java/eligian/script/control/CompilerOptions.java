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

public record CompilerOptions(
    boolean typeChecking,
    boolean dataFlowChecking,
    boolean prettyPrint,
    String engineSystemName,
    String containerSelector,
    String language,
    String layoutTemplate
) {

    public static CompilerOptions defaults() {
        return new CompilerOptions(
            true,
            true,
            true,
            "Eligius",
            "body",
            "en-US",
            "default"
        );
    }

    public CompilerOptions withTypeChecking(boolean value) {
        return new CompilerOptions(value, dataFlowChecking, prettyPrint, engineSystemName, containerSelector, language, layoutTemplate);
    }

    public CompilerOptions withPrettyPrint(boolean value) {
        return new CompilerOptions(typeChecking, dataFlowChecking, value, engineSystemName, containerSelector, language, layoutTemplate);
    }
}
