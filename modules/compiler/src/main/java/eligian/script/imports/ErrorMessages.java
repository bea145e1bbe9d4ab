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
package eligian.script.imports;

import java.util.Collection;
import java.util.stream.Collectors;

/**
 * Message and hint text of the import errors.
 */
public class ErrorMessages {

    public record Message(String message, String hint) {
    }

    public static final Message ABSOLUTE_PATH = new Message(
        "Import path must be relative (start with './' or '../'), absolute paths are not portable",
        "Use './filename.ext' or '../folder/filename.ext' for relative paths");

    public static final Message INVALID_PATH_FORMAT = new Message(
        "Invalid path format",
        "Paths must be quoted strings starting with './' or '../'");

    public static Message duplicateImportName(String name) {
        return new Message(
            String.format("Duplicate import name '%s', import names must be unique", name),
            "Choose a different name for this import");
    }

    public static Message reservedKeyword(String name, Collection<String> keywords) {
        var sorted = keywords.stream().sorted().collect(Collectors.joining(", "));
        return new Message(
            String.format("Cannot use reserved keyword '%s' as import name", name),
            "Reserved keywords: " + sorted);
    }

    public static Message operationNameConflict(String name) {
        return new Message(
            String.format("Cannot use operation name '%s' as import name", name),
            String.format("'%s' is a built-in operation. Choose a different import name", name));
    }

    public static Message unknownExtension(String extension) {
        return new Message(
            String.format("Unknown file extension '.%s', please specify type: import foo from './file.%s' as html|css|media", extension, extension),
            "Add 'as html', 'as css', or 'as media' to specify the asset type");
    }

    public static Message ambiguousExtension(String extension) {
        return new Message(
            String.format("Ambiguous file extension '.%s', please specify type explicitly", extension),
            "Add 'as media' to clarify this is a media file");
    }

    public static Message duplicateDefaultImport(String type) {
        return new Message(
            String.format("Duplicate '%s' import, only one %s import is allowed", type, type),
            String.format("Remove duplicate %s import statements", type));
    }

}
