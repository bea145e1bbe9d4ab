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

/**
 * Problem found by one of the import validators.
 */
public sealed interface ImportValidationError {

    ImportErrorCode code();

    String message();

    String hint();

    record PathError(ImportErrorCode code, String message, String hint) implements ImportValidationError {
    }

    record ImportNameError(ImportErrorCode code, String message, String hint) implements ImportValidationError {
    }

    record TypeInferenceError(ImportErrorCode code, String message, String hint, String extension) implements ImportValidationError {
    }

    record DuplicateDefaultImportError(ImportErrorCode code, String message, String hint, String importType) implements ImportValidationError {
    }

}
