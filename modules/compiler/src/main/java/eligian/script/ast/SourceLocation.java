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
package eligian.script.ast;

/**
 * Position of a node in the source text.
 *
 * Lines and columns are 1-based. Synthetic nodes use {@link #NONE}.
 */
public record SourceLocation(int line, int column, int length) {

    public static final SourceLocation NONE = new SourceLocation(0, 0, 0);

    public static SourceLocation of(int line, int column) {
        return new SourceLocation(line, column, 0);
    }

    public boolean isSynthetic() {
        return line <= 0;
    }

    @Override
    public String toString() {
        return isSynthetic() ? "<synthetic>" : line + ":" + column;
    }
}
