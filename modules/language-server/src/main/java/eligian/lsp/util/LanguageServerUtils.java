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
package eligian.lsp.util;

import eligian.script.ast.SourceLocation;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

/**
 * Utility methods for mapping compiler data structures
 * to LSP data structures.
 */
public class LanguageServerUtils {

    public static int compilerToLspLine(int line) {
        return line > 0 ? line - 1 : 0;
    }

    public static int compilerToLspCharacter(int column) {
        return column > 0 ? column - 1 : 0;
    }

    /**
     * Convert a source location to a range. Synthetic locations
     * map to the start of the document.
     *
     * @param location
     */
    public static Range locationToRange(SourceLocation location) {
        if( location == null || location.isSynthetic() )
            return new Range(new Position(0, 0), new Position(0, 0));
        var line = compilerToLspLine(location.line());
        var character = compilerToLspCharacter(location.column());
        return new Range(
                new Position(line, character),
                new Position(line, character + Math.max(location.length(), 0)));
    }

    /**
     * Get the identifier that contains the given position, or null
     * if the position is not on an identifier.
     *
     * @param text
     * @param position
     */
    public static String getIdentifierAt(String text, Position position) {
        var line = getLine(text, position.getLine());
        if( line == null )
            return null;
        var character = Math.min(position.getCharacter(), line.length());
        int start = character;
        while( start > 0 && isIdentifierChar(line.charAt(start - 1)) )
            start--;
        int end = character;
        while( end < line.length() && isIdentifierChar(line.charAt(end)) )
            end++;
        return start < end ? line.substring(start, end) : null;
    }

    /**
     * Get the part of the identifier before the given position.
     *
     * @param text
     * @param position
     */
    public static String getIdentifierPrefix(String text, Position position) {
        var line = getLine(text, position.getLine());
        if( line == null )
            return "";
        var character = Math.min(position.getCharacter(), line.length());
        int start = character;
        while( start > 0 && isIdentifierChar(line.charAt(start - 1)) )
            start--;
        return line.substring(start, character);
    }

    private static String getLine(String text, int index) {
        if( text == null || index < 0 )
            return null;
        var lines = text.split("\r?\n", -1);
        return index < lines.length ? lines[index] : null;
    }

    private static boolean isIdentifierChar(char c) {
        return Character.isLetterOrDigit(c) || c == '_';
    }

}
