package org.boogpp.compiler.frontend.lexer;

import org.boogpp.compiler.api.SourceInfo;

/**
 * Represents a single token extracted from the source code by the {@link Lexer}.
 *
 * @param type The type of the token (e.g., keyword, identifier, literal).
 * @param text The exact text of the token from the source code.
 * @param value The processed value of the token (a {@link NumberLiteral}, the unescaped string, the char).
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name of the compilation unit.
 */
public record Token(
        TokenType type,
        String text,
        Object value,
        int line,
        int column,
        String fileName
) {

    /**
     * @return The position of this token as API source information.
     */
    public SourceInfo source() {
        return new SourceInfo(fileName, line, column);
    }

    @Override
    public String toString() {
        return type + "('" + text + "')@" + line + ":" + column;
    }
}
