package org.jackanalyzer.compiler.frontend.lexer;

/**
 * Represents a single token extracted from Jack source code by the {@link Lexer}.
 *
 * @param type The lexical class of the token.
 * @param text The exact text of the token from the source code (string constants keep their quotes).
 * @param value The processed value: a {@link Keyword}, a {@link Symbol}, an {@link Integer}
 *              or the string constant's contents. {@code null} for identifiers.
 * @param line The line number where the token was found.
 * @param column The column number where the token begins.
 * @param fileName The logical file name the token originates from.
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
     * Returns the text a parse tree leaf records for this token.
     * This is the token text, except for string constants, whose leaf holds the contents without quotes.
     * @return The leaf text.
     */
    public String leafText() {
        return type == TokenType.STRING_CONST ? (String) value : text;
    }
}
