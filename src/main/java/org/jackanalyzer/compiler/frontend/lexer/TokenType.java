package org.jackanalyzer.compiler.frontend.lexer;

/**
 * Defines the lexical classes the {@link Lexer} recognizes in Jack source code.
 */
public enum TokenType {
    /** A reserved word such as {@code class} or {@code while}. */
    KEYWORD("keyword"),
    /** A single-character symbol such as {@code (} or {@code +}. */
    SYMBOL("symbol"),
    /** A sequence of letters, digits and underscores not starting with a digit. */
    IDENTIFIER("identifier"),
    /** A decimal integer in the range 0..32767. */
    INT_CONST("integerConstant"),
    /** A double-quoted string without newlines. */
    STRING_CONST("stringConstant");

    private final String tagName;

    TokenType(String tagName) {
        this.tagName = tagName;
    }

    /**
     * Gets the element name used for leaves of this type in the parse tree.
     * @return The tag name.
     */
    public String tagName() {
        return tagName;
    }
}
