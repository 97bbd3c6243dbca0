package org.jackanalyzer.compiler.frontend.lexer;

/**
 * A forward-only stream of classified tokens, as consumed by the
 * {@link org.jackanalyzer.compiler.frontend.parser.CompilationEngine}.
 * <p>
 * No token is current until {@link #advance()} has been called once. The accessors
 * for kind-specific payloads are only valid when the current token has that kind.
 */
public interface TokenSource {

    /**
     * Checks if there is a token after the current one.
     * @return true if {@link #advance()} may be called.
     */
    boolean hasMoreTokens();

    /**
     * Makes the next token the current one.
     * @throws IllegalStateException if there are no more tokens.
     */
    void advance();

    /**
     * Returns the current token.
     * @return The current token, or {@code null} if {@link #advance()} has not been called yet.
     */
    Token current();

    /**
     * Returns the lexical class of the current token.
     * @return The token type.
     */
    TokenType tokenType();

    /**
     * @return The keyword of the current token.
     * @throws IllegalStateException if the current token is not a keyword.
     */
    Keyword keyword();

    /**
     * @return The symbol of the current token.
     * @throws IllegalStateException if the current token is not a symbol.
     */
    Symbol symbol();

    /**
     * @return The name of the current identifier token.
     * @throws IllegalStateException if the current token is not an identifier.
     */
    String identifier();

    /**
     * @return The value of the current integer constant.
     * @throws IllegalStateException if the current token is not an integer constant.
     */
    int intVal();

    /**
     * @return The contents of the current string constant, without quotes.
     * @throws IllegalStateException if the current token is not a string constant.
     */
    String stringVal();

    /**
     * Captures the cursor position so it can be restored with {@link #reset(int)}.
     * @return An opaque position marker.
     */
    int mark();

    /**
     * Moves the cursor back to a position previously returned by {@link #mark()}.
     * @param mark The position marker.
     */
    void reset(int mark);
}
