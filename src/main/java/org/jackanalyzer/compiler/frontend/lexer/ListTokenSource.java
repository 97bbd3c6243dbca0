package org.jackanalyzer.compiler.frontend.lexer;

import java.util.List;

/**
 * A {@link TokenSource} over a token list produced by the {@link Lexer}.
 * The cursor is the index of the current token; -1 means no token is current yet.
 */
public class ListTokenSource implements TokenSource {

    private final List<Token> tokens;
    private int current = -1;

    /**
     * Creates a token source over the given tokens.
     * @param tokens The tokens, in source order.
     */
    public ListTokenSource(List<Token> tokens) {
        this.tokens = List.copyOf(tokens);
    }

    @Override
    public boolean hasMoreTokens() {
        return current + 1 < tokens.size();
    }

    @Override
    public void advance() {
        if (!hasMoreTokens()) {
            throw new IllegalStateException("No more tokens after position " + current);
        }
        current++;
    }

    @Override
    public Token current() {
        return current < 0 ? null : tokens.get(current);
    }

    @Override
    public TokenType tokenType() {
        return require().type();
    }

    @Override
    public Keyword keyword() {
        return (Keyword) require(TokenType.KEYWORD).value();
    }

    @Override
    public Symbol symbol() {
        return (Symbol) require(TokenType.SYMBOL).value();
    }

    @Override
    public String identifier() {
        return require(TokenType.IDENTIFIER).text();
    }

    @Override
    public int intVal() {
        return (Integer) require(TokenType.INT_CONST).value();
    }

    @Override
    public String stringVal() {
        return (String) require(TokenType.STRING_CONST).value();
    }

    @Override
    public int mark() {
        return current;
    }

    @Override
    public void reset(int mark) {
        if (mark < -1 || mark > current) {
            throw new IllegalArgumentException("Cannot reset to position " + mark + " from " + current);
        }
        current = mark;
    }

    private Token require() {
        Token token = current();
        if (token == null) {
            throw new IllegalStateException("No current token; advance() has not been called.");
        }
        return token;
    }

    private Token require(TokenType type) {
        Token token = require();
        if (token.type() != type) {
            throw new IllegalStateException("Current token '" + token.text() + "' is a " + token.type() + ", not a " + type);
        }
        return token;
    }
}
