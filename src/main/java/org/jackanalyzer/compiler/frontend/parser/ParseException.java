package org.jackanalyzer.compiler.frontend.parser;

import org.jackanalyzer.compiler.frontend.lexer.Token;

import java.util.List;

/**
 * Thrown when a token stream cannot be parsed as the requested grammar rule.
 * It names the single expectation that could not be met.
 */
public class ParseException extends Exception {

    private final ParseErrorKind kind;
    private final transient Token token;
    private final List<String> expected;

    /**
     * Constructs a new parse exception.
     * @param kind The kind of failure.
     * @param token The offending token, or {@code null} if the input ended too early.
     * @param expected What would have been accepted at that point.
     */
    public ParseException(ParseErrorKind kind, Token token, List<String> expected) {
        super(describe(kind, token, expected));
        this.kind = kind;
        this.token = token;
        this.expected = List.copyOf(expected);
    }

    public ParseErrorKind getKind() {
        return kind;
    }

    /**
     * @return The offending token, or {@code null} if the input ended too early.
     */
    public Token getToken() {
        return token;
    }

    public List<String> getExpected() {
        return expected;
    }

    /**
     * @return The line of the offending token, or 0 if the input ended too early.
     */
    public int getLine() {
        return token == null ? 0 : token.line();
    }

    private static String describe(ParseErrorKind kind, Token token, List<String> expected) {
        String wanted = expected.size() == 1 ? expected.get(0) : "one of " + String.join(", ", expected);
        if (token == null) {
            return "Unexpected end of input, expected " + wanted + " (" + kind + ")";
        }
        return String.format("Expected %s but found '%s' at %d:%d (%s)",
                wanted, token.text(), token.line(), token.column(), kind);
    }
}
