package org.jackanalyzer.compiler.frontend.parser;

import org.jackanalyzer.compiler.frontend.lexer.Token;

/**
 * The result of running a grammar rule.
 *
 * @param status Whether the rule matched, did not apply, or found malformed input.
 * @param kind The failure kind, or {@code null} if the rule matched.
 * @param token The token the rule failed on, or {@code null} if it matched or the input was exhausted.
 * @param expected A readable description of what the rule needed, or {@code null} if it matched.
 * @param position The index of the token the rule failed on (the index one past the last token
 *                 when the input was exhausted), or -1 if it matched.
 */
public record ParseOutcome(
        Status status,
        ParseErrorKind kind,
        Token token,
        String expected,
        int position
) {

    private static final ParseOutcome MATCHED = new ParseOutcome(Status.MATCHED, null, null, null, -1);

    /**
     * The three shapes an outcome can take.
     */
    public enum Status {
        /** The rule consumed its tokens and emitted its nodes. */
        MATCHED,
        /** The rule does not apply at this position. */
        NOT_APPLICABLE,
        /** The input cannot be parsed by this rule. */
        MALFORMED
    }

    /**
     * @return The shared successful outcome.
     */
    public static ParseOutcome matched() {
        return MATCHED;
    }

    /**
     * Creates a failed outcome whose status follows from the recoverability of its kind.
     * @param kind The failure kind.
     * @param token The offending token, or {@code null} at end of input.
     * @param expected What was expected.
     * @param position The index of the offending token.
     * @return The failed outcome.
     */
    public static ParseOutcome failure(ParseErrorKind kind, Token token, String expected, int position) {
        Status status = kind.isRecoverable() ? Status.NOT_APPLICABLE : Status.MALFORMED;
        return new ParseOutcome(status, kind, token, expected, position);
    }

    public boolean isMatched() {
        return status == Status.MATCHED;
    }
}
