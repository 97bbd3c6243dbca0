package org.jackanalyzer.compiler.frontend.parser;

/**
 * The ways a grammar rule can fail to match.
 * <p>
 * The {@code *_NOT_FOUND} kinds mean the current token has a different lexical class than the
 * rule needs, so the rule does not apply here and a combinator may try something else. The other
 * kinds mean the input is malformed: a token of the right class with the wrong value, or no input left.
 */
public enum ParseErrorKind {
    KEYWORD_NOT_FOUND(true),
    WRONG_KEYWORD(false),
    SYMBOL_NOT_FOUND(true),
    WRONG_SYMBOL(false),
    IDENTIFIER_NOT_FOUND(true),
    INTEGER_CONSTANT_NOT_FOUND(true),
    STRING_CONSTANT_NOT_FOUND(true),
    NO_MORE_TOKENS(false);

    private final boolean recoverable;

    ParseErrorKind(boolean recoverable) {
        this.recoverable = recoverable;
    }

    /**
     * @return true if this kind only signals that an alternative does not apply.
     */
    public boolean isRecoverable() {
        return recoverable;
    }
}
