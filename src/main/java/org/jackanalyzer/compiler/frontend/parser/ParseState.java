package org.jackanalyzer.compiler.frontend.parser;

import org.jackanalyzer.compiler.frontend.lexer.Token;
import org.jackanalyzer.compiler.frontend.lexer.TokenSource;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

/**
 * The mutable state of one parse: the token cursor, the tree built so far, and the failure
 * that got furthest into the input. Combinators snapshot it with {@link #mark()} before an
 * attempt and roll it back with {@link #restore(Mark)} when the attempt does not apply.
 */
public class ParseState {

    private final TokenSource tokens;
    private final ParseTree tree = new ParseTree();

    private int furthestPosition = -1;
    private ParseOutcome furthestFailure;
    private final Set<String> furthestExpected = new LinkedHashSet<>();

    /**
     * A snapshot of the parse state.
     *
     * @param tokenPosition The token source marker.
     * @param treeSize The number of tree events.
     */
    public record Mark(int tokenPosition, int treeSize) {

        /**
         * @return The index of the token an attempt starting at this mark inspects first.
         */
        public int nextTokenIndex() {
            return tokenPosition + 1;
        }
    }

    public ParseState(TokenSource tokens) {
        this.tokens = tokens;
    }

    public TokenSource tokens() {
        return tokens;
    }

    public ParseTree tree() {
        return tree;
    }

    public Mark mark() {
        return new Mark(tokens.mark(), tree.size());
    }

    public void restore(Mark mark) {
        tokens.reset(mark.tokenPosition());
        tree.truncate(mark.treeSize());
    }

    /**
     * Creates a failure on the current token and records it as a candidate for error reporting.
     * @param kind The failure kind.
     * @param expected What the rule needed.
     * @return The failed outcome.
     */
    public ParseOutcome failOnCurrent(ParseErrorKind kind, String expected) {
        return record(ParseOutcome.failure(kind, tokens.current(), expected, tokens.mark()));
    }

    /**
     * Creates a failure for running out of tokens and records it as a candidate for error reporting.
     * @param expected What the rule needed.
     * @return The failed outcome.
     */
    public ParseOutcome failAtEnd(String expected) {
        return record(ParseOutcome.failure(ParseErrorKind.NO_MORE_TOKENS, null, expected, tokens.mark() + 1));
    }

    private ParseOutcome record(ParseOutcome failure) {
        if (failure.position() > furthestPosition) {
            furthestPosition = failure.position();
            furthestFailure = failure;
            furthestExpected.clear();
        }
        if (failure.position() == furthestPosition) {
            furthestExpected.add(failure.expected());
        }
        return failure;
    }

    /**
     * Turns the failed outcome of a top-level rule into the exception reported to the user.
     * The exception describes the failure that got furthest into the input, which after
     * backtracking is usually a better pointer than the outcome the top-level rule ended with.
     * @param outcome The failed outcome of the top-level rule.
     * @return The exception to throw.
     */
    public ParseException toException(ParseOutcome outcome) {
        ParseOutcome reported = outcome;
        List<String> expected = new ArrayList<>();
        if (furthestFailure != null && furthestPosition >= outcome.position()) {
            if (furthestPosition > outcome.position()) {
                reported = furthestFailure;
            }
            expected.addAll(furthestExpected);
        } else {
            expected.add(outcome.expected());
        }
        return new ParseException(reported.kind(), reported.token(), expected);
    }
}
