package org.jackanalyzer.compiler.frontend.parser;

/**
 * A grammar rule or rule fragment that can be run against the current parse state.
 */
@FunctionalInterface
public interface Rule {

    /**
     * Runs the rule. On success the rule's tokens have been consumed and its nodes appended.
     * On failure the caller decides whether to restore the state.
     * @return The outcome.
     */
    ParseOutcome parse();
}
