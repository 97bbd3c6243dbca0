package org.jackanalyzer.compiler.diagnostics;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Collects the diagnostics of one analysis run, so the {@link org.jackanalyzer.compiler.frontend.lexer.Lexer}
 * can keep scanning after a bad character and report every problem at once.
 */
public class DiagnosticsEngine {

    private final List<Diagnostic> diagnostics = new ArrayList<>();

    public void reportError(String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.ERROR, message, fileName, lineNumber));
    }

    public void reportWarning(String message, String fileName, int lineNumber) {
        diagnostics.add(new Diagnostic(Diagnostic.Type.WARNING, message, fileName, lineNumber));
    }

    /**
     * Checks if errors have been reported.
     *
     * @return {@code true} if at least one error exists, otherwise {@code false}.
     */
    public boolean hasErrors() {
        return diagnostics.stream().anyMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }

    /**
     * Returns an unmodifiable view of all collected diagnostics, in reporting order.
     *
     * @return The diagnostics.
     */
    public List<Diagnostic> getDiagnostics() {
        return Collections.unmodifiableList(diagnostics);
    }

    /**
     * Returns all collected diagnostics as one string, one per line.
     *
     * @return A formatted summary.
     */
    public String summary() {
        return diagnostics.stream()
                .map(Diagnostic::toString)
                .collect(Collectors.joining("\n"));
    }
}
