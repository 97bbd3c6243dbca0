package org.jackanalyzer.compiler.diagnostics;

/**
 * A single message (error or warning) produced while analyzing a Jack source file.
 *
 * @param type The severity.
 * @param message The diagnostic message.
 * @param fileName The file the message refers to.
 * @param lineNumber The line the message refers to, or 0 if it concerns the whole file.
 */
public record Diagnostic(
        Type type,
        String message,
        String fileName,
        int lineNumber
) {
    /**
     * The severity of a diagnostic message.
     */
    public enum Type {
        /** Prevents the file from being parsed. */
        ERROR,
        /** Reported, but analysis continues. */
        WARNING
    }

    @Override
    public String toString() {
        return String.format("[%s] %s:%d: %s", type, fileName, lineNumber, message);
    }
}
