package org.jackanalyzer.compiler.api;

/**
 * Thrown when an analysis run cannot be carried out at all, e.g. because the input path
 * does not exist, contains no Jack sources, or an output file cannot be written.
 * Syntax errors in individual files are reported through {@link AnalysisReport} instead.
 */
public class AnalyzerException extends Exception {

    public AnalyzerException(String message) {
        super(message);
    }

    public AnalyzerException(String message, Throwable cause) {
        super(message, cause);
    }
}
