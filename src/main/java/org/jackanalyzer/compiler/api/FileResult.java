package org.jackanalyzer.compiler.api;

import org.jackanalyzer.compiler.diagnostics.Diagnostic;

import java.nio.file.Path;
import java.util.List;

/**
 * The outcome of analyzing one {@code .jack} file.
 *
 * @param source The analyzed source file.
 * @param treeOutput The parse tree file written, or {@code null} if the file failed.
 * @param tokenOutput The token listing written, or {@code null} if disabled or the file failed.
 * @param diagnostics The errors and warnings for this file.
 */
public record FileResult(
        Path source,
        Path treeOutput,
        Path tokenOutput,
        List<Diagnostic> diagnostics
) {

    public FileResult {
        diagnostics = List.copyOf(diagnostics);
    }

    /**
     * @return true if no error was reported for the file.
     */
    public boolean succeeded() {
        return diagnostics.stream().noneMatch(d -> d.type() == Diagnostic.Type.ERROR);
    }
}
