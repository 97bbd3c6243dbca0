package org.jackanalyzer.compiler.api;

import java.util.List;

/**
 * The per-file results of one analysis run, in the order the files were analyzed.
 *
 * @param files The file results.
 */
public record AnalysisReport(List<FileResult> files) {

    public AnalysisReport {
        files = List.copyOf(files);
    }

    public boolean succeeded() {
        return files.stream().allMatch(FileResult::succeeded);
    }

    public long failureCount() {
        return files.stream().filter(f -> !f.succeeded()).count();
    }
}
