package org.jackanalyzer.compiler;

import org.jackanalyzer.compiler.api.AnalysisReport;
import org.jackanalyzer.compiler.api.AnalyzerException;
import org.jackanalyzer.compiler.api.FileResult;
import org.jackanalyzer.compiler.diagnostics.DiagnosticsEngine;
import org.jackanalyzer.compiler.frontend.lexer.Lexer;
import org.jackanalyzer.compiler.frontend.lexer.ListTokenSource;
import org.jackanalyzer.compiler.frontend.lexer.Token;
import org.jackanalyzer.compiler.frontend.parser.CompilationEngine;
import org.jackanalyzer.compiler.frontend.parser.ParseException;
import org.jackanalyzer.compiler.frontend.parser.ParseTree;
import org.jackanalyzer.compiler.output.TokenListWriter;
import org.jackanalyzer.compiler.output.XmlTreeWriter;
import org.jackanalyzer.config.AnalyzerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Orchestrates the analysis of Jack sources: tokenizing, parsing and writing the parse tree
 * (and optionally the token listing) of every {@code .jack} file of a file or directory.
 * Files are analyzed one after another; each gets its own lexer, token source and engine.
 * It is not thread-safe.
 */
public class JackAnalyzer {

    private static final Logger LOG = LoggerFactory.getLogger(JackAnalyzer.class);

    private final AnalyzerSettings settings;
    private final XmlTreeWriter treeWriter;

    public JackAnalyzer(AnalyzerSettings settings) {
        this.settings = settings;
        this.treeWriter = new XmlTreeWriter(settings.indent());
    }

    /**
     * Analyzes a single source file or every source file directly inside a directory.
     *
     * @param input A {@code .jack} file or a directory.
     * @return The per-file results. Syntax errors are reported here, not thrown.
     * @throws AnalyzerException if the input cannot be read or holds no sources, or output cannot be written.
     */
    public AnalysisReport analyze(Path input) throws AnalyzerException {
        List<Path> sources = collectSources(input);
        LOG.info("Analyzing {} source file(s) from {}", sources.size(), input);

        List<FileResult> results = new ArrayList<>();
        for (Path source : sources) {
            results.add(analyzeFile(source));
        }

        AnalysisReport report = new AnalysisReport(results);
        if (report.succeeded()) {
            LOG.info("Analysis finished: {} file(s) parsed.", results.size());
        } else {
            LOG.warn("Analysis finished: {} of {} file(s) failed.", report.failureCount(), results.size());
        }
        return report;
    }

    /**
     * Analyzes one source file and writes its output files if it parses.
     *
     * @param source The {@code .jack} file.
     * @return The result for the file.
     * @throws AnalyzerException if the file cannot be read or an output file cannot be written.
     */
    public FileResult analyzeFile(Path source) throws AnalyzerException {
        String fileName = source.getFileName().toString();
        String text;
        try {
            text = Files.readString(source, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AnalyzerException("Failed to read " + source, e);
        }

        // Phase 1: Lexical Analysis
        DiagnosticsEngine diagnostics = new DiagnosticsEngine();
        List<Token> tokens = new Lexer(text, diagnostics, fileName).scanTokens();
        if (diagnostics.hasErrors()) {
            LOG.warn("Tokenizing {} failed:\n{}", fileName, diagnostics.summary());
            return new FileResult(source, null, null, diagnostics.getDiagnostics());
        }
        LOG.debug("{}: {} tokens", fileName, tokens.size());

        // Phase 2: Parsing (builds the parse tree)
        ListTokenSource tokenSource = new ListTokenSource(tokens);
        CompilationEngine engine = new CompilationEngine(tokenSource);
        try {
            engine.compileClass();
        } catch (ParseException e) {
            diagnostics.reportError(e.getMessage(), fileName, e.getLine());
            LOG.warn("Parsing {} failed: {}", fileName, e.getMessage());
            return new FileResult(source, null, null, diagnostics.getDiagnostics());
        }
        if (tokenSource.hasMoreTokens()) {
            tokenSource.advance();
            Token extra = tokenSource.current();
            diagnostics.reportWarning("Ignoring tokens after the end of the class, starting with '" + extra.text() + "'.",
                    fileName, extra.line());
        }

        // Phase 3: Output
        Path directory = outputDirectoryFor(source);
        String baseName = baseName(fileName);
        ParseTree tree = engine.tree();
        Path treeOutput = write(directory.resolve(baseName + ".xml"),
                settings.flatOutput() ? tree.toMarkup() + "\n" : treeWriter.write(tree));
        Path tokenOutput = null;
        if (settings.writeTokenFiles()) {
            tokenOutput = write(directory.resolve(baseName + "T.xml"), TokenListWriter.write(tokens));
        }
        LOG.info("{} -> {}", fileName, treeOutput);
        return new FileResult(source, treeOutput, tokenOutput, diagnostics.getDiagnostics());
    }

    private List<Path> collectSources(Path input) throws AnalyzerException {
        if (Files.isRegularFile(input)) {
            if (!isSource(input)) {
                throw new AnalyzerException("Not a " + settings.sourceExtension() + " file: " + input);
            }
            return List.of(input);
        }
        if (!Files.isDirectory(input)) {
            throw new AnalyzerException("No such file or directory: " + input);
        }
        try (Stream<Path> entries = Files.list(input)) {
            List<Path> sources = entries
                    .filter(Files::isRegularFile)
                    .filter(this::isSource)
                    .sorted()
                    .collect(Collectors.toList());
            if (sources.isEmpty()) {
                throw new AnalyzerException("No " + settings.sourceExtension() + " files in directory: " + input);
            }
            return sources;
        } catch (IOException e) {
            throw new AnalyzerException("Failed to list " + input, e);
        }
    }

    private boolean isSource(Path path) {
        return path.getFileName().toString().endsWith(settings.sourceExtension());
    }

    private Path outputDirectoryFor(Path source) {
        if (settings.outputDirectory() != null) {
            return settings.outputDirectory();
        }
        Path parent = source.toAbsolutePath().getParent();
        return parent != null ? parent : Path.of("").toAbsolutePath();
    }

    private String baseName(String fileName) {
        if (!fileName.endsWith(settings.sourceExtension())) {
            return fileName;
        }
        return fileName.substring(0, fileName.length() - settings.sourceExtension().length());
    }

    private Path write(Path target, String content) throws AnalyzerException {
        try {
            Files.createDirectories(target.toAbsolutePath().getParent());
            return Files.writeString(target, content, StandardCharsets.UTF_8);
        } catch (IOException e) {
            throw new AnalyzerException("Failed to write " + target, e);
        }
    }
}
