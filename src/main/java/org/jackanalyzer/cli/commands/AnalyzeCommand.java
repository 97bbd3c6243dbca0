package org.jackanalyzer.cli.commands;

import com.typesafe.config.ConfigException;
import org.jackanalyzer.cli.CommandLineInterface;
import org.jackanalyzer.compiler.JackAnalyzer;
import org.jackanalyzer.compiler.api.AnalysisReport;
import org.jackanalyzer.compiler.api.AnalyzerException;
import org.jackanalyzer.compiler.api.FileResult;
import org.jackanalyzer.compiler.diagnostics.Diagnostic;
import org.jackanalyzer.config.AnalyzerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;
import picocli.CommandLine.Parameters;
import picocli.CommandLine.ParentCommand;

import java.io.File;
import java.io.PrintWriter;
import java.util.concurrent.Callable;

@Command(name = "analyze", description = "Parses a .jack file, or every .jack file in a directory, and writes Xxx.xml for each.")
public class AnalyzeCommand implements Callable<Integer> {

    private static final Logger LOGGER = LoggerFactory.getLogger(AnalyzeCommand.class);

    @ParentCommand
    private CommandLineInterface parent;

    @Parameters(index = "0", paramLabel = "PATH", description = "A .jack file or a directory of .jack files.")
    private File input;

    @Option(names = {"-o", "--output"}, description = "Directory for the output files (default: next to each source).")
    private File outputDirectory;

    @Option(names = {"-t", "--tokens"}, description = "Also write the token listing XxxT.xml.")
    private boolean tokens;

    @Option(names = {"--flat"}, description = "Write the parse tree as markup without line breaks or indentation.")
    private boolean flat;

    @CommandLine.Spec
    CommandLine.Model.CommandSpec spec;

    @Override
    public Integer call() {
        final PrintWriter out = spec.commandLine().getOut();
        final PrintWriter err = spec.commandLine().getErr();

        AnalyzerSettings settings;
        try {
            settings = AnalyzerSettings.fromConfig(parent.getConfig());
        } catch (ConfigException | IllegalArgumentException e) {
            err.println("Invalid configuration: " + e.getMessage());
            return 1;
        }
        if (outputDirectory != null) {
            settings = settings.withOutputDirectory(outputDirectory.toPath());
        }
        if (tokens) {
            settings = settings.withTokenFiles(true);
        }
        if (flat) {
            settings = settings.withFlatOutput(true);
        }

        final AnalysisReport report;
        try {
            report = new JackAnalyzer(settings).analyze(input.toPath());
        } catch (AnalyzerException e) {
            LOGGER.error("Analysis aborted: {}", e.getMessage(), e);
            err.println(e.getMessage());
            return 1;
        }

        for (FileResult file : report.files()) {
            for (Diagnostic diagnostic : file.diagnostics()) {
                err.println(diagnostic);
            }
            if (file.succeeded()) {
                out.println(file.source() + " -> " + file.treeOutput());
            }
        }
        return report.succeeded() ? 0 : 1;
    }
}
