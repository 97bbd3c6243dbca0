package org.jackanalyzer.cli;

import org.jackanalyzer.config.LoggingConfigurator;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.assertEquals;

public class CommandLineInterfaceTest {

    @TempDir
    Path tempDir;

    private final StringWriter out = new StringWriter();
    private final StringWriter err = new StringWriter();

    private CommandLine newCommandLine() {
        CommandLine cmd = new CommandLine(new CommandLineInterface());
        cmd.setOut(new PrintWriter(out, true));
        cmd.setErr(new PrintWriter(err, true));
        return cmd;
    }

    @AfterEach
    void tearDown() {
        LoggingConfigurator.reset();
    }

    @Test
    @Tag("unit")
    public void testCliInitialization() {
        CommandLine cmd = newCommandLine();
        assertEquals("jack-analyzer", cmd.getCommandName());
        assertThat(cmd.getSubcommands()).containsKeys("analyze", "help");
    }

    @Test
    @Tag("unit")
    public void testAnalyzeWritesTreeAndTokens() throws IOException {
        Path source = Files.writeString(tempDir.resolve("Square.jack"), "class Square { field int size; }");
        Path output = tempDir.resolve("xml");

        int exitCode = newCommandLine().execute("analyze", "--tokens", "-o", output.toString(), source.toString());

        assertThat(exitCode).isZero();
        assertThat(output.resolve("Square.xml")).exists();
        assertThat(output.resolve("SquareT.xml")).exists();
        assertThat(out.toString()).contains("Square.jack -> ");
        assertThat(err.toString()).isEmpty();
    }

    @Test
    @Tag("unit")
    public void testAnalyzeReportsSyntaxErrors() throws IOException {
        Path source = Files.writeString(tempDir.resolve("Broken.jack"), "class Broken { field int size }");

        int exitCode = newCommandLine().execute("analyze", source.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("[ERROR] Broken.jack:1:").contains("WRONG_SYMBOL");
        assertThat(tempDir.resolve("Broken.xml")).doesNotExist();
    }

    @Test
    @Tag("unit")
    public void testAnalyzeMissingPath() {
        int exitCode = newCommandLine().execute("analyze", tempDir.resolve("nowhere").toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("No such file or directory");
    }

    @Test
    @Tag("unit")
    public void testMissingConfigFile() throws IOException {
        Path source = Files.writeString(tempDir.resolve("A.jack"), "class A { }");

        int exitCode = newCommandLine().execute("-c", tempDir.resolve("none.conf").toString(), "analyze", source.toString());

        assertThat(exitCode).isEqualTo(1);
        assertThat(err.toString()).contains("Invalid configuration");
    }
}
