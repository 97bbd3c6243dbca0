package org.jackanalyzer.compiler;

import org.jackanalyzer.compiler.api.AnalysisReport;
import org.jackanalyzer.compiler.api.AnalyzerException;
import org.jackanalyzer.compiler.api.FileResult;
import org.jackanalyzer.compiler.diagnostics.Diagnostic;
import org.jackanalyzer.config.AnalyzerSettings;
import org.junit.jupiter.api.Tag;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Contains tests for the {@link JackAnalyzer} that run the whole pipeline on files in a temporary directory.
 */
public class JackAnalyzerTest {

    private static final String MAIN = String.join("\n",
            "// Entry point",
            "class Main {",
            "    function void main() {",
            "        do Output.printString(\"Hello\");",
            "        return;",
            "    }",
            "}",
            "");

    private static final AnalyzerSettings DEFAULTS = new AnalyzerSettings(null, false, 2, false, ".jack");

    @TempDir
    Path tempDir;

    /**
     * Verifies that every source of a directory is analyzed, that a file with a syntax error
     * is reported without stopping the others, and that output lands next to the sources.
     */
    @Test
    @Tag("integration")
    void testAnalyzeDirectory() throws IOException, AnalyzerException {
        // Arrange
        Files.writeString(tempDir.resolve("Main.jack"), MAIN);
        Files.writeString(tempDir.resolve("Broken.jack"), "class Broken {\n  field int ;\n}\n");
        Files.writeString(tempDir.resolve("notes.txt"), "not a source");

        // Act
        AnalysisReport report = new JackAnalyzer(DEFAULTS).analyze(tempDir);

        // Assert
        assertThat(report.files()).extracting(f -> f.source().getFileName().toString())
                .containsExactly("Broken.jack", "Main.jack");
        assertThat(report.succeeded()).isFalse();
        assertThat(report.failureCount()).isEqualTo(1);

        FileResult broken = report.files().get(0);
        assertThat(broken.treeOutput()).isNull();
        assertThat(broken.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.ERROR);
            assertThat(d.fileName()).isEqualTo("Broken.jack");
            assertThat(d.lineNumber()).isEqualTo(2);
            assertThat(d.message()).contains("IDENTIFIER_NOT_FOUND");
        });
        assertThat(tempDir.resolve("Broken.xml")).doesNotExist();

        FileResult main = report.files().get(1);
        assertThat(main.succeeded()).isTrue();
        assertThat(main.treeOutput()).isEqualTo(tempDir.resolve("Main.xml"));
        assertThat(Files.readString(main.treeOutput()))
                .startsWith("<class>\n  <keyword> class </keyword>\n  <identifier> Main </identifier>\n")
                .contains("      <statements>\n        <doStatement>\n")
                .endsWith("</class>\n");
        assertThat(main.tokenOutput()).isNull();
    }

    @Test
    @Tag("integration")
    void testTokenListingAndFlatOutputInSeparateDirectory() throws IOException, AnalyzerException {
        Path source = Files.writeString(tempDir.resolve("Main.jack"), MAIN);
        Path out = tempDir.resolve("out");
        AnalyzerSettings settings = DEFAULTS.withOutputDirectory(out).withTokenFiles(true).withFlatOutput(true);

        FileResult result = new JackAnalyzer(settings).analyzeFile(source);

        assertThat(result.treeOutput()).isEqualTo(out.resolve("Main.xml"));
        assertThat(result.tokenOutput()).isEqualTo(out.resolve("MainT.xml"));
        assertThat(Files.readString(result.treeOutput()))
                .startsWith("<class><keyword>class</keyword><identifier>Main</identifier>")
                .endsWith("</class>\n")
                .doesNotContain("\n<");
        assertThat(Files.readString(result.tokenOutput()))
                .startsWith("<tokens>\n<keyword> class </keyword>\n")
                .contains("<stringConstant> Hello </stringConstant>");
    }

    @Test
    @Tag("integration")
    void testLexicalErrorSkipsParsing() throws IOException, AnalyzerException {
        Path source = Files.writeString(tempDir.resolve("Bad.jack"), "class Bad { field int x; # }");

        FileResult result = new JackAnalyzer(DEFAULTS).analyzeFile(source);

        assertThat(result.succeeded()).isFalse();
        assertThat(result.diagnostics()).extracting(Diagnostic::message).containsExactly("Unexpected character: #");
        assertThat(tempDir.resolve("Bad.xml")).doesNotExist();
    }

    @Test
    @Tag("integration")
    void testTrailingTokensAreReportedAsWarning() throws IOException, AnalyzerException {
        Path source = Files.writeString(tempDir.resolve("Extra.jack"), "class Extra { }\nclass More { }\n");

        FileResult result = new JackAnalyzer(DEFAULTS).analyzeFile(source);

        assertThat(result.succeeded()).isTrue();
        assertThat(result.diagnostics()).singleElement().satisfies(d -> {
            assertThat(d.type()).isEqualTo(Diagnostic.Type.WARNING);
            assertThat(d.lineNumber()).isEqualTo(2);
        });
        assertThat(tempDir.resolve("Extra.xml")).exists();
    }

    @Test
    @Tag("integration")
    void testMissingInputIsRejected() {
        assertThatThrownBy(() -> new JackAnalyzer(DEFAULTS).analyze(tempDir.resolve("missing")))
                .isInstanceOf(AnalyzerException.class)
                .hasMessageContaining("No such file or directory");
    }

    @Test
    @Tag("integration")
    void testDirectoryWithoutSourcesIsRejected() throws IOException {
        Files.writeString(tempDir.resolve("readme.md"), "# nothing here");

        assertThatThrownBy(() -> new JackAnalyzer(DEFAULTS).analyze(tempDir))
                .isInstanceOf(AnalyzerException.class)
                .hasMessageContaining("No .jack files");
    }

    @Test
    @Tag("integration")
    void testFileWithOtherExtensionIsRejected() throws IOException {
        Path notes = Files.writeString(tempDir.resolve("notes.txt"), "class A { }");

        assertThatThrownBy(() -> new JackAnalyzer(DEFAULTS).analyze(notes))
                .isInstanceOf(AnalyzerException.class)
                .hasMessageContaining("Not a .jack file");
    }
}
