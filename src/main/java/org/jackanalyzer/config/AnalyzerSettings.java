package org.jackanalyzer.config;

import com.typesafe.config.Config;

import java.nio.file.Path;

/**
 * The settings of an analysis run, read from the {@code jack-analyzer} block of the configuration.
 *
 * @param outputDirectory Where to write the output files; {@code null} writes them next to each source.
 * @param writeTokenFiles Whether to also write the {@code XxxT.xml} token listing.
 * @param indent Spaces per nesting level in the tree output.
 * @param flatOutput Whether to write the tree as flat markup instead of indented XML.
 * @param sourceExtension The extension identifying Jack source files.
 */
public record AnalyzerSettings(
        Path outputDirectory,
        boolean writeTokenFiles,
        int indent,
        boolean flatOutput,
        String sourceExtension
) {

    /** The configuration path of the settings block. */
    public static final String CONFIG_PATH = "jack-analyzer";

    /**
     * Reads the settings from a resolved configuration that includes the reference defaults.
     * @param config The application configuration.
     * @return The settings.
     * @throws com.typesafe.config.ConfigException if a setting is missing or has the wrong type.
     */
    public static AnalyzerSettings fromConfig(Config config) {
        Config block = config.getConfig(CONFIG_PATH);
        String output = block.getString("output-directory");
        return new AnalyzerSettings(
                output.isBlank() ? null : Path.of(output),
                block.getBoolean("write-token-files"),
                block.getInt("indent"),
                block.getBoolean("flat-output"),
                block.getString("source-extension"));
    }

    public AnalyzerSettings withOutputDirectory(Path directory) {
        return new AnalyzerSettings(directory, writeTokenFiles, indent, flatOutput, sourceExtension);
    }

    public AnalyzerSettings withTokenFiles(boolean enabled) {
        return new AnalyzerSettings(outputDirectory, enabled, indent, flatOutput, sourceExtension);
    }

    public AnalyzerSettings withFlatOutput(boolean enabled) {
        return new AnalyzerSettings(outputDirectory, writeTokenFiles, indent, enabled, sourceExtension);
    }
}
