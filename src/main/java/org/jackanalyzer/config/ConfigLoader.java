package org.jackanalyzer.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** The configuration file looked up in the working directory. */
    public static final String CONFIG_FILE_NAME = "jack-analyzer.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (-Dkey=value)
     * 3. The explicit configuration file, or jack-analyzer.conf in the working directory
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitFile A configuration file given on the command line, or {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or a substitution cannot be resolved.
     */
    public static Config load(final File explicitFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config cliConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + explicitFile.getAbsolutePath());
            }
            LOG.info("Loading configuration from file: {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile);
        } else {
            final File cwdFile = new File(CONFIG_FILE_NAME);
            if (cwdFile.isFile()) {
                LOG.info("Loading configuration from file: {}", cwdFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdFile);
            } else {
                LOG.debug("Configuration file '{}' not found. Using defaults.", cwdFile.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
            .withFallback(cliConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }
}
