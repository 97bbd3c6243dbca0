package org.jackanalyzer.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the log levels of the HOCON configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   default-level = "INFO"  # Level of the root logger
 *   levels {
 *     # Specific logger levels - override the default for particular components
 *     "org.jackanalyzer.compiler.frontend.parser" = "TRACE"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {}

    /**
     * Configures the logging system based on the provided configuration.
     * Calling it again has no effect until {@link #reset()} is called.
     *
     * @param config The application configuration containing logging settings.
     */
    public static void configure(final Config config) {
        if (loggingConfigured) {
            LOGGER.debug("Logging already configured, skipping.");
            return;
        }
        loggingConfigured = true;

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }

        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        configureDefaultLevel(loggingConfig, context);
        configureSpecificLevels(loggingConfig, context);
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final String levelStr = loggingConfig.getString(DEFAULT_LEVEL_KEY);
            final Level level = Level.toLevel(levelStr, Level.INFO);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            LOGGER.debug("No specific logger levels configured.");
            return;
        }

        int configuredCount = 0;
        // Logger names contain dots, so the entries are read from the root object rather than by path.
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = entry.getValue().unwrapped().toString();
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown log level '{}' for logger '{}'.", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            configuredCount++;
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
        }

        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Resets the configuration state so that {@link #configure(Config)} applies again. Intended for tests.
     */
    public static void reset() {
        loggingConfigured = false;
    }
}
