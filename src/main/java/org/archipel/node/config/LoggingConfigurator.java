package org.archipel.node.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} section of the configuration to Logback.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   format = "PLAIN"         # "PLAIN" or "JSON", defaults to JSON
 *   default-level = "WARN"   # level of the root logger
 *   levels {
 *     "org.archipel.runner" = "INFO"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";
    static final String FORMAT_PROPERTY = "archipel.logging.format";

    private static boolean loggingConfigured = false;

    private LoggingConfigurator() {
    }

    /**
     * Configures logging from the given configuration. Calling it again has no effect until
     * {@link #reset()} is called.
     *
     * @param config The application configuration.
     */
    public static synchronized void configure(final Config config) {
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
        configureFormat(loggingConfig, context);
        configureDefaultLevel(loggingConfig, context);
        configureSpecificLevels(loggingConfig, context);
        LOGGER.debug("Logging configuration applied.");
    }

    /**
     * Selects the appender and reloads {@code logback.xml} so that the choice takes effect.
     */
    private static void configureFormat(final Config loggingConfig, final LoggerContext context) {
        final String format = loggingConfig.hasPath(FORMAT_KEY) ? loggingConfig.getString(FORMAT_KEY) : "JSON";
        final String appender = "PLAIN".equalsIgnoreCase(format) ? "STDOUT_PLAIN" : "STDOUT";
        if (appender.equals(System.getProperty(FORMAT_PROPERTY))) {
            return;
        }
        System.setProperty(FORMAT_PROPERTY, appender);

        final URL logbackXml = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (logbackXml == null) {
            LOGGER.debug("No logback.xml on the classpath, keeping the current appenders.");
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        context.putProperty(FORMAT_PROPERTY, appender);
        try {
            configurator.doConfigure(logbackXml);
        } catch (final JoranException e) {
            LOGGER.warn("Failed to reload logback.xml for format {}: {}", format, e.getMessage());
        }
        LOGGER.debug("Configured logging format: {}", format);
    }

    private static void configureDefaultLevel(final Config loggingConfig, final LoggerContext context) {
        if (loggingConfig.hasPath(DEFAULT_LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(DEFAULT_LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured default log level: {}", level);
        }
    }

    private static void configureSpecificLevels(final Config loggingConfig, final LoggerContext context) {
        if (!loggingConfig.hasPath(LEVELS_KEY)) {
            return;
        }
        final Config levelsConfig = loggingConfig.getConfig(LEVELS_KEY);
        for (final Map.Entry<String, ConfigValue> entry : levelsConfig.root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = entry.getValue().unwrapped().toString();
            final Level level = Level.toLevel(levelName, null);
            if (level == null) {
                LOGGER.warn("Ignoring unknown level '{}' for logger '{}'", levelName, loggerName);
                continue;
            }
            context.getLogger(loggerName).setLevel(level);
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, level);
        }
    }

    /**
     * Allows {@link #configure(Config)} to run again. Meant for tests.
     */
    public static synchronized void reset() {
        loggingConfigured = false;
    }
}
