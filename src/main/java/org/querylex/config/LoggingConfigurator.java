package org.querylex.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import ch.qos.logback.core.joran.util.ConfigurationWatchListUtil;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.Map;

/**
 * Applies the {@code logging} block of the HOCON configuration to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   format = "PLAIN"          # "PLAIN" or "JSON"
 *   default-level = "WARN"    # root logger level
 *   levels {
 *     "org.querylex.sql2.lexer" = "DEBUG"
 *   }
 * }
 * </pre>
 * A format change reloads the active Logback configuration file, since the console
 * appender is chosen there through the {@value #FORMAT_PROPERTY} property. Levels are
 * applied afterwards so the reload does not discard them.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String FORMAT_KEY = "format";
    private static final String DEFAULT_LEVEL_KEY = "default-level";
    private static final String LEVELS_KEY = "levels";
    private static final String PLAIN_APPENDER = "STDOUT_PLAIN";
    private static final String JSON_APPENDER = "STDOUT";

    /** Logback context property that selects the console appender. */
    public static final String FORMAT_PROPERTY = "querylex.logging.format";

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

        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            loggingConfigured = true;
            return;
        }

        try {
            final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
            final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

            configureFormat(loggingConfig, context);
            configureDefaultLevel(loggingConfig, context);
            configureSpecificLevels(loggingConfig, context);

            loggingConfigured = true;
            LOGGER.debug("Logging configuration applied successfully.");
        } catch (final Exception e) {
            LOGGER.error("Failed to configure logging, using Logback defaults.", e);
            loggingConfigured = true; // Prevent retry attempts
        }
    }

    private static void configureFormat(final Config loggingConfig, final LoggerContext context) {
        final String format = loggingConfig.hasPath(FORMAT_KEY)
            ? loggingConfig.getString(FORMAT_KEY)
            : "PLAIN";
        final String appender = "JSON".equalsIgnoreCase(format) ? JSON_APPENDER : PLAIN_APPENDER;
        final String active = System.getProperty(FORMAT_PROPERTY, PLAIN_APPENDER);
        System.setProperty(FORMAT_PROPERTY, appender);
        if (!appender.equals(active)) {
            reloadConfiguration(context);
        }
        context.putProperty(FORMAT_PROPERTY, appender);
        LOGGER.debug("Configured logging format: {}", format);
    }

    private static void reloadConfiguration(final LoggerContext context) {
        URL configUrl = ConfigurationWatchListUtil.getMainWatchURL(context);
        if (configUrl == null) {
            configUrl = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        }
        if (configUrl == null) {
            LOGGER.warn("No Logback configuration file found, logging format stays unchanged.");
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        try {
            configurator.doConfigure(configUrl);
        } catch (final JoranException e) {
            LOGGER.error("Failed to reload Logback configuration from {}", configUrl, e);
        }
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

        int configuredCount = 0;
        for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LEVELS_KEY).root().entrySet()) {
            final String loggerName = entry.getKey();
            final String levelName = entry.getValue().unwrapped().toString();
            context.getLogger(loggerName).setLevel(Level.toLevel(levelName));
            configuredCount++;
            LOGGER.debug("Configured logger '{}' to level: {}", loggerName, levelName);
        }
        LOGGER.debug("Configured {} specific logger levels.", configuredCount);
    }

    /**
     * Resets the configured flag. Intended for tests.
     */
    public static void reset() {
        loggingConfigured = false;
    }
}
