package org.boogpp.cli;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies logging settings to Logback at runtime.
 *
 * <h3>Configuration Structure:</h3>
 * <pre>
 * logging {
 *   level = "WARN"        # root level
 *   loggers {
 *     "org.boogpp" = "INFO"
 *   }
 * }
 * </pre>
 * The CLI's {@code --verbose} and {@code --quiet} flags are applied afterwards and win.
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGGING_CONFIG_PATH = "logging";
    private static final String LEVEL_KEY = "level";
    private static final String LOGGERS_KEY = "loggers";
    private static final String COMPILER_LOGGER = "org.boogpp";

    private LoggingConfigurator() {}

    /**
     * Applies the {@code logging} section of the configuration, if any.
     * @param config The configuration tree.
     */
    public static void configure(final Config config) {
        if (!config.hasPath(LOGGING_CONFIG_PATH)) {
            LOGGER.debug("No logging configuration found, using Logback defaults.");
            return;
        }
        final Config loggingConfig = config.getConfig(LOGGING_CONFIG_PATH);
        final LoggerContext context = context();
        if (context == null) {
            return;
        }
        if (loggingConfig.hasPath(LEVEL_KEY)) {
            final Level level = Level.toLevel(loggingConfig.getString(LEVEL_KEY), Level.WARN);
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(level);
            LOGGER.debug("Configured root log level: {}", level);
        }
        if (loggingConfig.hasPath(LOGGERS_KEY)) {
            for (final Map.Entry<String, ConfigValue> entry : loggingConfig.getConfig(LOGGERS_KEY).root().entrySet()) {
                final String levelName = String.valueOf(entry.getValue().unwrapped());
                final Level level = Level.toLevel(levelName, null);
                if (level == null) {
                    LOGGER.warn("Ignoring unknown level '{}' for logger '{}'", levelName, entry.getKey());
                    continue;
                }
                context.getLogger(entry.getKey()).setLevel(level);
                LOGGER.debug("Configured logger '{}' to level: {}", entry.getKey(), level);
            }
        }
    }

    /**
     * Overrides the compiler's log level for one invocation.
     * @param level The level for the {@code org.boogpp} loggers.
     */
    public static void setCompilerLevel(final Level level) {
        final LoggerContext context = context();
        if (context != null) {
            context.getLogger(COMPILER_LOGGER).setLevel(level);
        }
    }

    private static LoggerContext context() {
        if (LoggerFactory.getILoggerFactory() instanceof LoggerContext context) {
            return context;
        }
        LOGGER.debug("SLF4J is not bound to Logback; logging settings are not applied.");
        return null;
    }
}
