package org.taskfarm.cli.config;

import java.util.Map;

import org.slf4j.LoggerFactory;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigValue;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.LoggerContext;

/**
 * Applies log levels from the {@code logging} section of the configuration:
 * <pre>
 * logging {
 *   default-level = "INFO"
 *   levels { "org.taskfarm.farm.services.Dispatcher" = "DEBUG" }
 * }
 * </pre>
 * Unknown level names fall back to DEBUG (Logback's own behavior).
 */
public final class LoggingConfigurator {

    private LoggingConfigurator() {
    }

    /**
     * @param config the application configuration; does nothing without a {@code logging} section.
     */
    public static void configure(Config config) {
        if (!config.hasPath("logging")) {
            return;
        }
        Config logging = config.getConfig("logging");
        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();

        if (logging.hasPath("default-level")) {
            context.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME)
                .setLevel(Level.toLevel(logging.getString("default-level"), Level.DEBUG));
        }

        if (logging.hasPath("levels")) {
            for (Map.Entry<String, ConfigValue> entry : logging.getObject("levels").entrySet()) {
                String loggerName = entry.getKey();
                Logger logger = context.getLogger(loggerName);
                logger.setLevel(Level.toLevel(String.valueOf(entry.getValue().unwrapped()), Level.DEBUG));
            }
        }
    }
}
