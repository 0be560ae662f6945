package org.pathwise.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import com.typesafe.config.Config;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Applies the log levels of the {@code pathwise.logging} block to Logback.
 *
 * <pre>
 * pathwise.logging {
 *   level = "WARN"
 *   levels { "org.pathwise.compiler.frontend.semantics" = "DEBUG" }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final String LOGGING_PATH = "pathwise.logging";

    private LoggingConfigurator() {
    }

    public static void configure(Config config) {
        if (!config.hasPath(LOGGING_PATH)) {
            return;
        }
        if (!(LoggerFactory.getILoggerFactory() instanceof LoggerContext context)) {
            return;
        }
        Config logging = config.getConfig(LOGGING_PATH);

        if (logging.hasPath("level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(Level.toLevel(logging.getString("level"), Level.WARN));
        }
        if (logging.hasPath("levels")) {
            for (Map.Entry<String, Object> entry : logging.getObject("levels").unwrapped().entrySet()) {
                context.getLogger(entry.getKey()).setLevel(Level.toLevel(String.valueOf(entry.getValue()), Level.INFO));
            }
        }
    }
}
