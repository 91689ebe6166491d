package org.pxboard.node.config;

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
 * <pre>
 * logging {
 *   format = "PLAIN"          # PLAIN or JSON
 *   default-level = "INFO"
 *   levels {
 *     "org.pxboard.board.sector" = "DEBUG"
 *   }
 * }
 * </pre>
 */
public final class LoggingConfigurator {

    private static final org.slf4j.Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    static final String FORMAT_PROPERTY = "pxboard.logging.format";

    private static volatile boolean configured = false;

    private LoggingConfigurator() {
    }

    /**
     * Applies the logging settings once; later calls are ignored until {@link #reset()}.
     */
    public static synchronized void configure(final Config config) {
        if (configured) {
            return;
        }
        configured = true;
        if (!config.hasPath("logging")) {
            return;
        }

        final Config logging = config.getConfig("logging");
        final LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        if (logging.hasPath("format")) {
            applyFormat(logging.getString("format"), context);
        }
        if (logging.hasPath("default-level")) {
            context.getLogger(Logger.ROOT_LOGGER_NAME)
                .setLevel(Level.toLevel(logging.getString("default-level"), Level.INFO));
        }
        if (logging.hasPath("levels")) {
            for (final Map.Entry<String, ConfigValue> entry : logging.getObject("levels").entrySet()) {
                final String levelName = String.valueOf(entry.getValue().unwrapped());
                final Level level = Level.toLevel(levelName, null);
                if (level == null) {
                    LOGGER.warn("Ignoring unknown level '{}' for logger '{}'", levelName, entry.getKey());
                    continue;
                }
                context.getLogger(entry.getKey()).setLevel(level);
            }
        }
    }

    /**
     * Switches between the JSON ({@code STDOUT}) and plain ({@code STDOUT_PLAIN}) console
     * appenders by reloading {@code logback.xml} with the matching property.
     */
    private static void applyFormat(final String format, final LoggerContext context) {
        final String appender = "JSON".equalsIgnoreCase(format) ? "STDOUT" : "STDOUT_PLAIN";
        if (appender.equals(System.getProperty(FORMAT_PROPERTY))) {
            return;
        }
        System.setProperty(FORMAT_PROPERTY, appender);

        final URL logbackXml = LoggingConfigurator.class.getClassLoader().getResource("logback.xml");
        if (logbackXml == null) {
            return;
        }
        final JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        context.reset();
        context.putProperty(FORMAT_PROPERTY, appender);
        try {
            configurator.doConfigure(logbackXml);
        } catch (final JoranException e) {
            System.err.println("Failed to reload logback.xml: " + e.getMessage());
        }
    }

    /**
     * Allows {@link #configure(Config)} to run again. Used by tests.
     */
    public static synchronized void reset() {
        configured = false;
    }
}
