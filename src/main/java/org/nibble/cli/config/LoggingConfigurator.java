package org.nibble.cli.config;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.LoggerContext;
import ch.qos.logback.classic.joran.JoranConfigurator;
import ch.qos.logback.core.joran.spi.JoranException;
import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigValue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.net.URL;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Applies the {@code logging} block of the assembler configuration to Logback.
 * <pre>
 * logging {
 *   format = "PLAIN"          # or "JSON"
 *   default-level = "WARN"
 *   levels { "org.nibble.assembler" = "DEBUG" }
 * }
 * </pre>
 * The bundled {@code logback.xml} attaches either the {@code STDOUT_PLAIN} or the {@code STDOUT}
 * (JSON) appender to the root logger, chosen by the {@value #FORMAT_PROPERTY} context property.
 * Applying a configuration reloads {@code logback.xml} with that property set and then sets the
 * logger levels, so all values are validated before Logback is touched.
 */
public final class LoggingConfigurator {

    /** Context property read by {@code logback.xml} to pick the root appender. */
    public static final String FORMAT_PROPERTY = "nibble.logging.format";

    static final String PLAIN_APPENDER = "STDOUT_PLAIN";
    static final String JSON_APPENDER = "STDOUT";

    private static final Logger LOGGER = LoggerFactory.getLogger(LoggingConfigurator.class);
    private static final String LOGBACK_RESOURCE = "logback.xml";

    private LoggingConfigurator() {}

    /**
     * Reloads Logback for the given configuration. A configuration without a {@code logging}
     * block leaves Logback untouched.
     *
     * @param config The resolved application configuration.
     * @throws ConfigException.BadValue if the format or a level name is not recognised.
     */
    public static void configure(Config config) {
        if (!config.hasPath("logging")) {
            return;
        }
        Config logging = config.getConfig("logging");

        String appender = appenderFor(logging);
        Level rootLevel = logging.hasPath("default-level")
                ? level(logging, "default-level", logging.getString("default-level"))
                : null;
        Map<String, Level> loggerLevels = new LinkedHashMap<>();
        if (logging.hasPath("levels")) {
            Config levels = logging.getConfig("levels");
            for (Map.Entry<String, ConfigValue> entry : levels.root().entrySet()) {
                String name = String.valueOf(entry.getValue().unwrapped());
                loggerLevels.put(entry.getKey(), level(logging, "levels." + entry.getKey(), name));
            }
        }

        LoggerContext context = (LoggerContext) LoggerFactory.getILoggerFactory();
        reload(context, appender);
        if (rootLevel != null) {
            context.getLogger(Logger.ROOT_LOGGER_NAME).setLevel(rootLevel);
        }
        loggerLevels.forEach((name, level) -> context.getLogger(name).setLevel(level));
        LOGGER.debug("Logging uses appender {}, root level {}, overrides {}", appender, rootLevel, loggerLevels);
    }

    private static String appenderFor(Config logging) {
        if (!logging.hasPath("format")) {
            return PLAIN_APPENDER;
        }
        String format = logging.getString("format").toUpperCase(Locale.ROOT);
        switch (format) {
            case "PLAIN":
                return PLAIN_APPENDER;
            case "JSON":
                return JSON_APPENDER;
            default:
                throw new ConfigException.BadValue(logging.origin(), "logging.format",
                        "expected PLAIN or JSON, got '" + logging.getString("format") + "'");
        }
    }

    private static Level level(Config logging, String path, String name) {
        Level level = Level.toLevel(name, null);
        if (level == null) {
            throw new ConfigException.BadValue(logging.origin(), "logging." + path, "unknown log level '" + name + "'");
        }
        return level;
    }

    private static void reload(LoggerContext context, String appender) {
        URL logbackXml = LoggingConfigurator.class.getClassLoader().getResource(LOGBACK_RESOURCE);
        if (logbackXml == null) {
            throw new IllegalStateException(LOGBACK_RESOURCE + " is missing from the classpath");
        }
        context.reset();
        context.putProperty(FORMAT_PROPERTY, appender);
        JoranConfigurator configurator = new JoranConfigurator();
        configurator.setContext(context);
        try {
            configurator.doConfigure(logbackXml);
        } catch (JoranException e) {
            throw new IllegalStateException("Could not load " + logbackXml, e);
        }
    }
}
