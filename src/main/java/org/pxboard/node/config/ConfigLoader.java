package org.pxboard.node.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration.
 * <p>
 * Precedence, highest first:
 * <ol>
 *   <li>Environment variables</li>
 *   <li>System properties ({@code -Dkey=value})</li>
 *   <li>The configuration file: the one given explicitly, else {@code pxboard.conf} in the working directory</li>
 *   <li>{@code reference.conf} on the classpath</li>
 * </ol>
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "pxboard.conf";

    private ConfigLoader() {
    }

    /**
     * Loads the configuration using {@code pxboard.conf} from the working directory, if present.
     */
    public static Config load() {
        final File defaultFile = new File(CONFIG_FILE_NAME);
        if (defaultFile.isFile()) {
            return load(defaultFile);
        }
        LOG.debug("No '{}' in {}, using built-in defaults", CONFIG_FILE_NAME, defaultFile.getAbsoluteFile().getParent());
        return layer(ConfigFactory.empty());
    }

    /**
     * Loads the configuration using the given file.
     *
     * @throws IllegalArgumentException if the file does not exist.
     * @throws com.typesafe.config.ConfigException if the file cannot be parsed or substitutions cannot be resolved.
     */
    public static Config load(final File configFile) {
        if (!configFile.isFile()) {
            throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
        }
        LOG.info("Loading configuration from {}", configFile.getAbsolutePath());
        return layer(ConfigFactory.parseFile(configFile));
    }

    private static Config layer(final Config fileConfig) {
        return ConfigFactory.systemEnvironment()
            .withFallback(ConfigFactory.systemProperties())
            .withFallback(fileConfig)
            .withFallback(ConfigFactory.parseResources("reference.conf"))
            .resolve();
    }
}
