package org.elnamic.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigParseOptions;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;
import java.util.Map;

/**
 * Loads the interpreter configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "elnamic.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. {@code -Dkey=value} overrides given on the command line
     * 2. Java system properties
     * 3. Environment variables
     * 4. The given configuration file, or {@code elnamic.conf} in the working directory
     * 5. Default values (from reference.conf on the classpath)
     *
     * @param configFile An explicit configuration file, or {@code null} to look for {@code elnamic.conf}.
     * @param overrides Command-line overrides, may be {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws com.typesafe.config.ConfigException if an explicit file is missing or malformed.
     */
    public static Config load(final File configFile, final Map<String, String> overrides) {
        final Config overrideConfig = overrides != null ? ConfigFactory.parseMap(overrides) : ConfigFactory.empty();
        final Config propertyConfig = ConfigFactory.systemProperties();
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config fileConfig = loadFile(configFile);
        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return overrideConfig
            .withFallback(propertyConfig)
            .withFallback(envConfig)
            .withFallback(fileConfig)
            .withFallback(defaultConfig)
            .resolve();
    }

    private static Config loadFile(final File configFile) {
        if (configFile != null) {
            LOG.debug("Loading configuration from file: {}", configFile.getAbsolutePath());
            return ConfigFactory.parseFile(configFile, ConfigParseOptions.defaults().setAllowMissing(false));
        }
        final File defaultFile = new File(CONFIG_FILE_NAME);
        if (defaultFile.isFile()) {
            LOG.debug("Loading configuration from file: {}", defaultFile.getAbsolutePath());
            return ConfigFactory.parseFile(defaultFile);
        }
        LOG.debug("Configuration file '{}' not found. Using defaults.", CONFIG_FILE_NAME);
        return ConfigFactory.empty();
    }
}
