package org.persistor.pipeline.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the persistor configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    public static final String CONFIG_FILE_NAME = "persistor.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the configuration from {@code persistor.conf} in the working directory, if present.
     *
     * @return A resolved {@link Config} object containing the merged configuration.
     * @see #load(File)
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (e.g., -Dpersistor.append=true)
     * 3. Configuration File
     * 4. Default values (from reference.conf on the classpath)
     * <p>
     * The well-known variables ({@code APPEND}, {@code STORE_PARAM}, ...) are mapped onto the
     * {@code persistor} tree by {@code ${?VAR}} substitutions in reference.conf.
     *
     * @param configFile The configuration file; skipped if it does not exist.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws PersistorConfigurationException if a source cannot be parsed or a substitution cannot be resolved.
     */
    public static Config load(File configFile) {
        try {
            final Config envConfig = ConfigFactory.systemEnvironment();
            final Config propertiesConfig = ConfigFactory.systemProperties();

            final Config fileConfig;
            if (configFile != null && configFile.isFile()) {
                LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(configFile);
            } else {
                LOG.debug("Configuration file '{}' not found, using defaults", configFile);
                fileConfig = ConfigFactory.empty();
            }

            final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

            // The one provided first wins.
            return envConfig
                .withFallback(propertiesConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
        } catch (ConfigException e) {
            throw new PersistorConfigurationException("Failed to load configuration: " + e.getMessage(), e);
        }
    }
}
