package org.nanoir.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the nanoir configuration by layering several sources.
 * Hosts normally go through {@code RuntimeOptions.load()}.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "nanoir.conf";

    private ConfigLoader() {
        // Static utility
    }

    /**
     * Loads the configuration from the working directory, respecting the precedence order:
     * 1. Environment Variables
     * 2. Java System Properties (-Dnanoir.runtime.trace-nodes=true)
     * 3. Configuration File (nanoir.conf in the working directory)
     * 4. Default values (reference.conf on the classpath)
     *
     * @return A resolved {@link Config}.
     */
    public static Config load() {
        return load(new File(CONFIG_FILE_NAME));
    }

    /**
     * Loads the configuration with an explicit file for the third layer.
     *
     * @param configFile The optional configuration file; skipped if it does not exist.
     * @return A resolved {@link Config}.
     */
    public static Config load(File configFile) {
        final Config envConfig = ConfigFactory.systemEnvironment();
        final Config sysConfig = ConfigFactory.systemProperties();

        final Config fileConfig;
        if (configFile.exists() && !configFile.isDirectory()) {
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            LOG.debug("Configuration file '{}' not found, using defaults", configFile.getPath());
            fileConfig = ConfigFactory.empty();
        }

        final Config defaultConfig = ConfigFactory.parseResources("reference.conf");

        // The one provided first wins.
        return envConfig
                .withFallback(sysConfig)
                .withFallback(fileConfig)
                .withFallback(defaultConfig)
                .resolve();
    }
}
