package com.anirudhology.codeauthorship.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the pipeline configuration. Sources, highest precedence first:
 * 1. Java system properties (-Dcodeauthorship.balance.exact=true)
 * 2. Environment variables
 * 3. Configuration file (explicit, or codeauthorship.conf in the working directory)
 * 4. Defaults from reference.conf on the classpath
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "codeauthorship.conf";

    private ConfigLoader() {
    }

    /**
     * @param configFile explicit configuration file, or null to look for codeauthorship.conf
     * @return resolved configuration
     * @throws IllegalArgumentException if an explicit file does not exist
     */
    public static Config load(File configFile) {
        final Config fileConfig;
        if (configFile != null) {
            if (!configFile.isFile()) {
                throw new IllegalArgumentException("Configuration file not found: " + configFile.getAbsolutePath());
            }
            LOG.info("Loading configuration from file: {}", configFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(configFile);
        } else {
            final File defaultFile = new File(CONFIG_FILE_NAME);
            if (defaultFile.isFile()) {
                LOG.info("Loading configuration from file: {}", defaultFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(defaultFile);
            } else {
                LOG.debug("No '{}' in the working directory, using defaults", CONFIG_FILE_NAME);
                fileConfig = ConfigFactory.empty();
            }
        }

        // The one provided first wins
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }
}
