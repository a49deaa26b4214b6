package org.querylex.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigException;
import com.typesafe.config.ConfigFactory;
import com.typesafe.config.ConfigOriginFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Loads the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /** Name of the configuration file picked up from the working directory. */
    public static final String CONFIG_FILE_NAME = "querylex.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. Java System Properties (e.g., -Dquerylex.scanner.delimiter-alignment=TOKEN)
     * 2. Environment Variables
     * 3. Configuration file (the explicit one, else querylex.conf in the working directory)
     * 4. Default values (reference.conf on the classpath)
     *
     * @param explicitFile A configuration file given on the command line, or null.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws ConfigException.IO if an explicit file was given but does not exist.
     */
    public static Config load(final File explicitFile) {
        final Config fileConfig;
        if (explicitFile != null) {
            if (!explicitFile.isFile()) {
                throw new ConfigException.IO(ConfigOriginFactory.newFile(explicitFile.getAbsolutePath()),
                        "Configuration file not found");
            }
            LOG.info("Loading configuration from file: {}", explicitFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitFile);
        } else {
            final File cwdFile = new File(CONFIG_FILE_NAME);
            if (cwdFile.isFile()) {
                LOG.info("Loading configuration from file: {}", cwdFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdFile);
            } else {
                LOG.debug("Configuration file '{}' not found. Using classpath defaults.", cwdFile.getPath());
                fileConfig = ConfigFactory.empty();
            }
        }

        // The one provided first wins.
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }
}
