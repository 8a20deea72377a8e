package org.flagcleaner.cli.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Responsible for loading the application configuration from various sources.
 * The loader respects a specific precedence order to allow for flexible configuration.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);
    static final String CONFIG_FILE_NAME = "flagcleaner.conf";

    private ConfigLoader() {
        // Private constructor to prevent instantiation
    }

    /**
     * Loads the application configuration, respecting the precedence order:
     * 1. CLI arguments (as Java System Properties, e.g., -Dflagcleaner.threads=4)
     * 2. Environment Variables
     * 3. Configuration File (the --config file, else flagcleaner.conf in the working directory)
     * 4. Default values (from reference.conf on the classpath)
     *
     * @param explicitConfigFile The file passed via --config, or {@code null}.
     * @return A resolved {@link Config} object containing the merged configuration.
     * @throws IllegalArgumentException if {@code explicitConfigFile} does not exist.
     * @throws com.typesafe.config.ConfigException if a file cannot be parsed or a substitution cannot be resolved.
     */
    public static Config load(final File explicitConfigFile) {
        final Config fileConfig;
        if (explicitConfigFile != null) {
            if (!explicitConfigFile.isFile()) {
                throw new IllegalArgumentException(
                        "Configuration file specified via --config was not found: " + explicitConfigFile.getAbsolutePath());
            }
            LOG.debug("Using configuration file specified via --config: {}", explicitConfigFile.getAbsolutePath());
            fileConfig = ConfigFactory.parseFile(explicitConfigFile);
        } else {
            final File cwdConfigFile = new File(CONFIG_FILE_NAME);
            if (cwdConfigFile.isFile()) {
                LOG.debug("Using configuration file found in current directory: {}", cwdConfigFile.getAbsolutePath());
                fileConfig = ConfigFactory.parseFile(cwdConfigFile);
            } else {
                LOG.debug("No '{}' found in current directory. Using default configuration from classpath.", CONFIG_FILE_NAME);
                fileConfig = ConfigFactory.empty();
            }
        }

        // Chain the configs together. The one provided first wins.
        return ConfigFactory.systemProperties()
                .withFallback(ConfigFactory.systemEnvironment())
                .withFallback(fileConfig)
                .withFallback(ConfigFactory.defaultReference())
                .resolve();
    }
}
