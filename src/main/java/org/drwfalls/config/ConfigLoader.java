package org.drwfalls.config;

import com.typesafe.config.Config;
import com.typesafe.config.ConfigFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.File;

/**
 * Assembles the engine configuration from three layers, highest priority first:
 * Java system properties (e.g. {@code -Ddrwfalls.field.virusCount=40}), an optional
 * HOCON file and the defaults in {@code reference.conf}.
 */
public final class ConfigLoader {

    private static final Logger LOG = LoggerFactory.getLogger(ConfigLoader.class);

    /**
     * Name of the file looked up in the working directory by {@link #load()}.
     */
    public static final String DEFAULT_FILE_NAME = "drwfalls.conf";

    private ConfigLoader() {
    }

    /**
     * Loads the configuration with {@value #DEFAULT_FILE_NAME} in the working directory as file layer.
     *
     * @return the resolved configuration
     */
    public static Config load() {
        return load(new File(DEFAULT_FILE_NAME));
    }

    /**
     * Loads the configuration with the given file as file layer.
     *
     * @param file the HOCON file, skipped if missing or a directory
     * @return the resolved configuration
     * @throws com.typesafe.config.ConfigException if the file cannot be parsed or a substitution cannot be resolved
     */
    public static Config load(File file) {
        return ConfigFactory.systemProperties()
                .withFallback(fileLayer(file))
                .withFallback(ConfigFactory.parseResources("reference.conf"))
                .resolve();
    }

    private static Config fileLayer(File file) {
        if (!file.isFile()) {
            LOG.debug("No configuration file at '{}', using defaults", file.getPath());
            return ConfigFactory.empty();
        }
        LOG.info("Reading field configuration from {}", file.getAbsolutePath());
        return ConfigFactory.parseFile(file);
    }
}
