package com.terralint.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Loads lint configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code terralint.yaml} into {@link LintConfig} records.
 * If the config file is missing or invalid, {@link #load(Path)} returns
 * {@link LintConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * LintConfig config = ConfigLoader.load(Path.of("terralint.yaml"));
 * String variablesFile = config.files().variables();
 * }</pre>
 */
public class ConfigLoader {

    /** Default configuration file name, looked up in the lint root. */
    public static final String DEFAULT_FILE_NAME = "terralint.yaml";

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    private ConfigLoader() {
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link LintConfig#defaults()}.
     *
     * @param configPath path to {@code terralint.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static LintConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return LintConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return LintConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            LintConfig config = YAML_MAPPER.readValue(configPath.toFile(), LintConfig.class);
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return LintConfig.defaults();
        }
    }

    /**
     * Loads configuration from a YAML file, failing instead of falling back to defaults.
     *
     * @param configPath path to {@code terralint.yaml}
     * @return loaded configuration
     * @throws ConfigurationException if the file is missing, unreadable or malformed
     */
    public static LintConfig loadStrict(Path configPath) {
        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            throw new ConfigurationException("Configuration file not found or not readable: " + configPath);
        }
        try {
            return YAML_MAPPER.readValue(configPath.toFile(), LintConfig.class);
        } catch (IOException e) {
            throw new ConfigurationException("Failed to parse configuration file " + configPath + ": " + e.getMessage(), e);
        }
    }
}
