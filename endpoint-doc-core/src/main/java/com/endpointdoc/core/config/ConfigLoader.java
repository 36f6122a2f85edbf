package com.endpointdoc.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading the documentation policy from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code endpointdoc.yaml} into a {@link DocumentOptions} record.
 * If the file is missing, empty or invalid, returns {@link DocumentOptions#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * DocumentOptions options = ConfigLoader.load(Paths.get("endpointdoc.yaml"));
 * DocumentBuilder builder = new DocumentBuilder(options);
 * }</pre>
 */
public class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * Default configuration file name.
     */
    public static final String DEFAULT_FILE_NAME = "endpointdoc.yaml";

    private ConfigLoader() {
    }

    /**
     * Loads the documentation policy from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link DocumentOptions#defaults()}.
     *
     * @param configPath path to {@code endpointdoc.yaml}
     * @return loaded policy or defaults if unavailable
     */
    public static DocumentOptions load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using default documentation policy.", configPath);
            return DocumentOptions.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return DocumentOptions.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            DocumentOptions options = YAML_MAPPER.readValue(configPath.toFile(), DocumentOptions.class);
            if (options == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return DocumentOptions.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return options;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return DocumentOptions.defaults();
        }
    }
}
