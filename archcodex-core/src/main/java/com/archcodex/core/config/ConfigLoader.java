package com.archcodex.core.config;

import com.fasterxml.jackson.databind.MapperFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Utility for loading ArchCodex configuration from YAML files.
 *
 * <p>Uses Jackson to deserialize {@code archcodex.yaml} into {@link ArchCodexConfig} records.
 * Enum values are case-insensitive, so {@code untaggedPolicy: deny} and {@code severities: [error]}
 * both work. If the config file is missing or invalid, returns {@link ArchCodexConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * ArchCodexConfig config = ConfigLoader.load(Path.of("archcodex.yaml"));
 * ValidationOrchestrator orchestrator = ValidationOrchestrator.builder(registry)
 *     .config(config)
 *     .build();
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    /** Conventional file name in the project root */
    public static final String DEFAULT_FILE_NAME = "archcodex.yaml";

    private static final ObjectMapper YAML_MAPPER = YAMLMapper.builder()
        .enable(MapperFeature.ACCEPT_CASE_INSENSITIVE_ENUMS)
        .build();

    private ConfigLoader() {
        throw new AssertionError("Utility class should not be instantiated");
    }

    /**
     * Loads configuration from a YAML file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link ArchCodexConfig#defaults()}.
     *
     * @param configPath path to {@code archcodex.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static ArchCodexConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return ArchCodexConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return ArchCodexConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ArchCodexConfig config = YAML_MAPPER.readValue(configPath.toFile(), ArchCodexConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return ArchCodexConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.warn("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return ArchCodexConfig.defaults();
        }
    }

    /**
     * Loads {@value #DEFAULT_FILE_NAME} from a project root.
     *
     * @param projectRoot project root directory
     * @return loaded configuration or defaults
     */
    public static ArchCodexConfig loadFromProject(Path projectRoot) {
        return load(projectRoot.resolve(DEFAULT_FILE_NAME));
    }
}
