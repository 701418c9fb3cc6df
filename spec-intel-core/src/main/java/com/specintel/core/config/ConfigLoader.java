package com.specintel.core.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.specintel.core.config.EngineConfig.DomainSource;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Utility for loading engine configuration from YAML or JSON files.
 *
 * <p>Uses Jackson to deserialize {@code specintel.yaml} into {@link EngineConfig} records.
 * If the config file is missing or invalid, returns {@link EngineConfig#defaults()}.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * Path configPath = Path.of("specintel.yaml");
 * EngineConfig config = ConfigLoader.load(configPath);
 * ScoringPolicy policy = ScoringPolicy.from(config, "programming");
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);

    private ConfigLoader() {
        // Utility class
    }

    /**
     * Loads configuration from a file.
     *
     * <p>If the file doesn't exist or can't be parsed, logs a warning and returns
     * {@link EngineConfig#defaults()}.
     *
     * @param configPath path to {@code specintel.yaml}
     * @return loaded configuration or defaults if unavailable
     */
    public static EngineConfig load(Path configPath) {
        if (!Files.exists(configPath)) {
            log.warn("Configuration file not found: {}. Using defaults.", configPath);
            return EngineConfig.defaults();
        }

        if (!Files.isRegularFile(configPath) || !Files.isReadable(configPath)) {
            log.warn("Configuration file is not readable: {}. Using defaults.", configPath);
            return EngineConfig.defaults();
        }

        try {
            log.debug("Loading configuration from: {}", configPath);
            ObjectMapper mapper = StructuredDocuments.mapperFor(configPath);
            EngineConfig config = mapper.readValue(configPath.toFile(), EngineConfig.class);
            if (config == null) {
                log.warn("Configuration file is empty: {}. Using defaults.", configPath);
                return EngineConfig.defaults();
            }
            log.info("Loaded configuration from: {}", configPath);
            return config;
        } catch (IOException e) {
            log.error("Failed to parse configuration file: {}. Using defaults. Error: {}",
                configPath, e.getMessage());
            return EngineConfig.defaults();
        }
    }

    /**
     * Resolves the configured domain documents against the configuration file's directory.
     *
     * <p>Entries without an ID or path are skipped with a warning.
     *
     * @param config loaded configuration
     * @param configPath file the configuration was loaded from
     * @return domain ID to absolute document path, in configuration order
     */
    public static Map<String, Path> domainDocuments(EngineConfig config, Path configPath) {
        Path baseDir = configPath.toAbsolutePath().getParent();
        Map<String, Path> documents = new LinkedHashMap<>();
        for (DomainSource source : config.domains()) {
            if (isBlank(source.id()) || isBlank(source.path())) {
                log.warn("Skipping domain entry without id or path in {}: {}", configPath, source);
                continue;
            }
            Path path = Path.of(source.path());
            documents.put(source.id(), path.isAbsolute() || baseDir == null ? path : baseDir.resolve(path).normalize());
        }
        return documents;
    }

    private static boolean isBlank(String value) {
        return value == null || value.isBlank();
    }
}
