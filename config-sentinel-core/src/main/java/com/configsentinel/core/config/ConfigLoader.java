package com.configsentinel.core.config;

import com.configsentinel.core.conversion.DateTimeFormats;
import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Reads {@link SentinelConfig} from {@code config-sentinel.yaml}.
 *
 * <p>Loading never fails. A file that is absent, unreadable, not a YAML mapping or not bindable
 * to {@link SentinelConfig} is logged with its location and replaced by
 * {@link SentinelConfig#defaults()}. Date/time patterns are checked one by one: an invalid entry
 * is logged with its index and dropped, and the rest of the file still applies.
 *
 * <p><b>Usage:</b>
 * <pre>{@code
 * SentinelConfig config = ConfigLoader.loadFromDirectory(Paths.get("/etc/orders"));
 *
 * JsonNodeTranslator translator = new JsonNodeTranslator(config.toDateTimeFormats());
 * ValidationResult result = schema.validate(node, translator, config.toValidationOptions());
 * }</pre>
 */
public final class ConfigLoader {

    private static final Logger log = LoggerFactory.getLogger(ConfigLoader.class);
    private static final ObjectMapper YAML_MAPPER = new ObjectMapper(new YAMLFactory());

    /**
     * File names looked up by {@link #loadFromDirectory(Path)}, in order.
     */
    public static final List<String> CONFIG_FILE_NAMES = List.of("config-sentinel.yaml", "config-sentinel.yml");

    private ConfigLoader() {
        // Utility class - prevent instantiation
    }

    /**
     * Loads settings from a YAML file, dropping invalid date/time patterns.
     *
     * @param configPath path to the settings file
     * @return loaded settings, or defaults if the file cannot be used
     */
    public static SentinelConfig load(Path configPath) {
        return read(configPath)
            .map(config -> withValidPatterns(config, configPath))
            .orElseGet(SentinelConfig::defaults);
    }

    /**
     * Loads the first of {@link #CONFIG_FILE_NAMES} present in a directory.
     *
     * @param directory directory to search
     * @return loaded settings, or defaults if no settings file exists
     */
    public static SentinelConfig loadFromDirectory(Path directory) {
        for (String fileName : CONFIG_FILE_NAMES) {
            Path candidate = directory.resolve(fileName);
            if (Files.isRegularFile(candidate)) {
                return load(candidate);
            }
        }
        log.debug("No {} in {}. Using defaults.", CONFIG_FILE_NAMES, directory);
        return SentinelConfig.defaults();
    }

    /**
     * Same as {@link #load(Path)}, but a null path yields defaults.
     *
     * @param configPath path to the settings file, may be null
     * @return loaded settings or defaults
     */
    public static SentinelConfig loadOrDefaults(Path configPath) {
        return configPath == null ? SentinelConfig.defaults() : load(configPath);
    }

    private static Optional<SentinelConfig> read(Path configPath) {
        if (!Files.isRegularFile(configPath)) {
            log.warn("No configuration file at {}. Using defaults.", configPath);
            return Optional.empty();
        }
        try {
            JsonNode root = YAML_MAPPER.readTree(configPath.toFile());
            if (root == null || root.isMissingNode() || root.isNull()) {
                log.warn("Configuration file {} is empty. Using defaults.", configPath);
                return Optional.empty();
            }
            if (!root.isObject()) {
                log.error("Configuration file {} must hold a mapping, found {}. Using defaults.",
                    configPath, root.getNodeType());
                return Optional.empty();
            }
            return Optional.of(YAML_MAPPER.treeToValue(root, SentinelConfig.class));
        } catch (JsonProcessingException e) {
            JsonLocation location = e.getLocation();
            log.error("Invalid configuration in {} (line {}, column {}): {}. Using defaults.",
                configPath,
                location == null ? "?" : location.getLineNr(),
                location == null ? "?" : location.getColumnNr(),
                e.getOriginalMessage());
            return Optional.empty();
        } catch (IOException e) {
            log.error("Cannot read configuration file {}: {}. Using defaults.", configPath, e.getMessage());
            return Optional.empty();
        }
    }

    private static SentinelConfig withValidPatterns(SentinelConfig config, Path configPath) {
        List<String> patterns = new ArrayList<>();
        List<String> configured = config.dateTimeFormats();
        for (int i = 0; i < configured.size(); i++) {
            String pattern = configured.get(i);
            try {
                patterns.add(DateTimeFormats.requireValidPattern(pattern));
            } catch (IllegalArgumentException e) {
                log.warn("Dropping dateTimeFormats[{}] '{}' in {}: {}", i, pattern, configPath, e.getMessage());
            }
        }
        log.info("Loaded configuration from {}: {} date/time pattern(s), unrecognized fields {}",
            configPath, patterns.size(), config.validation().unrecognizedFields());
        return config.withDateTimeFormats(patterns);
    }
}
