package com.blanklines.config;

import com.blanklines.api.error.Severity;
import com.blanklines.rules.RuleId;
import com.blanklines.util.LoggerUtil;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.github.javaparser.ParserConfiguration;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads the YAML configuration, validating values and falling back to defaults.
 */
public class ConfigurationLoader {
    private static final Logger logger = LoggerUtil.getLogger(ConfigurationLoader.class.getName());
    private static final String DEFAULT_CONFIG_RESOURCE = "/config/default-config.yml";

    public static final String JAVA_PLUGIN = "java";

    private static CheckerConfig _cachedDefaultConfig = null;

    /**
     * Loads configuration from a file with fallback to defaults.
     */
    public static CheckerConfig loadConfig(Path configPath) {
        if (configPath == null) {
            logger.warning("No config path provided, using default configuration");
            return loadDefaultConfig();
        }

        if (!Files.exists(configPath)) {
            logger.fine("Configuration file not found: " + configPath + ", using default configuration");
            return loadDefaultConfig();
        }

        try {
            logger.info("Loading configuration from: " + configPath);

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(configPath.toFile(), Map.class);

            if (config == null) {
                logger.warning("Configuration file is empty: " + configPath + ", using default configuration");
                return loadDefaultConfig();
            }

            CheckerConfig checkerConfig = _createConfigFromMap(config);
            logger.info("Configuration loaded successfully with " +
                    checkerConfig.getRuleConfigsMap().size() + " rule configurations");

            return checkerConfig;
        } catch (Exception e) {
            logger.log(Level.WARNING, "Error parsing configuration file: " + e.getMessage(), e);
            logger.info("Falling back to default configuration");
            return loadDefaultConfig();
        }
    }

    /**
     * Loads the embedded default configuration with caching.
     */
    public static synchronized CheckerConfig loadDefaultConfig() {
        if (_cachedDefaultConfig != null) {
            return _cachedDefaultConfig;
        }

        try (InputStream defaultConfigStream =
                     ConfigurationLoader.class.getResourceAsStream(DEFAULT_CONFIG_RESOURCE)) {

            if (defaultConfigStream == null) {
                logger.severe("Default configuration resource not found: " + DEFAULT_CONFIG_RESOURCE);
                return _createEmptyConfig();
            }

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            @SuppressWarnings("unchecked")
            Map<String, Object> config = mapper.readValue(defaultConfigStream, Map.class);

            _cachedDefaultConfig = _createConfigFromMap(config);
            logger.fine("Default configuration loaded successfully");

            return _cachedDefaultConfig;
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to load default configuration", e);
            return _createEmptyConfig();
        }
    }

    /**
     * Creates a configuration from a parsed Map, with validation.
     */
    static CheckerConfig _createConfigFromMap(Map<String, Object> config) {
        Map<String, Object> generalConfig = new HashMap<>();
        Object general = config.get("general");
        if (general instanceof Map) {
            generalConfig = _toStringKeyed((Map<?, ?>) general);
        } else {
            logger.warning("Missing or invalid 'general' section in config, using defaults");
        }

        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Map<String, Object>> pluginConfigs = _readSections(config, "plugins");
        _ensureDefaultPluginConfigs(pluginConfigs);

        Map<String, Map<String, Object>> ruleConfigs = _readSections(config, "rules");
        _ensureDefaultRuleConfigs(ruleConfigs);

        _validateConfigurationValues(generalConfig, pluginConfigs, ruleConfigs);

        return new CheckerConfig(generalConfig, pluginConfigs, ruleConfigs);
    }

    private static Map<String, Map<String, Object>> _readSections(Map<String, Object> config, String name) {
        Map<String, Map<String, Object>> sections = new HashMap<>();
        Object value = config.get(name);

        if (!(value instanceof Map)) {
            logger.warning("Missing or invalid '" + name + "' section in config, using defaults");
            return sections;
        }

        for (Map.Entry<?, ?> entry : ((Map<?, ?>) value).entrySet()) {
            String key = String.valueOf(entry.getKey());
            if (entry.getValue() instanceof Map) {
                sections.put(key, _toStringKeyed((Map<?, ?>) entry.getValue()));
            } else {
                logger.warning("Invalid configuration for " + name + " entry '" + key + "', using defaults");
                sections.put(key, new HashMap<>());
            }
        }
        return sections;
    }

    private static Map<String, Object> _toStringKeyed(Map<?, ?> map) {
        Map<String, Object> result = new HashMap<>();
        for (Map.Entry<?, ?> entry : map.entrySet()) {
            result.put(String.valueOf(entry.getKey()), entry.getValue());
        }
        return result;
    }

    /**
     * Validates configuration values to ensure they are within acceptable ranges.
     */
    private static void _validateConfigurationValues(Map<String, Object> generalConfig,
                                                     Map<String, Map<String, Object>> pluginConfigs,
                                                     Map<String, Map<String, Object>> ruleConfigs) {
        if (_validateIntRange(generalConfig, "threads", 1, 64)) {
            generalConfig.put("threads", Runtime.getRuntime().availableProcessors());
        }

        Map<String, Object> javaConfig = pluginConfigs.get(JAVA_PLUGIN);
        if (_validateIntRange(javaConfig, "cacheSize", 0, 10000)) {
            javaConfig.put("cacheSize", 100);
        }

        Object languageLevel = javaConfig.get("languageLevel");
        try {
            ParserConfiguration.LanguageLevel.valueOf(String.valueOf(languageLevel).trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warning("Unknown Java language level '" + languageLevel + "'. Using JAVA_17.");
            javaConfig.put("languageLevel", "JAVA_17");
        }

        for (Map.Entry<String, Map<String, Object>> entry : ruleConfigs.entrySet()) {
            Object severity = entry.getValue().get("severity");
            try {
                Severity.valueOf(String.valueOf(severity).trim().toUpperCase(Locale.ROOT));
            } catch (IllegalArgumentException e) {
                logger.warning("Unknown severity '" + severity + "' for rule " + entry.getKey() + ". Using WARNING.");
                entry.getValue().put("severity", Severity.WARNING.name());
            }
        }
    }

    /**
     * Validates that an integer configuration value is within the specified range.
     * Returns true when an out-of-range value was removed.
     */
    private static boolean _validateIntRange(Map<String, Object> config, String key, int min, int max) {
        if (config.containsKey(key) && config.get(key) instanceof Number) {
            int value = ((Number) config.get(key)).intValue();
            if (value < min || value > max) {
                logger.warning("Configuration value '" + key + "' is outside acceptable range " +
                        "(" + min + "-" + max + "). Using default value.");
                config.remove(key);
                return true;
            }
        }
        return false;
    }

    /**
     * Creates an empty configuration with minimum defaults.
     */
    private static CheckerConfig _createEmptyConfig() {
        Map<String, Object> generalConfig = new HashMap<>();
        _ensureDefaultGeneralConfig(generalConfig);

        Map<String, Map<String, Object>> pluginConfigs = new HashMap<>();
        _ensureDefaultPluginConfigs(pluginConfigs);

        Map<String, Map<String, Object>> ruleConfigs = new HashMap<>();
        _ensureDefaultRuleConfigs(ruleConfigs);

        return new CheckerConfig(generalConfig, pluginConfigs, ruleConfigs);
    }

    /**
     * Ensures that general configuration has all required default values.
     */
    private static void _ensureDefaultGeneralConfig(Map<String, Object> generalConfig) {
        if (!(generalConfig.get("threads") instanceof Number)) {
            generalConfig.put("threads", Runtime.getRuntime().availableProcessors());
        }
        if (!(generalConfig.get("ignoreFiles") instanceof List)) {
            generalConfig.put("ignoreFiles", new ArrayList<String>());
        }
        if (!(generalConfig.get("failOnWarning") instanceof Boolean)) {
            generalConfig.put("failOnWarning", false);
        }
    }

    /**
     * Ensures that plugin configurations have all required default values.
     */
    private static void _ensureDefaultPluginConfigs(Map<String, Map<String, Object>> pluginConfigs) {
        Map<String, Object> javaConfig = pluginConfigs.computeIfAbsent(JAVA_PLUGIN, k -> new HashMap<>());
        if (!(javaConfig.get("languageLevel") instanceof String)) {
            javaConfig.put("languageLevel", "JAVA_17");
        }
        if (!(javaConfig.get("cacheSize") instanceof Number)) {
            javaConfig.put("cacheSize", 100);
        }
    }

    /**
     * Ensures that every rule has an entry with enabled flag and severity.
     */
    private static void _ensureDefaultRuleConfigs(Map<String, Map<String, Object>> ruleConfigs) {
        for (RuleId ruleId : RuleId.values()) {
            Map<String, Object> ruleConfig = ruleConfigs.computeIfAbsent(ruleId.getId(), k -> new HashMap<>());
            Object enabled = ruleConfig.get("enabled");
            if (enabled instanceof String
                    && ("true".equalsIgnoreCase(((String) enabled).trim())
                    || "false".equalsIgnoreCase(((String) enabled).trim()))) {
                ruleConfig.put("enabled", Boolean.valueOf(((String) enabled).trim()));
            } else if (!(enabled instanceof Boolean)) {
                if (enabled != null) {
                    logger.warning("Invalid 'enabled' value for rule " + ruleId.getId() + ": " + enabled
                            + ", enabling the rule");
                }
                ruleConfig.put("enabled", true);
            }
            if (!(ruleConfig.get("severity") instanceof String)) {
                ruleConfig.put("severity", Severity.WARNING.name());
            }
        }
    }

    /**
     * Saves configuration to a file.
     */
    public static void saveConfig(CheckerConfig config, Path configPath) throws IOException {
        try {
            Path parent = configPath.getParent();
            if (parent != null && !Files.exists(parent)) {
                Files.createDirectories(parent);
            }

            Map<String, Object> configMap = new LinkedHashMap<>();
            configMap.put("general", config.getGeneralConfigMap());
            configMap.put("plugins", config.getPluginConfigsMap());
            configMap.put("rules", config.getRuleConfigsMap());

            ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
            mapper.writeValue(configPath.toFile(), configMap);

            logger.info("Configuration saved successfully to: " + configPath);
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Failed to save configuration to: " + configPath, e);
            throw e;
        }
    }
}
