package com.blanklines.config;

import com.blanklines.api.error.Severity;
import com.blanklines.rules.RuleId;

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Configuration for the checker.
 */
public class CheckerConfig {
    private final Map<String, Object> generalConfig;
    private final Map<String, Map<String, Object>> pluginConfigs;
    private final Map<String, Map<String, Object>> ruleConfigs;

    public CheckerConfig(Map<String, Object> generalConfig,
                         Map<String, Map<String, Object>> pluginConfigs,
                         Map<String, Map<String, Object>> ruleConfigs) {
        this.generalConfig = generalConfig;
        this.pluginConfigs = pluginConfigs;
        this.ruleConfigs = ruleConfigs;
    }

    /**
     * Gets a copy of the general config map.
     */
    public Map<String, Object> getGeneralConfigMap() {
        return new HashMap<>(generalConfig);
    }

    /**
     * Gets a copy of the plugin configs map.
     */
    public Map<String, Map<String, Object>> getPluginConfigsMap() {
        return _copy(pluginConfigs);
    }

    /**
     * Gets a copy of the rule configs map.
     */
    public Map<String, Map<String, Object>> getRuleConfigsMap() {
        return _copy(ruleConfigs);
    }

    private static Map<String, Map<String, Object>> _copy(Map<String, Map<String, Object>> source) {
        Map<String, Map<String, Object>> result = new HashMap<>();
        for (Map.Entry<String, Map<String, Object>> entry : source.entrySet()) {
            result.put(entry.getKey(), new HashMap<>(entry.getValue()));
        }
        return result;
    }

    @SuppressWarnings("unchecked")
    public <T> T getGeneralConfig(String key, T defaultValue) {
        Object value = generalConfig.get(key);
        return value != null ? (T) value : defaultValue;
    }

    public <T> T getPluginConfig(String plugin, String key, T defaultValue) {
        return _lookup(pluginConfigs, plugin, key, defaultValue);
    }

    public <T> T getRuleConfig(RuleId ruleId, String key, T defaultValue) {
        return _lookup(ruleConfigs, ruleId.getId(), key, defaultValue);
    }

    public boolean isRuleEnabled(RuleId ruleId, boolean enabledByDefault) {
        return getRuleConfig(ruleId, "enabled", enabledByDefault);
    }

    /**
     * Severity configured for a rule, or {@code defaultSeverity} when none or an unknown one is set.
     */
    public Severity getRuleSeverity(RuleId ruleId, Severity defaultSeverity) {
        String name = getRuleConfig(ruleId, "severity", defaultSeverity.name());
        try {
            return Severity.valueOf(name.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return defaultSeverity;
        }
    }

    @SuppressWarnings("unchecked")
    private static <T> T _lookup(Map<String, Map<String, Object>> sections, String section, String key, T defaultValue) {
        try {
            Map<String, Object> sectionConfig = sections.get(section);
            if (sectionConfig == null) {
                return defaultValue;
            }

            Object value = sectionConfig.get(key);
            if (value == null) {
                return defaultValue;
            }

            if (defaultValue != null && !defaultValue.getClass().isInstance(value)) {

                if (defaultValue instanceof Integer && value instanceof Number) {
                    return (T) Integer.valueOf(((Number) value).intValue());
                } else if (defaultValue instanceof Boolean && value instanceof String) {
                    return (T) Boolean.valueOf(value.toString());
                } else if (defaultValue instanceof String) {
                    return (T) value.toString();
                }

                return defaultValue;
            }

            return (T) value;
        } catch (ClassCastException e) {
            return defaultValue;
        }
    }
}
