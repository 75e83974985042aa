package com.blanklines.rules;

import com.blanklines.api.error.Severity;
import com.blanklines.util.LoggerUtil;

import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.Locale;
import java.util.Map;
import java.util.MissingResourceException;
import java.util.ResourceBundle;
import java.util.logging.Logger;

/**
 * Holds the descriptors of the supported rules, with texts taken from the
 * {@code messages/CheckerResources} bundle.
 */
public class RuleRegistry {
    private static final Logger logger = LoggerUtil.getLogger(RuleRegistry.class);
    private static final String BUNDLE_NAME = "messages.CheckerResources";
    private static final String CATEGORY = "Formatting Style";

    private final Map<RuleId, RuleDescriptor> descriptors;

    private RuleRegistry(Map<RuleId, RuleDescriptor> descriptors) {
        this.descriptors = Collections.unmodifiableMap(descriptors);
    }

    public static RuleRegistry load() {
        return load(Locale.getDefault());
    }

    public static RuleRegistry load(Locale locale) {
        ResourceBundle bundle = ResourceBundle.getBundle(BUNDLE_NAME, locale);

        Map<RuleId, RuleDescriptor> descriptors = new EnumMap<>(RuleId.class);
        for (RuleId ruleId : RuleId.values()) {
            descriptors.put(ruleId, _createDescriptor(bundle, ruleId));
        }

        logger.fine("Loaded " + descriptors.size() + " rule descriptors for locale " + locale);
        return new RuleRegistry(descriptors);
    }

    private static RuleDescriptor _createDescriptor(ResourceBundle bundle, RuleId ruleId) {
        String prefix = ruleId.getId() + ".";

        return new RuleDescriptor(
                ruleId,
                _text(bundle, prefix + "title", "AnalyzerTitle"),
                _text(bundle, prefix + "description", "AnalyzerDescription"),
                _text(bundle, prefix + "message", "AnalyzerMessageFormat"),
                CATEGORY,
                Severity.WARNING,
                true);
    }

    /**
     * Looks up a rule-specific key, then the shared one.
     */
    private static String _text(ResourceBundle bundle, String key, String sharedKey) {
        if (bundle.containsKey(key)) {
            return bundle.getString(key);
        }
        try {
            return bundle.getString(sharedKey);
        } catch (MissingResourceException e) {
            logger.warning("Missing message resource '" + sharedKey + "' in " + BUNDLE_NAME);
            return sharedKey;
        }
    }

    public RuleDescriptor get(RuleId ruleId) {
        return descriptors.get(ruleId);
    }

    public Collection<RuleDescriptor> getAll() {
        return descriptors.values();
    }
}
