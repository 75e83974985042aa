package com.blanklines.rules;

import com.blanklines.api.error.Severity;

import java.text.MessageFormat;

/**
 * Static metadata for one rule, supplied once at registration time.
 */
public class RuleDescriptor {
    private final RuleId ruleId;
    private final String title;
    private final String description;
    private final String messageFormat;
    private final String category;
    private final Severity defaultSeverity;
    private final boolean enabledByDefault;

    public RuleDescriptor(RuleId ruleId, String title, String description, String messageFormat,
                          String category, Severity defaultSeverity, boolean enabledByDefault) {
        this.ruleId = ruleId;
        this.title = title;
        this.description = description;
        this.messageFormat = messageFormat;
        this.category = category;
        this.defaultSeverity = defaultSeverity;
        this.enabledByDefault = enabledByDefault;
    }

    /**
     * Renders the message format with the given arguments.
     */
    public String formatMessage(Object... args) {
        return MessageFormat.format(messageFormat, args);
    }

    // Getters
    public RuleId getRuleId() { return ruleId; }
    public String getId() { return ruleId.getId(); }
    public String getTitle() { return title; }
    public String getDescription() { return description; }
    public String getCategory() { return category; }
    public Severity getDefaultSeverity() { return defaultSeverity; }
    public boolean isEnabledByDefault() { return enabledByDefault; }
}
