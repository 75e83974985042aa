package com.blanklines.rules;

/**
 * Identifiers of the two spacing rules.
 */
public enum RuleId {
    /** An assignment run is not preceded by a blank line. */
    BEFORE("BLAA_1"),
    /** An assignment run is not followed by a blank line. */
    AFTER("BLAA_2");

    private final String id;

    RuleId(String id) {
        this.id = id;
    }

    public String getId() {
        return id;
    }

    public static RuleId fromId(String id) {
        for (RuleId rule : values()) {
            if (rule.id.equalsIgnoreCase(id) || rule.name().equalsIgnoreCase(id)) {
                return rule;
            }
        }
        throw new IllegalArgumentException("Unknown rule id: " + id);
    }
}
