package com.blanklines.core;

import com.blanklines.api.tree.SourceSpan;
import com.blanklines.rules.RuleId;

import java.util.Objects;

/**
 * A rule violation at a location.
 */
public final class Diagnostic {
    private final RuleId ruleId;
    private final SourceSpan location;

    public Diagnostic(RuleId ruleId, SourceSpan location) {
        this.ruleId = ruleId;
        this.location = location;
    }

    public RuleId getRuleId() {
        return ruleId;
    }

    public SourceSpan getLocation() {
        return location;
    }

    @Override
    public boolean equals(Object o) {
        if (this == o) return true;
        if (!(o instanceof Diagnostic)) return false;
        Diagnostic that = (Diagnostic) o;
        return ruleId == that.ruleId && location.equals(that.location);
    }

    @Override
    public int hashCode() {
        return Objects.hash(ruleId, location);
    }

    @Override
    public String toString() {
        return ruleId.getId() + " at " + location;
    }
}
