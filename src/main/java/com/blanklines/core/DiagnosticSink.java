package com.blanklines.core;

import com.blanklines.api.tree.SourceSpan;
import com.blanklines.rules.RuleId;

/**
 * Receives rule violations as they are found. Implementations shared between
 * threads handle their own synchronization.
 */
@FunctionalInterface
public interface DiagnosticSink {
    void report(RuleId ruleId, SourceSpan location);
}
