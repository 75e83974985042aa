package com.blanklines.core;

import com.blanklines.api.tree.SourceSpan;
import com.blanklines.rules.RuleId;

import java.util.ArrayList;
import java.util.List;

/**
 * Sink that keeps reported diagnostics in arrival order.
 */
public class CollectingDiagnosticSink implements DiagnosticSink {
    private final List<Diagnostic> diagnostics = new ArrayList<>();

    @Override
    public synchronized void report(RuleId ruleId, SourceSpan location) {
        diagnostics.add(new Diagnostic(ruleId, location));
    }

    public synchronized List<Diagnostic> getDiagnostics() {
        return new ArrayList<>(diagnostics);
    }

    public synchronized int size() {
        return diagnostics.size();
    }
}
