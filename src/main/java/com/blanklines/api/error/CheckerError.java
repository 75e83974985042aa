package com.blanklines.api.error;

/**
 * Represents a finding reported while checking a source file.
 */
public class CheckerError {
    private final Severity severity;
    private final String message;
    private final int line;
    private final int column;
    private final String ruleId;
    private final String suggestion;

    public CheckerError(Severity severity, String message, int line, int column) {
        this(severity, message, line, column, null, null);
    }

    public CheckerError(Severity severity, String message, int line, int column, String ruleId, String suggestion) {
        this.severity = severity;
        this.message = message;
        this.line = line;
        this.column = column;
        this.ruleId = ruleId;
        this.suggestion = suggestion;
    }

    // Getters
    public Severity getSeverity() { return severity; }
    public String getMessage() { return message; }
    public int getLine() { return line; }
    public int getColumn() { return column; }
    public String getRuleId() { return ruleId; }
    public String getSuggestion() { return suggestion; }
}
