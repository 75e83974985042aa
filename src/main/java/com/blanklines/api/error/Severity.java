package com.blanklines.api.error;

public enum Severity {
    FATAL,   // Unparseable sources or other issues preventing the check
    ERROR,   // Findings configured to fail the build
    WARNING, // Default level for spacing findings
    INFO     // Informational messages about the check
}
