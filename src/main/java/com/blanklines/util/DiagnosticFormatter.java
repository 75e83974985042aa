package com.blanklines.util;

import com.blanklines.api.error.CheckerError;
import com.blanklines.api.error.Severity;
import com.blanklines.rules.RuleDescriptor;

import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Formats findings for console output.
 */
public class DiagnosticFormatter {
    public static final String ANSI_RESET = "\u001B[0m";
    public static final String ANSI_RED = "\u001B[31m";
    public static final String ANSI_GREEN = "\u001B[32m";
    public static final String ANSI_YELLOW = "\u001B[33m";
    public static final String ANSI_BLUE = "\u001B[34m";
    public static final String ANSI_BOLD = "\u001B[1m";

    private final boolean useColors;

    /**
     * Creates a new formatter.
     *
     * @param useColors whether to use colors in the output
     */
    public DiagnosticFormatter(boolean useColors) {
        this.useColors = useColors;
    }

    /**
     * Formats one finding as {@code SEVERITY [RULE]: message (Line n, Col m)}.
     */
    public String formatError(CheckerError error) {
        StringBuilder sb = new StringBuilder();

        String severityStr = switch (error.getSeverity()) {
            case FATAL -> colorize(ANSI_RED, "FATAL");
            case ERROR -> colorize(ANSI_RED, "ERROR");
            case WARNING -> colorize(ANSI_YELLOW, "WARNING");
            case INFO -> colorize(ANSI_BLUE, "INFO");
        };

        sb.append(severityStr);
        if (error.getRuleId() != null) {
            sb.append(" [").append(error.getRuleId()).append("]");
        }
        sb.append(": ").append(error.getMessage());
        sb.append(" (Line ").append(error.getLine()).append(", Col ").append(error.getColumn()).append(")");

        if (error.getSuggestion() != null && !error.getSuggestion().isEmpty()) {
            sb.append("\n  ").append(colorize(ANSI_GREEN, "Suggestion: "))
                    .append(error.getSuggestion());
        }

        return sb.toString();
    }

    /**
     * Formats a finding in the compact {@code file:line:col: SEVERITY RULE message} form used in CI mode.
     */
    public String formatCompact(Path file, CheckerError error) {
        return file + ":" + error.getLine() + ":" + error.getColumn() + ": "
                + error.getSeverity()
                + (error.getRuleId() != null ? " " + error.getRuleId() : "")
                + " " + error.getMessage();
    }

    /**
     * Formats the metadata of a rule for the {@code rules} command.
     */
    public String formatRule(RuleDescriptor descriptor) {
        return colorize(ANSI_BOLD, descriptor.getId()) + " - " + descriptor.getTitle() + "\n"
                + "  Category: " + descriptor.getCategory() + "\n"
                + "  Default severity: " + descriptor.getDefaultSeverity() + "\n"
                + "  Enabled by default: " + descriptor.isEnabledByDefault() + "\n"
                + "  " + descriptor.getDescription();
    }

    /**
     * Creates a summary of findings per file.
     */
    public String formatErrorSummary(Map<Path, List<CheckerError>> fileErrors) {
        StringBuilder sb = new StringBuilder();

        sb.append(colorize(ANSI_BOLD, "Summary:\n"));

        long totalFatals = 0;
        long totalErrors = 0;
        long totalWarnings = 0;
        long totalInfos = 0;

        for (Map.Entry<Path, List<CheckerError>> entry : fileErrors.entrySet()) {
            List<CheckerError> errors = entry.getValue();

            if (errors.isEmpty()) {
                continue;
            }

            Map<Severity, Long> counts = errors.stream()
                    .collect(Collectors.groupingBy(CheckerError::getSeverity, Collectors.counting()));
            long fatals = counts.getOrDefault(Severity.FATAL, 0L);
            long errs = counts.getOrDefault(Severity.ERROR, 0L);
            long warnings = counts.getOrDefault(Severity.WARNING, 0L);
            long infos = counts.getOrDefault(Severity.INFO, 0L);

            totalFatals += fatals;
            totalErrors += errs;
            totalWarnings += warnings;
            totalInfos += infos;

            sb.append(entry.getKey().getFileName()).append(": ");
            sb.append(_formatCounts(fatals, errs, warnings, infos));
            sb.append("\n");
        }

        sb.append("\nTotal: ").append(_formatCounts(totalFatals, totalErrors, totalWarnings, totalInfos));

        return sb.toString();
    }

    private String _formatCounts(long fatals, long errors, long warnings, long infos) {
        StringBuilder sb = new StringBuilder();

        if (fatals > 0) {
            sb.append(colorize(ANSI_RED, fatals + " fatal")).append(", ");
        }
        if (errors > 0) {
            sb.append(colorize(ANSI_RED, errors + " errors")).append(", ");
        }
        if (warnings > 0) {
            sb.append(colorize(ANSI_YELLOW, warnings + " warnings")).append(", ");
        }
        if (infos > 0) {
            sb.append(colorize(ANSI_BLUE, infos + " info")).append(", ");
        }

        if (sb.length() == 0) {
            return "no issues";
        }

        // Trailing comma and space
        sb.setLength(sb.length() - 2);
        return sb.toString();
    }

    /**
     * Groups findings by severity.
     */
    public Map<Severity, List<CheckerError>> groupBySeverity(List<CheckerError> errors) {
        return errors.stream().collect(Collectors.groupingBy(CheckerError::getSeverity));
    }

    /**
     * Applies ANSI color to text if colors are enabled.
     */
    public String colorize(String color, String message) {
        if (useColors) {
            return color + message + ANSI_RESET;
        }
        return message;
    }
}
