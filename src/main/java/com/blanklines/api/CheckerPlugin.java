package com.blanklines.api;

import java.nio.file.Path;

import com.blanklines.config.CheckerConfig;

/**
 * Interface for language-specific checker plugins.
 */
public interface CheckerPlugin {
    /**
     * Initialize the plugin with the configuration.
     */
    void initialize(CheckerConfig config);

    /**
     * Check the provided source code and report spacing findings.
     */
    CheckResult check(Path filePath, String sourceCode);
}
