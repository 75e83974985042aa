package com.blanklines.api;

import java.nio.file.Path;
import java.util.Map;

/**
 * The main checker interface that all engines must provide.
 */
public interface CodeChecker {
    CheckResult checkFile(Path filePath, String sourceCode);
    Map<Path, CheckResult> checkDirectory(Path directory);
}
