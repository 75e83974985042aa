package com.blanklines.core;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

import com.blanklines.api.CheckResult;
import com.blanklines.api.CheckerPlugin;
import com.blanklines.api.CodeChecker;
import com.blanklines.api.error.CheckerError;
import com.blanklines.api.error.Severity;
import com.blanklines.config.CheckerConfig;
import com.blanklines.plugins.FileType;
import com.blanklines.util.LoggerUtil;

/**
 * Thread-safe checker engine. Delegates each file to the plugin registered
 * for its file type and checks directories on a worker pool.
 */
public class CheckerEngine implements CodeChecker, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(CheckerEngine.class);

    private final Map<FileType, CheckerPlugin> plugins = new ConcurrentHashMap<>();
    private final CheckerConfig config;

    private final AtomicInteger processedFileCount = new AtomicInteger(0);
    private final AtomicInteger successCount = new AtomicInteger(0);
    private final AtomicInteger errorCount = new AtomicInteger(0);

    public CheckerEngine(CheckerConfig config) {
        this.config = config;
        logger.fine("Checker engine initialized with configuration");
    }

    /**
     * Registers a plugin for a specific file type.
     */
    public void registerPlugin(FileType fileType, CheckerPlugin plugin) {
        plugins.put(fileType, plugin);
        plugin.initialize(config);
        logger.fine("Registered plugin for file type: " + fileType.getDescription());
    }

    /**
     * Checks a single file using the appropriate plugin.
     */
    @Override
    public CheckResult checkFile(Path filePath, String sourceCode) {
        FileType fileType = FileType.detect(filePath);
        CheckerPlugin plugin = plugins.get(fileType);

        if (plugin == null) {
            logger.warning("No plugin found for file type: " + fileType + " - " + filePath);
            return CheckResult.builder()
                    .successful(false)
                    .addError(new CheckerError(
                            Severity.ERROR,
                            "No plugin registered for file type: " + fileType,
                            1, 1))
                    .build();
        }

        try {
            processedFileCount.incrementAndGet();
            CheckResult result = plugin.check(filePath, sourceCode);

            if (result.isSuccessful()) {
                successCount.incrementAndGet();
                logger.fine("Checked: " + filePath + " (" + result.getErrors().size() + " findings)");
            } else {
                errorCount.incrementAndGet();
                logger.fine("Check failed for " + filePath + " - " +
                        result.getErrors().stream()
                                .map(e -> e.getSeverity() + ": " + e.getMessage())
                                .collect(Collectors.joining(", ")));
            }

            return result;
        } catch (RuntimeException e) {
            errorCount.incrementAndGet();
            logger.log(Level.SEVERE, "Unexpected error checking file: " + filePath, e);

            return _fatal("Unexpected error: " + e.getMessage());
        }
    }

    /**
     * Checks every supported file below a directory using one thread per processor.
     */
    @Override
    public Map<Path, CheckResult> checkDirectory(Path directory) {
        return checkDirectory(directory, Runtime.getRuntime().availableProcessors());
    }

    /**
     * Checks a directory with a specified thread count.
     */
    public Map<Path, CheckResult> checkDirectory(Path directory, int threadCount) {
        ConcurrentHashMap<Path, CheckResult> results = new ConcurrentHashMap<>();

        if (!Files.exists(directory)) {
            logger.warning("Directory does not exist: " + directory);
            return results;
        }

        if (!Files.isDirectory(directory)) {
            logger.warning("Path is not a directory: " + directory);
            return results;
        }

        List<Path> filesToProcess;
        try (Stream<Path> walk = Files.walk(directory)) {
            filesToProcess = walk
                    .filter(Files::isRegularFile)
                    .filter(path -> {
                        FileType type = FileType.detect(path);
                        return type != FileType.UNKNOWN && plugins.containsKey(type);
                    })
                    .collect(Collectors.toList());
        } catch (IOException e) {
            logger.log(Level.SEVERE, "Error scanning directory: " + directory, e);
            return results;
        }

        logger.info("Found " + filesToProcess.size() + " files to check in " + directory);

        if (!filesToProcess.isEmpty()) {
            results.putAll(checkFiles(filesToProcess, threadCount));
        }

        return results;
    }

    /**
     * Checks the given files in parallel.
     */
    public Map<Path, CheckResult> checkFiles(List<Path> files, int threadCount) {
        ConcurrentHashMap<Path, CheckResult> results = new ConcurrentHashMap<>();
        ExecutorService executor = Executors.newFixedThreadPool(Math.max(1, threadCount));

        try {
            for (Path file : files) {
                executor.submit(() -> {
                    try {
                        String content = Files.readString(file, StandardCharsets.UTF_8);
                        results.put(file, checkFile(file, content));
                    } catch (IOException e) {
                        logger.log(Level.WARNING, "Failed to read file: " + file, e);
                        results.put(file, _fatal("Failed to read file: " + e.getMessage()));
                    }
                });
            }
        } finally {
            executor.shutdown();
        }

        try {
            if (!executor.awaitTermination(30, TimeUnit.MINUTES)) {
                logger.warning("Timeout waiting for file processing to complete");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            logger.log(Level.WARNING, "Processing interrupted", e);
            Thread.currentThread().interrupt();
            executor.shutdownNow();
        }

        logger.fine("Processed " + results.size() + " files");
        return results;
    }

    private static CheckResult _fatal(String message) {
        return CheckResult.builder()
                .successful(false)
                .addError(new CheckerError(Severity.FATAL, message, 1, 1))
                .build();
    }

    public int getProcessedFileCount() {
        return processedFileCount.get();
    }

    public int getSuccessCount() {
        return successCount.get();
    }

    public int getErrorCount() {
        return errorCount.get();
    }

    public boolean hasPluginFor(FileType fileType) {
        return plugins.containsKey(fileType);
    }

    /**
     * Closes all plugins and releases resources.
     */
    @Override
    public void close() throws Exception {
        logger.fine("Closing checker: processed=" + processedFileCount.get() +
                ", success=" + successCount.get() + ", errors=" + errorCount.get());

        Exception firstException = null;

        for (Map.Entry<FileType, CheckerPlugin> entry : plugins.entrySet()) {
            CheckerPlugin plugin = entry.getValue();
            if (plugin instanceof AutoCloseable) {
                try {
                    ((AutoCloseable) plugin).close();
                } catch (Exception e) {
                    logger.log(Level.WARNING, "Error closing plugin for file type: " + entry.getKey(), e);
                    // Keep the first exception but continue closing other plugins
                    if (firstException == null) {
                        firstException = e;
                    }
                }
            }
        }

        plugins.clear();

        if (firstException != null) {
            throw firstException;
        }
    }
}
