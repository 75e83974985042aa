package com.blanklines.cli;

import com.blanklines.api.CheckResult;
import com.blanklines.api.error.CheckerError;
import com.blanklines.api.error.Severity;
import com.blanklines.config.CheckerConfig;
import com.blanklines.config.ConfigurationLoader;
import com.blanklines.core.CheckerEngine;
import com.blanklines.plugins.FileType;
import com.blanklines.plugins.java.BlankLineJavaPlugin;
import com.blanklines.rules.RuleDescriptor;
import com.blanklines.rules.RuleRegistry;
import com.blanklines.util.DiagnosticFormatter;
import com.blanklines.util.LoggerUtil;

import java.io.IOException;
import java.nio.file.FileSystems;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.PathMatcher;
import java.nio.file.Paths;
import java.time.Duration;
import java.time.Instant;
import java.util.*;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Command Line Interface for the blank line checker.
 */
public class CheckerCli {
    private static final Logger logger = LoggerUtil.getLogger(CheckerCli.class);
    private static final String VERSION = "1.0.0";
    private static final String CONFIG_FILE_NAME = ".blanklines.yml";

    static final int EXIT_OK = 0;
    static final int EXIT_FINDINGS = 1;
    static final int EXIT_USAGE = 2;

    private static DiagnosticFormatter formatter = new DiagnosticFormatter(false);

    public static void main(String[] args) {
        int exitCode;
        try {
            exitCode = run(args);
        } finally {
            LoggerUtil.shutdown();
        }
        System.exit(exitCode);
    }

    /**
     * Runs a command and returns the process exit code.
     */
    static int run(String[] args) {
        boolean useColors = !_hasOption(args, "--no-color") && !_hasOption(args, "--ci");
        formatter = new DiagnosticFormatter(useColors);

        if (args.length < 1) {
            _printUsage();
            return EXIT_USAGE;
        }

        if (_hasOption(args, "--verbose")) {
            LoggerUtil.setConsoleLevel(Level.FINE);
        } else {
            LoggerUtil.setConsoleLevel(Level.WARNING);
        }

        String logFile = _getOptionValue(args, "--log-file");
        if (logFile != null) {
            try {
                LoggerUtil.openLogFile(Paths.get(logFile));
            } catch (IOException e) {
                _printWarning("Cannot write log file " + logFile + ": " + e.getMessage());
            }
        }

        try {
            String command = args[0];

            switch (command) {
                case "check":
                    return _checkFiles(args);
                case "rules":
                    return _listRules();
                case "init":
                    return _initializeConfig(args);
                case "--version":
                case "-v":
                    _printVersion();
                    return EXIT_OK;
                case "--help":
                case "-h":
                    _printUsage();
                    return EXIT_OK;
                default:
                    _printError("Unknown command: " + command);
                    _printUsage();
                    return EXIT_USAGE;
            }
        } catch (Exception e) {
            _printError("Error: " + e.getMessage());
            logger.log(Level.SEVERE, "Unhandled exception", e);

            if (!_hasOption(args, "--verbose")) {
                _printInfo("Use --verbose for stack trace");
            }
            return EXIT_USAGE;
        } finally {
            LoggerUtil.closeLogFile();
        }
    }

    private static void _printVersion() {
        System.out.println("Blank Line Checker version " + VERSION);
    }

    private static void _printUsage() {
        System.out.println(formatter.colorize(DiagnosticFormatter.ANSI_BOLD, "Blank Line Checker CLI v" + VERSION));
        System.out.println("Usage:");
        System.out.println("  blanklines check <path>           - Report assignments lacking blank lines");
        System.out.println("  blanklines rules                  - List the rules and their metadata");
        System.out.println("  blanklines init [--force]         - Initialize configuration file");
        System.out.println("  blanklines --help|-h              - Show this help");
        System.out.println("  blanklines --version|-v           - Show version information");
        System.out.println();
        System.out.println("Options:");
        System.out.println("  --config=<file>                   - Use specific config file (default: " + CONFIG_FILE_NAME + ")");
        System.out.println("  --verbose                         - Show detailed output");
        System.out.println("  --ci                              - CI friendly output (one line per finding)");
        System.out.println("  --no-color                        - Disable colored output");
        System.out.println("  --include=<glob>                  - Only include files matching pattern");
        System.out.println("  --threads=<num>                   - Number of threads to use (default: available processors)");
        System.out.println("  --fail-on-warning                 - Exit with an error when warnings are found");
        System.out.println("  --log-file=<file>                 - Append detailed logs to a file");
        System.out.println("  --force                           - Force overwrite (with init command)");
    }

    private static int _checkFiles(String[] args) throws Exception {
        if (args.length < 2 || args[1].startsWith("--")) {
            _printError("Error: Missing path argument");
            _printUsage();
            return EXIT_USAGE;
        }

        Path path = Paths.get(args[1]);

        if (!Files.exists(path)) {
            _printError("Error: Path does not exist: " + args[1]);
            return EXIT_USAGE;
        }

        boolean verbose = _hasOption(args, "--verbose");
        boolean ciMode = _hasOption(args, "--ci");
        String includePattern = _getOptionValue(args, "--include");

        CheckerConfig config = _loadConfig(args);
        boolean failOnWarning = _hasOption(args, "--fail-on-warning")
                || config.getGeneralConfig("failOnWarning", false);
        int threads = _threadCount(args, config);

        try (CheckerEngine engine = _createEngine(config)) {
            List<Path> filesToCheck = _findFiles(path,
                    config.getGeneralConfig("ignoreFiles", new ArrayList<String>()),
                    includePattern);

            if (!ciMode) {
                _printInfo("Found " + filesToCheck.size() + " files to check");
            }

            Instant start = Instant.now();
            Map<Path, CheckResult> results = new TreeMap<>(engine.checkFiles(filesToCheck, threads));
            Duration duration = Duration.between(start, Instant.now());

            Map<Path, List<CheckerError>> errorsByFile = new LinkedHashMap<>();
            int issueCount = 0;
            int failedFiles = 0;

            for (Map.Entry<Path, CheckResult> entry : results.entrySet()) {
                Path file = entry.getKey();
                CheckResult result = entry.getValue();

                if (result.getErrors().stream().anyMatch(e -> e.getSeverity() == Severity.FATAL)) {
                    failedFiles++;
                }

                if (!result.hasFindings()) {
                    if (verbose) {
                        _printSuccess("  OK: " + file);
                    }
                    continue;
                }

                errorsByFile.put(file, result.getErrors());
                issueCount += result.getErrors().size();

                if (ciMode) {
                    result.getErrors().forEach(e -> System.out.println(formatter.formatCompact(file, e)));
                } else {
                    System.out.println(formatter.colorize(DiagnosticFormatter.ANSI_BOLD, file + ":"));
                    Map<Severity, List<CheckerError>> errorsBySeverity = formatter.groupBySeverity(result.getErrors());
                    for (Severity severity : Severity.values()) {
                        _printErrorsBySeverity(errorsBySeverity, severity);
                    }
                }
            }

            int filesWithErrors = _countFiles(errorsByFile, Severity.ERROR, Severity.FATAL);
            int filesWithWarnings = _countFiles(errorsByFile, Severity.WARNING);

            if (ciMode) {
                System.out.println("RESULT:files=" + results.size() +
                        ";errors=" + filesWithErrors +
                        ";warnings=" + filesWithWarnings +
                        ";issues=" + issueCount +
                        ";failures=" + failedFiles);
            } else {
                System.out.println("\nCheck complete in " + _formatDuration(duration) + ":");
                System.out.println("  Files checked: " + results.size());
                System.out.println("  Total issues found: " + issueCount);
                System.out.println("  Files with errors: " + filesWithErrors);
                System.out.println("  Files with warnings: " + filesWithWarnings);
                System.out.println("  Files with processing failures: " + failedFiles);

                if (!errorsByFile.isEmpty()) {
                    System.out.println("\n" + formatter.formatErrorSummary(errorsByFile));
                }
            }

            boolean failed = filesWithErrors > 0 || (failOnWarning && filesWithWarnings > 0);
            return failed ? EXIT_FINDINGS : EXIT_OK;
        }
    }

    private static int _countFiles(Map<Path, List<CheckerError>> errorsByFile, Severity... severities) {
        Set<Severity> wanted = EnumSet.copyOf(Arrays.asList(severities));
        return (int) errorsByFile.values().stream()
                .filter(errors -> errors.stream().anyMatch(e -> wanted.contains(e.getSeverity())))
                .count();
    }

    private static int _listRules() {
        RuleRegistry registry = RuleRegistry.load();
        for (RuleDescriptor descriptor : registry.getAll()) {
            System.out.println(formatter.formatRule(descriptor));
            System.out.println();
        }
        return EXIT_OK;
    }

    private static int _initializeConfig(String[] args) throws IOException {
        String configFile = _getOptionValue(args, "--config");
        Path configPath = Paths.get(configFile != null ? configFile : CONFIG_FILE_NAME);
        boolean force = _hasOption(args, "--force");

        if (Files.exists(configPath) && !force) {
            _printWarning("Configuration file already exists: " + configPath);
            System.out.println("Use --force to overwrite it or specify a different path with --config");
            return EXIT_OK;
        }

        CheckerConfig config = ConfigurationLoader.loadDefaultConfig();
        ConfigurationLoader.saveConfig(config, configPath);
        _printSuccess("Created configuration file: " + configPath);
        return EXIT_OK;
    }

    private static CheckerConfig _loadConfig(String[] args) {
        String configFile = _getOptionValue(args, "--config");
        if (configFile != null) {
            _printInfo("Using config file: " + configFile);
            return ConfigurationLoader.loadConfig(Paths.get(configFile));
        }
        return ConfigurationLoader.loadConfig(Paths.get(CONFIG_FILE_NAME));
    }

    private static int _threadCount(String[] args, CheckerConfig config) {
        int threads = config.getGeneralConfig("threads", Runtime.getRuntime().availableProcessors());
        String threadsStr = _getOptionValue(args, "--threads");
        if (threadsStr != null) {
            try {
                threads = Integer.parseInt(threadsStr);
            } catch (NumberFormatException e) {
                _printWarning("Invalid thread count: " + threadsStr + ", using " + threads);
            }
        }
        return Math.max(1, threads);
    }

    private static CheckerEngine _createEngine(CheckerConfig config) {
        CheckerEngine engine = new CheckerEngine(config);
        engine.registerPlugin(FileType.JAVA, new BlankLineJavaPlugin());
        return engine;
    }

    static List<Path> _findFiles(Path path, List<String> ignorePatterns, String includePattern) throws IOException {
        if (Files.isRegularFile(path)) {
            return List.of(path);
        }

        try (Stream<Path> walk = Files.walk(path)) {
            return walk
                    .filter(Files::isRegularFile)
                    .filter(p -> FileType.detect(p) == FileType.JAVA)
                    .filter(p -> _matchesIncludePattern(p, includePattern))
                    .filter(p -> !_isIgnored(p, path, ignorePatterns))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException e) {
            _printError("Error scanning directory: " + e.getMessage());
            throw e;
        }
    }

    static boolean _matchesIncludePattern(Path file, String includePattern) {
        if (includePattern == null || includePattern.isEmpty()) {
            return true;
        }

        String fileName = file.getFileName().toString();

        if (includePattern.contains("*") || includePattern.contains("?")) {
            PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + includePattern);
            return matcher.matches(Paths.get(fileName));
        }
        return fileName.contains(includePattern);
    }

    static boolean _isIgnored(Path file, Path basePath, List<String> ignorePatterns) {
        if (ignorePatterns == null || ignorePatterns.isEmpty()) {
            return false;
        }

        String relativePath = basePath.relativize(file).toString().replace("\\", "/");

        for (String pattern : ignorePatterns) {
            if (pattern.endsWith("/**")) {
                String directory = pattern.substring(0, pattern.length() - 3);
                if (directory.startsWith("**/")) {
                    if (("/" + relativePath).contains("/" + directory.substring(3) + "/")) {
                        return true;
                    }
                } else if (relativePath.startsWith(directory + "/")) {
                    return true;
                }
            } else if (pattern.contains("*") || pattern.contains("?")) {
                PathMatcher matcher = FileSystems.getDefault().getPathMatcher("glob:" + pattern);
                if (matcher.matches(Paths.get(relativePath))) {
                    return true;
                }
            } else if (pattern.equals(relativePath)) {
                return true;
            }
        }

        return false;
    }

    private static boolean _hasOption(String[] args, String option) {
        return Arrays.asList(args).contains(option);
    }

    private static String _getOptionValue(String[] args, String option) {
        String prefix = option + "=";
        return Arrays.stream(args)
                .filter(arg -> arg.startsWith(prefix))
                .map(arg -> arg.substring(prefix.length()))
                .findFirst()
                .orElse(null);
    }

    private static void _printErrorsBySeverity(Map<Severity, List<CheckerError>> errorsBySeverity, Severity severity) {
        if (errorsBySeverity.containsKey(severity)) {
            for (CheckerError error : errorsBySeverity.get(severity)) {
                switch (severity) {
                    case FATAL:
                    case ERROR:
                        _printError("  " + formatter.formatError(error));
                        break;
                    case WARNING:
                        _printWarning("  " + formatter.formatError(error));
                        break;
                    case INFO:
                        _printInfo("  " + formatter.formatError(error));
                        break;
                }
            }
        }
    }

    private static String _formatDuration(Duration duration) {
        long seconds = duration.getSeconds();
        long millis = duration.toMillis() % 1000;
        if (seconds < 60) {
            return String.format("%d.%03d seconds", seconds, millis);
        } else {
            long minutes = seconds / 60;
            seconds = seconds % 60;
            return String.format("%d min %d sec", minutes, seconds);
        }
    }

    private static void _printSuccess(String message) {
        System.out.println(formatter.colorize(DiagnosticFormatter.ANSI_GREEN, message));
    }

    private static void _printError(String message) {
        System.out.println(formatter.colorize(DiagnosticFormatter.ANSI_RED, message));
    }

    private static void _printWarning(String message) {
        System.out.println(formatter.colorize(DiagnosticFormatter.ANSI_YELLOW, message));
    }

    private static void _printInfo(String message) {
        System.out.println(formatter.colorize(DiagnosticFormatter.ANSI_BLUE, message));
    }
}
