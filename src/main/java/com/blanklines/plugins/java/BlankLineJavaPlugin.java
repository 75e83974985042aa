package com.blanklines.plugins.java;

import com.blanklines.api.CheckResult;
import com.blanklines.api.CheckerPlugin;
import com.blanklines.api.error.CheckerError;
import com.blanklines.api.error.Severity;
import com.blanklines.api.tree.SourceParseException;
import com.blanklines.api.tree.SourceSpan;
import com.blanklines.api.tree.SyntaxNode;
import com.blanklines.api.tree.SyntaxTree;
import com.blanklines.config.CheckerConfig;
import com.blanklines.config.ConfigurationLoader;
import com.blanklines.core.BlockSeparationChecker;
import com.blanklines.core.CollectingDiagnosticSink;
import com.blanklines.core.Diagnostic;
import com.blanklines.rules.RuleDescriptor;
import com.blanklines.rules.RuleId;
import com.blanklines.rules.RuleRegistry;
import com.blanklines.util.LoggerUtil;
import com.github.javaparser.ParserConfiguration;

import java.nio.file.Path;
import java.util.AbstractMap;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.logging.Logger;

/**
 * Java plugin: parses sources with JavaParser and runs the blank line rules
 * over every method, constructor, initializer and block lambda.
 */
public class BlankLineJavaPlugin implements CheckerPlugin, AutoCloseable {
    private static final Logger logger = LoggerUtil.getLogger(BlankLineJavaPlugin.class);

    private static final String SUGGESTION_BEFORE = "Insert an empty line before the first assignment";
    private static final String SUGGESTION_AFTER = "Insert an empty line after the last assignment";

    private JavaParserTreeProvider treeProvider;
    private RuleRegistry ruleRegistry;
    private final Map<RuleId, Severity> activeRules = new EnumMap<>(RuleId.class);
    private int cacheSize;

    // Keyed by path; each entry keeps the source it was parsed from
    private Map<String, Map.Entry<String, SyntaxTree>> treeCache;

    private final ReentrantReadWriteLock cacheLock = new ReentrantReadWriteLock();
    private final ReentrantReadWriteLock.ReadLock readLock = cacheLock.readLock();
    private final ReentrantReadWriteLock.WriteLock writeLock = cacheLock.writeLock();

    @Override
    public void initialize(CheckerConfig config) {
        String level = config.getPluginConfig(ConfigurationLoader.JAVA_PLUGIN, "languageLevel", "JAVA_17");
        this.treeProvider = new JavaParserTreeProvider(_parseLanguageLevel(level));
        this.ruleRegistry = RuleRegistry.load();
        this.cacheSize = config.getPluginConfig(ConfigurationLoader.JAVA_PLUGIN, "cacheSize", 100);
        this.treeCache = _createCache(cacheSize);

        activeRules.clear();
        for (RuleDescriptor descriptor : ruleRegistry.getAll()) {
            RuleId ruleId = descriptor.getRuleId();
            if (config.isRuleEnabled(ruleId, descriptor.isEnabledByDefault())) {
                activeRules.put(ruleId, config.getRuleSeverity(ruleId, descriptor.getDefaultSeverity()));
            } else {
                logger.info("Rule " + descriptor.getId() + " is disabled by configuration");
            }
        }

        logger.fine("Java plugin initialized: languageLevel=" + treeProvider.getLanguageLevel()
                + ", activeRules=" + activeRules.keySet());
    }

    private static ParserConfiguration.LanguageLevel _parseLanguageLevel(String level) {
        try {
            return ParserConfiguration.LanguageLevel.valueOf(level.trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            logger.warning("Unknown Java language level '" + level + "', using JAVA_17");
            return ParserConfiguration.LanguageLevel.JAVA_17;
        }
    }

    private static Map<String, Map.Entry<String, SyntaxTree>> _createCache(int maxEntries) {
        return new LinkedHashMap<String, Map.Entry<String, SyntaxTree>>(16, 0.75f, true) {
            @Override
            protected boolean removeEldestEntry(Map.Entry<String, Map.Entry<String, SyntaxTree>> eldest) {
                return size() > maxEntries;
            }
        };
    }

    @Override
    public CheckResult check(Path filePath, String sourceCode) {
        if (treeProvider == null) {
            throw new IllegalStateException("Plugin has not been initialized");
        }

        SyntaxTree tree;
        try {
            tree = _getTree(filePath, sourceCode);
        } catch (SourceParseException e) {
            return _handleParseError(filePath, e);
        }

        CollectingDiagnosticSink sink = new CollectingDiagnosticSink();
        BlockSeparationChecker checker = new BlockSeparationChecker(sink);

        for (SyntaxNode unit : tree.getCodeUnits()) {
            checker.checkTopLevel(unit);
        }

        List<CheckerError> errors = new ArrayList<>();
        for (Diagnostic diagnostic : sink.getDiagnostics()) {
            Severity severity = activeRules.get(diagnostic.getRuleId());
            if (severity != null) {
                errors.add(_toError(diagnostic, severity));
            }
        }

        logger.fine("Checked " + filePath + ": " + tree.getCodeUnits().size() + " code units, "
                + errors.size() + " findings");

        boolean successful = errors.stream()
                .noneMatch(e -> e.getSeverity() == Severity.FATAL || e.getSeverity() == Severity.ERROR);

        return CheckResult.builder()
                .successful(successful)
                .errors(errors)
                .build();
    }

    private SyntaxTree _getTree(Path filePath, String sourceCode) throws SourceParseException {
        if (cacheSize == 0) {
            return treeProvider.parse(sourceCode);
        }

        String cacheKey = filePath.toString();
        Map.Entry<String, SyntaxTree> cached;

        // LinkedHashMap in access order mutates on get, so reads also take the write lock
        writeLock.lock();
        try {
            cached = treeCache.get(cacheKey);
        } finally {
            writeLock.unlock();
        }

        if (cached != null && cached.getKey().equals(sourceCode)) {
            return cached.getValue();
        }

        SyntaxTree tree = treeProvider.parse(sourceCode);

        writeLock.lock();
        try {
            treeCache.put(cacheKey, new AbstractMap.SimpleImmutableEntry<>(sourceCode, tree));
        } finally {
            writeLock.unlock();
        }
        return tree;
    }

    private CheckerError _toError(Diagnostic diagnostic, Severity severity) {
        RuleDescriptor descriptor = ruleRegistry.get(diagnostic.getRuleId());
        SourceSpan location = diagnostic.getLocation();

        return new CheckerError(
                severity,
                descriptor.formatMessage(String.valueOf(location.getEndLine())),
                location.getBeginLine(),
                location.getBeginColumn(),
                descriptor.getId(),
                diagnostic.getRuleId() == RuleId.BEFORE ? SUGGESTION_BEFORE : SUGGESTION_AFTER);
    }

    private CheckResult _handleParseError(Path filePath, SourceParseException e) {
        logger.warning("Failed to parse " + filePath + ": " + e.getMessage());

        CheckerError error = new CheckerError(
                Severity.FATAL,
                "Failed to parse Java source code: " + e.getMessage(),
                e.getLine(), e.getColumn());

        return CheckResult.builder()
                .successful(false)
                .addError(error)
                .build();
    }

    /**
     * Number of parsed trees currently cached.
     */
    public int getCachedTreeCount() {
        readLock.lock();
        try {
            return treeCache == null ? 0 : treeCache.size();
        } finally {
            readLock.unlock();
        }
    }

    /**
     * Cleans up resources when the plugin is no longer needed.
     */
    @Override
    public void close() {
        writeLock.lock();
        try {
            if (treeCache != null) {
                treeCache.clear();
            }
        } finally {
            writeLock.unlock();
        }
    }
}
