package com.blanklines.core;

import com.blanklines.api.CheckResult;
import com.blanklines.api.CheckerPlugin;
import com.blanklines.api.error.Severity;
import com.blanklines.config.CheckerConfig;
import com.blanklines.config.ConfigurationLoader;
import com.blanklines.plugins.FileType;
import com.blanklines.plugins.java.BlankLineJavaPlugin;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

class CheckerEngineTest {

    private static final String VIOLATING = String.join("\n",
            "class A {",
            "    void m() {",
            "        foo();",
            "        int a = 1;",
            "    }",
            "}");

    private static final String CLEAN = String.join("\n",
            "class B {",
            "    void m() {",
            "        foo();",
            "",
            "        int a = 1;",
            "    }",
            "}");

    @TempDir
    Path tempDir;

    private CheckerEngine engine;

    @BeforeEach
    void setUp() {
        FileType.clearCache();
        engine = new CheckerEngine(ConfigurationLoader.loadDefaultConfig());
        engine.registerPlugin(FileType.JAVA, new BlankLineJavaPlugin());
    }

    @AfterEach
    void tearDown() throws Exception {
        engine.close();
    }

    @Test
    void testCheckFileDelegatesToJavaPlugin() {
        CheckResult result = engine.checkFile(tempDir.resolve("A.java"), VIOLATING);

        assertTrue(result.isSuccessful());
        assertEquals(1, result.getErrors().size());
        assertEquals("BLAA_1", result.getErrors().get(0).getRuleId());
        assertEquals(1, engine.getProcessedFileCount());
        assertEquals(1, engine.getSuccessCount());
    }

    @Test
    void testUnsupportedFileTypeIsAnError() {
        CheckResult result = engine.checkFile(tempDir.resolve("notes.txt"), "text");

        assertFalse(result.isSuccessful());
        assertEquals(Severity.ERROR, result.getErrors().get(0).getSeverity());
        assertEquals(0, engine.getProcessedFileCount());
    }

    @Test
    void testParseFailureCountsAsError() {
        CheckResult result = engine.checkFile(tempDir.resolve("Broken.java"), "class {");

        assertFalse(result.isSuccessful());
        assertEquals(1, engine.getErrorCount());
    }

    @Test
    void testCheckDirectoryInParallel() throws IOException {
        Path pkg = Files.createDirectories(tempDir.resolve("src/com/example"));
        Files.writeString(pkg.resolve("A.java"), VIOLATING);
        Files.writeString(pkg.resolve("B.java"), CLEAN);
        Files.writeString(pkg.resolve("readme.md"), "# notes");

        Map<Path, CheckResult> results = engine.checkDirectory(tempDir, 2);

        assertEquals(2, results.size());
        assertEquals(1, results.get(pkg.resolve("A.java")).getErrors().size());
        assertTrue(results.get(pkg.resolve("B.java")).getErrors().isEmpty());
        assertEquals(2, engine.getProcessedFileCount());
    }

    @Test
    void testCheckDirectoryOnMissingOrPlainFile() throws IOException {
        Path file = Files.writeString(tempDir.resolve("A.java"), VIOLATING);

        assertTrue(engine.checkDirectory(tempDir.resolve("missing")).isEmpty());
        assertTrue(engine.checkDirectory(file).isEmpty());
    }

    @Test
    void testPluginExceptionBecomesFatalResult() {
        CheckerPlugin failing = mock(CheckerPlugin.class);
        when(failing.check(any(Path.class), anyString())).thenThrow(new IllegalStateException("boom"));
        engine.registerPlugin(FileType.JAVA, failing);

        CheckResult result = engine.checkFile(tempDir.resolve("A.java"), VIOLATING);

        assertFalse(result.isSuccessful());
        assertEquals(Severity.FATAL, result.getErrors().get(0).getSeverity());
        assertTrue(result.getErrors().get(0).getMessage().contains("boom"));
        verify(failing).initialize(any(CheckerConfig.class));
    }

    @Test
    void testCloseClosesPlugins() throws Exception {
        assertTrue(engine.hasPluginFor(FileType.JAVA));

        engine.close();

        assertFalse(engine.hasPluginFor(FileType.JAVA));
    }
}
