package com.blanklines.cli;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

import static org.junit.jupiter.api.Assertions.*;

class CheckerCliTest {

    private static final String VIOLATING = String.join("\n",
            "class A {",
            "    void m() {",
            "        int a = 1;",
            "        foo();",
            "    }",
            "}");

    @TempDir
    Path tempDir;

    private final ByteArrayOutputStream out = new ByteArrayOutputStream();
    private PrintStream originalOut;

    @BeforeEach
    void captureOutput() {
        originalOut = System.out;
        System.setOut(new PrintStream(out, true, StandardCharsets.UTF_8));
    }

    @AfterEach
    void restoreOutput() {
        System.setOut(originalOut);
    }

    private String output() {
        return out.toString(StandardCharsets.UTF_8);
    }

    @Test
    void testCiModeListsFindingsAndSummary() throws IOException {
        Path file = Files.writeString(tempDir.resolve("A.java"), VIOLATING);

        int exitCode = CheckerCli.run(new String[]{"check", tempDir.toString(), "--ci"});

        assertEquals(CheckerCli.EXIT_OK, exitCode);
        assertTrue(output().contains(file + ":3:9: WARNING BLAA_2"), output());
        assertTrue(output().contains("RESULT:files=1;errors=0;warnings=1;issues=1;failures=0"), output());
    }

    @Test
    void testVerboseEnablesDetailedLogging() throws IOException {
        Files.writeString(tempDir.resolve("A.java"), VIOLATING);
        Logger pluginLogger = Logger.getLogger("com.blanklines.plugins.java.BlankLineJavaPlugin");

        CheckerCli.run(new String[]{"check", tempDir.toString(), "--ci", "--verbose"});
        assertTrue(pluginLogger.isLoggable(Level.FINE));

        CheckerCli.run(new String[]{"check", tempDir.toString(), "--ci"});
        assertFalse(pluginLogger.isLoggable(Level.FINE));
    }

    @Test
    void testLogFileReceivesDetailedRecords() throws IOException {
        Path file = Files.writeString(tempDir.resolve("A.java"), VIOLATING);
        Path logFile = tempDir.resolve("check.log");

        int exitCode = CheckerCli.run(new String[]{"check", file.toString(), "--ci", "--log-file=" + logFile});

        assertEquals(CheckerCli.EXIT_OK, exitCode);
        String log = Files.readString(logFile, StandardCharsets.UTF_8);
        assertTrue(log.contains("Checked " + file + ": 1 code units, 1 findings"), log);
    }

    @Test
    void testFailOnWarning() throws IOException {
        Files.writeString(tempDir.resolve("A.java"), VIOLATING);

        int exitCode = CheckerCli.run(new String[]{"check", tempDir.toString(), "--ci", "--fail-on-warning"});

        assertEquals(CheckerCli.EXIT_FINDINGS, exitCode);
    }

    @Test
    void testMissingPathIsUsageError() {
        assertEquals(CheckerCli.EXIT_USAGE, CheckerCli.run(new String[]{"check"}));
        assertEquals(CheckerCli.EXIT_USAGE,
                CheckerCli.run(new String[]{"check", tempDir.resolve("nope").toString(), "--no-color"}));
    }

    @Test
    void testUnknownCommand() {
        assertEquals(CheckerCli.EXIT_USAGE, CheckerCli.run(new String[]{"format", "--no-color"}));
        assertTrue(output().contains("Unknown command: format"));
    }

    @Test
    void testRulesCommandListsBothRules() {
        assertEquals(CheckerCli.EXIT_OK, CheckerCli.run(new String[]{"rules", "--no-color"}));
        assertTrue(output().contains("BLAA_1"));
        assertTrue(output().contains("BLAA_2"));
        assertTrue(output().contains("Formatting Style"));
    }

    @Test
    void testInitWritesConfigOnce() {
        Path config = tempDir.resolve("custom.yml");

        assertEquals(CheckerCli.EXIT_OK, CheckerCli.run(new String[]{"init", "--config=" + config, "--no-color"}));
        assertTrue(Files.exists(config));

        assertEquals(CheckerCli.EXIT_OK, CheckerCli.run(new String[]{"init", "--config=" + config, "--no-color"}));
        assertTrue(output().contains("Configuration file already exists"));
    }

    @Test
    void testFindFilesHonoursIgnoreAndInclude() throws IOException {
        Path generated = Files.createDirectories(tempDir.resolve("src/generated"));
        Path main = Files.createDirectories(tempDir.resolve("src/main"));
        Files.writeString(generated.resolve("Gen.java"), "class Gen { }");
        Files.writeString(main.resolve("Main.java"), "class Main { }");
        Files.writeString(main.resolve("MainTest.java"), "class MainTest { }");

        List<Path> all = CheckerCli._findFiles(tempDir, List.of("**/generated/**"), null);
        List<Path> tests = CheckerCli._findFiles(tempDir, List.of(), "*Test.java");

        assertEquals(List.of(main.resolve("Main.java"), main.resolve("MainTest.java")), all);
        assertEquals(List.of(main.resolve("MainTest.java")), tests);
    }

    @Test
    void testIgnorePatterns() {
        Path base = Paths.get("project");

        assertTrue(CheckerCli._isIgnored(base.resolve("target/A.java"), base, List.of("target/**")));
        assertTrue(CheckerCli._isIgnored(base.resolve("a/generated/B.java"), base, List.of("**/generated/**")));
        assertTrue(CheckerCli._isIgnored(base.resolve("src/C.java"), base, List.of("src/C.java")));
        assertTrue(CheckerCli._isIgnored(base.resolve("src/Old.java"), base, List.of("src/Old*.java")));
        assertFalse(CheckerCli._isIgnored(base.resolve("src/D.java"), base, List.of("target/**", "src/C.java")));
    }

    @Test
    void testIncludePattern() {
        assertTrue(CheckerCli._matchesIncludePattern(Paths.get("src/FooTest.java"), "*Test.java"));
        assertFalse(CheckerCli._matchesIncludePattern(Paths.get("src/Foo.java"), "*Test.java"));
        assertTrue(CheckerCli._matchesIncludePattern(Paths.get("src/Foo.java"), "Foo"));
        assertTrue(CheckerCli._matchesIncludePattern(Paths.get("src/Foo.java"), null));
    }
}
