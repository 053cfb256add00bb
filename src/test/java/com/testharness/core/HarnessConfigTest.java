package com.testharness.core;

import com.testharness.core.HarnessConfig.RunnerKind;
import com.testharness.support.TempDirs;
import org.testng.annotations.AfterMethod;
import org.testng.annotations.BeforeMethod;
import org.testng.annotations.Test;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

/**
 * Unit tests for configuration layering: defaults, settings file, environment.
 */
public class HarnessConfigTest {

    private Path dir;

    @BeforeMethod
    public void setUp() {
        dir = TempDirs.create("harness-config");
    }

    @AfterMethod(alwaysRun = true)
    public void tearDown() throws IOException {
        TempDirs.delete(dir);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Defaults
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void defaults_whenNothingConfigured() {
        HarnessConfig config = HarnessConfig.builder().build();

        assertThat(config.getTestModules()).isEmpty();
        assertThat(config.getTestModulesPaths()).isEmpty();
        assertThat(config.getTestModulePattern()).isEqualTo("*.Tests.jar");
        assertThat(config.getReportOutputPath()).isEqualTo(Paths.get("reports/test-results.json"));
        assertThat(config.getRunner()).isEqualTo(RunnerKind.REFLECTION);
        assertThat(config.hasAsyncTimeout()).isFalse();
    }

    @Test
    public void blankPattern_fallsBackToDefault() {
        HarnessConfig config = HarnessConfig.builder().testModulePattern("  ").build();

        assertThat(config.getTestModulePattern()).isEqualTo(HarnessConfig.DEFAULT_MODULE_PATTERN);
    }

    @Test
    public void nonPositiveTimeout_meansUnbounded() {
        assertThat(HarnessConfig.builder().asyncTimeout(Duration.ZERO).build().getAsyncTimeout()).isNull();
        assertThat(HarnessConfig.builder().asyncTimeout(Duration.ofSeconds(-5)).build().getAsyncTimeout()).isNull();
        assertThat(HarnessConfig.builder().asyncTimeout(Duration.ofSeconds(5)).build().getAsyncTimeout())
            .isEqualTo(Duration.ofSeconds(5));
    }

    // ════════════════════════════════════════════════════════════════════════
    // Environment
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void environment_populatesEveryValue() {
        HarnessConfig config = HarnessConfig.builder()
            .applyEnvironment(Map.of(
                "HARNESS_TEST_MODULES", "a.Tests.jar; b.Tests.jar;;",
                "HARNESS_TEST_MODULES_PATH", "build/libs;modules",
                "HARNESS_TEST_MODULE_PATTERN", "*.Specs.jar",
                "HARNESS_REPORT_OUTPUT_PATH", "out/report.json",
                "HARNESS_RUNNER", "junit-platform",
                "HARNESS_ASYNC_TIMEOUT_SECONDS", "30"))
            .build();

        assertThat(config.getTestModules()).containsExactly("a.Tests.jar", "b.Tests.jar");
        assertThat(config.getTestModulesPaths()).containsExactly("build/libs", "modules");
        assertThat(config.getTestModulePattern()).isEqualTo("*.Specs.jar");
        assertThat(config.getReportOutputPath()).isEqualTo(Paths.get("out/report.json"));
        assertThat(config.getRunner()).isEqualTo(RunnerKind.JUNIT_PLATFORM);
        assertThat(config.getAsyncTimeout()).isEqualTo(Duration.ofSeconds(30));
    }

    @Test
    public void environment_invalidValuesAreIgnored() {
        HarnessConfig config = HarnessConfig.builder()
            .applyEnvironment(Map.of(
                "HARNESS_RUNNER", "nunit",
                "HARNESS_ASYNC_TIMEOUT_SECONDS", "soon",
                "HARNESS_TEST_MODULE_PATTERN", "   "))
            .build();

        assertThat(config.getRunner()).isEqualTo(RunnerKind.REFLECTION);
        assertThat(config.hasAsyncTimeout()).isFalse();
        assertThat(config.getTestModulePattern()).isEqualTo(HarnessConfig.DEFAULT_MODULE_PATTERN);
    }

    // ════════════════════════════════════════════════════════════════════════
    // Settings file
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void settingsFile_acceptsArraysAndSeparatedStrings() throws IOException {
        Path settings = writeSettings("""
            {
              "TestHarness": {
                "TestModules": ["one.Tests.jar", "two.Tests.jar"],
                "TestModulesPath": "libs;more-libs",
                "TestModulePattern": "*.IT.jar",
                "ReportOutputPath": "target/results.json",
                "Runner": "JUNIT_PLATFORM",
                "AsyncTimeoutSeconds": 12
              }
            }
            """);

        HarnessConfig config = HarnessConfig.builder().applySettingsFile(settings).build();

        assertThat(config.getTestModules()).containsExactly("one.Tests.jar", "two.Tests.jar");
        assertThat(config.getTestModulesPaths()).containsExactly("libs", "more-libs");
        assertThat(config.getTestModulePattern()).isEqualTo("*.IT.jar");
        assertThat(config.getReportOutputPath()).isEqualTo(Paths.get("target/results.json"));
        assertThat(config.getRunner()).isEqualTo(RunnerKind.JUNIT_PLATFORM);
        assertThat(config.getAsyncTimeout()).isEqualTo(Duration.ofSeconds(12));
    }

    @Test
    public void environment_overridesSettingsFile() throws IOException {
        Path settings = writeSettings("""
            { "TestHarness": { "TestModulesPath": "from-file", "Runner": "JUNIT_PLATFORM" } }
            """);

        HarnessConfig config = HarnessConfig.builder()
            .applySettingsFile(settings)
            .applyEnvironment(Map.of("HARNESS_TEST_MODULES_PATH", "from-env"))
            .build();

        assertThat(config.getTestModulesPaths()).containsExactly("from-env");
        assertThat(config.getRunner()).isEqualTo(RunnerKind.JUNIT_PLATFORM);
    }

    @Test
    public void settingsFile_missingOrMalformed_isIgnored() throws IOException {
        Path malformed = writeSettings("{ not json");

        HarnessConfig fromMissing = HarnessConfig.builder().applySettingsFile(dir.resolve("absent.json")).build();
        HarnessConfig fromMalformed = HarnessConfig.builder().applySettingsFile(malformed).build();

        assertThat(fromMissing.getTestModulesPaths()).isEmpty();
        assertThat(fromMalformed.getTestModulesPaths()).isEmpty();
        assertThat(fromMalformed.getRunner()).isEqualTo(RunnerKind.REFLECTION);
    }

    @Test
    public void settingsFile_withoutHarnessSection_isIgnored() throws IOException {
        Path settings = writeSettings("{ \"Logging\": { \"Level\": \"DEBUG\" } }");

        HarnessConfig config = HarnessConfig.builder().applySettingsFile(settings).build();

        assertThat(config.getTestModulesPaths()).isEmpty();
    }

    // ════════════════════════════════════════════════════════════════════════
    // Parsing helpers
    // ════════════════════════════════════════════════════════════════════════

    @Test
    public void runnerKind_parsesNamesAndAliases() {
        assertThat(RunnerKind.parse("reflection")).isEqualTo(RunnerKind.REFLECTION);
        assertThat(RunnerKind.parse(" junit ")).isEqualTo(RunnerKind.JUNIT_PLATFORM);
        assertThat(RunnerKind.parse("Junit-Platform")).isEqualTo(RunnerKind.JUNIT_PLATFORM);
        assertThatThrownBy(() -> RunnerKind.parse("nunit")).isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    public void splitList_trimsAndDropsEmptyEntries() {
        assertThat(HarnessConfig.splitList(" a ; ;b;")).isEqualTo(List.of("a", "b"));
        assertThat(HarnessConfig.splitList("")).isEmpty();
        assertThat(HarnessConfig.splitList(null)).isEmpty();
    }

    private Path writeSettings(String json) throws IOException {
        return Files.writeString(dir.resolve("harness-settings.json"), json);
    }
}
