package com.testharness.core;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Resolved configuration for a harness run.
 *
 * Values are layered, lowest precedence first:
 *   1. JSON settings file (default harness-settings.json, optional)
 *   2. Environment variables
 *   3. Command-line options (applied by the CLI through the {@link Builder})
 *
 * Settings file shape:
 * <pre>
 *   {
 *     "TestHarness": {
 *       "TestModules":        ["build/libs/Orders.Tests.jar"],   // or "a.jar;b.jar"
 *       "TestModulesPath":    "build/libs;modules",              // or an array
 *       "TestModulePattern":  "*.Tests.jar",
 *       "ReportOutputPath":   "reports/test-results.json",
 *       "Runner":             "REFLECTION",                      // or JUNIT_PLATFORM
 *       "AsyncTimeoutSeconds": 0                                 // 0 = wait forever
 *     }
 *   }
 * </pre>
 *
 * Environment variables:
 *   HARNESS_TEST_MODULES           - ';'-separated explicit module JARs (takes precedence over paths)
 *   HARNESS_TEST_MODULES_PATH      - ';'-separated search paths (directories or JAR files)
 *   HARNESS_TEST_MODULE_PATTERN    - file-name glob used inside search directories (default: *.Tests.jar)
 *   HARNESS_REPORT_OUTPUT_PATH     - report location (default: reports/test-results.json)
 *   HARNESS_RUNNER                 - REFLECTION | JUNIT_PLATFORM (default: REFLECTION)
 *   HARNESS_ASYNC_TIMEOUT_SECONDS  - bound on waiting for an async test body (default: unbounded)
 */
public class HarnessConfig {

    private static final Logger log = LoggerFactory.getLogger(HarnessConfig.class);

    public static final String MODULE_EXTENSION = ".jar";
    public static final String DEFAULT_MODULE_PATTERN = "*.Tests" + MODULE_EXTENSION;
    public static final Path DEFAULT_REPORT_PATH = Paths.get("reports/test-results.json");
    public static final Path DEFAULT_SETTINGS_PATH = Paths.get("harness-settings.json");
    public static final String SETTINGS_SECTION = "TestHarness";

    /** Which backend executes the tests. */
    public enum RunnerKind {
        /** The built-in reflection engine. */
        REFLECTION,
        /** Adapter over the JUnit Platform Launcher. */
        JUNIT_PLATFORM;

        /** Accepts enum names in any case, plus the short aliases "junit" and "junit-platform". */
        public static RunnerKind parse(String value) {
            String v = value.trim().toUpperCase(Locale.ROOT).replace('-', '_');
            if (v.equals("JUNIT")) return JUNIT_PLATFORM;
            return valueOf(v);
        }
    }

    private final List<String> testModules;
    private final List<String> testModulesPaths;
    private final String       testModulePattern;
    private final Path         reportOutputPath;
    private final RunnerKind   runner;
    private final Duration     asyncTimeout;   // null = wait forever

    private HarnessConfig(Builder b) {
        this.testModules       = List.copyOf(b.testModules);
        this.testModulesPaths  = List.copyOf(b.testModulesPaths);
        this.testModulePattern = b.testModulePattern;
        this.reportOutputPath  = b.reportOutputPath;
        this.runner            = b.runner;
        this.asyncTimeout      = b.asyncTimeout;
    }

    // ── Static factory: settings file + environment ───────────────────────────

    public static HarnessConfig fromEnvironment() {
        return builder()
            .applySettingsFile(DEFAULT_SETTINGS_PATH)
            .applyEnvironment(System.getenv())
            .build();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public List<String> getTestModules()       { return testModules; }
    public List<String> getTestModulesPaths()  { return testModulesPaths; }
    public String       getTestModulePattern() { return testModulePattern; }
    public Path         getReportOutputPath()  { return reportOutputPath; }
    public RunnerKind   getRunner()            { return runner; }
    public Duration     getAsyncTimeout()      { return asyncTimeout; }
    public boolean      hasAsyncTimeout()      { return asyncTimeout != null; }

    @Override
    public String toString() {
        return String.format(
            "HarnessConfig{runner=%s, modules=%s, paths=%s, pattern='%s', report=%s, asyncTimeout=%s}",
            runner, testModules, testModulesPaths, testModulePattern, reportOutputPath,
            asyncTimeout != null ? asyncTimeout : "none");
    }

    // ── Builder ───────────────────────────────────────────────────────────────

    public static Builder builder() { return new Builder(); }

    public static class Builder {
        private List<String> testModules       = new ArrayList<>();
        private List<String> testModulesPaths  = new ArrayList<>();
        private String       testModulePattern = DEFAULT_MODULE_PATTERN;
        private Path         reportOutputPath  = DEFAULT_REPORT_PATH;
        private RunnerKind   runner            = RunnerKind.REFLECTION;
        private Duration     asyncTimeout      = null;

        public Builder testModules(List<String> modules)      { this.testModules = cleaned(modules); return this; }
        public Builder testModulesPaths(List<String> paths)   { this.testModulesPaths = cleaned(paths); return this; }
        public Builder runner(RunnerKind kind)                { this.runner = kind; return this; }
        public Builder reportOutputPath(Path path)            { this.reportOutputPath = path; return this; }

        public Builder testModulePattern(String pattern) {
            this.testModulePattern = (pattern != null && !pattern.isBlank()) ? pattern.trim() : DEFAULT_MODULE_PATTERN;
            return this;
        }

        /** Zero or negative means "wait forever". */
        public Builder asyncTimeout(Duration timeout) {
            this.asyncTimeout = (timeout != null && !timeout.isZero() && !timeout.isNegative()) ? timeout : null;
            return this;
        }

        /**
         * Applies the {@code TestHarness} section of a JSON settings file. A missing
         * file is not an error; an unreadable one is logged and ignored.
         */
        public Builder applySettingsFile(Path settingsFile) {
            if (settingsFile == null || !Files.isRegularFile(settingsFile)) {
                log.debug("HarnessConfig: no settings file at {}", settingsFile);
                return this;
            }
            JsonNode section;
            try {
                section = new ObjectMapper().readTree(settingsFile.toFile()).path(SETTINGS_SECTION);
            } catch (IOException e) {
                log.warn("HarnessConfig: Could not read settings file {}: {}", settingsFile, e.getMessage());
                return this;
            }
            if (section.isMissingNode()) {
                log.warn("HarnessConfig: Settings file {} has no '{}' section", settingsFile, SETTINGS_SECTION);
                return this;
            }

            List<String> modules = listNode(section.get("TestModules"));
            if (!modules.isEmpty()) testModules(modules);
            List<String> paths = listNode(section.get("TestModulesPath"));
            if (!paths.isEmpty()) testModulesPaths(paths);
            if (section.hasNonNull("TestModulePattern")) testModulePattern(section.get("TestModulePattern").asText());
            if (section.hasNonNull("ReportOutputPath")) reportOutputPath(Paths.get(section.get("ReportOutputPath").asText()));
            if (section.hasNonNull("Runner")) runnerOrWarn(section.get("Runner").asText(), "settings file");
            if (section.hasNonNull("AsyncTimeoutSeconds")) timeoutOrWarn(section.get("AsyncTimeoutSeconds").asText(), "settings file");

            log.info("HarnessConfig: Applied settings from {}", settingsFile.toAbsolutePath());
            return this;
        }

        /** Applies the HARNESS_* variables found in {@code env}; blank values are ignored. */
        public Builder applyEnvironment(Map<String, String> env) {
            String modules = nonBlank(env.get("HARNESS_TEST_MODULES"));
            if (modules != null) testModules(splitList(modules));
            String paths = nonBlank(env.get("HARNESS_TEST_MODULES_PATH"));
            if (paths != null) testModulesPaths(splitList(paths));
            String pattern = nonBlank(env.get("HARNESS_TEST_MODULE_PATTERN"));
            if (pattern != null) testModulePattern(pattern);
            String report = nonBlank(env.get("HARNESS_REPORT_OUTPUT_PATH"));
            if (report != null) reportOutputPath(Paths.get(report.trim()));
            String runnerName = nonBlank(env.get("HARNESS_RUNNER"));
            if (runnerName != null) runnerOrWarn(runnerName, "HARNESS_RUNNER");
            String timeout = nonBlank(env.get("HARNESS_ASYNC_TIMEOUT_SECONDS"));
            if (timeout != null) timeoutOrWarn(timeout, "HARNESS_ASYNC_TIMEOUT_SECONDS");
            return this;
        }

        public HarnessConfig build() {
            if (reportOutputPath == null) {
                reportOutputPath = DEFAULT_REPORT_PATH;
            }
            if (runner == null) {
                runner = RunnerKind.REFLECTION;
            }
            return new HarnessConfig(this);
        }

        private void runnerOrWarn(String value, String source) {
            try {
                runner(RunnerKind.parse(value));
            } catch (IllegalArgumentException e) {
                log.warn("HarnessConfig: Unknown runner '{}' from {}; keeping {}", value, source, runner);
            }
        }

        private void timeoutOrWarn(String value, String source) {
            try {
                asyncTimeout(Duration.ofSeconds(Long.parseLong(value.trim())));
            } catch (NumberFormatException e) {
                log.warn("HarnessConfig: Invalid async timeout '{}' from {}; keeping {}", value, source,
                    asyncTimeout != null ? asyncTimeout : "none");
            }
        }
    }

    // ── Parsing helpers ───────────────────────────────────────────────────────

    /** Splits a ';'-separated list, trimming entries and dropping empty ones. */
    public static List<String> splitList(String value) {
        if (value == null || value.isBlank()) return Collections.emptyList();
        return cleaned(Arrays.asList(value.split(";")));
    }

    private static List<String> listNode(JsonNode node) {
        if (node == null || node.isNull()) return Collections.emptyList();
        if (node.isArray()) {
            List<String> values = new ArrayList<>();
            node.forEach(n -> values.add(n.asText()));
            return cleaned(values);
        }
        return splitList(node.asText());
    }

    private static List<String> cleaned(List<String> values) {
        List<String> out = new ArrayList<>();
        if (values == null) return out;
        for (String v : values) {
            if (v != null && !v.isBlank()) out.add(v.trim());
        }
        return out;
    }

    private static String nonBlank(String value) {
        return (value != null && !value.isBlank()) ? value : null;
    }
}
