package com.testharness.cli;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.ParameterException;
import com.testharness.core.HarnessConfig;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Command-line options. Anything given here overrides the settings file and the
 * HARNESS_* environment variables.
 */
class HarnessArgs {

    @Parameter(names = { "-h", "--help" }, help = true, description = "Print usage and exit")
    public boolean help = false;

    @Parameter(names = { "--settings" }, description = "JSON settings file")
    public Path settingsFile = HarnessConfig.DEFAULT_SETTINGS_PATH;

    @Parameter(names = { "--modules" }, description = "Explicit test module JARs (',' or ';' separated); overrides --paths")
    public List<String> modules = new ArrayList<>();

    @Parameter(names = { "--paths" }, description = "Directories or JAR files to search for test modules")
    public List<String> paths = new ArrayList<>();

    @Parameter(names = { "--pattern" }, description = "File-name glob used inside search directories")
    public String pattern;

    @Parameter(names = { "--report" }, description = "Report output path")
    public Path reportPath;

    @Parameter(names = { "--runner" }, description = "REFLECTION or JUNIT_PLATFORM", validateWith = RunnerValidator.class)
    public String runner;

    @Parameter(names = { "--async-timeout" }, description = "Seconds to wait for an asynchronous test body (0 = no limit)")
    public Long asyncTimeoutSeconds;

    /** Both ',' (JCommander's splitter) and ';' separate list entries. */
    static List<String> flatten(List<String> values) {
        List<String> out = new ArrayList<>();
        for (String value : values) {
            out.addAll(HarnessConfig.splitList(value));
        }
        return out;
    }

    public static final class RunnerValidator implements IParameterValidator {
        @Override
        public void validate(String name, String value) throws ParameterException {
            try {
                HarnessConfig.RunnerKind.parse(value);
            } catch (IllegalArgumentException e) {
                throw new ParameterException("Unsupported runner for " + name + ": " + value);
            }
        }
    }
}
