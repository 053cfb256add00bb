package com.testharness.cli;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.ParameterException;
import com.testharness.core.HarnessConfig;
import com.testharness.core.RunnerFactory;
import com.testharness.core.TestRunner;
import com.testharness.model.TestOutcome;
import com.testharness.model.TestSuiteResult;
import com.testharness.report.JsonReportGenerator;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.Map;

/**
 * Process entry point: resolve configuration, run the selected backend, write the
 * JSON report and exit with the code from {@link ExitCodes}.
 *
 * <pre>
 *   java -jar test-harness.jar --paths build/libs --report out/results.json
 *   java -jar test-harness.jar --modules Orders.Tests.jar --runner junit-platform
 * </pre>
 */
public class HarnessMain {

    private static final Logger log = LoggerFactory.getLogger(HarnessMain.class);

    public static void main(String[] args) {
        System.exit(new HarnessMain().run(args, System.getenv()));
    }

    /**
     * Runs the harness and returns the exit code instead of exiting.
     *
     * @param env environment variables consulted between the settings file and {@code args}
     */
    public int run(String[] args, Map<String, String> env) {
        HarnessArgs harnessArgs = new HarnessArgs();
        JCommander commander = JCommander.newBuilder()
            .programName("test-harness")
            .addObject(harnessArgs)
            .build();
        try {
            commander.parse(args);
        } catch (ParameterException e) {
            log.error("HarnessMain: {}", e.getMessage());
            commander.usage();
            return ExitCodes.USAGE;
        }
        if (harnessArgs.help) {
            commander.usage();
            return ExitCodes.SUCCESS;
        }

        HarnessConfig config = resolveConfig(harnessArgs, env);
        log.info("HarnessMain: {}", config);

        TestRunner runner = RunnerFactory.create(config);
        log.info("HarnessMain: Running tests with the {} runner", runner.name());
        TestSuiteResult suite = runner.run();

        try {
            new JsonReportGenerator(config.getReportOutputPath()).write(suite);
        } catch (IOException | RuntimeException e) {
            log.error("HarnessMain: Failed to write report to {}", config.getReportOutputPath(), e);
            return ExitCodes.CRITICAL_ERROR;
        }

        int exitCode = ExitCodes.forSuite(suite);
        log.info("HarnessMain: {} passed, {} failed, {} critical -- exit code {}",
            suite.count(TestOutcome.PASS), suite.count(TestOutcome.FAIL),
            suite.count(TestOutcome.CRITICAL_ERROR), exitCode);
        return exitCode;
    }

    static HarnessConfig resolveConfig(HarnessArgs args, Map<String, String> env) {
        HarnessConfig.Builder builder = HarnessConfig.builder()
            .applySettingsFile(args.settingsFile)
            .applyEnvironment(env);

        if (!args.modules.isEmpty())        builder.testModules(HarnessArgs.flatten(args.modules));
        if (!args.paths.isEmpty()) {
            builder.testModulesPaths(HarnessArgs.flatten(args.paths));
            // search paths on the command line beat a module list from a lower layer
            if (args.modules.isEmpty()) builder.testModules(List.of());
        }
        if (args.pattern != null)           builder.testModulePattern(args.pattern);
        if (args.reportPath != null)        builder.reportOutputPath(args.reportPath);
        if (args.runner != null)            builder.runner(HarnessConfig.RunnerKind.parse(args.runner));
        if (args.asyncTimeoutSeconds != null) builder.asyncTimeout(Duration.ofSeconds(args.asyncTimeoutSeconds));

        return builder.build();
    }
}
