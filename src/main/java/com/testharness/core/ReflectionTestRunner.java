package com.testharness.core;

import com.testharness.discovery.DiscoveredTest;
import com.testharness.discovery.TestDiscoverer;
import com.testharness.executor.TestExecutor;
import com.testharness.loader.IsolatedModuleLoader;
import com.testharness.loader.ModuleContext;
import com.testharness.loader.ModuleLoadException;
import com.testharness.locator.ModuleLocator;
import com.testharness.model.TestCaseResult;
import com.testharness.model.TestOutcome;
import com.testharness.model.TestSuiteResult;
import com.testharness.util.Failures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * The built-in engine: locates test JARs, loads each into its own
 * {@link ModuleContext}, discovers marked methods by annotation name and runs them
 * through the {@link TestExecutor}.
 *
 * ## Run sequence
 *
 *   1. Stamp {@code StartedAt}.
 *   2. Locate modules. None found: finish immediately with an empty suite.
 *   3. For each module in order: load (failure: log, skip), discover, execute.
 *   4. Close every context, stamp {@code FinishedAt}, log the summary.
 *
 * Contexts stay open until the whole run is over; classes and methods held by
 * discovered tests are only valid while their context is open.
 *
 * Nothing escapes {@link #run()}: an unexpected engine failure is recorded as a
 * single CRITICAL_ERROR row.
 */
public class ReflectionTestRunner implements TestRunner {

    private static final Logger log = LoggerFactory.getLogger(ReflectionTestRunner.class);

    static final String ENGINE_FAILURE_TEST_NAME  = "TestHarness.Run";
    static final String ENGINE_FAILURE_CLASS_NAME = "ReflectionTestRunner";

    private final ModuleLocator        locator;
    private final IsolatedModuleLoader loader;
    private final TestDiscoverer       discoverer;
    private final TestExecutor         executor;
    private final Clock                clock;

    public ReflectionTestRunner(HarnessConfig config) {
        this(new ModuleLocator(config),
             new IsolatedModuleLoader(),
             new TestDiscoverer(),
             new TestExecutor(config.getAsyncTimeout()),
             Clock.systemUTC());
    }

    public ReflectionTestRunner(ModuleLocator locator, IsolatedModuleLoader loader,
                                TestDiscoverer discoverer, TestExecutor executor, Clock clock) {
        this.locator    = locator;
        this.loader     = loader;
        this.discoverer = discoverer;
        this.executor   = executor;
        this.clock      = clock;
    }

    @Override
    public String name() {
        return "reflection";
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    @Override
    public TestSuiteResult run() {
        TestSuiteResult suite = TestSuiteResult.start(clock);
        log.info("ReflectionTestRunner: Starting test run");

        List<ModuleContext> contexts = new ArrayList<>();
        try {
            List<Path> modules = locator.locate();
            if (modules.isEmpty()) {
                log.info("ReflectionTestRunner: No test modules to run");
            }

            int discoveredTotal = 0;
            for (Path module : modules) {
                ModuleContext context = loadOrSkip(module);
                if (context == null) continue;
                contexts.add(context);

                List<DiscoveredTest> tests = discoverer.discover(context);
                discoveredTotal += tests.size();
                suite.addAll(executor.executeAll(tests));
            }

            if (!modules.isEmpty() && discoveredTotal == 0) {
                log.info("ReflectionTestRunner: No test methods discovered in {} module(s)", modules.size());
            }
        } catch (RuntimeException | LinkageError e) {
            log.error("ReflectionTestRunner: Critical error during test run", e);
            suite.add(TestCaseResult.criticalError(ENGINE_FAILURE_TEST_NAME, ENGINE_FAILURE_CLASS_NAME,
                Duration.ZERO, Failures.describe(e), Failures.stackTraceOf(e)));
        } finally {
            closeAll(contexts);
        }

        suite.finish();
        logSummary(suite);
        return suite;
    }

    // ── Private helpers ───────────────────────────────────────────────────────

    private ModuleContext loadOrSkip(Path module) {
        try {
            return loader.load(module);
        } catch (ModuleLoadException e) {
            log.warn("ReflectionTestRunner: Failed to load test module {}; skipping it: {}", module, e.getMessage());
            return null;
        }
    }

    private void closeAll(List<ModuleContext> contexts) {
        for (ModuleContext context : contexts) {
            try {
                context.close();
            } catch (IOException e) {
                log.warn("ReflectionTestRunner: Could not close {}: {}", context, e.getMessage());
            }
        }
    }

    private void logSummary(TestSuiteResult suite) {
        log.info("ReflectionTestRunner: Finished test run -- {} total, {} passed, {} failed, {} critical",
            suite.size(),
            suite.count(TestOutcome.PASS),
            suite.count(TestOutcome.FAIL),
            suite.count(TestOutcome.CRITICAL_ERROR));
    }
}
