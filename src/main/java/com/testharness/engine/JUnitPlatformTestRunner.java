package com.testharness.engine;

import com.testharness.core.HarnessConfig;
import com.testharness.core.TestRunner;
import com.testharness.loader.IsolatedModuleLoader;
import com.testharness.loader.ModuleContext;
import com.testharness.loader.ModuleLoadException;
import com.testharness.locator.ModuleLocator;
import com.testharness.model.TestCaseResult;
import com.testharness.model.TestOutcome;
import com.testharness.model.TestSuiteResult;
import com.testharness.util.Failures;
import org.junit.platform.engine.TestExecutionResult;
import org.junit.platform.engine.TestSource;
import org.junit.platform.engine.support.descriptor.ClassSource;
import org.junit.platform.engine.support.descriptor.MethodSource;
import org.junit.platform.launcher.Launcher;
import org.junit.platform.launcher.LauncherDiscoveryRequest;
import org.junit.platform.launcher.TestExecutionListener;
import org.junit.platform.launcher.TestIdentifier;
import org.junit.platform.launcher.TestPlan;
import org.junit.platform.launcher.core.LauncherFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.function.Supplier;

import static org.junit.platform.engine.discovery.DiscoverySelectors.selectClasspathRoots;
import static org.junit.platform.launcher.core.LauncherDiscoveryRequestBuilder.request;

/**
 * Runs test modules through the JUnit Platform Launcher instead of the built-in
 * reflection engine, and reports them with the same row model.
 *
 * Each module JAR is loaded into its own {@link ModuleContext} with the JUnit API
 * packages shared from the host, selected as a classpath root and executed with
 * the context as thread context class loader, so engines resolve test classes
 * from the module rather than from the harness class path.
 *
 * Only test leaves become rows. When a container (test class, engine) is skipped
 * or fails before its tests run, each of those tests gets a row carrying the
 * container's outcome.
 */
public class JUnitPlatformTestRunner implements TestRunner {

    private static final Logger log = LoggerFactory.getLogger(JUnitPlatformTestRunner.class);

    public static final String ENGINE_FAILURE_TEST_NAME  = "JUnitPlatform.Run";
    public static final String ENGINE_FAILURE_CLASS_NAME = "JUnitPlatform";

    /** Platform status name for a test the engine never started. */
    static final String SKIPPED_STATUS = "SKIPPED";

    static final List<String> SHARED_PACKAGES = List.of("org.junit.", "org.opentest4j.", "org.apiguardian.");

    private final ModuleLocator        locator;
    private final IsolatedModuleLoader loader;
    private final Supplier<Launcher>   launcherFactory;
    private final Clock                clock;

    public JUnitPlatformTestRunner(HarnessConfig config) {
        this(new ModuleLocator(config),
             new IsolatedModuleLoader(JUnitPlatformTestRunner.class.getClassLoader(), SHARED_PACKAGES),
             LauncherFactory::create,
             Clock.systemUTC());
    }

    public JUnitPlatformTestRunner(ModuleLocator locator, IsolatedModuleLoader loader,
                                   Supplier<Launcher> launcherFactory, Clock clock) {
        this.locator         = locator;
        this.loader          = loader;
        this.launcherFactory = launcherFactory;
        this.clock           = clock;
    }

    @Override
    public String name() {
        return "junit-platform";
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    @Override
    public TestSuiteResult run() {
        TestSuiteResult suite = TestSuiteResult.start(clock);
        log.info("JUnitPlatformTestRunner: Starting test run");

        try {
            List<Path> modules = locator.locate();
            if (modules.isEmpty()) {
                log.info("JUnitPlatformTestRunner: No test modules to run");
            } else {
                Launcher launcher = launcherFactory.get();
                for (Path module : modules) {
                    runModule(launcher, module, suite);
                }
            }
        } catch (RuntimeException | LinkageError e) {
            log.error("JUnitPlatformTestRunner: Critical error during test run", e);
            suite.add(TestCaseResult.criticalError(ENGINE_FAILURE_TEST_NAME, ENGINE_FAILURE_CLASS_NAME,
                Duration.ZERO, Failures.describe(e), Failures.stackTraceOf(e)));
        }

        suite.finish();
        log.info("JUnitPlatformTestRunner: Finished test run -- {} total, {} passed, {} failed, {} critical",
            suite.size(),
            suite.count(TestOutcome.PASS),
            suite.count(TestOutcome.FAIL),
            suite.count(TestOutcome.CRITICAL_ERROR));
        return suite;
    }

    /**
     * Maps a JUnit Platform status name onto the harness outcome. Skipped and
     * aborted tests count as failures; an unknown status is an infrastructure error.
     */
    public static TestOutcome mapStatus(String status) {
        if (status == null) return TestOutcome.CRITICAL_ERROR;
        switch (status) {
            case "SUCCESSFUL": return TestOutcome.PASS;
            case "FAILED":
            case "SKIPPED":
            case "ABORTED":    return TestOutcome.FAIL;
            default:           return TestOutcome.CRITICAL_ERROR;
        }
    }

    // ── Per module ────────────────────────────────────────────────────────────

    private void runModule(Launcher launcher, Path module, TestSuiteResult suite) {
        ModuleContext context;
        try {
            context = loader.load(module);
        } catch (ModuleLoadException e) {
            log.warn("JUnitPlatformTestRunner: Failed to load test module {}; skipping it: {}", module, e.getMessage());
            return;
        }

        Thread thread = Thread.currentThread();
        ClassLoader previousLoader = thread.getContextClassLoader();
        thread.setContextClassLoader(context);
        try {
            LauncherDiscoveryRequest request = request()
                .selectors(selectClasspathRoots(Set.of(context.getModulePath())))
                .build();
            RowCollector collector = new RowCollector();
            launcher.execute(request, collector);
            suite.addAll(collector.rows());
            log.info("JUnitPlatformTestRunner: {} row(s) from {}", collector.rows().size(),
                module.getFileName());
        } finally {
            thread.setContextClassLoader(previousLoader);
            try {
                context.close();
            } catch (IOException e) {
                log.warn("JUnitPlatformTestRunner: Could not close {}: {}", context, e.getMessage());
            }
        }
    }

    // ── Listener ──────────────────────────────────────────────────────────────

    /**
     * Turns launcher callbacks into rows, in completion order.
     *
     * A container that is skipped or does not finish successfully hands its outcome
     * to every test below it that has not reported yet, since the engine never
     * starts those tests. Only a container with no such tests gets a row of its own.
     */
    static final class RowCollector implements TestExecutionListener {

        private final Map<String, Long> startedAt = new ConcurrentHashMap<>();
        private final Set<String> reported = new HashSet<>();
        private final List<TestCaseResult> rows = new ArrayList<>();
        private TestPlan plan;

        List<TestCaseResult> rows() {
            return rows;
        }

        @Override
        public synchronized void testPlanExecutionStarted(TestPlan testPlan) {
            this.plan = testPlan;
        }

        @Override
        public void executionStarted(TestIdentifier id) {
            startedAt.put(id.getUniqueId(), System.nanoTime());
        }

        @Override
        public synchronized void executionSkipped(TestIdentifier id, String reason) {
            String message = "Skipped" + (reason != null && !reason.isBlank() ? ": " + reason : "");
            record(id, Duration.ZERO, mapStatus(SKIPPED_STATUS), message, null);
        }

        @Override
        public synchronized void executionFinished(TestIdentifier id, TestExecutionResult result) {
            Long start = startedAt.remove(id.getUniqueId());
            Duration duration = start != null
                ? Duration.ofNanos(Math.max(0L, System.nanoTime() - start))
                : Duration.ZERO;

            TestExecutionResult.Status status = result.getStatus();
            if (!id.isTest() && status == TestExecutionResult.Status.SUCCESSFUL) return;

            Throwable cause = result.getThrowable().orElse(null);
            String message = cause != null ? Failures.describe(cause) : "";
            String trace = cause != null ? Failures.stackTraceOf(cause) : null;
            record(id, duration, mapStatus(status.name()), message, trace);
        }

        private void record(TestIdentifier id, Duration duration, TestOutcome outcome, String message, String trace) {
            if (id.isTest()) {
                add(id, duration, outcome, message, trace);
                return;
            }

            List<TestIdentifier> unreported = new ArrayList<>();
            if (plan != null) {
                for (TestIdentifier descendant : plan.getDescendants(id)) {
                    if (descendant.isTest() && !reported.contains(descendant.getUniqueId())) {
                        unreported.add(descendant);
                    }
                }
            }
            if (unreported.isEmpty()) {
                add(id, duration, outcome, message, trace);
                return;
            }
            for (TestIdentifier test : unreported) {
                add(test, Duration.ZERO, outcome, message, trace);
            }
        }

        private void add(TestIdentifier id, Duration duration, TestOutcome outcome, String message, String trace) {
            reported.add(id.getUniqueId());
            rows.add(TestCaseResult.of(testName(id), className(id), duration, outcome, message, trace));
        }

        private static String testName(TestIdentifier id) {
            TestSource source = id.getSource().orElse(null);
            if (source instanceof MethodSource) {
                MethodSource method = (MethodSource) source;
                return method.getClassName() + "." + method.getMethodName();
            }
            return id.getDisplayName();
        }

        private static String className(TestIdentifier id) {
            TestSource source = id.getSource().orElse(null);
            if (source instanceof MethodSource) return ((MethodSource) source).getClassName();
            if (source instanceof ClassSource) return ((ClassSource) source).getClassName();
            return ENGINE_FAILURE_CLASS_NAME;
        }
    }
}
