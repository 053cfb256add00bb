package com.testharness.executor;

import com.testharness.discovery.DiscoveredTest;
import com.testharness.model.TestCaseResult;
import com.testharness.model.TestOutcome;
import com.testharness.util.Failures;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CancellationException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs discovered test cases one at a time and classifies each into exactly one
 * {@link TestCaseResult}.
 *
 * ## Execution model
 *
 *   1. A method that declares parameters is never invoked: FAIL, zero duration.
 *   2. Instance methods get a fresh instance from the no-arg constructor. If that
 *      fails the case is a CRITICAL_ERROR with zero duration.
 *   3. The method is invoked with the module's class loader as the thread context
 *      loader. The clock starts right before the call and stops in a finally block.
 *   4. A returned {@code Future} / {@code CompletionStage} is awaited; this is the
 *      only place the executor blocks. Settling normally is a PASS, settling
 *      exceptionally is a FAIL carrying the original cause.
 *   5. Anything thrown by the test body is a FAIL. Anything thrown by the
 *      reflection machinery itself is a CRITICAL_ERROR.
 *   6. The thread's interrupt flag is cleared after every case, so a body that
 *      leaves it set cannot break the waits of the cases after it.
 *
 * No case can stop the ones after it.
 */
public class TestExecutor {

    private static final Logger log = LoggerFactory.getLogger(TestExecutor.class);

    public static final String PARAMETERIZED_MESSAGE = "Parameterized tests are not executed by this runner.";
    public static final String INSTANTIATION_PREFIX  = "Failed to create test class instance: ";

    private final Duration asyncTimeout;   // null = wait forever

    public TestExecutor() {
        this(null);
    }

    /**
     * @param asyncTimeout upper bound on waiting for an asynchronous test body,
     *                     or {@code null} to wait as long as it takes
     */
    public TestExecutor(Duration asyncTimeout) {
        this.asyncTimeout = asyncTimeout;
    }

    // ── Primary API ───────────────────────────────────────────────────────────

    /**
     * Executes the cases in the given order and returns one result per case, in the same order.
     */
    public List<TestCaseResult> executeAll(List<DiscoveredTest> tests) {
        List<TestCaseResult> results = new ArrayList<>(tests.size());
        for (DiscoveredTest test : tests) {
            results.add(execute(test));
        }
        return results;
    }

    /**
     * Executes a single case. Never throws for anything the test or the reflection
     * layer does; the failure is encoded in the returned row instead.
     */
    public TestCaseResult execute(DiscoveredTest test) {
        String testName  = test.testName();
        String className = test.className();

        if (test.isParameterized()) {
            log.info("TestExecutor: Not executing parameterized test {}.{}", className, testName);
            return TestCaseResult.failed(testName, className, Duration.ZERO, PARAMETERIZED_MESSAGE, null);
        }

        Object instance = null;
        if (!test.isStatic()) {
            try {
                instance = instantiate(test.declaringType());
            } catch (ReflectiveOperationException | RuntimeException | LinkageError e) {
                Throwable cause = Failures.unwrap(e);
                log.error("TestExecutor: Failed to create instance of {} for test {}", className, testName, cause);
                return TestCaseResult.criticalError(testName, className, Duration.ZERO,
                    INSTANTIATION_PREFIX + Failures.describe(cause), Failures.stackTraceOf(cause));
            }
        }

        return invoke(test, instance);
    }

    // ── Invocation ────────────────────────────────────────────────────────────

    private TestCaseResult invoke(DiscoveredTest test, Object instance) {
        String testName  = test.testName();
        String className = test.className();
        Method method    = test.method();

        Thread thread = Thread.currentThread();
        ClassLoader previousLoader = thread.getContextClassLoader();
        thread.setContextClassLoader(test.declaringType().getClassLoader());

        TestOutcome outcome;
        String      message    = "";
        String      stackTrace = null;
        Duration    duration;

        long start = System.nanoTime();
        try {
            method.setAccessible(true);
            InvocationResult invocation = InvocationResult.of(method.invoke(instance));
            if (invocation.isPending()) {
                await(invocation.getPending());
            }
            outcome = TestOutcome.PASS;
        } catch (InvocationTargetException | ExecutionException e) {
            Throwable cause = Failures.unwrap(e);
            outcome    = TestOutcome.FAIL;
            message    = Failures.describe(cause);
            stackTrace = Failures.stackTraceOf(cause);
            log.warn("TestExecutor: Test {}.{} failed: {}", className, testName, message);
        } catch (TimeoutException e) {
            outcome = TestOutcome.FAIL;
            message = "Asynchronous test did not complete within " + asyncTimeout;
            log.warn("TestExecutor: Test {}.{} timed out after {}", className, testName, asyncTimeout);
        } catch (CancellationException e) {
            outcome    = TestOutcome.FAIL;
            message    = "Asynchronous test was cancelled";
            stackTrace = Failures.stackTraceOf(e);
            log.warn("TestExecutor: Test {}.{} was cancelled", className, testName);
        } catch (InterruptedException e) {
            outcome    = TestOutcome.CRITICAL_ERROR;
            message    = "Interrupted while waiting for asynchronous test";
            stackTrace = Failures.stackTraceOf(e);
            log.error("TestExecutor: Interrupted while waiting for {}.{}", className, testName);
        } catch (Exception | LinkageError e) {
            Throwable cause = Failures.unwrap(e);
            outcome    = TestOutcome.CRITICAL_ERROR;
            message    = Failures.describe(cause);
            stackTrace = Failures.stackTraceOf(cause);
            log.error("TestExecutor: Critical error while running test {}.{}", className, testName, cause);
        } finally {
            duration = Duration.ofNanos(Math.max(0L, System.nanoTime() - start));
            thread.setContextClassLoader(previousLoader);
            if (Thread.interrupted()) {
                log.warn("TestExecutor: Cleared interrupt flag left set by {}.{}", className, testName);
            }
        }

        log.info("TestExecutor: {} {}.{} ({} ms)", outcome, className, testName, duration.toMillis());
        return TestCaseResult.of(testName, className, duration, outcome, message, stackTrace);
    }

    private void await(Future<?> pending) throws ExecutionException, InterruptedException, TimeoutException {
        if (asyncTimeout == null) {
            pending.get();
            return;
        }
        try {
            pending.get(asyncTimeout.toNanos(), TimeUnit.NANOSECONDS);
        } catch (TimeoutException e) {
            pending.cancel(true);
            throw e;
        }
    }

    private static Object instantiate(Class<?> type) throws ReflectiveOperationException {
        Constructor<?> constructor = type.getDeclaredConstructor();
        constructor.setAccessible(true);
        return constructor.newInstance();
    }
}
