package com.testharness.model;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Duration;
import java.util.Objects;

/**
 * One row of a {@link TestSuiteResult}: the outcome of a single discovered or
 * attempted test case.
 *
 * <p>Immutable -- use the static factories. Rows are created exactly once per
 * case by whichever backend ran it and are owned by the suite they are appended to.
 *
 * <pre>
 *   TestCaseResult.passed("adds", "com.example.CalculatorTests", elapsed);
 *   TestCaseResult.failed("divides", "com.example.CalculatorTests", elapsed,
 *                         "expected 2 but was 3", stackTrace);
 * </pre>
 *
 * <p>{@code message} is never null (empty on pass); {@code stackTrace} is null
 * unless the case failed or hit a critical error.
 */
@JsonInclude(JsonInclude.Include.NON_NULL)
@JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
@JsonPropertyOrder({"testName", "className", "duration", "outcome", "message", "stackTrace"})
public final class TestCaseResult {

    private final String      testName;
    private final String      className;
    private final Duration    duration;
    private final TestOutcome outcome;
    private final String      message;
    private final String      stackTrace;

    private TestCaseResult(String testName, String className, Duration duration,
                           TestOutcome outcome, String message, String stackTrace) {
        Objects.requireNonNull(duration, "duration");
        if (duration.isNegative()) {
            throw new IllegalArgumentException("duration must not be negative: " + duration);
        }
        this.testName   = testName != null ? testName : "";
        this.className  = className != null ? className : "";
        this.duration   = duration;
        this.outcome    = Objects.requireNonNull(outcome, "outcome");
        this.message    = message != null ? message : "";
        this.stackTrace = stackTrace;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static TestCaseResult passed(String testName, String className, Duration duration) {
        return new TestCaseResult(testName, className, duration, TestOutcome.PASS, "", null);
    }

    public static TestCaseResult failed(String testName, String className, Duration duration,
                                        String message, String stackTrace) {
        return new TestCaseResult(testName, className, duration, TestOutcome.FAIL, message, stackTrace);
    }

    public static TestCaseResult criticalError(String testName, String className, Duration duration,
                                               String message, String stackTrace) {
        return new TestCaseResult(testName, className, duration, TestOutcome.CRITICAL_ERROR, message, stackTrace);
    }

    /** General form, used by adapters that translate a foreign status into an outcome. */
    public static TestCaseResult of(String testName, String className, Duration duration,
                                    TestOutcome outcome, String message, String stackTrace) {
        return new TestCaseResult(testName, className, duration, outcome, message,
            outcome == TestOutcome.PASS ? null : stackTrace);
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public String      getTestName()   { return testName; }
    public String      getClassName()  { return className; }
    public Duration    getDuration()   { return duration; }
    public TestOutcome getOutcome()    { return outcome; }
    public String      getMessage()    { return message; }
    public String      getStackTrace() { return stackTrace; }

    @Override
    public String toString() {
        return String.format("TestCaseResult{%s.%s, outcome=%s, duration=%s, message='%s'}",
            className, testName, outcome, duration, message);
    }
}
