package com.testharness.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * The result of one test run: wall-clock bounds plus the ordered case rows.
 *
 * <p>Lifecycle:
 * <ol>
 *   <li>{@link #start(Clock)} at the beginning of a run, before any discovery work</li>
 *   <li>{@link #add(TestCaseResult)} once per case, in execution order</li>
 *   <li>{@link #finish()} after the last case; the suite is read-only afterwards</li>
 * </ol>
 *
 * Only the runner that started a suite appends to it, from a single thread.
 */
@JsonNaming(PropertyNamingStrategies.UpperCamelCaseStrategy.class)
@JsonPropertyOrder({"startedAt", "finishedAt", "testCases"})
public final class TestSuiteResult {

    private final Clock clock;
    private final Instant startedAt;
    private final List<TestCaseResult> testCases = new ArrayList<>();
    private Instant finishedAt;

    private TestSuiteResult(Clock clock) {
        this.clock = clock;
        this.startedAt = clock.instant();
    }

    public static TestSuiteResult start(Clock clock) {
        return new TestSuiteResult(Objects.requireNonNull(clock, "clock"));
    }

    public static TestSuiteResult start() {
        return start(Clock.systemUTC());
    }

    // ── Mutation (runner only) ────────────────────────────────────────────────

    public void add(TestCaseResult result) {
        Objects.requireNonNull(result, "result");
        if (isFinished()) {
            throw new IllegalStateException("Suite already finished at " + finishedAt + "; cannot add " + result);
        }
        testCases.add(result);
    }

    public void addAll(List<TestCaseResult> results) {
        results.forEach(this::add);
    }

    /**
     * Stamps {@code FinishedAt}. Never earlier than {@code StartedAt}, even if the
     * clock stepped backwards during the run. Calling it twice is a no-op.
     */
    public TestSuiteResult finish() {
        if (finishedAt == null) {
            Instant now = clock.instant();
            finishedAt = now.isBefore(startedAt) ? startedAt : now;
        }
        return this;
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public Instant getStartedAt()  { return startedAt; }
    public Instant getFinishedAt() { return finishedAt; }

    public List<TestCaseResult> getTestCases() {
        return Collections.unmodifiableList(testCases);
    }

    @JsonIgnore
    public boolean isFinished() { return finishedAt != null; }

    @JsonIgnore
    public int size() { return testCases.size(); }

    public long count(TestOutcome outcome) {
        return testCases.stream().filter(tc -> tc.getOutcome() == outcome).count();
    }

    public boolean hasOutcome(TestOutcome outcome) {
        return testCases.stream().anyMatch(tc -> tc.getOutcome() == outcome);
    }

    @Override
    public String toString() {
        return String.format("TestSuiteResult{cases=%d, passed=%d, failed=%d, critical=%d, startedAt=%s, finishedAt=%s}",
            testCases.size(), count(TestOutcome.PASS), count(TestOutcome.FAIL),
            count(TestOutcome.CRITICAL_ERROR), startedAt, finishedAt);
    }
}
