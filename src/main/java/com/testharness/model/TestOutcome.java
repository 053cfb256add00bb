package com.testharness.model;

/**
 * The classification every executed or attempted test case ends up with.
 *
 * <p>The taxonomy is deliberately closed at three values so that every backend
 * (the reflection engine and the JUnit Platform adapter) reports into the same
 * shape, and so the exit code can be derived from it without backend knowledge.
 *
 * <p>Cases that were skipped, inconclusive or never invoked (parameterized
 * methods) are reported as {@link #FAIL}: the report must never make an
 * unexecuted case look like a pass.
 */
public enum TestOutcome {

    /** The case completed and its body did not signal failure. */
    PASS,

    /** The body signaled failure, or the case was skipped / inconclusive / not executed. */
    FAIL,

    /** The harness itself could not run the case (instantiation, infrastructure, engine failure). */
    CRITICAL_ERROR
}
