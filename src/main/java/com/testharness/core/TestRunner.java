package com.testharness.core;

import com.testharness.model.TestSuiteResult;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

/**
 * The contract every backend implements: run everything the configuration points
 * at and hand back a finished suite.
 *
 * <p>{@link #run()} never throws. Location, load and discovery problems are logged;
 * execution problems become {@code CRITICAL_ERROR} rows. Callers can therefore treat
 * the reflection engine and the JUnit Platform adapter identically.
 */
public interface TestRunner {

    /**
     * Runs the configured test modules. The returned suite is finished:
     * {@code FinishedAt} is set and no more rows will be added.
     */
    TestSuiteResult run();

    /** Runs on {@code executor}; the run itself stays sequential. */
    default CompletableFuture<TestSuiteResult> runAsync(Executor executor) {
        return CompletableFuture.supplyAsync(this::run, executor);
    }

    default CompletableFuture<TestSuiteResult> runAsync() {
        return CompletableFuture.supplyAsync(this::run);
    }

    /** Short backend name for logs. */
    String name();
}
