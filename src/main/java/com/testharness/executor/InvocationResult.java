package com.testharness.executor;

import java.util.Objects;
import java.util.concurrent.CompletionStage;
import java.util.concurrent.Future;

/**
 * What a test method handed back when it was invoked.
 *
 *   IMMEDIATE -- the body ran to completion during the call; nothing to wait for
 *   PENDING   -- the body returned an asynchronous computation that must settle
 *                before the case can be classified
 *
 * {@link TestExecutor} suspends only on {@code PENDING}, one case at a time.
 */
public final class InvocationResult {

    public enum Kind { IMMEDIATE, PENDING }

    private static final InvocationResult IMMEDIATE = new InvocationResult(Kind.IMMEDIATE, null);

    private final Kind      kind;
    private final Future<?> pending;   // non-null only when kind == PENDING

    private InvocationResult(Kind kind, Future<?> pending) {
        this.kind    = kind;
        this.pending = pending;
    }

    // ── Static factories ──────────────────────────────────────────────────────

    public static InvocationResult immediate() {
        return IMMEDIATE;
    }

    public static InvocationResult pending(Future<?> future) {
        return new InvocationResult(Kind.PENDING, Objects.requireNonNull(future, "future"));
    }

    /**
     * Classifies a method's return value. {@code Future}s and {@code CompletionStage}s
     * are pending; everything else, including {@code null} from a void method, is immediate.
     */
    public static InvocationResult of(Object returned) {
        if (returned instanceof Future<?> future) {
            return pending(future);
        }
        if (returned instanceof CompletionStage<?> stage) {
            return pending(stage.toCompletableFuture());
        }
        return immediate();
    }

    // ── Getters ───────────────────────────────────────────────────────────────

    public Kind      getKind()    { return kind; }
    public Future<?> getPending() { return pending; }

    public boolean isPending()    { return kind == Kind.PENDING; }

    @Override
    public String toString() {
        return "InvocationResult{" + kind + "}";
    }
}
