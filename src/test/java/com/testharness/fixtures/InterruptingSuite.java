package com.testharness.fixtures;

import org.testng.annotations.Test;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

/** Module fixture whose first test returns with the thread's interrupt flag still set. */
public class InterruptingSuite {

    @Test
    public void leavesInterruptFlag() {
        Thread.currentThread().interrupt();
    }

    @Test
    public CompletableFuture<Void> asyncPassesLater() {
        return CompletableFuture.runAsync(() -> { },
            CompletableFuture.delayedExecutor(50, TimeUnit.MILLISECONDS));
    }
}
