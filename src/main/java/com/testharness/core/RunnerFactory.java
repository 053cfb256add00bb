package com.testharness.core;

import com.testharness.engine.JUnitPlatformTestRunner;

/**
 * Picks the {@link TestRunner} backend named by {@link HarnessConfig#getRunner()}.
 */
public final class RunnerFactory {

    private RunnerFactory() {}

    public static TestRunner create(HarnessConfig config) {
        return switch (config.getRunner()) {
            case REFLECTION     -> new ReflectionTestRunner(config);
            case JUNIT_PLATFORM -> new JUnitPlatformTestRunner(config);
        };
    }
}
