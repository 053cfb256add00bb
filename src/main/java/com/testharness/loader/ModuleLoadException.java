package com.testharness.loader;

import java.nio.file.Path;

/**
 * Signals that a test module could not be turned into a {@link ModuleContext}:
 * the file is missing, is not a readable JAR, or its class path could not be built.
 *
 * <p>The runners log it and skip the module; it never aborts a run.
 */
public class ModuleLoadException extends Exception {

    private final Path modulePath;

    public ModuleLoadException(Path modulePath, String message) {
        super(message + ": " + modulePath);
        this.modulePath = modulePath;
    }

    public ModuleLoadException(Path modulePath, String message, Throwable cause) {
        super(message + ": " + modulePath + " (" + cause.getMessage() + ")", cause);
        this.modulePath = modulePath;
    }

    /** The module that failed to load. */
    public Path getModulePath() {
        return modulePath;
    }
}
