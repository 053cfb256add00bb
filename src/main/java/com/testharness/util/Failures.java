package com.testharness.util;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.UndeclaredThrowableException;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;

/**
 * Helpers for turning a {@link Throwable} into report text.
 */
public final class Failures {

    private Failures() {}

    /** Peels reflection and future wrappers until the original failure is reached. */
    public static Throwable unwrap(Throwable t) {
        Throwable current = t;
        while ((current instanceof InvocationTargetException
                || current instanceof ExecutionException
                || current instanceof CompletionException
                || current instanceof UndeclaredThrowableException)
               && current.getCause() != null
               && current.getCause() != current) {
            current = current.getCause();
        }
        return current;
    }

    /** The failure's own message, or its type name when it carries none. */
    public static String describe(Throwable t) {
        String message = t.getMessage();
        return (message != null && !message.isBlank()) ? message : t.getClass().getName();
    }

    public static String stackTraceOf(Throwable t) {
        StringWriter out = new StringWriter();
        t.printStackTrace(new PrintWriter(out));
        return out.toString();
    }
}
