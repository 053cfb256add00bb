package com.testharness.fixtures.dep;

/** Dependency fixture, packed into its own JAR. */
public final class GreetingHelper {

    private GreetingHelper() {}

    public static String greet(String name) {
        return "Hello, " + name;
    }
}
