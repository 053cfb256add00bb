package com.testharness.discovery;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Optional;

/**
 * The test frameworks whose markers the discoverer recognises, and the fully
 * qualified annotation names that identify a test method for each.
 *
 * Markers are compared as strings read from bytecode, never as {@code Class}
 * objects, so the harness needs none of these frameworks on its class path.
 * Declaration order is match priority: when a method carries markers from two
 * families, the earlier family wins.
 */
public enum MarkerFamily {

    JUNIT_JUPITER("JUnit Jupiter",
        "org.junit.jupiter.api.Test",
        "org.junit.jupiter.params.ParameterizedTest"),

    JUNIT4("JUnit 4",
        "org.junit.Test"),

    TESTNG("TestNG",
        "org.testng.annotations.Test");

    private final String displayName;
    private final List<String> markers;

    MarkerFamily(String displayName, String... markers) {
        this.displayName = displayName;
        this.markers = List.of(markers);
    }

    public String getDisplayName() { return displayName; }

    /** This family's marker annotation names, "is a test" first. */
    public List<String> getMarkers() { return markers; }

    /** Every recognised marker, in match priority order. */
    public static List<String> allMarkers() {
        List<String> all = new ArrayList<>();
        for (MarkerFamily family : values()) {
            all.addAll(family.markers);
        }
        return Collections.unmodifiableList(all);
    }

    public static Optional<MarkerFamily> forMarker(String annotationName) {
        for (MarkerFamily family : values()) {
            if (family.markers.contains(annotationName)) {
                return Optional.of(family);
            }
        }
        return Optional.empty();
    }
}
