package com.testharness.fixtures;

import org.testng.annotations.Test;

/** Module fixture: a base class whose tests only run through concrete subclasses. */
public abstract class AbstractBaseSuite {

    @Test
    public void inherited() {
    }

    @Test
    public void overridden() {
        throw new AssertionError("base version must be shadowed");
    }
}
