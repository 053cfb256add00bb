package com.testharness.fixtures;

import org.testng.annotations.Test;

/** Module fixture in which every marked method passes. */
public class PassingSuite {

    @Test
    public void first() {
    }

    @Test
    public void second() {
    }
}
