package com.testharness.cli;

import com.testharness.model.TestOutcome;
import com.testharness.model.TestSuiteResult;

/**
 * Process exit codes. The worst outcome in the suite decides.
 */
public final class ExitCodes {

    public static final int SUCCESS        = 0;
    public static final int TEST_FAILURES  = 1;
    public static final int CRITICAL_ERROR = 2;
    public static final int USAGE          = 64;

    private ExitCodes() {}

    public static int forSuite(TestSuiteResult suite) {
        if (suite.hasOutcome(TestOutcome.CRITICAL_ERROR)) return CRITICAL_ERROR;
        if (suite.hasOutcome(TestOutcome.FAIL))           return TEST_FAILURES;
        return SUCCESS;
    }
}
