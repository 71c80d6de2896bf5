/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

import java.io.Serializable;

/**
 * Outcome of running one {@link RuleTestCase}.
 *
 * @param error the check's failure message when it threw, otherwise {@code null}
 */
public record RuleTestReport(
        String testName,
        boolean expectedPass,
        boolean actualPass,
        String error
) implements Serializable {

    public boolean matched() {
        return error == null && expectedPass == actualPass;
    }

    public static RuleTestReport of(RuleTestCase testCase, boolean actualPass) {
        return new RuleTestReport(testCase.name(), testCase.expectedPass(), actualPass, null);
    }

    public static RuleTestReport errored(RuleTestCase testCase, String error) {
        return new RuleTestReport(testCase.name(), testCase.expectedPass(), false, error);
    }
}
