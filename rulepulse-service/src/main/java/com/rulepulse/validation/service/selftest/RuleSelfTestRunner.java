/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.service.selftest;

import com.rulepulse.validation.api.model.CheckOutcome;
import com.rulepulse.validation.api.model.RuleTestCase;
import com.rulepulse.validation.api.model.RuleTestReport;
import com.rulepulse.validation.api.model.ValidationRule;

import java.util.ArrayList;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Runs a rule's embedded test cases against its own check.
 *
 * <p>A check that throws yields an errored report for that case; the remaining cases still
 * run. Nothing here touches effectiveness tracking.
 */
public class RuleSelfTestRunner {

    private static final Logger logger = Logger.getLogger(RuleSelfTestRunner.class.getName());

    public List<RuleTestReport> run(ValidationRule rule) {
        List<RuleTestReport> reports = new ArrayList<>(rule.testCases().size());
        for (RuleTestCase testCase : rule.testCases()) {
            reports.add(runCase(rule, testCase));
        }
        long mismatches = reports.stream().filter(report -> !report.matched()).count();
        if (mismatches > 0) {
            logger.warning(String.format("Rule '%s' failed %d of %d self-tests",
                    rule.id(), mismatches, reports.size()));
        }
        return reports;
    }

    private RuleTestReport runCase(ValidationRule rule, RuleTestCase testCase) {
        try {
            CheckOutcome outcome = rule.check().check(rule, testCase.input());
            if (outcome == null) {
                return RuleTestReport.errored(testCase, "check returned no outcome");
            }
            return RuleTestReport.of(testCase, outcome.passed());
        } catch (Exception e) {
            logger.log(Level.FINE, "Self-test '" + testCase.name() + "' of rule '" + rule.id() + "' threw", e);
            String message = e.getMessage() != null ? e.getMessage() : e.getClass().getSimpleName();
            return RuleTestReport.errored(testCase, message);
        }
    }
}
