/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api;

import com.rulepulse.validation.api.model.CheckOutcome;
import com.rulepulse.validation.api.model.ValidationRule;

import java.util.Map;

/**
 * The executable part of a validation rule.
 *
 * <p>Implementations read whatever they need from the caller-supplied input map and the
 * rule's own parameters. A check may throw; the validation manager turns the failure into a
 * failed result instead of aborting the run.
 */
@FunctionalInterface
public interface RuleCheck {

    /**
     * Check that always passes. Used for rules registered without behavior.
     */
    RuleCheck NONE = (rule, input) -> CheckOutcome.pass();

    CheckOutcome check(ValidationRule rule, Map<String, Object> input) throws Exception;
}
