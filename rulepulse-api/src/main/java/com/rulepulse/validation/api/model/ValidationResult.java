/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

import java.io.Serializable;
import java.time.Instant;

/**
 * Outcome of one rule during a validation run.
 *
 * @param executionFailed {@code true} when the rule's check threw instead of returning
 */
public record ValidationResult(
        String ruleId,
        String ruleName,
        ValidationCategory category,
        ValidationSeverity severity,
        boolean passed,
        String message,
        boolean executionFailed,
        Instant timestamp
) implements Serializable {

    public ValidationResult {
        if (message == null) message = "";
        if (timestamp == null) timestamp = Instant.now();
    }

    public static ValidationResult of(ValidationRule rule, CheckOutcome outcome) {
        return new ValidationResult(rule.id(), rule.name(), rule.category(), rule.severity(),
                outcome.passed(), outcome.message(), false, Instant.now());
    }

    public static ValidationResult executionFailure(ValidationRule rule, String message) {
        return new ValidationResult(rule.id(), rule.name(), rule.category(),
                ValidationSeverity.ERROR, false, message, true, Instant.now());
    }
}
