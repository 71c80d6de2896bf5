/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

import java.io.Serializable;
import java.time.Duration;
import java.util.List;

/**
 * Results of a validation run, in rule registration order.
 */
public record ValidationSummary(List<ValidationResult> results, Duration elapsed) implements Serializable {

    public ValidationSummary {
        results = results == null ? List.of() : List.copyOf(results);
        if (elapsed == null) elapsed = Duration.ZERO;
    }

    /**
     * True when no rule failed, regardless of severity.
     */
    public boolean passed() {
        return results.stream().allMatch(ValidationResult::passed);
    }

    /**
     * True when at least one failure is ERROR or CRITICAL.
     */
    public boolean hasErrors() {
        return errorCount() > 0;
    }

    public boolean hasWarnings() {
        return warningCount() > 0;
    }

    public long errorCount() {
        return results.stream()
                .filter(r -> !r.passed() && r.severity().isAtLeast(ValidationSeverity.ERROR))
                .count();
    }

    public long warningCount() {
        return results.stream()
                .filter(r -> !r.passed() && r.severity() == ValidationSeverity.WARNING)
                .count();
    }

    public List<ValidationResult> failedResults() {
        return results.stream().filter(r -> !r.passed()).toList();
    }

    public List<ValidationResult> resultsFor(ValidationCategory category) {
        return results.stream().filter(r -> r.category() == category).toList();
    }

    public int size() {
        return results.size();
    }
}
