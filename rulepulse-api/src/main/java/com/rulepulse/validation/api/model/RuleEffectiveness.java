/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Objects;

/**
 * Accumulated validation and feedback statistics for one rule.
 *
 * <p>Snapshots are immutable; every tracked event produces a new instance through
 * {@link #withValidation} or {@link #withFeedback}. The counters always satisfy
 * {@code passed + failed == total} and {@code positive + negative == feedbackCount}.
 * {@code averageSeverity} is the running mean of the severity level of failed validations
 * only, so it stays 0 until the first failure.
 */
public record RuleEffectiveness(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("rule_name") String ruleName,
        @JsonProperty("category") ValidationCategory category,
        @JsonProperty("total_validations") long totalValidations,
        @JsonProperty("passed_validations") long passedValidations,
        @JsonProperty("failed_validations") long failedValidations,
        @JsonProperty("feedback_count") long feedbackCount,
        @JsonProperty("positive_feedback") long positiveFeedback,
        @JsonProperty("negative_feedback") long negativeFeedback,
        @JsonProperty("average_severity") double averageSeverity,
        @JsonProperty("status") EffectivenessStatus status,
        @JsonProperty("last_updated") Instant lastUpdated
) implements Serializable {

    public RuleEffectiveness {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        if (ruleName == null) ruleName = ruleId;
        if (category == null) category = ValidationCategory.GENERAL;
        if (status == null) status = EffectivenessStatus.UNKNOWN;
        if (lastUpdated == null) lastUpdated = Instant.now();
    }

    public static RuleEffectiveness empty(String ruleId, String ruleName, ValidationCategory category) {
        return new RuleEffectiveness(ruleId, ruleName, category, 0, 0, 0, 0, 0, 0, 0.0,
                EffectivenessStatus.UNKNOWN, Instant.now());
    }

    public static RuleEffectiveness empty(ValidationRule rule) {
        return empty(rule.id(), rule.name(), rule.category());
    }

    /**
     * Folds one validation outcome into the counters. The severity only contributes to the
     * average when the validation failed.
     */
    public RuleEffectiveness withValidation(boolean passed, ValidationSeverity severity, Instant at) {
        long total = totalValidations + 1;
        long passedCount = passedValidations + (passed ? 1 : 0);
        long failedCount = failedValidations + (passed ? 0 : 1);
        double average = averageSeverity;
        if (!passed) {
            int level = severity == null ? 0 : severity.level();
            average = averageSeverity + (level - averageSeverity) / failedCount;
        }
        return new RuleEffectiveness(ruleId, ruleName, category, total, passedCount, failedCount,
                feedbackCount, positiveFeedback, negativeFeedback, average, status, at);
    }

    public RuleEffectiveness withFeedback(boolean positive, Instant at) {
        return new RuleEffectiveness(ruleId, ruleName, category, totalValidations,
                passedValidations, failedValidations, feedbackCount + 1,
                positiveFeedback + (positive ? 1 : 0), negativeFeedback + (positive ? 0 : 1),
                averageSeverity, status, at);
    }

    public RuleEffectiveness withStatus(EffectivenessStatus status) {
        return new RuleEffectiveness(ruleId, ruleName, category, totalValidations,
                passedValidations, failedValidations, feedbackCount, positiveFeedback,
                negativeFeedback, averageSeverity, status, lastUpdated);
    }

    public double failureRate() {
        return totalValidations == 0 ? 0.0 : (double) failedValidations / totalValidations;
    }

    public double passRate() {
        return totalValidations == 0 ? 0.0 : (double) passedValidations / totalValidations;
    }

    public double positiveFeedbackRatio() {
        return feedbackCount == 0 ? 0.0 : (double) positiveFeedback / feedbackCount;
    }

    public double negativeFeedbackRatio() {
        return feedbackCount == 0 ? 0.0 : (double) negativeFeedback / feedbackCount;
    }
}
