/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;

/**
 * Payload pushed to the community metrics sink after each tracked validation.
 */
public record RuleMetricsSnapshot(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("category") ValidationCategory category,
        @JsonProperty("total_validations") long totalValidations,
        @JsonProperty("passed_validations") long passedValidations,
        @JsonProperty("failed_validations") long failedValidations,
        @JsonProperty("failure_rate") double failureRate,
        @JsonProperty("average_severity") double averageSeverity,
        @JsonProperty("status") EffectivenessStatus status,
        @JsonProperty("timestamp") Instant timestamp
) implements Serializable {

    public static RuleMetricsSnapshot of(RuleEffectiveness effectiveness) {
        return new RuleMetricsSnapshot(
                effectiveness.ruleId(),
                effectiveness.category(),
                effectiveness.totalValidations(),
                effectiveness.passedValidations(),
                effectiveness.failedValidations(),
                effectiveness.failureRate(),
                effectiveness.averageSeverity(),
                effectiveness.status(),
                effectiveness.lastUpdated());
    }
}
