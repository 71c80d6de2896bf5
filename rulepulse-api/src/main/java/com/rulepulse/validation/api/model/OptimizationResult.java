/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * A candidate parameter value that scored better than the rule's current value.
 *
 * <p>{@code metrics} carries the projected {@code failure_rate}, {@code pass_rate},
 * {@code average_severity} and {@code feedback_score} for the candidate, plus the
 * strategy's {@code score}.
 */
public record OptimizationResult(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("parameter_name") String parameterName,
        @JsonProperty("original_value") double originalValue,
        @JsonProperty("optimized_value") double optimizedValue,
        @JsonProperty("improvement") double improvement,
        @JsonProperty("strategy") OptimizationStrategy strategy,
        @JsonProperty("metrics") Map<String, Double> metrics,
        @JsonProperty("created_at") Instant createdAt
) implements Serializable {

    public static final String FAILURE_RATE = "failure_rate";
    public static final String PASS_RATE = "pass_rate";
    public static final String AVERAGE_SEVERITY = "average_severity";
    public static final String FEEDBACK_SCORE = "feedback_score";
    public static final String SCORE = "score";

    public OptimizationResult {
        Objects.requireNonNull(ruleId, "ruleId must not be null");
        Objects.requireNonNull(parameterName, "parameterName must not be null");
        if (strategy == null) strategy = OptimizationStrategy.MINIMIZE_FAILURES;
        metrics = metrics == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        if (createdAt == null) createdAt = Instant.now();
    }

    public OptimizationResult withRuleId(String ruleId) {
        return new OptimizationResult(ruleId, parameterName, originalValue, optimizedValue,
                improvement, strategy, metrics, createdAt);
    }
}
