/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

public record OptimizationSummary(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("total_optimizations") int totalOptimizations,
        @JsonProperty("average_improvement") double averageImprovement,
        @JsonProperty("best_improvement") double bestImprovement,
        @JsonProperty("optimized_parameters") List<String> optimizedParameters
) implements Serializable {

    public OptimizationSummary {
        optimizedParameters = optimizedParameters == null ? List.of() : List.copyOf(optimizedParameters);
    }

    public static OptimizationSummary empty(String ruleId) {
        return new OptimizationSummary(ruleId, 0, 0.0, 0.0, List.of());
    }
}
