/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.util.List;

/**
 * Persisted form of a rule's optimization history, oldest entry first.
 */
public record OptimizationHistory(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("entries") List<OptimizationResult> entries
) implements Serializable {

    public OptimizationHistory {
        entries = entries == null ? List.of() : List.copyOf(entries);
    }
}
