/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;

public record EffectivenessSummary(
        @JsonProperty("total_rules") int totalRules,
        @JsonProperty("effective_rules") int effectiveRules,
        @JsonProperty("ineffective_rules") int ineffectiveRules,
        @JsonProperty("rules_needing_improvement") int rulesNeedingImprovement,
        @JsonProperty("effectiveness_rate") double effectivenessRate
) implements Serializable {

    public static EffectivenessSummary empty() {
        return new EffectivenessSummary(0, 0, 0, 0, 0.0);
    }
}
