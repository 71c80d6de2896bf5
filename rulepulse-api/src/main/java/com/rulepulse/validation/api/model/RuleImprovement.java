/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.io.Serializable;
import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A human-readable suggestion for making a rule more useful, with the numbers behind it.
 */
public record RuleImprovement(
        @JsonProperty("rule_id") String ruleId,
        @JsonProperty("title") String title,
        @JsonProperty("description") String description,
        @JsonProperty("priority") ImprovementPriority priority,
        @JsonProperty("category") ValidationCategory category,
        @JsonProperty("suggestions") List<String> suggestions,
        @JsonProperty("metrics") Map<String, Double> metrics,
        @JsonProperty("created_at") Instant createdAt
) implements Serializable {

    public RuleImprovement {
        if (priority == null) priority = ImprovementPriority.MEDIUM;
        if (category == null) category = ValidationCategory.GENERAL;
        suggestions = suggestions == null ? List.of() : List.copyOf(suggestions);
        metrics = metrics == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(metrics));
        if (createdAt == null) createdAt = Instant.now();
    }

    @JsonIgnore
    public boolean isHighPriority() {
        return priority == ImprovementPriority.HIGH;
    }
}
