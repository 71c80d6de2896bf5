/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.optimizer.analysis;

import com.rulepulse.validation.api.model.ImprovementPriority;
import com.rulepulse.validation.api.model.RuleEffectiveness;
import com.rulepulse.validation.api.model.RuleImprovement;
import com.rulepulse.validation.api.model.ValidationRule;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Everything an {@link ImprovementPattern} may inspect for one rule.
 *
 * @param rule              the rule definition, or {@code null} when only statistics are known;
 *                          rule-level patterns are skipped in that case
 * @param registeredRuleIds ids currently registered, used to detect dangling dependencies
 */
public record ImprovementContext(
        RuleEffectiveness effectiveness,
        ValidationRule rule,
        Set<String> registeredRuleIds,
        Instant generatedAt
) {

    public ImprovementContext {
        Objects.requireNonNull(effectiveness, "effectiveness must not be null");
        registeredRuleIds = registeredRuleIds == null ? Set.of() : Set.copyOf(registeredRuleIds);
        if (generatedAt == null) generatedAt = Instant.now();
    }

    public static ImprovementContext of(RuleEffectiveness effectiveness) {
        return new ImprovementContext(effectiveness, null, Set.of(), null);
    }

    public static ImprovementContext of(ValidationRule rule, RuleEffectiveness effectiveness, Set<String> registeredRuleIds) {
        return new ImprovementContext(
                effectiveness != null ? effectiveness : RuleEffectiveness.empty(rule),
                rule, registeredRuleIds, null);
    }

    public Optional<ValidationRule> ruleDefinition() {
        return Optional.ofNullable(rule);
    }

    public String ruleId() {
        return effectiveness.ruleId();
    }

    RuleImprovement improvement(String title,
                                String description,
                                ImprovementPriority priority,
                                List<String> suggestions,
                                Map<String, Double> metrics) {
        return new RuleImprovement(ruleId(), title, description, priority,
                rule != null ? rule.category() : effectiveness.category(),
                suggestions, metrics, generatedAt);
    }
}
