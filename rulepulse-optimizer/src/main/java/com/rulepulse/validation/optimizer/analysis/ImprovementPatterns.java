/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.optimizer.analysis;

import com.rulepulse.validation.api.model.ImprovementPriority;
import com.rulepulse.validation.api.model.RuleEffectiveness;
import com.rulepulse.validation.api.model.RuleImprovement;
import com.rulepulse.validation.api.model.ValidationRule;
import com.rulepulse.validation.api.model.ValidationSeverity;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * The built-in improvement checks, in the order the generator applies them.
 */
public final class ImprovementPatterns {

    static final int MIN_SAMPLE_SIZE = 10;
    static final int MIN_FEEDBACK = 5;
    static final double HIGH_FAILURE_RATE = 0.3;
    static final double HIGH_NEGATIVE_RATIO = 0.5;
    static final double INCONSISTENCY_BAND = 0.2;
    static final double EXTREME_MAGNITUDE = 1000.0;
    static final int MIN_DESCRIPTION_LENGTH = 20;

    private ImprovementPatterns() {
        throw new AssertionError("No instances");
    }

    public static List<ImprovementPattern> defaults() {
        List<ImprovementPattern> patterns = new ArrayList<>(statistical());
        patterns.addAll(ruleSpecific());
        return List.copyOf(patterns);
    }

    /**
     * Patterns that need only the recorded statistics.
     */
    public static List<ImprovementPattern> statistical() {
        return List.of(
                ImprovementPatterns::highFailureRate,
                ImprovementPatterns::highSeverityFailures,
                ImprovementPatterns::highNegativeFeedback,
                ImprovementPatterns::inconsistentResults,
                ImprovementPatterns::lowUserFeedback);
    }

    /**
     * Patterns that inspect the rule definition; they yield nothing without one.
     */
    public static List<ImprovementPattern> ruleSpecific() {
        return List.of(
                ImprovementPatterns::extremeParameterValues,
                ImprovementPatterns::missingDependencies,
                ImprovementPatterns::minimalDocumentation);
    }

    static List<RuleImprovement> highFailureRate(ImprovementContext context) {
        RuleEffectiveness e = context.effectiveness();
        if (e.totalValidations() < MIN_SAMPLE_SIZE || e.failureRate() <= HIGH_FAILURE_RATE) {
            return List.of();
        }
        return List.of(context.improvement(
                "High Failure Rate",
                String.format(Locale.ROOT, "Rule fails %.1f%% of validations; the failure rate suggests it is too strict "
                        + "or checks the wrong condition.", e.failureRate() * 100),
                ImprovementPriority.HIGH,
                List.of("Review the rule's thresholds against typical designs",
                        "Check whether failures come from a specific board type or layout style",
                        "Consider splitting the rule into stricter and relaxed variants"),
                Map.of("failure_rate", e.failureRate(),
                        "failed_validations", (double) e.failedValidations())));
    }

    static List<RuleImprovement> highSeverityFailures(ImprovementContext context) {
        RuleEffectiveness e = context.effectiveness();
        if (e.failedValidations() == 0 || e.averageSeverity() < ValidationSeverity.ERROR.level()) {
            return List.of();
        }
        return List.of(context.improvement(
                "High Severity Failures",
                String.format(Locale.ROOT, "Failures of this rule average severity %.2f, at or above ERROR.",
                        e.averageSeverity()),
                ImprovementPriority.HIGH,
                List.of("Verify the assigned severity matches the real impact of a violation",
                        "Add guidance to the failure message so users can fix the issue quickly"),
                Map.of("average_severity", e.averageSeverity())));
    }

    static List<RuleImprovement> highNegativeFeedback(ImprovementContext context) {
        RuleEffectiveness e = context.effectiveness();
        if (e.feedbackCount() < MIN_FEEDBACK || e.negativeFeedbackRatio() <= HIGH_NEGATIVE_RATIO) {
            return List.of();
        }
        return List.of(context.improvement(
                "High Negative Feedback",
                String.format(Locale.ROOT, "%.1f%% of user feedback is negative feedback; users do not find "
                        + "this rule's results useful.", e.negativeFeedbackRatio() * 100),
                ImprovementPriority.HIGH,
                List.of("Read the feedback comments for recurring complaints",
                        "Check for false positives on common, valid designs",
                        "Clarify the rule's message and documentation"),
                Map.of("negative_feedback_ratio", e.negativeFeedbackRatio())));
    }

    static List<RuleImprovement> inconsistentResults(ImprovementContext context) {
        RuleEffectiveness e = context.effectiveness();
        if (e.totalValidations() < MIN_SAMPLE_SIZE) {
            return List.of();
        }
        double spread = Math.abs(e.passedValidations() - e.failedValidations()) / (double) e.totalValidations();
        if (spread > INCONSISTENCY_BAND) {
            return List.of();
        }
        return List.of(context.improvement(
                "Inconsistent Results",
                "Rule passes and fails in nearly equal measure; results look inconsistent across designs.",
                ImprovementPriority.MEDIUM,
                List.of("Look for input data the rule depends on but does not validate",
                        "Make the rule's conditions more specific"),
                Map.of("pass_rate", e.passRate(),
                        "failure_rate", e.failureRate())));
    }

    static List<RuleImprovement> lowUserFeedback(ImprovementContext context) {
        RuleEffectiveness e = context.effectiveness();
        if (e.totalValidations() < MIN_SAMPLE_SIZE || e.feedbackCount() >= MIN_FEEDBACK) {
            return List.of();
        }
        return List.of(context.improvement(
                "Low User Feedback",
                "Rule runs often but has received little user feedback, so its usefulness cannot be judged.",
                ImprovementPriority.MEDIUM,
                List.of("Prompt users for feedback when this rule reports a violation"),
                Map.of("feedback_count", (double) e.feedbackCount(),
                        "total_validations", (double) e.totalValidations())));
    }

    static List<RuleImprovement> extremeParameterValues(ImprovementContext context) {
        ValidationRule rule = context.rule();
        if (rule == null) {
            return List.of();
        }
        List<RuleImprovement> improvements = new ArrayList<>();
        rule.numericParameters().forEach((name, value) -> {
            String reason;
            if (value == 0.0) {
                reason = "is 0, which leaves no range to tune it in";
            } else if (Math.abs(value) >= EXTREME_MAGNITUDE) {
                reason = "has an unusually large magnitude";
            } else {
                return;
            }
            improvements.add(context.improvement(
                    "Extreme Parameter Value: " + name,
                    "Parameter '" + name + "' " + reason + " (" + value + ").",
                    ImprovementPriority.MEDIUM,
                    List.of("Confirm the unit and scale of '" + name + "'",
                            "Choose a value typical for the target designs"),
                    Map.of("parameter_value", value)));
        });
        return improvements;
    }

    static List<RuleImprovement> missingDependencies(ImprovementContext context) {
        ValidationRule rule = context.rule();
        if (rule == null) {
            return List.of();
        }
        List<String> missing = rule.dependencies().stream()
                .filter(id -> !context.registeredRuleIds().contains(id))
                .toList();
        if (missing.isEmpty()) {
            return List.of();
        }
        return List.of(context.improvement(
                "Missing Dependencies",
                "Rule depends on rules that are not registered: " + String.join(", ", missing) + ".",
                ImprovementPriority.MEDIUM,
                List.of("Register the missing rules or remove them from the dependency list"),
                Map.of("missing_dependency_count", (double) missing.size())));
    }

    static List<RuleImprovement> minimalDocumentation(ImprovementContext context) {
        ValidationRule rule = context.rule();
        if (rule == null || rule.description().length() >= MIN_DESCRIPTION_LENGTH) {
            return List.of();
        }
        return List.of(context.improvement(
                "Minimal Documentation",
                "Rule description is too short to explain what it checks.",
                ImprovementPriority.LOW,
                List.of("Describe what the rule checks and why it matters",
                        "Document each parameter and its unit"),
                Map.of("description_length", (double) rule.description().length())));
    }
}
