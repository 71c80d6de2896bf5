/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.optimizer.analysis;

import com.rulepulse.validation.api.model.RuleImprovement;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Turns a rule's effectiveness statistics and definition into improvement suggestions.
 *
 * <p>Runs an ordered list of {@link ImprovementPattern}s; the output keeps that order. A
 * pattern that throws is logged and skipped so one faulty check cannot hide the others.
 *
 * <h2>Usage</h2>
 * <pre>
 * RuleImprovementGenerator generator = new RuleImprovementGenerator();
 * List&lt;RuleImprovement&gt; improvements =
 *     generator.generateImprovements(ImprovementContext.of(rule, effectiveness, registeredIds));
 * </pre>
 */
public class RuleImprovementGenerator {

    private static final Logger logger = Logger.getLogger(RuleImprovementGenerator.class.getName());

    private final List<ImprovementPattern> patterns;

    public RuleImprovementGenerator() {
        this(ImprovementPatterns.defaults());
    }

    public RuleImprovementGenerator(List<ImprovementPattern> patterns) {
        this.patterns = List.copyOf(patterns);
    }

    /**
     * Returns a generator that runs this one's patterns followed by {@code extra}.
     */
    public RuleImprovementGenerator withAdditionalPatterns(List<ImprovementPattern> extra) {
        List<ImprovementPattern> combined = new ArrayList<>(patterns);
        combined.addAll(extra);
        return new RuleImprovementGenerator(combined);
    }

    public List<RuleImprovement> generateImprovements(ImprovementContext context) {
        List<RuleImprovement> improvements = new ArrayList<>();
        for (ImprovementPattern pattern : patterns) {
            try {
                improvements.addAll(pattern.detect(context));
            } catch (RuntimeException e) {
                logger.log(Level.WARNING, "Improvement pattern failed for rule " + context.ruleId(), e);
            }
        }
        return improvements;
    }

    public List<RuleImprovement> generateImprovements(Collection<ImprovementContext> contexts) {
        List<RuleImprovement> improvements = new ArrayList<>();
        for (ImprovementContext context : contexts) {
            improvements.addAll(generateImprovements(context));
        }
        return improvements;
    }

    public List<ImprovementPattern> patterns() {
        return patterns;
    }
}
