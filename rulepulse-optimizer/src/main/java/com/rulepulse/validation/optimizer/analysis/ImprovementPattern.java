/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.optimizer.analysis;

import com.rulepulse.validation.api.model.RuleImprovement;

import java.util.List;

/**
 * One check in the improvement generator. Patterns must be stateless and side-effect free.
 */
@FunctionalInterface
public interface ImprovementPattern {

    /**
     * @return the improvements this pattern suggests for the rule, empty when it does not apply
     */
    List<RuleImprovement> detect(ImprovementContext context);
}
