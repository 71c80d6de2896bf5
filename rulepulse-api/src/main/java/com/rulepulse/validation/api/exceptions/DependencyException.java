/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.exceptions;

import java.util.Set;

/**
 * Thrown when removing a rule that other registered rules still depend on.
 */
public class DependencyException extends RulePulseException {

    private final String ruleId;
    private final Set<String> dependents;

    public DependencyException(String ruleId, Set<String> dependents) {
        super("Rule '" + ruleId + "' is still required by " + dependents);
        this.ruleId = ruleId;
        this.dependents = Set.copyOf(dependents);
    }

    public String getRuleId() {
        return ruleId;
    }

    public Set<String> getDependents() {
        return dependents;
    }
}
