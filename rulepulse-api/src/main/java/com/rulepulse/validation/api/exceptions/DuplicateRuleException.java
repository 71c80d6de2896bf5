/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.exceptions;

/**
 * Thrown when a rule is registered under an id that is already taken.
 */
public class DuplicateRuleException extends RulePulseException {

    private final String ruleId;

    public DuplicateRuleException(String ruleId) {
        super("Rule with id '" + ruleId + "' is already registered");
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
