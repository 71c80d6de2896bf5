/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.exceptions;

public class RuleNotFoundException extends RulePulseException {

    private final String ruleId;

    public RuleNotFoundException(String ruleId) {
        super("Rule '" + ruleId + "' not found");
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
