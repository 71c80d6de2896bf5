/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.exceptions;

/**
 * Thrown when a parameter update names a parameter the rule does not declare.
 */
public class InvalidParameterException extends RulePulseException {

    private final String ruleId;
    private final String parameterName;

    public InvalidParameterException(String ruleId, String parameterName) {
        super("Rule '" + ruleId + "' has no parameter named '" + parameterName + "'");
        this.ruleId = ruleId;
        this.parameterName = parameterName;
    }

    public String getRuleId() {
        return ruleId;
    }

    public String getParameterName() {
        return parameterName;
    }
}
