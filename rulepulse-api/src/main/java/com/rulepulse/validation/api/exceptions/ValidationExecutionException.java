/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.exceptions;

/**
 * Wraps a failure raised by a rule's check while a validation run is in progress.
 *
 * <p>Never escapes {@code validate}: the manager logs it and turns it into a failed
 * ERROR-severity result for the offending rule.
 */
public class ValidationExecutionException extends RulePulseException {

    private final String ruleId;

    public ValidationExecutionException(String ruleId, Throwable cause) {
        super("Rule '" + ruleId + "' failed to execute: " + cause.getMessage(), cause);
        this.ruleId = ruleId;
    }

    public String getRuleId() {
        return ruleId;
    }
}
