/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

import java.io.Serializable;
import java.util.Map;
import java.util.Objects;

/**
 * A self-test shipped with a rule: an input and whether the rule is expected to pass on it.
 */
public record RuleTestCase(
        String name,
        String description,
        Map<String, Object> input,
        boolean expectedPass
) implements Serializable {

    public RuleTestCase {
        Objects.requireNonNull(name, "name must not be null");
        if (description == null) description = "";
        input = input == null ? Map.of() : Map.copyOf(input);
    }

    public static RuleTestCase expectPass(String name, Map<String, Object> input) {
        return new RuleTestCase(name, "", input, true);
    }

    public static RuleTestCase expectFail(String name, Map<String, Object> input) {
        return new RuleTestCase(name, "", input, false);
    }
}
