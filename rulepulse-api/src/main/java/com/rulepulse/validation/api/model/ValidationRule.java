/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

import com.rulepulse.validation.api.RuleCheck;
import com.rulepulse.validation.api.exceptions.InvalidParameterException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * A configurable design-rule check.
 *
 * <p>Instances are immutable. Parameter changes produce a new rule through
 * {@link #withParameter(String, Object)}, which only accepts parameters the rule already
 * declares. Parameter order is the declaration order and is preserved by every copy.
 *
 * <h2>Usage</h2>
 * <pre>
 * ValidationRule rule = ValidationRule.builder("trace-width")
 *     .name("Minimum trace width")
 *     .category(ValidationCategory.MANUFACTURING)
 *     .severity(ValidationSeverity.ERROR)
 *     .parameter("min_width", 0.2)
 *     .check((r, input) -&gt; ...)
 *     .build();
 * </pre>
 */
public record ValidationRule(
        String id,
        String name,
        String description,
        ValidationCategory category,
        ValidationSeverity severity,
        Map<String, Object> parameters,
        Set<String> dependencies,
        boolean enabled,
        RuleCheck check,
        List<RuleTestCase> testCases
) {

    public ValidationRule {
        Objects.requireNonNull(id, "id must not be null");
        if (id.isBlank()) {
            throw new IllegalArgumentException("id must not be blank");
        }
        if (name == null) name = id;
        if (description == null) description = "";
        if (category == null) category = ValidationCategory.GENERAL;
        if (severity == null) severity = ValidationSeverity.WARNING;
        parameters = parameters == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(parameters));
        dependencies = dependencies == null
                ? Set.of()
                : Collections.unmodifiableSet(new LinkedHashSet<>(dependencies));
        if (check == null) check = RuleCheck.NONE;
        testCases = testCases == null ? List.of() : List.copyOf(testCases);
    }

    public static Builder builder(String id) {
        return new Builder(id);
    }

    /**
     * Returns a copy with one parameter replaced.
     *
     * @throws InvalidParameterException if the rule does not declare {@code parameterName}
     */
    public ValidationRule withParameter(String parameterName, Object value) {
        if (!parameters.containsKey(parameterName)) {
            throw new InvalidParameterException(id, parameterName);
        }
        Map<String, Object> updated = new LinkedHashMap<>(parameters);
        updated.put(parameterName, value);
        return new ValidationRule(id, name, description, category, severity, updated,
                dependencies, enabled, check, testCases);
    }

    public ValidationRule withEnabled(boolean enabled) {
        return new ValidationRule(id, name, description, category, severity, parameters,
                dependencies, enabled, check, testCases);
    }

    /**
     * Numeric parameters only, in declaration order, widened to {@code double}.
     */
    public Map<String, Double> numericParameters() {
        Map<String, Double> numeric = new LinkedHashMap<>();
        parameters.forEach((key, value) -> {
            if (value instanceof Number number) {
                numeric.put(key, number.doubleValue());
            }
        });
        return numeric;
    }

    public Object parameter(String parameterName) {
        return parameters.get(parameterName);
    }

    public double doubleParameter(String parameterName, double defaultValue) {
        Object value = parameters.get(parameterName);
        return value instanceof Number number ? number.doubleValue() : defaultValue;
    }

    public Builder toBuilder() {
        Builder builder = new Builder(id)
                .name(name)
                .description(description)
                .category(category)
                .severity(severity)
                .enabled(enabled)
                .check(check);
        parameters.forEach(builder::parameter);
        dependencies.forEach(builder::dependsOn);
        testCases.forEach(builder::testCase);
        return builder;
    }

    public static final class Builder {
        private final String id;
        private String name;
        private String description = "";
        private ValidationCategory category = ValidationCategory.GENERAL;
        private ValidationSeverity severity = ValidationSeverity.WARNING;
        private final Map<String, Object> parameters = new LinkedHashMap<>();
        private final Set<String> dependencies = new LinkedHashSet<>();
        private boolean enabled = true;
        private RuleCheck check = RuleCheck.NONE;
        private final List<RuleTestCase> testCases = new ArrayList<>();

        private Builder(String id) {
            this.id = id;
        }

        public Builder name(String name) {
            this.name = name;
            return this;
        }

        public Builder description(String description) {
            this.description = description;
            return this;
        }

        public Builder category(ValidationCategory category) {
            this.category = category;
            return this;
        }

        public Builder severity(ValidationSeverity severity) {
            this.severity = severity;
            return this;
        }

        public Builder parameter(String name, Object value) {
            this.parameters.put(name, value);
            return this;
        }

        public Builder parameters(Map<String, ?> parameters) {
            this.parameters.putAll(parameters);
            return this;
        }

        public Builder dependsOn(String ruleId) {
            this.dependencies.add(ruleId);
            return this;
        }

        public Builder enabled(boolean enabled) {
            this.enabled = enabled;
            return this;
        }

        public Builder check(RuleCheck check) {
            this.check = check;
            return this;
        }

        public Builder testCase(RuleTestCase testCase) {
            this.testCases.add(testCase);
            return this;
        }

        public ValidationRule build() {
            return new ValidationRule(id, name, description, category, severity, parameters,
                    dependencies, enabled, check, testCases);
        }
    }
}
