/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.api.model;

import com.rulepulse.validation.api.RuleCheck;
import com.rulepulse.validation.api.exceptions.InvalidParameterException;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.*;

class ValidationRuleTest {

    private ValidationRule sampleRule() {
        return ValidationRule.builder("trace-width")
                .name("Minimum trace width")
                .description("Checks that signal traces meet the fab minimum")
                .category(ValidationCategory.MANUFACTURING)
                .severity(ValidationSeverity.ERROR)
                .parameter("min_width", 0.2)
                .parameter("label", "signal")
                .parameter("max_length", 150)
                .dependsOn("board-outline")
                .build();
    }

    @Test
    @DisplayName("Should apply defaults for omitted builder fields")
    void shouldApplyDefaults() {
        ValidationRule rule = ValidationRule.builder("bare").build();

        assertThat(rule.name()).isEqualTo("bare");
        assertThat(rule.description()).isEmpty();
        assertThat(rule.category()).isEqualTo(ValidationCategory.GENERAL);
        assertThat(rule.severity()).isEqualTo(ValidationSeverity.WARNING);
        assertThat(rule.enabled()).isTrue();
        assertThat(rule.check()).isSameAs(RuleCheck.NONE);
        assertThat(rule.parameters()).isEmpty();
        assertThat(rule.dependencies()).isEmpty();
        assertThat(rule.testCases()).isEmpty();
    }

    @Test
    @DisplayName("Should reject blank ids")
    void shouldRejectBlankId() {
        assertThatThrownBy(() -> ValidationRule.builder("  ").build())
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    @DisplayName("Should replace a declared parameter and keep declaration order")
    void shouldReplaceDeclaredParameter() {
        // Given
        ValidationRule rule = sampleRule();

        // When
        ValidationRule updated = rule.withParameter("min_width", 0.15);

        // Then
        assertThat(updated.parameter("min_width")).isEqualTo(0.15);
        assertThat(updated.parameters().keySet()).containsExactly("min_width", "label", "max_length");
        assertThat(rule.parameter("min_width")).isEqualTo(0.2);
        assertThat(updated.id()).isEqualTo(rule.id());
        assertThat(updated.dependencies()).containsExactly("board-outline");
    }

    @Test
    @DisplayName("Should refuse to add an undeclared parameter")
    void shouldRefuseUndeclaredParameter() {
        ValidationRule rule = sampleRule();

        assertThatThrownBy(() -> rule.withParameter("spacing", 1.0))
                .isInstanceOf(InvalidParameterException.class)
                .hasMessageContaining("spacing")
                .extracting("ruleId").isEqualTo("trace-width");
    }

    @Test
    @DisplayName("Should expose numeric parameters widened to double")
    void shouldExposeNumericParameters() {
        Map<String, Double> numeric = sampleRule().numericParameters();

        assertThat(numeric).containsExactly(entry("min_width", 0.2), entry("max_length", 150.0));
    }

    @Test
    @DisplayName("Should keep parameters immutable")
    void shouldKeepParametersImmutable() {
        ValidationRule rule = sampleRule();

        assertThatThrownBy(() -> rule.parameters().put("x", 1))
                .isInstanceOf(UnsupportedOperationException.class);
    }

    @Test
    @DisplayName("Should round-trip through toBuilder")
    void shouldRoundTripThroughBuilder() {
        ValidationRule rule = sampleRule();

        ValidationRule copy = rule.toBuilder().enabled(false).build();

        assertThat(copy.enabled()).isFalse();
        assertThat(copy.withEnabled(true)).isEqualTo(rule);
    }
}
