/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.runtime.metrics;

import com.rulepulse.validation.api.CommunityMetricsSink;
import com.rulepulse.validation.api.model.RuleMetricsSnapshot;
import com.rulepulse.validation.api.model.ValidationCategory;
import com.rulepulse.validation.infra.metrics.MetricsRegistry;

import java.util.EnumMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Default {@link CommunityMetricsSink}: keeps the latest snapshot per rule and mirrors it
 * into {@link MetricsRegistry} gauges tagged with the rule id.
 *
 * <p>Snapshots arriving out of order are resolved by timestamp; an older snapshot never
 * replaces a newer one.
 */
public final class CommunityMetricsRecorder implements CommunityMetricsSink {

    private final ConcurrentMap<String, RuleMetricsSnapshot> latest = new ConcurrentHashMap<>();
    private final MetricsRegistry metrics;

    public CommunityMetricsRecorder() {
        this(MetricsRegistry.getInstance());
    }

    public CommunityMetricsRecorder(MetricsRegistry metrics) {
        this.metrics = metrics;
    }

    @Override
    public void publish(RuleMetricsSnapshot snapshot) {
        RuleMetricsSnapshot stored = latest.merge(snapshot.ruleId(), snapshot,
                (previous, incoming) -> incoming.timestamp().isBefore(previous.timestamp()) ? previous : incoming);
        if (stored != snapshot) {
            return;
        }
        String ruleId = snapshot.ruleId();
        metrics.gauge("rulepulse_rule_validations", "rule", ruleId).set(snapshot.totalValidations());
        metrics.gauge("rulepulse_rule_failure_rate", "rule", ruleId).set(snapshot.failureRate());
        metrics.gauge("rulepulse_rule_average_severity", "rule", ruleId).set(snapshot.averageSeverity());
    }

    public Optional<RuleMetricsSnapshot> latest(String ruleId) {
        return Optional.ofNullable(latest.get(ruleId));
    }

    public Map<String, RuleMetricsSnapshot> snapshots() {
        return Map.copyOf(latest);
    }

    /**
     * Validation totals summed over the latest snapshot of every rule.
     */
    public RuleTotals ruleEffectivenessTotals() {
        long total = 0;
        long passed = 0;
        long failed = 0;
        for (RuleMetricsSnapshot snapshot : latest.values()) {
            total += snapshot.totalValidations();
            passed += snapshot.passedValidations();
            failed += snapshot.failedValidations();
        }
        return new RuleTotals(total, passed, failed);
    }

    public Map<ValidationCategory, RuleTotals> totalsByCategory() {
        Map<ValidationCategory, RuleTotals> byCategory = new EnumMap<>(ValidationCategory.class);
        for (RuleMetricsSnapshot snapshot : latest.values()) {
            RuleTotals contribution = new RuleTotals(snapshot.totalValidations(), snapshot.passedValidations(), snapshot.failedValidations());
            byCategory.merge(snapshot.category(), contribution, RuleTotals::plus);
        }
        return byCategory;
    }

    public void clear() {
        latest.clear();
    }

    public record RuleTotals(long total, long passed, long failed) {

        public double failureRate() {
            return total == 0 ? 0.0 : (double) failed / total;
        }

        RuleTotals plus(RuleTotals other) {
            return new RuleTotals(total + other.total, passed + other.passed, failed + other.failed);
        }
    }
}
