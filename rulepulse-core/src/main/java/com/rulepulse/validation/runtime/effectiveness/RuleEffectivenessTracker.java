/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.runtime.effectiveness;

import com.rulepulse.validation.api.CommunityMetricsSink;
import com.rulepulse.validation.api.exceptions.RuleNotFoundException;
import com.rulepulse.validation.api.model.EffectivenessStatus;
import com.rulepulse.validation.api.model.EffectivenessSummary;
import com.rulepulse.validation.api.model.RuleEffectiveness;
import com.rulepulse.validation.api.model.RuleMetricsSnapshot;
import com.rulepulse.validation.api.model.ValidationRule;
import com.rulepulse.validation.api.model.ValidationSeverity;
import com.rulepulse.validation.infra.config.EffectivenessPolicy;
import com.rulepulse.validation.infra.metrics.MetricsRegistry;
import com.rulepulse.validation.infra.persistence.RecordStore;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Records validation outcomes and user feedback per rule and keeps each rule's
 * effectiveness status current.
 *
 * <p><b>Thread-safety:</b> all updates for one rule id (read, modify, reclassify, persist)
 * run under that rule's lock from {@link RuleLockRegistry}; different rules never contend.
 * Readers see the latest published snapshot without locking.
 *
 * <p><b>Failure policy:</b> persistence and metrics-sink failures are logged at WARNING and
 * absorbed. The in-memory state is authoritative and the next successful write catches the
 * store up.
 */
public class RuleEffectivenessTracker {

    private static final Logger logger = Logger.getLogger(RuleEffectivenessTracker.class.getName());

    private final ConcurrentMap<String, RuleEffectiveness> effectiveness = new ConcurrentHashMap<>();
    private final RuleLockRegistry locks = new RuleLockRegistry();
    private final RecordStore<RuleEffectiveness> store;
    private final CommunityMetricsSink metricsSink;
    private final EffectivenessClassifier classifier;
    private final MetricsRegistry metrics;
    private final Clock clock;

    public RuleEffectivenessTracker(RecordStore<RuleEffectiveness> store,
                                    CommunityMetricsSink metricsSink,
                                    EffectivenessPolicy policy) {
        this(store, metricsSink, policy, MetricsRegistry.getInstance(), Clock.systemUTC());
    }

    public RuleEffectivenessTracker(RecordStore<RuleEffectiveness> store,
                                    CommunityMetricsSink metricsSink,
                                    EffectivenessPolicy policy,
                                    MetricsRegistry metrics,
                                    Clock clock) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.metricsSink = metricsSink != null ? metricsSink : CommunityMetricsSink.noop();
        this.classifier = new EffectivenessClassifier(policy != null ? policy : EffectivenessPolicy.defaults());
        this.metrics = metrics != null ? metrics : MetricsRegistry.noop();
        this.clock = clock != null ? clock : Clock.systemUTC();
        loadPersisted();
    }

    /**
     * Records one validation of {@code rule}. The severity only affects the rule's average
     * when the validation failed.
     *
     * @return the updated snapshot
     */
    public RuleEffectiveness trackValidation(ValidationRule rule, boolean passed, ValidationSeverity severity) {
        Objects.requireNonNull(rule, "rule must not be null");
        RuleEffectiveness updated = update(rule.id(),
                () -> RuleEffectiveness.empty(rule),
                current -> current.withValidation(passed, severity, clock.instant()));

        metrics.counter("rulepulse_validations_tracked_total", "outcome", passed ? "passed" : "failed").increment();
        publish(updated);
        return updated;
    }

    public RuleEffectiveness trackValidation(ValidationRule rule, boolean passed) {
        return trackValidation(rule, passed, rule.severity());
    }

    /**
     * Records feedback for a rule that has already been tracked.
     *
     * @throws RuleNotFoundException if no validation or feedback was ever recorded for it
     */
    public RuleEffectiveness addFeedback(String ruleId, boolean positive) {
        return update(ruleId,
                () -> {
                    throw new RuleNotFoundException(ruleId);
                },
                current -> recordFeedback(current, positive));
    }

    /**
     * Records feedback for a registered rule, creating its record when this is the first
     * event seen for it.
     */
    public RuleEffectiveness addFeedback(ValidationRule rule, boolean positive) {
        Objects.requireNonNull(rule, "rule must not be null");
        return update(rule.id(),
                () -> RuleEffectiveness.empty(rule),
                current -> recordFeedback(current, positive));
    }

    public Optional<RuleEffectiveness> getRuleEffectiveness(String ruleId) {
        return Optional.ofNullable(effectiveness.get(ruleId));
    }

    /**
     * All tracked rules, ordered by rule id.
     */
    public List<RuleEffectiveness> getAllEffectiveness() {
        return effectiveness.values().stream()
                .sorted(Comparator.comparing(RuleEffectiveness::ruleId))
                .toList();
    }

    public List<RuleEffectiveness> getEffectiveRules() {
        return withStatus(EffectivenessStatus.EFFECTIVE);
    }

    public List<RuleEffectiveness> getIneffectiveRules() {
        return withStatus(EffectivenessStatus.INEFFECTIVE);
    }

    public List<RuleEffectiveness> getRulesNeedingImprovement() {
        return withStatus(EffectivenessStatus.NEEDS_IMPROVEMENT);
    }

    public EffectivenessSummary getEffectivenessSummary() {
        List<RuleEffectiveness> all = getAllEffectiveness();
        if (all.isEmpty()) {
            return EffectivenessSummary.empty();
        }
        int effective = 0;
        int ineffective = 0;
        int needsImprovement = 0;
        for (RuleEffectiveness e : all) {
            switch (e.status()) {
                case EFFECTIVE -> effective++;
                case INEFFECTIVE -> ineffective++;
                case NEEDS_IMPROVEMENT -> needsImprovement++;
                default -> { }
            }
        }
        return new EffectivenessSummary(all.size(), effective, ineffective, needsImprovement,
                (double) effective / all.size());
    }

    public EffectivenessClassifier classifier() {
        return classifier;
    }

    /**
     * Administrative wipe of every record, in memory and in the store. Each rule is removed
     * under its own lock, so an update in flight either finishes before its rule is wiped
     * or starts a fresh record afterwards.
     */
    public void reset() {
        Set<String> ruleIds = new TreeSet<>(effectiveness.keySet());
        try {
            ruleIds.addAll(store.loadAll().keySet());
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Could not list persisted effectiveness records, wiping tracked rules only", e);
        }
        for (String ruleId : ruleIds) {
            locks.withLock(ruleId, () -> {
                effectiveness.remove(ruleId);
                try {
                    store.delete(ruleId);
                } catch (RuntimeException e) {
                    logger.log(Level.WARNING, "Failed to delete persisted effectiveness for rule " + ruleId, e);
                }
                return null;
            });
        }
        logger.info("Effectiveness records reset for " + ruleIds.size() + " rules");
    }

    private RuleEffectiveness recordFeedback(RuleEffectiveness current, boolean positive) {
        metrics.counter("rulepulse_feedback_total", "sentiment", positive ? "positive" : "negative").increment();
        return current.withFeedback(positive, clock.instant());
    }

    private RuleEffectiveness update(String ruleId,
                                     Supplier<RuleEffectiveness> initial,
                                     UnaryOperator<RuleEffectiveness> mutation) {
        return locks.withLock(ruleId, () -> {
            RuleEffectiveness existing = effectiveness.get(ruleId);
            RuleEffectiveness current = existing != null ? existing : initial.get();
            RuleEffectiveness mutated = mutation.apply(current);
            RuleEffectiveness classified = mutated.withStatus(classifier.classify(mutated));
            if (classified.status() != current.status()) {
                logger.fine(() -> "Rule " + ruleId + " status " + current.status() + " -> " + classified.status());
            }
            effectiveness.put(ruleId, classified);
            persist(classified);
            return classified;
        });
    }

    private void persist(RuleEffectiveness record) {
        try {
            store.save(record.ruleId(), record);
        } catch (RuntimeException e) {
            metrics.counter("rulepulse_persistence_failures_total", "store", "effectiveness").increment();
            logger.log(Level.WARNING, "Failed to persist effectiveness for rule " + record.ruleId(), e);
        }
    }

    private void publish(RuleEffectiveness record) {
        try {
            metricsSink.publish(RuleMetricsSnapshot.of(record));
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Community metrics sink rejected snapshot for rule " + record.ruleId(), e);
        }
    }

    private List<RuleEffectiveness> withStatus(EffectivenessStatus status) {
        return getAllEffectiveness().stream()
                .filter(e -> e.status() == status)
                .toList();
    }

    private void loadPersisted() {
        Map<String, RuleEffectiveness> persisted;
        try {
            persisted = store.loadAll();
        } catch (RuntimeException e) {
            logger.log(Level.WARNING, "Could not load persisted effectiveness records, starting empty", e);
            return;
        }
        persisted.values().forEach(record ->
                effectiveness.put(record.ruleId(), record.withStatus(classifier.classify(record))));
        if (!persisted.isEmpty()) {
            logger.info("Loaded effectiveness records for " + persisted.size() + " rules");
        }
    }
}
