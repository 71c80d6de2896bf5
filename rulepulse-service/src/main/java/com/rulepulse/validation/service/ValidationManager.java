/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.service;

import com.rulepulse.validation.api.exceptions.InvalidParameterException;
import com.rulepulse.validation.api.exceptions.RuleNotFoundException;
import com.rulepulse.validation.api.exceptions.ValidationExecutionException;
import com.rulepulse.validation.api.model.CheckOutcome;
import com.rulepulse.validation.api.model.EffectivenessSummary;
import com.rulepulse.validation.api.model.OptimizationResult;
import com.rulepulse.validation.api.model.OptimizationStrategy;
import com.rulepulse.validation.api.model.OptimizationHistory;
import com.rulepulse.validation.api.model.OptimizationSummary;
import com.rulepulse.validation.api.model.RuleEffectiveness;
import com.rulepulse.validation.api.model.RuleImprovement;
import com.rulepulse.validation.api.model.RuleTestReport;
import com.rulepulse.validation.api.model.ValidationCategory;
import com.rulepulse.validation.api.model.ValidationResult;
import com.rulepulse.validation.api.model.ValidationRule;
import com.rulepulse.validation.api.model.ValidationSummary;
import com.rulepulse.validation.infra.metrics.MetricsRegistry;
import com.rulepulse.validation.infra.persistence.InMemoryRecordStore;
import com.rulepulse.validation.infra.persistence.JsonFileRecordStore;
import com.rulepulse.validation.infra.persistence.RecordStore;
import com.rulepulse.validation.optimizer.analysis.ImprovementContext;
import com.rulepulse.validation.optimizer.analysis.RuleImprovementGenerator;
import com.rulepulse.validation.optimizer.optimization.ParameterRangeTable;
import com.rulepulse.validation.optimizer.optimization.RuleParameterOptimizer;
import com.rulepulse.validation.runtime.effectiveness.RuleEffectivenessTracker;
import com.rulepulse.validation.runtime.metrics.CommunityMetricsRecorder;
import com.rulepulse.validation.service.export.ExportFormat;
import com.rulepulse.validation.service.export.OptimizationHistoryExporter;
import com.rulepulse.validation.service.registry.RuleRegistry;
import com.rulepulse.validation.service.selftest.RuleSelfTestRunner;
import io.opentelemetry.api.trace.Span;
import io.opentelemetry.api.trace.Tracer;
import io.opentelemetry.context.Scope;

import java.io.Reader;
import java.io.Writer;
import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Entry point for registering rules, running them and acting on their effectiveness.
 *
 * <p>This service handles:
 * <ul>
 *   <li>Rule registration, replacement and removal</li>
 *   <li>Validation runs, with every outcome forwarded to the effectiveness tracker</li>
 *   <li>Rule self-tests</li>
 *   <li>User feedback</li>
 *   <li>Improvement suggestions and parameter optimization</li>
 *   <li>Optimization history export and import</li>
 * </ul>
 *
 * <p><b>Thread Safety:</b> all methods may be called concurrently. Rule checks run on the
 * caller's thread, outside any registry lock.
 */
public class ValidationManager {

    private static final Logger logger = Logger.getLogger(ValidationManager.class.getName());

    private final RuleRegistry registry;
    private final RuleEffectivenessTracker tracker;
    private final RuleImprovementGenerator improvementGenerator;
    private final RuleParameterOptimizer optimizer;
    private final OptimizationHistoryExporter exporter;
    private final RuleSelfTestRunner selfTestRunner;
    private final Tracer tracer;
    private final MetricsRegistry metrics;

    public ValidationManager(RuleEffectivenessTracker tracker,
                             RuleParameterOptimizer optimizer,
                             Tracer tracer) {
        this(new RuleRegistry(), tracker, new RuleImprovementGenerator(), optimizer,
                new OptimizationHistoryExporter(tracer), new RuleSelfTestRunner(), tracer,
                MetricsRegistry.getInstance());
    }

    public ValidationManager(RuleRegistry registry,
                             RuleEffectivenessTracker tracker,
                             RuleImprovementGenerator improvementGenerator,
                             RuleParameterOptimizer optimizer,
                             OptimizationHistoryExporter exporter,
                             RuleSelfTestRunner selfTestRunner,
                             Tracer tracer,
                             MetricsRegistry metrics) {
        this.registry = Objects.requireNonNull(registry, "registry must not be null");
        this.tracker = Objects.requireNonNull(tracker, "tracker must not be null");
        this.improvementGenerator = Objects.requireNonNull(improvementGenerator, "improvementGenerator must not be null");
        this.optimizer = Objects.requireNonNull(optimizer, "optimizer must not be null");
        this.exporter = Objects.requireNonNull(exporter, "exporter must not be null");
        this.selfTestRunner = Objects.requireNonNull(selfTestRunner, "selfTestRunner must not be null");
        this.tracer = Objects.requireNonNull(tracer, "tracer must not be null");
        this.metrics = metrics != null ? metrics : MetricsRegistry.noop();
    }

    /**
     * Wires a manager from configuration. Effectiveness snapshots are published to a
     * {@link CommunityMetricsRecorder} backed by the discovered metrics registry.
     */
    public static ValidationManager create(ValidationEngineConfig config, Tracer tracer) {
        MetricsRegistry metrics = MetricsRegistry.getInstance();
        return create(config, tracer, new CommunityMetricsRecorder(metrics), metrics);
    }

    public static ValidationManager create(ValidationEngineConfig config,
                                           Tracer tracer,
                                           CommunityMetricsRecorder recorder,
                                           MetricsRegistry metrics) {
        RecordStore<RuleEffectiveness> effectivenessStore;
        RecordStore<OptimizationHistory> historyStore;
        if (config.persistenceMode() == ValidationEngineConfig.PersistenceMode.FILE) {
            effectivenessStore = new JsonFileRecordStore<>(config.effectivenessDir(), RuleEffectiveness.class);
            historyStore = new JsonFileRecordStore<>(config.historyDir(), OptimizationHistory.class);
        } else {
            effectivenessStore = new InMemoryRecordStore<>();
            historyStore = new InMemoryRecordStore<>();
        }
        logger.info("Creating validation manager: " + config);

        RuleEffectivenessTracker tracker = new RuleEffectivenessTracker(
                effectivenessStore, recorder, config.policy(), metrics, Clock.systemUTC());
        RuleParameterOptimizer optimizer = new RuleParameterOptimizer(
                ParameterRangeTable.defaults(), tracer, historyStore, config.maxHistoryPerRule(), Clock.systemUTC());
        return new ValidationManager(new RuleRegistry(), tracker, new RuleImprovementGenerator(), optimizer,
                new OptimizationHistoryExporter(tracer), new RuleSelfTestRunner(), tracer, metrics);
    }

    // ========================================================================
    // RULES
    // ========================================================================

    public void addRule(ValidationRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        registry.add(rule);
        logger.fine("Registered rule '" + rule.id() + "' in " + rule.category());
    }

    /**
     * Unregisters a rule. Its effectiveness record and optimization history are kept.
     */
    public ValidationRule removeRule(String ruleId) {
        ValidationRule removed = registry.remove(ruleId);
        logger.fine("Removed rule '" + ruleId + "'");
        return removed;
    }

    public Optional<ValidationRule> getRule(String ruleId) {
        return registry.find(ruleId);
    }

    public List<ValidationRule> getRules() {
        return registry.all();
    }

    public List<ValidationRule> getRulesByCategory(ValidationCategory category) {
        return registry.inCategory(category);
    }

    public ValidationRule updateRule(ValidationRule rule) {
        Objects.requireNonNull(rule, "rule must not be null");
        return registry.replace(rule);
    }

    public ValidationRule setRuleEnabled(String ruleId, boolean enabled) {
        return registry.update(ruleId, rule -> rule.withEnabled(enabled));
    }

    // ========================================================================
    // VALIDATION
    // ========================================================================

    public ValidationSummary validate(Map<String, Object> input) {
        return execute("validate", registry.all(), input);
    }

    /**
     * Runs the enabled rules of the given categories.
     *
     * @throws IllegalArgumentException if {@code categories} is empty or holds a null
     */
    public ValidationSummary validate(Map<String, Object> input, Collection<ValidationCategory> categories) {
        Set<ValidationCategory> selected = requireCategories(categories);
        return execute("validate-categories", registry.inCategories(selected), input);
    }

    /**
     * Runs the named rules in the given order, skipping disabled ones.
     *
     * @throws RuleNotFoundException if any id is not registered
     */
    public ValidationSummary validateRules(Map<String, Object> input, Collection<String> ruleIds) {
        Objects.requireNonNull(ruleIds, "ruleIds must not be null");
        List<ValidationRule> rules = new ArrayList<>();
        for (String ruleId : new LinkedHashSet<>(ruleIds)) {
            rules.add(registry.require(ruleId));
        }
        return execute("validate-rules", rules, input);
    }

    private ValidationSummary execute(String spanName, List<ValidationRule> rules, Map<String, Object> input) {
        Objects.requireNonNull(input, "input must not be null");
        Span span = tracer.spanBuilder(spanName).startSpan();
        try (Scope scope = span.makeCurrent()) {
            long start = System.nanoTime();
            Map<String, Object> view = Collections.unmodifiableMap(input);
            List<ValidationResult> results = new ArrayList<>(rules.size());
            for (ValidationRule rule : rules) {
                if (rule.enabled()) {
                    results.add(executeRule(rule, view));
                }
            }
            Duration elapsed = Duration.ofNanos(System.nanoTime() - start);
            metrics.timer("rulepulse_validation_duration").record(elapsed);

            ValidationSummary summary = new ValidationSummary(results, elapsed);
            span.setAttribute("rules", results.size());
            span.setAttribute("failures", summary.failedResults().size());
            return summary;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    private ValidationResult executeRule(ValidationRule rule, Map<String, Object> input) {
        ValidationResult result;
        try {
            CheckOutcome outcome = rule.check().check(rule, input);
            if (outcome == null) {
                throw new IllegalStateException("check returned no outcome");
            }
            result = ValidationResult.of(rule, outcome);
        } catch (Exception e) {
            if (e instanceof InterruptedException) {
                Thread.currentThread().interrupt();
            }
            ValidationExecutionException failure = new ValidationExecutionException(rule.id(), e);
            logger.log(Level.WARNING, failure.getMessage(), failure);
            metrics.counter("rulepulse_rule_execution_failures_total", "rule", rule.id()).increment();
            result = ValidationResult.executionFailure(rule, failure.getMessage());
        }
        tracker.trackValidation(rule, result.passed(), result.severity());
        return result;
    }

    // ========================================================================
    // SELF-TESTS
    // ========================================================================

    public Map<ValidationCategory, Map<String, List<RuleTestReport>>> runTests() {
        return runTests(registry.all());
    }

    /**
     * @throws IllegalArgumentException if {@code categories} is empty or holds a null
     */
    public Map<ValidationCategory, Map<String, List<RuleTestReport>>> runTests(Collection<ValidationCategory> categories) {
        return runTests(registry.inCategories(requireCategories(categories)));
    }

    // Enabled rules with at least one test case; effectiveness is left untouched.
    private Map<ValidationCategory, Map<String, List<RuleTestReport>>> runTests(List<ValidationRule> rules) {
        Map<ValidationCategory, Map<String, List<RuleTestReport>>> reports = new EnumMap<>(ValidationCategory.class);
        for (ValidationRule rule : rules) {
            if (!rule.enabled() || rule.testCases().isEmpty()) {
                continue;
            }
            reports.computeIfAbsent(rule.category(), c -> new LinkedHashMap<>())
                    .put(rule.name(), selfTestRunner.run(rule));
        }
        return reports;
    }

    // ========================================================================
    // FEEDBACK
    // ========================================================================

    public RuleEffectiveness addRuleFeedback(String ruleId, boolean positive) {
        return addRuleFeedback(ruleId, positive, null);
    }

    /**
     * @throws RuleNotFoundException if the rule is not registered
     */
    public RuleEffectiveness addRuleFeedback(String ruleId, boolean positive, String feedbackText) {
        ValidationRule rule = registry.require(ruleId);
        if (feedbackText != null && !feedbackText.isBlank()) {
            logger.info(String.format("%s feedback for rule '%s': %s",
                    positive ? "Positive" : "Negative", ruleId, feedbackText));
        }
        return tracker.addFeedback(rule, positive);
    }

    // ========================================================================
    // IMPROVEMENTS
    // ========================================================================

    /**
     * @throws RuleNotFoundException if the rule is not registered
     */
    public List<RuleImprovement> getRuleImprovements(String ruleId) {
        return improvementGenerator.generateImprovements(contextFor(registry.require(ruleId)));
    }

    public List<RuleImprovement> getHighPriorityImprovements() {
        return improvementGenerator.generateImprovements(contextsFor(registry.all())).stream()
                .filter(RuleImprovement::isHighPriority)
                .toList();
    }

    public List<RuleImprovement> getImprovementsByCategory(ValidationCategory category) {
        return improvementGenerator.generateImprovements(contextsFor(registry.inCategory(category)));
    }

    private List<ImprovementContext> contextsFor(List<ValidationRule> rules) {
        Set<String> registered = registry.ids();
        List<ImprovementContext> contexts = new ArrayList<>(rules.size());
        for (ValidationRule rule : rules) {
            contexts.add(ImprovementContext.of(rule, effectivenessOf(rule), registered));
        }
        return contexts;
    }

    private ImprovementContext contextFor(ValidationRule rule) {
        return ImprovementContext.of(rule, effectivenessOf(rule), registry.ids());
    }

    private RuleEffectiveness effectivenessOf(ValidationRule rule) {
        return tracker.getRuleEffectiveness(rule.id()).orElseGet(() -> RuleEffectiveness.empty(rule));
    }

    // ========================================================================
    // OPTIMIZATION
    // ========================================================================

    /**
     * @return improving candidates, best first
     * @throws RuleNotFoundException if the rule is not registered
     */
    public List<OptimizationResult> optimizeRuleParameters(String ruleId, OptimizationStrategy strategy) {
        ValidationRule rule = registry.require(ruleId);
        return optimizer.optimizeParameters(rule, effectivenessOf(rule), strategy);
    }

    /**
     * Optimizes several rules with one strategy.
     *
     * @return results per rule id, in the given order
     * @throws RuleNotFoundException if any id is not registered; no rule is optimized then
     */
    public Map<String, List<OptimizationResult>> optimizeRules(Collection<String> ruleIds, OptimizationStrategy strategy) {
        Objects.requireNonNull(ruleIds, "ruleIds must not be null");
        List<ValidationRule> rules = new ArrayList<>();
        for (String ruleId : new LinkedHashSet<>(ruleIds)) {
            rules.add(registry.require(ruleId));
        }
        Span span = tracer.spanBuilder("optimize-rules").startSpan();
        try (Scope scope = span.makeCurrent()) {
            span.setAttribute("rules", rules.size());
            span.setAttribute("strategy", String.valueOf(strategy));

            Map<String, List<OptimizationResult>> results = new LinkedHashMap<>();
            for (ValidationRule rule : rules) {
                results.put(rule.id(), optimizer.optimizeParameters(rule, effectivenessOf(rule), strategy));
            }
            return results;
        } catch (RuntimeException e) {
            span.recordException(e);
            throw e;
        } finally {
            span.end();
        }
    }

    public List<OptimizationResult> getOptimizationHistory(String ruleId) {
        return optimizer.getOptimizationHistory(ruleId);
    }

    public Optional<OptimizationResult> getBestOptimization(String ruleId) {
        return optimizer.getBestOptimization(ruleId);
    }

    public OptimizationSummary getOptimizationSummary(String ruleId) {
        return optimizer.getOptimizationSummary(ruleId);
    }

    /**
     * Writes the optimized value back onto the rule.
     *
     * @return false, leaving the rule untouched, when the result targets another rule or a
     *         parameter the rule does not declare
     * @throws RuleNotFoundException if the rule is not registered
     */
    public boolean applyOptimization(String ruleId, OptimizationResult result) {
        Objects.requireNonNull(result, "result must not be null");
        if (!ruleId.equals(result.ruleId())) {
            logger.warning(String.format("Refusing to apply optimization for rule '%s' to rule '%s'",
                    result.ruleId(), ruleId));
            return false;
        }
        try {
            registry.update(ruleId, rule -> rule.withParameter(result.parameterName(), result.optimizedValue()));
        } catch (InvalidParameterException e) {
            logger.warning(e.getMessage());
            return false;
        }
        logger.info(String.format("Applied optimization to rule '%s': %s %s -> %s",
                ruleId, result.parameterName(), result.originalValue(), result.optimizedValue()));
        return true;
    }

    // ========================================================================
    // EFFECTIVENESS
    // ========================================================================

    public Optional<RuleEffectiveness> getRuleEffectiveness(String ruleId) {
        return tracker.getRuleEffectiveness(ruleId);
    }

    public List<RuleEffectiveness> getAllEffectiveness() {
        return tracker.getAllEffectiveness();
    }

    public List<RuleEffectiveness> getEffectiveRules() {
        return tracker.getEffectiveRules();
    }

    public List<RuleEffectiveness> getIneffectiveRules() {
        return tracker.getIneffectiveRules();
    }

    public List<RuleEffectiveness> getRulesNeedingImprovement() {
        return tracker.getRulesNeedingImprovement();
    }

    public EffectivenessSummary getEffectivenessSummary() {
        return tracker.getEffectivenessSummary();
    }

    public void resetEffectiveness() {
        tracker.reset();
    }

    // ========================================================================
    // EXPORT
    // ========================================================================

    /**
     * @throws RuleNotFoundException       if the rule is not registered
     * @throws java.io.UncheckedIOException if the writer fails
     */
    public void exportOptimizationHistory(String ruleId, ExportFormat format, Writer writer) {
        ValidationRule rule = registry.require(ruleId);
        exporter.export(ruleId, rule.name(), optimizer.getOptimizationHistory(ruleId), format, writer);
    }

    /**
     * Appends an exported history to the rule's own.
     *
     * @return number of imported results
     * @throws RuleNotFoundException       if the rule is not registered
     * @throws IllegalArgumentException    if the document belongs to another rule
     * @throws java.io.UncheckedIOException if the reader fails
     */
    public int importOptimizationHistory(String ruleId, ExportFormat format, Reader reader) {
        registry.require(ruleId);
        List<OptimizationResult> imported = exporter.importHistory(ruleId, format, reader);
        optimizer.recordHistory(ruleId, imported);
        logger.info("Imported " + imported.size() + " optimization results for rule '" + ruleId + "'");
        return imported.size();
    }

    private static Set<ValidationCategory> requireCategories(Collection<ValidationCategory> categories) {
        if (categories == null || categories.isEmpty()) {
            throw new IllegalArgumentException("categories must not be empty");
        }
        Set<ValidationCategory> selected = EnumSet.noneOf(ValidationCategory.class);
        for (ValidationCategory category : categories) {
            if (category == null) {
                throw new IllegalArgumentException("categories must not contain null");
            }
            selected.add(category);
        }
        return selected;
    }
}
