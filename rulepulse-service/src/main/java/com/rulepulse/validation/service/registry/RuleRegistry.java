/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.service.registry;

import com.rulepulse.validation.api.exceptions.DependencyException;
import com.rulepulse.validation.api.exceptions.DuplicateRuleException;
import com.rulepulse.validation.api.exceptions.RuleNotFoundException;
import com.rulepulse.validation.api.model.ValidationCategory;
import com.rulepulse.validation.api.model.ValidationRule;

import java.util.ArrayList;
import java.util.Collection;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.UnaryOperator;

/**
 * Registered rules in registration order, with a category index.
 *
 * <p><b>Thread Safety:</b> guarded by a read-write lock; readers get copies and never see a
 * rule half-replaced. Rules are immutable, so returned instances can be used freely.
 */
public class RuleRegistry {

    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();
    private final Map<String, ValidationRule> rules = new LinkedHashMap<>();
    private final Map<ValidationCategory, Set<String>> categoryIndex = new EnumMap<>(ValidationCategory.class);

    /**
     * @throws DuplicateRuleException if a rule with the same id is registered
     */
    public void add(ValidationRule rule) {
        lock.writeLock().lock();
        try {
            if (rules.containsKey(rule.id())) {
                throw new DuplicateRuleException(rule.id());
            }
            rules.put(rule.id(), rule);
            index(rule);
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * @throws RuleNotFoundException if no rule has this id
     * @throws DependencyException   if another registered rule depends on it
     */
    public ValidationRule remove(String ruleId) {
        lock.writeLock().lock();
        try {
            ValidationRule existing = rules.get(ruleId);
            if (existing == null) {
                throw new RuleNotFoundException(ruleId);
            }
            Set<String> dependents = dependentsOf(ruleId);
            if (!dependents.isEmpty()) {
                throw new DependencyException(ruleId, dependents);
            }
            rules.remove(ruleId);
            unindex(existing);
            return existing;
        } finally {
            lock.writeLock().unlock();
        }
    }

    /**
     * Replaces a registered rule, keeping its registration position.
     *
     * @throws RuleNotFoundException if no rule has this id
     */
    public ValidationRule replace(ValidationRule rule) {
        return update(rule.id(), existing -> rule);
    }

    /**
     * Atomically applies {@code change} to a registered rule. The change must keep the id.
     *
     * @throws RuleNotFoundException if no rule has this id
     */
    public ValidationRule update(String ruleId, UnaryOperator<ValidationRule> change) {
        lock.writeLock().lock();
        try {
            ValidationRule existing = rules.get(ruleId);
            if (existing == null) {
                throw new RuleNotFoundException(ruleId);
            }
            ValidationRule updated = change.apply(existing);
            if (!updated.id().equals(ruleId)) {
                throw new IllegalArgumentException("Rule update changed id from '" + ruleId + "' to '" + updated.id() + "'");
            }
            rules.put(ruleId, updated);
            if (updated.category() != existing.category()) {
                unindex(existing);
                reindex(updated.category());
            }
            return updated;
        } finally {
            lock.writeLock().unlock();
        }
    }

    public Optional<ValidationRule> find(String ruleId) {
        lock.readLock().lock();
        try {
            return Optional.ofNullable(rules.get(ruleId));
        } finally {
            lock.readLock().unlock();
        }
    }

    public ValidationRule require(String ruleId) {
        return find(ruleId).orElseThrow(() -> new RuleNotFoundException(ruleId));
    }

    public boolean contains(String ruleId) {
        lock.readLock().lock();
        try {
            return rules.containsKey(ruleId);
        } finally {
            lock.readLock().unlock();
        }
    }

    public List<ValidationRule> all() {
        lock.readLock().lock();
        try {
            return List.copyOf(rules.values());
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Enabled and disabled rules of one category, in registration order.
     */
    public List<ValidationRule> inCategory(ValidationCategory category) {
        lock.readLock().lock();
        try {
            Set<String> ids = categoryIndex.getOrDefault(category, Set.of());
            List<ValidationRule> result = new ArrayList<>(ids.size());
            for (String id : ids) {
                result.add(rules.get(id));
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    /**
     * Rules of any of the given categories, in registration order.
     */
    public List<ValidationRule> inCategories(Collection<ValidationCategory> categories) {
        lock.readLock().lock();
        try {
            Set<String> selected = new HashSet<>();
            for (ValidationCategory category : categories) {
                selected.addAll(categoryIndex.getOrDefault(category, Set.of()));
            }
            List<ValidationRule> result = new ArrayList<>(selected.size());
            for (ValidationRule rule : rules.values()) {
                if (selected.contains(rule.id())) {
                    result.add(rule);
                }
            }
            return result;
        } finally {
            lock.readLock().unlock();
        }
    }

    public Set<String> ids() {
        lock.readLock().lock();
        try {
            return Set.copyOf(rules.keySet());
        } finally {
            lock.readLock().unlock();
        }
    }

    public int size() {
        lock.readLock().lock();
        try {
            return rules.size();
        } finally {
            lock.readLock().unlock();
        }
    }

    private Set<String> dependentsOf(String ruleId) {
        Set<String> dependents = new TreeSet<>();
        for (ValidationRule candidate : rules.values()) {
            if (!candidate.id().equals(ruleId) && candidate.dependencies().contains(ruleId)) {
                dependents.add(candidate.id());
            }
        }
        return dependents;
    }

    private void index(ValidationRule rule) {
        categoryIndex.computeIfAbsent(rule.category(), c -> new LinkedHashSet<>()).add(rule.id());
    }

    // Rebuilds one category in registration order after a rule moved into it.
    private void reindex(ValidationCategory category) {
        Set<String> ids = new LinkedHashSet<>();
        for (ValidationRule rule : rules.values()) {
            if (rule.category() == category) {
                ids.add(rule.id());
            }
        }
        categoryIndex.put(category, ids);
    }

    private void unindex(ValidationRule rule) {
        Set<String> ids = categoryIndex.get(rule.category());
        if (ids != null) {
            ids.remove(rule.id());
            if (ids.isEmpty()) {
                categoryIndex.remove(rule.category());
            }
        }
    }
}
