/*
 * Copyright (c) 2025 RulePulse
 * Licensed under the Apache License, Version 2.0
 */
package com.rulepulse.validation.runtime.effectiveness;

import com.rulepulse.validation.api.model.EffectivenessStatus;
import com.rulepulse.validation.api.model.RuleEffectiveness;
import com.rulepulse.validation.infra.config.EffectivenessPolicy;

import java.util.Objects;

/**
 * Maps a rule's counters to an {@link EffectivenessStatus}.
 *
 * <p>The result depends only on the counters and the policy, never on history or call order.
 * Once both samples are large enough the checks run in this order:
 * <ol>
 *   <li>INEFFECTIVE when the negative-feedback ratio or the failure ratio reaches
 *       {@code ineffectiveRatio}, or positive feedback is below {@code mixedFeedbackFloor}</li>
 *   <li>NEEDS_IMPROVEMENT when positive feedback is below {@code effectiveRatio} or the
 *       pass/fail split is within {@code inconsistencyBand} of even</li>
 *   <li>EFFECTIVE otherwise</li>
 * </ol>
 */
public final class EffectivenessClassifier {

    private final EffectivenessPolicy policy;

    public EffectivenessClassifier(EffectivenessPolicy policy) {
        this.policy = Objects.requireNonNull(policy, "policy must not be null");
    }

    public EffectivenessPolicy policy() {
        return policy;
    }

    public EffectivenessStatus classify(RuleEffectiveness effectiveness) {
        long total = effectiveness.totalValidations();
        long feedback = effectiveness.feedbackCount();
        if (total == 0 && feedback == 0) {
            return EffectivenessStatus.UNKNOWN;
        }
        if (total < policy.minValidations() || feedback < policy.minFeedback()) {
            return EffectivenessStatus.UNKNOWN;
        }

        double positiveRatio = effectiveness.positiveFeedbackRatio();
        if (effectiveness.negativeFeedbackRatio() >= policy.ineffectiveRatio()
                || effectiveness.failureRate() >= policy.ineffectiveRatio()
                || (feedback > 0 && positiveRatio < policy.mixedFeedbackFloor())) {
            return EffectivenessStatus.INEFFECTIVE;
        }
        if (positiveRatio < policy.effectiveRatio() || isInconsistent(effectiveness)) {
            return EffectivenessStatus.NEEDS_IMPROVEMENT;
        }
        return EffectivenessStatus.EFFECTIVE;
    }

    /**
     * True when the rule both passes and fails and neither outcome clearly dominates.
     */
    public boolean isInconsistent(RuleEffectiveness effectiveness) {
        long total = effectiveness.totalValidations();
        if (total == 0 || effectiveness.passedValidations() == 0 || effectiveness.failedValidations() == 0) {
            return false;
        }
        double spread = Math.abs(effectiveness.passedValidations() - effectiveness.failedValidations());
        return spread / total <= policy.inconsistencyBand();
    }
}
