package com.agentswarm.common.hitl;

import com.agentswarm.common.model.ActionCategory;
import com.agentswarm.common.model.ActionRecord;
import com.agentswarm.common.model.PendingAction;

import java.util.List;
import java.util.Locale;
import java.util.OptionalDouble;

/**
 * Pure logic class: confidence that an action may run without a human in the loop.
 *
 * <p>confidence = prior(category), blended {@value #BASE_WEIGHT}/{@value #LEARNED_WEIGHT}
 * with the learned approval ratio when history exists, then scaled by environment and
 * target sensitivity and clamped to [0, 1]. An explicit override short-circuits everything.
 *
 * <p>No I/O. No logging. No Spring.
 */
public final class ConfidenceCalculator {

    public static final double BASE_WEIGHT    = 0.3;
    public static final double LEARNED_WEIGHT = 0.7;

    public static final double PRODUCTION_FACTOR       = 0.7;
    public static final double DEVELOPMENT_FACTOR      = 1.1;
    public static final double SENSITIVE_TARGET_FACTOR = 0.8;

    public static final double LEARNING_DECAY   = 0.9;
    public static final int    LEARNING_HISTORY = 50;

    private static final List<String> SENSITIVE_TARGET_MARKERS = List.of("prod", "main", "master");

    private ConfidenceCalculator() {}

    public static double basePrior(ActionCategory category) {
        return switch (category) {
            case SAFE        -> 0.9;
            case MODERATE    -> 0.6;
            case DESTRUCTIVE -> 0.3;
            case CRITICAL    -> 0.1;
        };
    }

    /**
     * @param action      the pending action
     * @param category    its classified category
     * @param learned     learned approval ratio for the action type, empty without history
     * @param environment deployment environment ({@code production}, {@code development}, ...), may be null
     */
    public static double calculate(PendingAction action, ActionCategory category,
                                   OptionalDouble learned, String environment) {
        if (action.confidenceOverride() != null) {
            return clamp(action.confidenceOverride());
        }

        double confidence = basePrior(category);
        if (learned.isPresent()) {
            confidence = BASE_WEIGHT * confidence + LEARNED_WEIGHT * learned.getAsDouble();
        }

        if (environment != null) {
            String env = environment.toLowerCase(Locale.ROOT);
            if (env.equals("production")) {
                confidence *= PRODUCTION_FACTOR;
            } else if (env.equals("development")) {
                confidence *= DEVELOPMENT_FACTOR;
            }
        }

        if (isSensitiveTarget(action.target())) {
            confidence *= SENSITIVE_TARGET_FACTOR;
        }

        return clamp(confidence);
    }

    /**
     * Decayed approval ratio over the newest {@value #LEARNING_HISTORY} resolved records,
     * newest weighted 1.0, each older one {@value #LEARNING_DECAY} times the previous.
     *
     * @param newestFirst records of a single action type, newest first
     */
    public static OptionalDouble learnedConfidence(List<ActionRecord> newestFirst) {
        double approved = 0.0;
        double total = 0.0;
        double weight = 1.0;
        int used = 0;
        for (ActionRecord record : newestFirst) {
            if (!record.isResolved()) {
                continue;
            }
            if (used++ == LEARNING_HISTORY) {
                break;
            }
            if (record.approved()) {
                approved += weight;
            }
            total += weight;
            weight *= LEARNING_DECAY;
        }
        return total == 0.0 ? OptionalDouble.empty() : OptionalDouble.of(approved / total);
    }

    public static boolean isSensitiveTarget(String target) {
        if (target == null) {
            return false;
        }
        String t = target.toLowerCase(Locale.ROOT);
        return SENSITIVE_TARGET_MARKERS.stream().anyMatch(t::contains);
    }

    private static double clamp(double value) {
        return Math.max(0.0, Math.min(1.0, value));
    }
}
