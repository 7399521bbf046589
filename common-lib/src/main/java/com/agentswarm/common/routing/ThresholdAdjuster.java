package com.agentswarm.common.routing;

import com.agentswarm.common.model.RoutingThreshold;
import com.agentswarm.common.model.TaskOutcome;

import java.time.Duration;
import java.time.Instant;
import java.util.Comparator;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Pure logic class: recomputes a domain's routing threshold from its recorded
 * task outcomes.
 *
 * <p>The trailing window holds the last {@value #WINDOW_SIZE} outcomes of the domain
 * recorded within {@link #WINDOW_AGE}, newest first. Each position is weighted by
 * {@value #DECAY}<sup>position</sup>.
 *
 * <p>Adjustment rules:
 * <ul>
 *   <li>A streak of {@value #STREAK_LENGTH} cheap-path failures lowers the threshold by
 *       {@value #LEARNING_RATE}: the domain needs its agent more often.</li>
 *   <li>A streak of {@value #STREAK_LENGTH} cheap-path successes with quality at least
 *       {@value #MIN_QUALITY} raises it by {@value #LEARNING_RATE}.</li>
 *   <li>The direction must agree with the outcome just recorded, so a failure never
 *       raises and a success never lowers the threshold.</li>
 *   <li>The result is clamped to [{@link RoutingThreshold#THRESHOLD_MIN},
 *       {@link RoutingThreshold#THRESHOLD_MAX}].</li>
 * </ul>
 *
 * <p>No I/O. No logging. No Spring.
 */
public final class ThresholdAdjuster {

    public static final double   LEARNING_RATE     = 0.1;
    public static final int      STREAK_LENGTH     = 3;
    public static final double   MIN_QUALITY       = 0.6;
    public static final double   DECAY             = 0.95;
    public static final int      WINDOW_SIZE       = 100;
    public static final Duration WINDOW_AGE        = Duration.ofDays(30);
    public static final int      MIN_SAMPLES       = 5;
    public static final double   SIGNIFICANT_DELTA = 0.05;

    public enum StreakKind { FAILURE, SUFFICIENT, NONE }

    public record Streak(StreakKind kind, int length) {
        static final Streak NONE = new Streak(StreakKind.NONE, 0);
    }

    /**
     * @param newThreshold  threshold after the step and clamp
     * @param successRate   decayed success rate over the window
     * @param sampleCount   outcomes in the window
     * @param streak        streak observed at the head of the window
     * @param reason        human-readable explanation of the step ("no change" when none)
     */
    public record Adjustment(
        double newThreshold,
        double successRate,
        int    sampleCount,
        Streak streak,
        String reason
    ) {
        public boolean isSignificantChange(double oldThreshold) {
            return Math.abs(newThreshold - oldThreshold) >= SIGNIFICANT_DELTA;
        }
    }

    private ThresholdAdjuster() {}

    /** Outcomes of the window: within {@link #WINDOW_AGE} of {@code now}, newest first, at most {@link #WINDOW_SIZE}. */
    public static List<TaskOutcome> window(List<TaskOutcome> domainOutcomes, Instant now) {
        Instant cutoff = now.minus(WINDOW_AGE);
        return domainOutcomes.stream()
            .filter(o -> o.timestamp() != null && !o.timestamp().isBefore(cutoff))
            .sorted(Comparator.comparing(TaskOutcome::timestamp).reversed())
            .limit(WINDOW_SIZE)
            .collect(Collectors.toList());
    }

    public static double decayedSuccessRate(List<TaskOutcome> newestFirst) {
        double weighted = 0.0;
        double total = 0.0;
        double weight = 1.0;
        for (TaskOutcome outcome : newestFirst) {
            if (outcome.success()) {
                weighted += weight;
            }
            total += weight;
            weight *= DECAY;
        }
        return total == 0.0 ? 0.0 : weighted / total;
    }

    /**
     * Consecutive cheap-path outcomes at the head of the window sharing a verdict.
     * Agent-loaded outcomes are skipped; a low-quality success ends the streak.
     */
    public static Streak detectStreak(List<TaskOutcome> newestFirst) {
        StreakKind kind = StreakKind.NONE;
        int length = 0;
        for (TaskOutcome outcome : newestFirst) {
            if (outcome.agentLoaded()) {
                continue;
            }
            StreakKind verdict = verdictOf(outcome);
            if (verdict == StreakKind.NONE) {
                break;
            }
            if (kind == StreakKind.NONE) {
                kind = verdict;
            } else if (kind != verdict) {
                break;
            }
            length++;
        }
        return length == 0 ? Streak.NONE : new Streak(kind, length);
    }

    /**
     * Recomputes the threshold after {@code latest} was appended.
     *
     * @param current         threshold before the outcome
     * @param domainOutcomes  every stored outcome of the domain, {@code latest} included
     * @param latest          the outcome that triggered the recomputation
     * @param now             evaluation instant
     */
    public static Adjustment adjust(RoutingThreshold current, List<TaskOutcome> domainOutcomes,
                                    TaskOutcome latest, Instant now) {
        List<TaskOutcome> window = window(domainOutcomes, now);
        double successRate = decayedSuccessRate(window);
        Streak streak = detectStreak(window);

        double threshold = current.currentThreshold();
        String reason = "no change";
        if (streak.length() >= STREAK_LENGTH) {
            if (streak.kind() == StreakKind.FAILURE && !latest.success()) {
                threshold -= LEARNING_RATE;
                reason = String.format("%d consecutive cheap-path failures, lowering threshold", streak.length());
            } else if (streak.kind() == StreakKind.SUFFICIENT && latest.success()) {
                threshold += LEARNING_RATE;
                reason = String.format("%d consecutive sufficient cheap-path results, raising threshold",
                    streak.length());
            }
        }
        return new Adjustment(clamp(round(threshold)), successRate, window.size(), streak, reason);
    }

    public static double clamp(double threshold) {
        return Math.max(RoutingThreshold.THRESHOLD_MIN, Math.min(RoutingThreshold.THRESHOLD_MAX, threshold));
    }

    private static StreakKind verdictOf(TaskOutcome outcome) {
        if (!outcome.success()) {
            return StreakKind.FAILURE;
        }
        return outcome.qualityScore() >= MIN_QUALITY ? StreakKind.SUFFICIENT : StreakKind.NONE;
    }

    private static double round(double value) {
        return Math.round(value * 100.0) / 100.0;
    }
}
