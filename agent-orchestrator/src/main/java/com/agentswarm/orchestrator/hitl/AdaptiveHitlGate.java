package com.agentswarm.orchestrator.hitl;

import com.agentswarm.common.exception.LearningStoreUnavailableException;
import com.agentswarm.common.hitl.ActionClassifier;
import com.agentswarm.common.hitl.ConfidenceCalculator;
import com.agentswarm.common.model.ActionCategory;
import com.agentswarm.common.model.ActionRecord;
import com.agentswarm.common.model.PauseDecision;
import com.agentswarm.common.model.PendingAction;
import com.agentswarm.common.store.LearningStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.OptionalDouble;

/**
 * Decides whether an agent-initiated action must wait for human confirmation.
 *
 * <p>Rules in fixed precedence, the first match deciding:
 * <ol>
 *   <li>critical category or always-pause type: pause</li>
 *   <li>bulk target list at or above the bulk threshold: pause</li>
 *   <li>more attempts of the type inside the rate window than allowed: pause</li>
 *   <li>confidence below the pause threshold: pause, otherwise proceed</li>
 * </ol>
 *
 * <p>Every {@link #shouldPause} call counts as one rate-limit attempt. When the decision
 * store is unavailable the gate degrades to pausing only critical and always-pause
 * actions; it never throws for store failures.
 */
public class AdaptiveHitlGate {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveHitlGate.class);

    public static final double DEFAULT_PAUSE_THRESHOLD = 0.6;
    public static final int    DEFAULT_BULK_THRESHOLD  = 5;
    public static final String ENVIRONMENT_KEY         = "environment";

    private final LearningStore<ActionRecord> records;
    private final ActionRateLimiter           rateLimiter;
    private final Clock                       clock;
    private final double                      pauseThreshold;
    private final int                         bulkThreshold;

    public AdaptiveHitlGate(LearningStore<ActionRecord> records, ActionRateLimiter rateLimiter, Clock clock,
                            double pauseThreshold, int bulkThreshold) {
        this.records = records;
        this.rateLimiter = rateLimiter;
        this.clock = clock;
        this.pauseThreshold = pauseThreshold;
        this.bulkThreshold = bulkThreshold;
    }

    public ActionCategory classifyAction(PendingAction action) {
        return ActionClassifier.classify(action);
    }

    /** Pure read: repeated calls without an intervening {@link #recordDecision} return the same value. */
    public double calculateConfidence(PendingAction action, Map<String, ?> context) {
        return ConfidenceCalculator.calculate(action, classifyAction(action),
            getLearnedConfidence(action.type()), environmentOf(action, context));
    }

    public PauseDecision shouldPause(PendingAction action, Map<String, ?> context) {
        String type = action.type();
        int attempts = rateLimiter.recordAttempt(type);
        ActionCategory category = classifyAction(action);

        if (category == ActionCategory.CRITICAL || ActionClassifier.isAlwaysPause(type)) {
            return logged(PauseDecision.pause(
                String.format("Critical action '%s' always requires confirmation", type), ActionCategory.CRITICAL));
        }

        if (action.targets().size() >= bulkThreshold) {
            return logged(PauseDecision.pause(String.format(
                "Bulk operation affecting %d targets (threshold %d)", action.targets().size(), bulkThreshold),
                category));
        }

        if (rateLimiter.exceeds(attempts)) {
            return logged(PauseDecision.pause(String.format(
                "Rate limit: %d '%s' actions within %ds (max %d)",
                attempts, type, rateLimiter.getWindow().toSeconds(), rateLimiter.getMaxAttempts()), category));
        }

        OptionalDouble learned;
        try {
            learned = learnedFromStore(type);
        } catch (LearningStoreUnavailableException e) {
            log.warn("[HITL] decision store unavailable, degraded mode. type={} reason={}", type, e.getMessage());
            return logged(new PauseDecision(false,
                String.format("Degraded mode: '%s' is not critical, proceeding without learned confidence", type),
                category, null));
        }

        double confidence = ConfidenceCalculator.calculate(action, category, learned, environmentOf(action, context));
        if (confidence < pauseThreshold) {
            return logged(new PauseDecision(true, String.format(
                "Confidence %.2f below threshold %.2f for %s action '%s'", confidence, pauseThreshold, category, type),
                category, confidence));
        }
        return logged(new PauseDecision(false, String.format(
            "Confidence %.2f meets threshold %.2f", confidence, pauseThreshold), category, confidence));
    }

    /**
     * Appends the human decision on {@code action}.
     *
     * @return {@code false} when the store is unavailable and the decision was not persisted
     */
    public boolean recordDecision(PendingAction action, boolean approved, String feedback) {
        double confidenceAtTime = calculateConfidence(action, Map.of());
        ActionRecord record = new ActionRecord(action.type(), action.target(), action.environment(),
            action.targets(), approved, feedback, confidenceAtTime, clock.instant());
        try {
            records.append(record);
            log.info("[HITL] decision recorded type={} approved={} confidenceAtTime={}",
                     action.type(), approved, confidenceAtTime);
            return true;
        } catch (LearningStoreUnavailableException e) {
            log.warn("[HITL] decision not recorded, store unavailable. type={} reason={}",
                     action.type(), e.getMessage());
            return false;
        }
    }

    /** Decayed approval ratio of {@code actionType}; empty without history or when the store is unavailable. */
    public OptionalDouble getLearnedConfidence(String actionType) {
        try {
            return learnedFromStore(actionType);
        } catch (LearningStoreUnavailableException e) {
            log.warn("[HITL] learned confidence unavailable type={} reason={}", actionType, e.getMessage());
            return OptionalDouble.empty();
        }
    }

    public HitlStats getStats() {
        List<ActionRecord> all = safeQuery();
        int approvals = (int) all.stream().filter(r -> r.isResolved() && r.approved()).count();
        int rejections = (int) all.stream().filter(r -> r.isResolved() && !r.approved()).count();
        int total = approvals + rejections;
        return new HitlStats(total, approvals, rejections, total == 0 ? 0.0 : (double) approvals / total);
    }

    /** Newest first, at most {@code limit}. */
    public List<ActionRecord> getRecentDecisions(int limit) {
        List<ActionRecord> all = new ArrayList<>(safeQuery());
        Collections.reverse(all);
        return all.subList(0, Math.min(Math.max(limit, 0), all.size()));
    }

    private OptionalDouble learnedFromStore(String actionType) {
        List<ActionRecord> history = new ArrayList<>(records.query(r -> actionType.equals(r.actionType())));
        Collections.reverse(history);
        return ConfidenceCalculator.learnedConfidence(history);
    }

    private List<ActionRecord> safeQuery() {
        try {
            return records.query(r -> true);
        } catch (LearningStoreUnavailableException e) {
            log.warn("[HITL] decision store unavailable reason={}", e.getMessage());
            return List.of();
        }
    }

    private static String environmentOf(PendingAction action, Map<String, ?> context) {
        if (context != null && context.get(ENVIRONMENT_KEY) != null) {
            return String.valueOf(context.get(ENVIRONMENT_KEY));
        }
        return action.environment();
    }

    private static PauseDecision logged(PauseDecision decision) {
        log.debug("[HITL] pause={} category={} reason={}", decision.pause(), decision.category(), decision.reason());
        return decision;
    }
}
