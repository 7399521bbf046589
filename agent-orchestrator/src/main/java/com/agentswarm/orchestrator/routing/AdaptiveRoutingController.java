package com.agentswarm.orchestrator.routing;

import com.agentswarm.common.exception.LearningStoreUnavailableException;
import com.agentswarm.common.model.RoutingDecision;
import com.agentswarm.common.model.RoutingThreshold;
import com.agentswarm.common.model.TaskOutcome;
import com.agentswarm.common.model.ThresholdChange;
import com.agentswarm.common.routing.DomainStats;
import com.agentswarm.common.routing.ThresholdAdjuster;
import com.agentswarm.common.store.LearningStore;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicReference;
import java.util.stream.Collectors;

/**
 * Decides per domain whether a task is complex enough to warrant loading a specialized
 * agent, and learns the threshold from recorded task outcomes.
 *
 * <p>The learning math lives in {@link ThresholdAdjuster}; this class wires it to the
 * stores. A store failure never propagates: decisions fall back to the base threshold
 * and outcome recording is skipped with a WARN log.
 */
public class AdaptiveRoutingController {

    private static final Logger log = LoggerFactory.getLogger(AdaptiveRoutingController.class);

    static final String RESET_REASON = "manual reset";

    private final LearningStore<TaskOutcome>      outcomes;
    private final LearningStore<RoutingThreshold> thresholds;
    private final LearningStore<ThresholdChange>  changes;
    private final Clock                           clock;

    public AdaptiveRoutingController(LearningStore<TaskOutcome> outcomes,
                                     LearningStore<RoutingThreshold> thresholds,
                                     LearningStore<ThresholdChange> changes,
                                     Clock clock) {
        this.outcomes = outcomes;
        this.thresholds = thresholds;
        this.changes = changes;
        this.clock = clock;
    }

    public RoutingDecision shouldLoadAgent(String domain, int complexity) {
        RoutingThreshold threshold = getThreshold(domain);
        boolean load = threshold.shouldLoadAgent(complexity);

        StringBuilder reason = new StringBuilder(String.format("complexity %d %s threshold %.2f for domain '%s'",
            complexity, load ? ">=" : "<", threshold.currentThreshold(), domain));
        if (threshold.sampleCount() >= ThresholdAdjuster.MIN_SAMPLES) {
            reason.append(String.format(" (learned success rate %.0f%% over %d tasks)",
                threshold.successRate() * 100, threshold.sampleCount()));
        }
        return new RoutingDecision(load, reason.toString(), threshold.currentThreshold());
    }

    /** Current threshold of {@code domain}, created at base on first query. */
    public RoutingThreshold getThreshold(String domain) {
        try {
            return thresholds.latest(domain)
                .orElseGet(() -> thresholds.update(domain, current ->
                    current.orElseGet(() -> RoutingThreshold.initial(domain, clock.instant()))));
        } catch (LearningStoreUnavailableException e) {
            log.warn("[Routing] threshold store unavailable, using base threshold. domain={} reason={}",
                     domain, e.getMessage());
            return RoutingThreshold.initial(domain, clock.instant());
        }
    }

    /**
     * Appends {@code outcome} and recomputes its domain's threshold.
     *
     * @return {@code false} when the task id was already recorded or the store is unavailable
     * @throws IllegalArgumentException when the outcome has no task id, domain or timestamp
     */
    public boolean recordOutcome(TaskOutcome outcome) {
        if (outcome.taskId() == null || outcome.domain() == null || outcome.timestamp() == null) {
            throw new IllegalArgumentException("task_id, domain and timestamp are required");
        }
        try {
            if (!outcomes.append(outcome)) {
                log.debug("[Routing] duplicate outcome ignored taskId={}", outcome.taskId());
                return false;
            }
            String domain = outcome.domain();
            Instant now = clock.instant();
            List<TaskOutcome> domainOutcomes = outcomes.query(o -> domain.equals(o.domain()));

            AtomicReference<ThresholdChange> change = new AtomicReference<>();
            RoutingThreshold updated = thresholds.update(domain, current -> {
                RoutingThreshold before = current.orElseGet(() -> RoutingThreshold.initial(domain, now));
                ThresholdAdjuster.Adjustment adjustment =
                    ThresholdAdjuster.adjust(before, domainOutcomes, outcome, now);
                if (adjustment.isSignificantChange(before.currentThreshold())) {
                    change.set(new ThresholdChange(domain, now, before.currentThreshold(),
                        adjustment.newThreshold(), adjustment.reason(), adjustment.sampleCount()));
                }
                return before.withLearnedState(adjustment.newThreshold(), adjustment.successRate(),
                    adjustment.sampleCount(), now);
            });

            if (change.get() != null) {
                changes.append(change.get());
                log.info("[Routing] threshold adjusted domain={} old={} new={} reason={}",
                         domain, change.get().oldThreshold(), change.get().newThreshold(), change.get().reason());
            }
            log.debug("[Routing] outcome recorded taskId={} domain={} threshold={} successRate={}",
                      outcome.taskId(), domain, updated.currentThreshold(), updated.successRate());
            return true;
        } catch (LearningStoreUnavailableException e) {
            log.warn("[Routing] outcome not recorded, store unavailable. taskId={} reason={}",
                     outcome.taskId(), e.getMessage());
            return false;
        }
    }

    public DomainStats getDomainStats(String domain) {
        RoutingThreshold threshold = getThreshold(domain);
        return DomainStats.of(threshold, recentOutcomes(domain));
    }

    public RoutingStats getAllStats() {
        Map<String, DomainStats> perDomain = new TreeMap<>();
        for (String domain : knownDomains()) {
            perDomain.put(domain, getDomainStats(domain));
        }
        double average = perDomain.values().stream()
            .mapToDouble(DomainStats::currentThreshold)
            .average()
            .orElse(RoutingThreshold.DEFAULT_BASE_THRESHOLD);
        return new RoutingStats(perDomain.size(), average, perDomain);
    }

    /** Returns {@code domain} to its base threshold and records the reset. */
    public RoutingThreshold resetDomain(String domain) {
        try {
            Instant now = clock.instant();
            AtomicReference<Double> previous = new AtomicReference<>();
            RoutingThreshold reset = thresholds.update(domain, current -> {
                RoutingThreshold before = current.orElseGet(() -> RoutingThreshold.initial(domain, now));
                previous.set(before.currentThreshold());
                return before.withLearnedState(before.baseThreshold(), before.successRate(),
                    before.sampleCount(), now);
            });
            changes.append(new ThresholdChange(domain, now, previous.get(), reset.currentThreshold(),
                RESET_REASON, reset.sampleCount()));
            log.info("[Routing] domain reset domain={} old={} new={}", domain, previous.get(), reset.currentThreshold());
            return reset;
        } catch (LearningStoreUnavailableException e) {
            log.warn("[Routing] reset not persisted, store unavailable. domain={} reason={}", domain, e.getMessage());
            return RoutingThreshold.initial(domain, clock.instant());
        }
    }

    public List<ThresholdChange> getThresholdHistory(String domain) {
        try {
            return changes.query(c -> domain.equals(c.domain()));
        } catch (LearningStoreUnavailableException e) {
            log.warn("[Routing] history unavailable domain={} reason={}", domain, e.getMessage());
            return List.of();
        }
    }

    private List<TaskOutcome> recentOutcomes(String domain) {
        Instant cutoff = clock.instant().minus(ThresholdAdjuster.WINDOW_AGE);
        try {
            return outcomes.query(o -> domain.equals(o.domain())
                && o.timestamp() != null && !o.timestamp().isBefore(cutoff));
        } catch (LearningStoreUnavailableException e) {
            log.warn("[Routing] outcome store unavailable domain={} reason={}", domain, e.getMessage());
            return List.of();
        }
    }

    private TreeSet<String> knownDomains() {
        TreeSet<String> domains = new TreeSet<>();
        try {
            domains.addAll(thresholds.query(t -> true).stream()
                .map(RoutingThreshold::domain).filter(Objects::nonNull).collect(Collectors.toList()));
            domains.addAll(outcomes.query(o -> true).stream()
                .map(TaskOutcome::domain).filter(Objects::nonNull).collect(Collectors.toList()));
        } catch (LearningStoreUnavailableException e) {
            log.warn("[Routing] domain listing unavailable reason={}", e.getMessage());
        }
        return domains;
    }
}
