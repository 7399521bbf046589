package com.agentswarm.common.routing;

import com.agentswarm.common.model.RoutingThreshold;
import com.agentswarm.common.model.TaskOutcome;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * Reporting view of one routing domain over the trailing {@link ThresholdAdjuster#WINDOW_AGE}.
 */
public record DomainStats(
    @JsonProperty("domain")             String  domain,
    @JsonProperty("current_threshold")  double  currentThreshold,
    @JsonProperty("base_threshold")     int     baseThreshold,
    @JsonProperty("success_rate")       double  successRate,
    @JsonProperty("total_tasks")        int     totalTasks,
    @JsonProperty("successful_tasks")   int     successfulTasks,
    @JsonProperty("raw_success_rate")   double  rawSuccessRate,
    @JsonProperty("agent_usage_rate")   double  agentUsageRate,
    @JsonProperty("avg_quality")        double  avgQuality,
    @JsonProperty("avg_complexity")     double  avgComplexity,
    @JsonProperty("last_updated")       Instant lastUpdated
) {

    /**
     * @param threshold      the domain's current threshold
     * @param recentOutcomes outcomes of the domain recorded within the reporting window
     */
    public static DomainStats of(RoutingThreshold threshold, List<TaskOutcome> recentOutcomes) {
        int total = recentOutcomes.size();
        int successful = (int) recentOutcomes.stream().filter(TaskOutcome::success).count();
        int loaded = (int) recentOutcomes.stream().filter(TaskOutcome::agentLoaded).count();
        double avgQuality = recentOutcomes.stream().mapToDouble(TaskOutcome::qualityScore).average().orElse(0.0);
        double avgComplexity = recentOutcomes.stream().mapToInt(TaskOutcome::complexity).average().orElse(0.0);
        return new DomainStats(
            threshold.domain(),
            threshold.currentThreshold(),
            threshold.baseThreshold(),
            threshold.successRate(),
            total,
            successful,
            total == 0 ? 0.0 : (double) successful / total,
            total == 0 ? 0.0 : (double) loaded / total,
            avgQuality,
            avgComplexity,
            threshold.lastUpdated());
    }
}
