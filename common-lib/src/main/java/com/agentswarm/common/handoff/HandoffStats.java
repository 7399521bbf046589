package com.agentswarm.common.handoff;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Derived handoff analytics over one or more recorded chains. No separate store.
 */
public record HandoffStats(
    @JsonProperty("total_handoffs")               int                  totalHandoffs,
    @JsonProperty("unique_paths")                 int                  uniquePaths,
    @JsonProperty("most_common_handoffs")         List<PathCount>      mostCommonHandoffs,
    @JsonProperty("total_executions")             int                  totalExecutions,
    @JsonProperty("avg_handoffs_per_execution")   double               avgHandoffsPerExecution,
    @JsonProperty("agent_frequency")              Map<String, Integer> agentFrequency
) {

    /** A directed agent pair and how often it occurred. */
    public record PathCount(
        @JsonProperty("from")  String from,
        @JsonProperty("to")    String to,
        @JsonProperty("count") int    count
    ) {}

    public static HandoffStats empty() {
        return new HandoffStats(0, 0, List.of(), 0, 0.0, Map.of());
    }
}
