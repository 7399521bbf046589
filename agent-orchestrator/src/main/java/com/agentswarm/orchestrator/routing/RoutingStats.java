package com.agentswarm.orchestrator.routing;

import com.agentswarm.common.routing.DomainStats;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/**
 * Routing overview across all known domains.
 */
public record RoutingStats(
    @JsonProperty("total_domains")     int                      totalDomains,
    @JsonProperty("average_threshold") double                   averageThreshold,
    @JsonProperty("domains")           Map<String, DomainStats> domains
) {}
