package com.agentswarm.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Answer of the adaptive routing controller for one (domain, complexity) query.
 */
public record RoutingDecision(
    @JsonProperty("load_agent") boolean loadAgent,
    @JsonProperty("reason")     String  reason,
    @JsonProperty("threshold")  double  threshold
) {}
