package com.agentswarm.orchestrator.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record RoutingCheckRequest(
    @JsonProperty("domain")     String domain,
    @JsonProperty("complexity") int    complexity
) {}
