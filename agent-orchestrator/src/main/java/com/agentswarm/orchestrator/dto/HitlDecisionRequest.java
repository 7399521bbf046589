package com.agentswarm.orchestrator.dto;

import com.agentswarm.common.model.PendingAction;
import com.fasterxml.jackson.annotation.JsonProperty;

public record HitlDecisionRequest(
    @JsonProperty("action")   PendingAction action,
    @JsonProperty("approved") boolean       approved,
    @JsonProperty("feedback") String        feedback
) {}
