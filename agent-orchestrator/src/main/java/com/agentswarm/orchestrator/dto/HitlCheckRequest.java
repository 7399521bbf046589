package com.agentswarm.orchestrator.dto;

import com.agentswarm.common.model.PendingAction;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Map;

/** Action to check plus optional caller context (e.g. {@code environment}). */
public record HitlCheckRequest(
    @JsonProperty("action")  PendingAction       action,
    @JsonProperty("context") Map<String, Object> context
) {}
