package com.agentswarm.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Answer of the HITL gate: whether to pause for human confirmation and why.
 * {@code confidence} is {@code null} when a rule ahead of the confidence check decided.
 */
public record PauseDecision(
    @JsonProperty("pause")      boolean        pause,
    @JsonProperty("reason")     String         reason,
    @JsonProperty("category")   ActionCategory category,
    @JsonProperty("confidence") Double         confidence
) {
    public static PauseDecision pause(String reason, ActionCategory category) {
        return new PauseDecision(true, reason, category, null);
    }
}
