package com.agentswarm.orchestrator.logger;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One line of the handoff event log.
 */
public record HandoffEvent(
    @JsonProperty("timestamp")    Instant   timestamp,
    @JsonProperty("event_type")   EventType eventType,
    @JsonProperty("execution_id") String    executionId,
    @JsonProperty("from_agent")   String    fromAgent,
    @JsonProperty("to_agent")     String    toAgent,
    @JsonProperty("reason")       String    reason,
    @JsonProperty("detail")       String    detail
) {

    public enum EventType {
        HANDOFF_TRIGGERED,
        HANDOFF_COMPLETED,
        HANDOFF_SUPPRESSED,
        HANDOFF_REJECTED,
        HANDOFF_FAILED
    }
}
