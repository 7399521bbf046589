package com.agentswarm.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * One accepted handoff in an execution's chain.
 *
 * <p>{@code contextSize} is the byte length of the JSON-serialized context the
 * source agent declared, kept for auditing how much state travels between agents.
 */
public record HandoffHistoryEntry(
    @JsonProperty("from_agent")   String  fromAgent,
    @JsonProperty("to_agent")     String  toAgent,
    @JsonProperty("reason")       String  reason,
    @JsonProperty("context_size") int     contextSize,
    @JsonProperty("timestamp")    Instant timestamp
) {}
