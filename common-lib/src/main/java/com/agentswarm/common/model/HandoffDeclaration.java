package com.agentswarm.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A request, parsed from one agent's raw output, to transfer control to another agent.
 * Lives only for the duration of a single execution.
 */
public record HandoffDeclaration(
    @JsonProperty("to_agent")   String              toAgent,
    @JsonProperty("reason")     String              reason,
    @JsonProperty("context")    Map<String, Object> context,
    @JsonProperty("created_at") Instant             createdAt
) {
    public HandoffDeclaration {
        reason  = reason == null ? "" : reason;
        context = context == null
            ? Map.of()
            : Collections.unmodifiableMap(new LinkedHashMap<>(context));
    }
}
