package com.agentswarm.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;
import java.util.List;

/**
 * A human decision on a checked action. {@code approved} stays {@code null}
 * until the decision is resolved; only resolved records feed learned confidence.
 */
public record ActionRecord(
    @JsonProperty("action_type")        String       actionType,
    @JsonProperty("target")             String       target,
    @JsonProperty("environment")        String       environment,
    @JsonProperty("targets")            List<String> targets,
    @JsonProperty("approved")           Boolean      approved,
    @JsonProperty("feedback")           String       feedback,
    @JsonProperty("confidence_at_time") double       confidenceAtTime,
    @JsonProperty("timestamp")          Instant      timestamp
) {
    public ActionRecord {
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public boolean isResolved() {
        return approved != null;
    }
}
