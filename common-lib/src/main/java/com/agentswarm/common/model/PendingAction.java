package com.agentswarm.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;

/**
 * An action an agent intends to execute, submitted to the HITL gate before it runs.
 *
 * <p>{@code targets} is the bulk target list (empty when the action has a single
 * {@code target}). {@code confidenceOverride}, when present, replaces the computed
 * confidence entirely.
 */
public record PendingAction(
    @JsonProperty("type")                String       type,
    @JsonProperty("target")              String       target,
    @JsonProperty("environment")         String       environment,
    @JsonProperty("targets")             List<String> targets,
    @JsonProperty("confidence_override") Double       confidenceOverride
) {
    public PendingAction {
        type    = type == null ? "unknown" : type;
        targets = targets == null ? List.of() : List.copyOf(targets);
    }

    public static PendingAction of(String type) {
        return new PendingAction(type, null, null, List.of(), null);
    }

    public static PendingAction of(String type, String target) {
        return new PendingAction(type, target, null, List.of(), null);
    }

    public static PendingAction bulk(String type, List<String> targets) {
        return new PendingAction(type, null, null, targets, null);
    }
}
