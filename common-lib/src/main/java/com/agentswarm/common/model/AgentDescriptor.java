package com.agentswarm.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.nio.file.Path;
import java.util.List;

/**
 * Immutable capability descriptor of a single agent, built once per registry scan.
 *
 * <ul>
 *   <li>{@code name}            – normalized agent name (file stem minus {@code _agent} and version marker).</li>
 *   <li>{@code version}         – version marker taken from the file stem ({@code v2}) or {@code base}.</li>
 *   <li>{@code path}            – handle to the descriptor text; read lazily by the registry.</li>
 *   <li>{@code supportsHandoff} – whether the descriptor documents the handoff protocol.</li>
 *   <li>{@code specialties}     – declared specialties, at most ten.</li>
 *   <li>{@code purpose}         – one-line purpose statement, empty when the descriptor has none.</li>
 * </ul>
 */
public record AgentDescriptor(
    @JsonProperty("name")             String       name,
    @JsonProperty("version")          String       version,
    @JsonProperty("path")             Path         path,
    @JsonProperty("supports_handoff") boolean      supportsHandoff,
    @JsonProperty("specialties")      List<String> specialties,
    @JsonProperty("purpose")          String       purpose
) {
    public AgentDescriptor {
        specialties = specialties == null ? List.of() : List.copyOf(specialties);
        purpose     = purpose == null ? "" : purpose;
    }
}
