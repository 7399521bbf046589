package com.agentswarm.orchestrator.session;

import com.agentswarm.common.model.HandoffHistoryEntry;
import com.agentswarm.orchestrator.service.SwarmState;
import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Mutable session artifact of one execution, rewritten on every hop so an external
 * observer can follow which agent is active.
 */
@Data
@NoArgsConstructor
public class SwarmSession {

    @JsonProperty("execution_id")
    private String executionId;

    @JsonProperty("initial_agent")
    private String initialAgent;

    @JsonProperty("current_agent")
    private String currentAgent;

    @JsonProperty("version")
    private String version;

    @JsonProperty("state")
    private SwarmState state = SwarmState.IDLE;

    @JsonProperty("handoff_chain")
    private List<HandoffHistoryEntry> handoffChain = new ArrayList<>();

    @JsonProperty("handoffs_enabled")
    private boolean handoffsEnabled;

    @JsonProperty("created_at")
    private Instant createdAt;

    @JsonProperty("updated_at")
    private Instant updatedAt;
}
