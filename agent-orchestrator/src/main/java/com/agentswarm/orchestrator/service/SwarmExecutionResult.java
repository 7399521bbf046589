package com.agentswarm.orchestrator.service;

import com.agentswarm.common.model.HandoffDeclaration;
import com.agentswarm.common.model.HandoffHistoryEntry;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.List;
import java.util.Map;

/**
 * Outcome of a completed swarm execution.
 *
 * <ul>
 *   <li>{@code finalOutput}         – raw output of the last agent that ran.</li>
 *   <li>{@code suppressedHandoff}   – declaration ignored because handoffs are disabled, else null.</li>
 *   <li>{@code diagnostic}          – cycle guard or parser detail explaining the completion, else null.</li>
 *   <li>{@code intermediateOutputs} – every agent run in order, the final one included.</li>
 *   <li>{@code finalContext}        – accumulated context including internal {@code _} keys.</li>
 * </ul>
 */
public record SwarmExecutionResult(
    @JsonProperty("execution_id")         String                    executionId,
    @JsonProperty("final_output")         String                    finalOutput,
    @JsonProperty("initial_agent")        String                    initialAgent,
    @JsonProperty("final_agent")          String                    finalAgent,
    @JsonProperty("handoff_chain")        List<HandoffHistoryEntry> handoffChain,
    @JsonProperty("completion_reason")    CompletionReason          completionReason,
    @JsonProperty("suppressed_handoff")   HandoffDeclaration        suppressedHandoff,
    @JsonProperty("diagnostic")           String                    diagnostic,
    @JsonProperty("intermediate_outputs") List<AgentStep>           intermediateOutputs,
    @JsonProperty("final_context")        Map<String, Object>       finalContext,
    @JsonProperty("execution_time_ms")    long                      executionTimeMs
) {

    public record AgentStep(
        @JsonProperty("agent")  String agent,
        @JsonProperty("output") String output
    ) {}

    public int totalHandoffs() {
        return handoffChain.size();
    }
}
