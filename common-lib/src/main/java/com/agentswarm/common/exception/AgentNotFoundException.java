package com.agentswarm.common.exception;

import com.agentswarm.common.model.HandoffHistoryEntry;

import java.util.List;

/**
 * Raised when an agent name (initial agent, handoff target or explicit load) is not
 * in the registry. Lists the closest available names to aid debugging.
 */
public class AgentNotFoundException extends SwarmAbortedException {

    private final List<String> candidates;

    public AgentNotFoundException(String agentName, List<String> candidates) {
        this(agentName, candidates, List.of(), null);
    }

    public AgentNotFoundException(String agentName, List<String> candidates,
                                  List<HandoffHistoryEntry> handoffChain, String lastOutput) {
        super(agentName, "Agent not found in registry. Available: " + describe(candidates),
            handoffChain, lastOutput);
        this.candidates = candidates == null ? List.of() : List.copyOf(candidates);
    }

    public List<String> getCandidates() {
        return candidates;
    }

    private static String describe(List<String> candidates) {
        if (candidates == null || candidates.isEmpty()) {
            return "(none)";
        }
        return String.join(", ", candidates);
    }
}
