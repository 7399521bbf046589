package com.agentswarm.common.exception;

import com.agentswarm.common.model.HandoffHistoryEntry;

import java.util.List;
import java.util.stream.Collectors;

/**
 * Raised when an agent declares a handoff after the chain already holds
 * {@code maxHandoffs} entries. Fatal, never retried.
 */
public class MaxHandoffsExceededException extends SwarmAbortedException {

    private final int maxHandoffs;

    public MaxHandoffsExceededException(String agentName, int maxHandoffs, String attemptedTarget,
                                        List<HandoffHistoryEntry> handoffChain, String lastOutput) {
        super(agentName, String.format("Exceeded %d handoffs (attempted %s -> %s). Chain: %s",
                maxHandoffs, agentName, attemptedTarget, renderChain(handoffChain)),
            handoffChain, lastOutput);
        this.maxHandoffs = maxHandoffs;
    }

    public int getMaxHandoffs() {
        return maxHandoffs;
    }

    private static String renderChain(List<HandoffHistoryEntry> chain) {
        if (chain == null || chain.isEmpty()) {
            return "(empty)";
        }
        String hops = chain.stream()
            .map(HandoffHistoryEntry::toAgent)
            .collect(Collectors.joining(" -> "));
        return chain.get(0).fromAgent() + " -> " + hops;
    }
}
