package com.agentswarm.common.exception;

import com.agentswarm.common.model.HandoffHistoryEntry;

import java.util.List;

/**
 * Base of the conditions that are fatal to a swarm execution.
 *
 * <p>Always carries the handoff chain accumulated so far and the last agent's raw
 * output, so a human can resume or diagnose without re-running the chain.
 */
public abstract class SwarmAbortedException extends AgentException {

    private final List<HandoffHistoryEntry> handoffChain;
    private final String lastOutput;

    protected SwarmAbortedException(String agentName, String message,
                                    List<HandoffHistoryEntry> handoffChain, String lastOutput) {
        super(agentName, message);
        this.handoffChain = handoffChain == null ? List.of() : List.copyOf(handoffChain);
        this.lastOutput   = lastOutput;
    }

    protected SwarmAbortedException(String agentName, String message, List<HandoffHistoryEntry> handoffChain,
                                    String lastOutput, Throwable cause) {
        super(agentName, message, cause);
        this.handoffChain = handoffChain == null ? List.of() : List.copyOf(handoffChain);
        this.lastOutput   = lastOutput;
    }

    public List<HandoffHistoryEntry> getHandoffChain() {
        return handoffChain;
    }

    /** Raw output of the last agent that ran, {@code null} when no agent ran yet. */
    public String getLastOutput() {
        return lastOutput;
    }
}
