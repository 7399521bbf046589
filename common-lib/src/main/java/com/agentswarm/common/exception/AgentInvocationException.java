package com.agentswarm.common.exception;

import com.agentswarm.common.model.HandoffHistoryEntry;

import java.util.List;

/**
 * The agent invoker failed while running {@code agentName}. Wraps the invoker's
 * exception together with the chain accepted before the failure.
 */
public class AgentInvocationException extends SwarmAbortedException {

    public AgentInvocationException(String agentName, List<HandoffHistoryEntry> handoffChain,
                                    String lastOutput, Throwable cause) {
        super(agentName, "Invocation failed after " + (handoffChain == null ? 0 : handoffChain.size())
            + " handoffs: " + cause.getMessage(), handoffChain, lastOutput, cause);
    }
}
