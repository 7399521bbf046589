package com.agentswarm.orchestrator.service;

/** Why a swarm execution reached COMPLETE. */
public enum CompletionReason {
    /** The last output carried no well-formed handoff declaration. */
    NO_HANDOFF,
    /** The declaring agent's descriptor does not support handoffs; its output is final. */
    TERMINAL_AGENT,
    /** Handoffs are switched off; the declaration is reported but not followed. */
    HANDOFFS_DISABLED,
    CYCLE_DETECTED
}
