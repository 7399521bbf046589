package com.agentswarm.orchestrator.service;

import com.agentswarm.orchestrator.session.ExecutionContext;

/**
 * Runs one agent prompt against the underlying language model and returns its raw
 * text output. Supplied by the caller for each execution.
 */
@FunctionalInterface
public interface AgentInvoker {

    String invoke(String agentName, String prompt, ExecutionContext context);
}
