package com.agentswarm.common.exception;

/**
 * Agent registry misconfiguration: two descriptors normalizing to the same name,
 * or a descriptor that cannot be read.
 */
public class AgentRegistryException extends AgentException {

    public AgentRegistryException(String agentName, String message) {
        super(agentName, message);
    }

    public AgentRegistryException(String agentName, String message, Throwable cause) {
        super(agentName, message, cause);
    }
}
