package com.agentswarm.orchestrator.service;

public enum SwarmState {
    IDLE,
    RUNNING,
    COMPLETE,
    ABORTED
}
