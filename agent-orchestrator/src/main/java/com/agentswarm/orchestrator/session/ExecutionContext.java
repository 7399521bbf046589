package com.agentswarm.orchestrator.session;

import java.time.Clock;
import java.time.Instant;
import java.util.UUID;
import java.util.regex.Pattern;

/**
 * Identity of one swarm execution. Passed explicitly through the hop loop; two
 * executions never share session state.
 */
public record ExecutionContext(String executionId, Instant createdAt) {

    private static final Pattern VALID_ID = Pattern.compile("[A-Za-z0-9_-]+");

    public ExecutionContext {
        if (executionId == null || !VALID_ID.matcher(executionId).matches()) {
            throw new IllegalArgumentException("Invalid execution id: " + executionId);
        }
    }

    public static ExecutionContext create(Clock clock) {
        return new ExecutionContext(UUID.randomUUID().toString(), clock.instant());
    }
}
