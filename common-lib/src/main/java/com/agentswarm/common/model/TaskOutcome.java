package com.agentswarm.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Write-once result of a completed task, appended by the caller and consumed by
 * the adaptive routing controller.
 *
 * <ul>
 *   <li>{@code agentUsed}       – agent that handled the task, {@code null} on the cheap path.</li>
 *   <li>{@code agentLoaded}     – whether a specialized agent was loaded at all.</li>
 *   <li>{@code qualityScore}    – caller-assessed quality ([0.0, 1.0]).</li>
 *   <li>{@code userCorrections} – number of corrections the user had to make.</li>
 * </ul>
 */
public record TaskOutcome(
    @JsonProperty("task_id")          String  taskId,
    @JsonProperty("timestamp")        Instant timestamp,
    @JsonProperty("query")            String  query,
    @JsonProperty("domain")           String  domain,
    @JsonProperty("complexity")       int     complexity,
    @JsonProperty("agent_used")       String  agentUsed,
    @JsonProperty("agent_loaded")     boolean agentLoaded,
    @JsonProperty("success")          boolean success,
    @JsonProperty("quality_score")    double  qualityScore,
    @JsonProperty("user_corrections") int     userCorrections
) {}
