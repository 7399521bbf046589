package com.agentswarm.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Audit record of a routing threshold movement (learned step or manual reset).
 */
public record ThresholdChange(
    @JsonProperty("domain")        String  domain,
    @JsonProperty("timestamp")     Instant timestamp,
    @JsonProperty("old_threshold") double  oldThreshold,
    @JsonProperty("new_threshold") double  newThreshold,
    @JsonProperty("reason")        String  reason,
    @JsonProperty("sample_count")  int     sampleCount
) {}
