package com.agentswarm.common.model;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.time.Instant;

/**
 * Adaptive agent-loading threshold for one domain.
 *
 * <ul>
 *   <li>{@code baseThreshold}    – complexity floor the domain starts from and returns to on reset.</li>
 *   <li>{@code currentThreshold} – learned threshold, always within
 *       [{@link #THRESHOLD_MIN}, {@link #THRESHOLD_MAX}].</li>
 *   <li>{@code successRate}      – decay-weighted success rate over the trailing window ([0.0, 1.0]).</li>
 *   <li>{@code sampleCount}      – number of outcomes in the window at the last update.</li>
 * </ul>
 */
public record RoutingThreshold(
    @JsonProperty("domain")            String  domain,
    @JsonProperty("base_threshold")    int     baseThreshold,
    @JsonProperty("current_threshold") double  currentThreshold,
    @JsonProperty("success_rate")      double  successRate,
    @JsonProperty("sample_count")      int     sampleCount,
    @JsonProperty("last_updated")      Instant lastUpdated
) {

    public static final int    DEFAULT_BASE_THRESHOLD = 3;
    public static final double THRESHOLD_MIN          = 1.0;
    public static final double THRESHOLD_MAX          = 10.0;

    /** Fresh threshold at the default base, as created on first query of an unseen domain. */
    public static RoutingThreshold initial(String domain, Instant now) {
        return new RoutingThreshold(domain, DEFAULT_BASE_THRESHOLD, DEFAULT_BASE_THRESHOLD, 0.0, 0, now);
    }

    public boolean shouldLoadAgent(int complexity) {
        return complexity >= currentThreshold;
    }

    public RoutingThreshold withLearnedState(double newThreshold, double newSuccessRate,
                                             int newSampleCount, Instant now) {
        return new RoutingThreshold(domain, baseThreshold, newThreshold, newSuccessRate, newSampleCount, now);
    }
}
