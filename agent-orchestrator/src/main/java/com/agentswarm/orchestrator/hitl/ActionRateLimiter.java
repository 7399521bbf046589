package com.agentswarm.orchestrator.hitl;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.HashMap;
import java.util.Map;

/**
 * Sliding-window attempt counter per action type. In-memory only: a restart clears it.
 * Types whose attempts have all left the window are dropped on the next recorded attempt.
 */
public class ActionRateLimiter {

    public static final int      DEFAULT_MAX_ATTEMPTS = 10;
    public static final Duration DEFAULT_WINDOW       = Duration.ofSeconds(60);

    private final Clock    clock;
    private final int      maxAttempts;
    private final Duration window;

    private final Map<String, Deque<Instant>> attempts = new HashMap<>();

    public ActionRateLimiter(Clock clock, int maxAttempts, Duration window) {
        this.clock = clock;
        this.maxAttempts = maxAttempts;
        this.window = window;
    }

    /**
     * Records one attempt of {@code actionType} and returns the attempt count inside the window,
     * this one included.
     */
    public synchronized int recordAttempt(String actionType) {
        Instant now = clock.instant();
        Instant cutoff = now.minus(window);
        attempts.values().removeIf(recent -> {
            while (!recent.isEmpty() && !recent.peekFirst().isAfter(cutoff)) {
                recent.pollFirst();
            }
            return recent.isEmpty();
        });
        Deque<Instant> recent = attempts.computeIfAbsent(actionType, k -> new ArrayDeque<>());
        recent.addLast(now);
        return recent.size();
    }

    /** Action types with at least one attempt inside the window as of the last recorded attempt. */
    synchronized int trackedTypes() {
        return attempts.size();
    }

    public boolean exceeds(int count) {
        return count > maxAttempts;
    }

    public int getMaxAttempts() {
        return maxAttempts;
    }

    public Duration getWindow() {
        return window;
    }
}
