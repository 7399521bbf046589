package com.agentswarm.common.guard;

import com.agentswarm.common.model.HandoffHistoryEntry;

import java.util.List;

/**
 * Cycle guard for swarm handoff chains.
 *
 * <h3>Repeat count of a proposed {@code from -> to} handoff</h3>
 * <ul>
 *   <li>+1 for every earlier occurrence of the same directed pair in the chain.</li>
 *   <li>+1 when the last accepted handoff is the reverse pair {@code to -> from}
 *       (an immediate back-edge such as {@code A -> B, B -> A}).</li>
 * </ul>
 *
 * <p>The handoff is rejected once the repeat count reaches {@code repeatTolerance}.
 * With the default tolerance of {@value #DEFAULT_REPEAT_TOLERANCE} no pair may repeat
 * and no agent may immediately hand back to the agent that just handed to it.
 * A self-handoff is always rejected.
 *
 * <p>Longer cycles that revisit an agent through a different pair
 * ({@code A -> B -> C -> A}) are bounded by the hard handoff cap instead.
 *
 * <p>This class is stateless, pure, and thread-safe.
 */
public final class CycleGuard {

    public static final int DEFAULT_REPEAT_TOLERANCE = 1;

    private CycleGuard() {}

    /**
     * @param chain           handoffs accepted so far in this execution, oldest first
     * @param fromAgent       agent declaring the handoff
     * @param toAgent         declared target
     * @param repeatTolerance repeat count at which the guard trips (values below 1 are treated as 1)
     * @return {@link GuardResult}, never null
     */
    public static GuardResult evaluate(List<HandoffHistoryEntry> chain, String fromAgent, String toAgent,
                                       int repeatTolerance) {
        if (fromAgent.equals(toAgent)) {
            return new GuardResult(false, 0,
                String.format("SelfHandoff agent=%s", fromAgent));
        }

        int repeats = 0;
        for (HandoffHistoryEntry entry : chain) {
            if (entry.fromAgent().equals(fromAgent) && entry.toAgent().equals(toAgent)) {
                repeats++;
            }
        }
        boolean backEdge = false;
        if (!chain.isEmpty()) {
            HandoffHistoryEntry last = chain.get(chain.size() - 1);
            backEdge = last.fromAgent().equals(toAgent) && last.toAgent().equals(fromAgent);
            if (backEdge) {
                repeats++;
            }
        }

        int tolerance = Math.max(1, repeatTolerance);
        if (repeats >= tolerance) {
            return new GuardResult(false, repeats,
                String.format("CycleDetected %s->%s repeats=%d tolerance=%d%s",
                    fromAgent, toAgent, repeats, tolerance, backEdge ? " (immediate back-edge)" : ""));
        }
        return new GuardResult(true, repeats, null);
    }

    public record GuardResult(
        boolean allowed,
        int     repeats,
        String  reason
    ) {}
}
