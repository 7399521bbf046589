package com.agentswarm.common.model;

/**
 * Coarse risk classification of an agent-initiated action.
 *
 * <ul>
 *   <li>{@link #SAFE}        – read-type operations.</li>
 *   <li>{@link #MODERATE}    – writes that can be undone.</li>
 *   <li>{@link #DESTRUCTIVE} – deletes and removals.</li>
 *   <li>{@link #CRITICAL}    – force pushes, drops, truncates. Always confirmed by a human.</li>
 * </ul>
 */
public enum ActionCategory {
    SAFE,
    MODERATE,
    DESTRUCTIVE,
    CRITICAL
}
