package com.agentswarm.common.handoff;

import com.agentswarm.common.model.HandoffHistoryEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Computes {@link HandoffStats} from recorded handoff chains.
 *
 * <p>Pairs are directed: {@code A -> B} and {@code B -> A} are distinct paths.
 * Ties in the most-common list keep first-seen order.
 */
public final class HandoffStatsCalculator {

    public static final int TOP_PATHS = 10;

    private HandoffStatsCalculator() {}

    public static HandoffStats compute(List<List<HandoffHistoryEntry>> chains) {
        if (chains == null || chains.isEmpty()) {
            return HandoffStats.empty();
        }

        Map<String, HandoffStats.PathCount> paths = new LinkedHashMap<>();
        Map<String, Integer> agentFrequency = new LinkedHashMap<>();
        int total = 0;

        for (List<HandoffHistoryEntry> chain : chains) {
            for (HandoffHistoryEntry entry : chain) {
                total++;
                String key = entry.fromAgent() + "\u0000" + entry.toAgent();
                paths.merge(key, new HandoffStats.PathCount(entry.fromAgent(), entry.toAgent(), 1),
                    (a, b) -> new HandoffStats.PathCount(a.from(), a.to(), a.count() + 1));
                agentFrequency.merge(entry.fromAgent(), 1, Integer::sum);
                agentFrequency.merge(entry.toAgent(), 1, Integer::sum);
            }
        }

        List<HandoffStats.PathCount> ranked = new ArrayList<>(paths.values());
        ranked.sort(Comparator.comparingInt(HandoffStats.PathCount::count).reversed());
        List<HandoffStats.PathCount> top = List.copyOf(ranked.subList(0, Math.min(TOP_PATHS, ranked.size())));

        double avg = (double) total / chains.size();
        return new HandoffStats(total, paths.size(), top, chains.size(), avg, Collections.unmodifiableMap(agentFrequency));
    }
}
