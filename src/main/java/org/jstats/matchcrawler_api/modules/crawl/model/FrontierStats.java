package org.jstats.matchcrawler_api.modules.crawl.model;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Row counts of the frontier grouped by kind and state.
 */
public record FrontierStats(List<Count> counts) {

    public record Count(EntityKind kind, FrontierState state, long count) {
    }

    public FrontierStats {
        counts = counts == null ? List.of() : List.copyOf(counts);
    }

    public long count(EntityKind kind, FrontierState state) {
        return counts.stream()
                .filter(c -> c.kind() == kind && c.state() == state)
                .mapToLong(Count::count)
                .sum();
    }

    public long total(FrontierState state) {
        return counts.stream()
                .filter(c -> c.state() == state)
                .mapToLong(Count::count)
                .sum();
    }

    public Map<EntityKind, Map<FrontierState, Long>> asMap() {
        Map<EntityKind, Map<FrontierState, Long>> out = new EnumMap<>(EntityKind.class);
        for (EntityKind kind : EntityKind.values()) {
            Map<FrontierState, Long> byState = new EnumMap<>(FrontierState.class);
            for (FrontierState state : FrontierState.values()) {
                byState.put(state, count(kind, state));
            }
            out.put(kind, byState);
        }
        return out;
    }
}
