package org.jstats.matchcrawler_api.modules.crawl.model;

import java.util.Comparator;
import java.util.Objects;

/**
 * Opaque identifier of a match, unique per region + id.
 */
public record MatchRef(String region, String id) implements Comparable<MatchRef> {

    private static final Comparator<MatchRef> ORDER =
            Comparator.comparing(MatchRef::region).thenComparing(MatchRef::id);

    public MatchRef {
        Objects.requireNonNull(region, "region is required");
        Objects.requireNonNull(id, "id is required");
    }

    @Override
    public int compareTo(MatchRef other) {
        return ORDER.compare(this, other);
    }

    @Override
    public String toString() {
        return region + "/" + id;
    }
}
