package org.jstats.matchcrawler_api.modules.crawl.remote;

import java.time.Instant;
import java.util.Objects;

/**
 * Bounds of a match-list request.
 *
 * @param since   only matches started at or after this instant
 * @param limit   maximum number of ids to return
 * @param queueId restrict to one queue, or null for all queues
 */
public record MatchWindow(Instant since, int limit, Integer queueId) {

    public MatchWindow {
        Objects.requireNonNull(since, "since is required");
        if (limit <= 0) {
            throw new IllegalArgumentException("limit must be positive");
        }
    }
}
