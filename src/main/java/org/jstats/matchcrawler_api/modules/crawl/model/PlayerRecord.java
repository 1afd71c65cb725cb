package org.jstats.matchcrawler_api.modules.crawl.model;

import java.time.Instant;

/**
 * A player whose match list has been fetched at least once.
 */
public record PlayerRecord(PlayerRef ref, Instant crawledAt, int matchesListed) {
}
