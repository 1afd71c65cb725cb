package org.jstats.matchcrawler_api.modules.crawl.service;

import org.jstats.matchcrawler_api.modules.crawl.model.EntityKind;

import java.time.Instant;
import java.util.List;
import java.util.Map;

/**
 * Snapshot of a crawl run, final once {@code running} is false.
 */
public record CrawlRunSummary(
        String runId,
        Instant startedAt,
        Instant finishedAt,
        Instant deadline,
        int maxMatches,
        boolean running,
        StopReason stopReason,
        String error,
        long matchesStored,
        long matchesSkipped,
        long playersCrawled,
        Map<String, Long> failuresByReason,
        List<FailedRef> failedRefs,
        long totalMatchesInStore
) {

    public record FailedRef(EntityKind kind, String region, String refId, String reason, String detail) {
    }
}
