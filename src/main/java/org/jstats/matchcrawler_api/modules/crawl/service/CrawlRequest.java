package org.jstats.matchcrawler_api.modules.crawl.service;

import jakarta.validation.constraints.Positive;

import java.time.Duration;
import java.util.List;

/**
 * Per-run overrides of the configured crawl settings. Null fields fall back to configuration.
 *
 * @param seeds          seed players as "puuid" or "region/puuid"; empty uses the configured seeds and ladders
 * @param maxMatches     match ceiling of the run
 * @param maxRunDuration relative deadline of the run
 */
public record CrawlRequest(
        List<String> seeds,
        @Positive Integer maxMatches,
        Duration maxRunDuration
) {

    public CrawlRequest {
        seeds = seeds == null ? List.of() : List.copyOf(seeds);
    }

    public static CrawlRequest defaults() {
        return new CrawlRequest(List.of(), null, null);
    }
}
