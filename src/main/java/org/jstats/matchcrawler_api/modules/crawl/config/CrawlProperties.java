package org.jstats.matchcrawler_api.modules.crawl.config;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Positive;
import org.jstats.matchcrawler_api.modules.crawl.model.PlayerRef;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;
import java.time.Instant;
import java.util.List;

/**
 * Crawl settings.
 *
 * @param seeds            seed players as "puuid" (default region) or "region/puuid"
 * @param region           region of seeds given without one
 * @param window           how far back a player's match list is read
 * @param maxMatches       stop once the store holds this many matches
 * @param deadline         absolute wall-clock deadline, optional
 * @param maxRunDuration   relative deadline of a single run
 * @param maxAttempts      transient failures before an entry is failed
 * @param baseBackoff      first retry delay; doubles per attempt
 * @param maxBackoff       retry delay cap
 * @param matchesPerPlayer match ids requested per player
 * @param queueId          only matches of this queue are kept (420 = ranked solo 5v5); null keeps all
 * @param batchSize        entries claimed per worker round
 * @param workers          worker threads
 * @param inFlightTimeout  claims older than this are considered abandoned
 * @param pollInterval     idle wait when nothing is claimable
 * @param ladderTiers      ranked ladders used as extra seeds (challenger, grandmaster, master)
 * @param runOnStartup     start a run when the application is ready
 * @param failedRefsCap    failed refs kept in a run summary
 * @param storageRetry     retry of storage operations inside a run
 */
@Validated
@ConfigurationProperties(prefix = "crawler")
public record CrawlProperties(
        @DefaultValue List<String> seeds,
        @NotBlank @DefaultValue("euw1") String region,
        @DefaultValue("30d") Duration window,
        @Positive @DefaultValue("1000") int maxMatches,
        Instant deadline,
        @DefaultValue("24h") Duration maxRunDuration,
        @Positive @DefaultValue("5") int maxAttempts,
        @DefaultValue("2s") Duration baseBackoff,
        @DefaultValue("5m") Duration maxBackoff,
        @Positive @DefaultValue("20") int matchesPerPlayer,
        @DefaultValue("420") Integer queueId,
        @Positive @DefaultValue("10") int batchSize,
        @Positive @DefaultValue("4") int workers,
        @DefaultValue("10m") Duration inFlightTimeout,
        @DefaultValue("1s") Duration pollInterval,
        @DefaultValue List<String> ladderTiers,
        @DefaultValue("false") boolean runOnStartup,
        @Positive @DefaultValue("50") int failedRefsCap,
        @DefaultValue StorageRetry storageRetry
) {

    public record StorageRetry(
            @DefaultValue("3") int maxAttempts,
            @DefaultValue("200ms") Duration initialDelay,
            @DefaultValue("2s") Duration maxDelay) {
    }

    public List<PlayerRef> seedRefs() {
        return seeds.stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(this::toPlayerRef)
                .distinct()
                .toList();
    }

    public PlayerRef toPlayerRef(String seed) {
        int slash = seed.indexOf('/');
        if (slash < 0) {
            return new PlayerRef(region, seed);
        }
        if (slash == 0 || slash == seed.length() - 1) {
            throw new IllegalArgumentException("Seed must be 'puuid' or 'region/puuid', got '" + seed + "'");
        }
        return new PlayerRef(seed.substring(0, slash), seed.substring(slash + 1));
    }
}
