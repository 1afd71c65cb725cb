package org.jstats.matchcrawler_api.modules.crawl.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.matchcrawler_api.modules.crawl.config.CrawlProperties;
import org.jstats.matchcrawler_api.modules.crawl.model.EntityKind;
import org.jstats.matchcrawler_api.modules.crawl.model.FrontierEntry;
import org.jstats.matchcrawler_api.modules.crawl.model.FrontierState;
import org.jstats.matchcrawler_api.modules.crawl.model.FrontierStats;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchRef;
import org.jstats.matchcrawler_api.modules.crawl.model.PlayerRef;
import org.jstats.matchcrawler_api.modules.crawl.repository.CrawlRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.Collection;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;

/**
 * Discovered-but-unfetched work. Deduplicates against the repository, hands out batches
 * (matches before players, oldest first) and decides when a run has to stop.
 */
@Service
@NullMarked
public class FrontierManager {

    private static final Logger log = LoggerFactory.getLogger(FrontierManager.class);

    private final CrawlRepository repository;
    private final CrawlProperties props;
    private final Clock clock;

    public FrontierManager(CrawlRepository repository, CrawlProperties props, Clock clock) {
        this.repository = repository;
        this.props = props;
        this.clock = clock;
    }

    /**
     * Enqueues the seed players that have not been crawled yet.
     *
     * @return number of new frontier entries
     */
    public int seed(Collection<PlayerRef> players) {
        int added = discoverPlayers(players);
        log.info("Seeded frontier with {} of {} players", added, players.size());
        return added;
    }

    public int discoverMatches(Collection<MatchRef> refs) {
        Instant now = clock.instant();
        List<FrontierEntry> fresh = new LinkedHashSet<>(refs).stream()
                .filter(ref -> !repository.exists(EntityKind.MATCH, ref.region(), ref.id()))
                .map(ref -> FrontierEntry.discovered(ref, now))
                .toList();
        return fresh.isEmpty() ? 0 : repository.putFrontierEntries(fresh);
    }

    public int discoverPlayers(Collection<PlayerRef> refs) {
        Instant now = clock.instant();
        List<FrontierEntry> fresh = new LinkedHashSet<>(refs).stream()
                .filter(ref -> !repository.exists(EntityKind.PLAYER, ref.region(), ref.id()))
                .map(ref -> FrontierEntry.discovered(ref, now))
                .toList();
        return fresh.isEmpty() ? 0 : repository.putFrontierEntries(fresh);
    }

    /**
     * Claims the next batch for a worker: match entries first, bounded by the run's remaining
     * match budget; player entries only when no match entry could be claimed. When the whole
     * budget is used up or reserved by matches in flight nothing is claimed.
     */
    public List<FrontierEntry> claimNextBatch(CrawlRun run, int limit) {
        Instant now = clock.instant();
        int slots = run.reserveMatchSlots(limit);
        if (slots == 0) {
            if (run.reservedMatches() > 0 || run.storedTotal() >= run.maxMatches()) {
                return List.of();
            }
        } else {
            List<FrontierEntry> matches;
            try {
                matches = repository.claimNextBatch(EntityKind.MATCH, slots, now);
            } catch (RuntimeException e) {
                run.releaseMatchSlots(slots);
                throw e;
            }
            run.releaseMatchSlots(slots - matches.size());
            if (!matches.isEmpty()) {
                return matches;
            }
        }
        return repository.claimNextBatch(EntityKind.PLAYER, limit, now);
    }

    /**
     * Evaluated before every claim.
     */
    public Optional<StopReason> checkStop(CrawlRun run) {
        if (!clock.instant().isBefore(run.deadline())) {
            return Optional.of(StopReason.DEADLINE);
        }
        if (run.storedTotal() >= run.maxMatches()) {
            return Optional.of(StopReason.CEILING);
        }
        FrontierStats stats = repository.frontierStats();
        if (stats.total(FrontierState.PENDING) == 0 && stats.total(FrontierState.IN_FLIGHT) == 0) {
            return Optional.of(StopReason.EXHAUSTED);
        }
        return Optional.empty();
    }

    /**
     * Returns claims older than the in-flight timeout to pending.
     */
    public int reclaimStale() {
        return reclaimClaimedBefore(clock.instant().minus(props.inFlightTimeout()));
    }

    public int reclaimClaimedBefore(Instant cutoff) {
        int reclaimed = repository.reclaimStale(cutoff);
        if (reclaimed > 0) {
            log.info("Reclaimed {} in-flight frontier entries claimed before {}", reclaimed, cutoff);
        }
        return reclaimed;
    }

    public FrontierStats stats() {
        return repository.frontierStats();
    }

    public List<FrontierEntry> failedEntries(int limit) {
        return repository.failedEntries(limit);
    }

    public int resetFailed(EntityKind kind) {
        int reset = repository.resetFailed(kind);
        log.info("Reset {} failed {} entries to pending", reset, kind);
        return reset;
    }
}
