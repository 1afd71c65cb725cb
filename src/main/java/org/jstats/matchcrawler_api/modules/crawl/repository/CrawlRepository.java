package org.jstats.matchcrawler_api.modules.crawl.repository;

import org.jstats.matchcrawler_api.modules.crawl.model.EntityKind;
import org.jstats.matchcrawler_api.modules.crawl.model.FrontierEntry;
import org.jstats.matchcrawler_api.modules.crawl.model.FrontierStats;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchRecord;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchRef;
import org.jstats.matchcrawler_api.modules.crawl.model.PlayerRecord;
import org.jstats.matchcrawler_api.modules.crawl.model.PlayerRef;

import java.time.Instant;
import java.util.Collection;
import java.util.List;
import java.util.stream.Stream;

/**
 * Durable store for matches, crawled players and the crawl frontier.
 * <p>
 * All methods throw {@link StorageException} on storage failures and
 * {@link StorageUnavailableException} when the store cannot be reached.
 */
public interface CrawlRepository {

    /**
     * @return true if the entity is durably stored (a match row, or a crawled player row)
     */
    boolean exists(EntityKind kind, String region, String refId);

    /**
     * Stores a match and its participants atomically.
     *
     * @return true if the match was inserted, false if it was already stored (no-op)
     */
    boolean putMatch(MatchRecord match);

    /**
     * Overwrites a stored match and its participants atomically; inserts it if absent.
     */
    void replaceMatch(MatchRecord match);

    /**
     * @return the players of a stored match in participant order, empty if the match is not stored
     */
    List<PlayerRef> matchParticipants(MatchRef match);

    void putPlayer(PlayerRecord player);

    /**
     * Inserts the entries that are not already present by (kind, region, refId).
     *
     * @return number of newly inserted entries
     */
    int putFrontierEntries(Collection<FrontierEntry> entries);

    /**
     * Atomically moves up to {@code limit} claimable pending entries of the kind to in-flight,
     * oldest discovery first. Concurrent callers never receive the same entry.
     */
    List<FrontierEntry> claimNextBatch(EntityKind kind, int limit, Instant now);

    /**
     * @return false if the entry was no longer in flight (e.g. reclaimed in the meantime)
     */
    boolean markDone(FrontierEntry entry);

    boolean markFailed(FrontierEntry entry, String reason);

    /**
     * Returns an in-flight entry to pending with its current attempt count.
     */
    boolean requeue(FrontierEntry entry, Instant notBefore, String reason);

    /**
     * @return number of in-flight entries claimed before the cutoff that went back to pending
     */
    int reclaimStale(Instant claimedBefore);

    int resetFailed(EntityKind kind);

    long countMatches();

    FrontierStats frontierStats();

    List<FrontierEntry> failedEntries(int limit);

    /**
     * Lazily streams stored matches ordered by (region, id), starting after the given ref
     * (or from the beginning when {@code after} is null). Close the stream when done.
     */
    Stream<MatchRecord> iterateMatches(MatchRef after);
}
