package org.jstats.matchcrawler_api.modules.crawl.service;

import org.jstats.matchcrawler_api.modules.crawl.config.CrawlConfig;
import org.jstats.matchcrawler_api.modules.crawl.config.CrawlProperties;
import org.jstats.matchcrawler_api.modules.crawl.model.EntityKind;
import org.jstats.matchcrawler_api.modules.crawl.model.FrontierEntry;
import org.jstats.matchcrawler_api.modules.crawl.model.FrontierState;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchRecord;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchRef;
import org.jstats.matchcrawler_api.modules.crawl.model.PlayerRecord;
import org.jstats.matchcrawler_api.modules.crawl.model.PlayerRef;
import org.jstats.matchcrawler_api.modules.crawl.remote.RemoteMatchClient;
import org.jstats.matchcrawler_api.modules.crawl.repository.StorageException;
import org.jstats.matchcrawler_api.modules.crawl.repository.StorageUnavailableException;
import org.jstats.matchcrawler_api.modules.crawl.support.FakeRemoteMatchClient;
import org.jstats.matchcrawler_api.modules.crawl.support.InMemoryCrawlRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.Set;

import static org.jstats.matchcrawler_api.modules.crawl.support.TestMatches.REGION;
import static org.jstats.matchcrawler_api.modules.crawl.support.TestMatches.match;
import static org.jstats.matchcrawler_api.modules.crawl.support.TestMatches.matchRef;
import static org.jstats.matchcrawler_api.modules.crawl.support.TestMatches.player;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@Timeout(20)
class CrawlCollectorTests {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final Clock clock = Clock.systemUTC();

    InMemoryCrawlRepository repo;
    FakeRemoteMatchClient remote;

    PlayerRef p1 = player("P1");
    PlayerRef p2 = player("P2");
    MatchRef m1 = matchRef("M1");
    MatchRef m2 = matchRef("M2");

    @BeforeEach
    void setUp() {
        repo = new InMemoryCrawlRepository();
        remote = new FakeRemoteMatchClient();
    }

    static CrawlProperties props(int workers, int batchSize, int maxAttempts) {
        return new CrawlProperties(
                List.of(), REGION, Duration.ofDays(30), 1000, null, Duration.ofHours(1),
                maxAttempts, Duration.ofMillis(1), Duration.ofMillis(5), 20, 420,
                batchSize, workers, Duration.ofMinutes(10), Duration.ofMillis(5),
                List.of(), false, 50,
                new CrawlProperties.StorageRetry(3, Duration.ofMillis(1), Duration.ofMillis(2)));
    }

    private CrawlCollector collector(CrawlProperties props) {
        var frontier = new FrontierManager(repo, props, clock);
        return new CrawlCollector(frontier, repo, remote,
                CrawlConfig.storageRetryTemplate(props.storageRetry()), props, clock);
    }

    private CrawlRun newRun(int maxMatches) {
        var now = clock.instant();
        return new CrawlRun("test-run", now, now.plus(Duration.ofMinutes(1)), maxMatches, repo.countMatches(), 50);
    }

    @Test
    void ceilingOfOne_storesOnlyFirstMatch_andLeavesRestPending() {
        MatchRecord first = match("M1", T0, true, p1, p2);
        MatchRecord second = match("M2", T0.plusSeconds(3600), false, p1);
        remote.withMatch(first).withMatch(second).withPlayerMatches(p1, m1, m2);

        var summary = collector(props(2, 10, 3)).collect(newRun(1), List.of(p1));

        assertEquals(StopReason.CEILING, summary.stopReason());
        assertEquals(List.of(m1), repo.storedMatches());
        assertEquals(FrontierState.PENDING, repo.state(EntityKind.MATCH, REGION, "M2"));
        assertEquals(FrontierState.PENDING, repo.state(EntityKind.PLAYER, REGION, "P2"));
        assertEquals(FrontierState.DONE, repo.state(EntityKind.PLAYER, REGION, "P1"));
        assertEquals(0, remote.fetchCount(m2));
        assertEquals(1, summary.matchesStored());
        assertEquals(1, summary.totalMatchesInStore());
        assertFalse(summary.running());
    }

    @Test
    void notFound_marksMatchFailed_neverRetries_andRunContinues() {
        remote.withMatch(match("M2", T0, true, p1)).withPlayerMatches(p1, m1, m2);
        remote.failFetch(m1, new RemoteMatchClient.NotFoundException("expired"));

        var summary = collector(props(1, 10, 3)).collect(newRun(100), List.of(p1));

        assertEquals(StopReason.EXHAUSTED, summary.stopReason());
        assertEquals(FrontierState.FAILED, repo.state(EntityKind.MATCH, REGION, "M1"));
        assertEquals(1, remote.fetchCount(m1));
        assertEquals(List.of(m2), repo.storedMatches());
        assertEquals(1L, summary.failuresByReason().get(CrawlCollector.REASON_NOT_FOUND));
        assertEquals("M1", summary.failedRefs().get(0).refId());
    }

    @Test
    void finiteGraph_terminatesExhausted_withEveryReachableMatchFetchedOnce() {
        PlayerRef p3 = player("P3");
        MatchRef m3 = matchRef("M3");
        remote.withMatch(match("M1", T0, true, p1, p2))
                .withMatch(match("M2", T0.plusSeconds(60), true, p2, p3))
                .withMatch(match("M3", T0.plusSeconds(120), false, p3));

        var summary = collector(props(3, 4, 3)).collect(newRun(1000), List.of(p1));

        assertEquals(StopReason.EXHAUSTED, summary.stopReason());
        assertEquals(Set.of(m1, m2, m3), Set.copyOf(repo.storedMatches()));
        for (MatchRef ref : List.of(m1, m2, m3)) {
            assertEquals(1, remote.fetchCount(ref), "fetched once: " + ref);
        }
        assertEquals(1, remote.listingCount(p1));
        assertEquals(1, remote.listingCount(p2));
        var stats = repo.frontierStats();
        assertEquals(0, stats.total(FrontierState.PENDING));
        assertEquals(0, stats.total(FrontierState.IN_FLIGHT));
        assertEquals(3, summary.matchesStored());
    }

    @Test
    void ceilingHolds_withManyWorkersAndLargeBatches() {
        MatchRef[] refs = new MatchRef[12];
        for (int i = 0; i < refs.length; i++) {
            refs[i] = matchRef("M" + (i + 1));
            remote.withMatch(match("M" + (i + 1), T0.plusSeconds(i), true, p1));
        }
        remote.withPlayerMatches(p1, refs);

        var summary = collector(props(4, 10, 3)).collect(newRun(5), List.of(p1));

        assertEquals(StopReason.CEILING, summary.stopReason());
        assertEquals(5, repo.countMatches());
        assertEquals(5, summary.totalMatchesInStore());
    }

    @Test
    void transientFailures_areRetriedWithBackoff_untilSuccess() {
        remote.withMatch(match("M1", T0, true, p1)).withPlayerMatches(p1, m1);
        remote.failFetch(m1,
                new RemoteMatchClient.TransientException("503"),
                new RemoteMatchClient.TransientException("timeout"));

        var summary = collector(props(1, 10, 5)).collect(newRun(100), List.of(p1));

        assertEquals(StopReason.EXHAUSTED, summary.stopReason());
        assertEquals(3, remote.fetchCount(m1));
        assertEquals(List.of(m1), repo.storedMatches());
        FrontierEntry entry = repo.entry(EntityKind.MATCH, REGION, "M1").orElseThrow();
        assertEquals(FrontierState.DONE, entry.state());
        assertEquals(2, entry.attempts());
    }

    @Test
    void transientFailures_exhaustMaxAttempts_andFailTheEntry() {
        remote.withMatch(match("M1", T0, true, p1)).withPlayerMatches(p1, m1);
        remote.failFetch(m1,
                new RemoteMatchClient.TransientException("503"),
                new RemoteMatchClient.TransientException("503"),
                new RemoteMatchClient.TransientException("503"),
                new RemoteMatchClient.TransientException("503"));

        var summary = collector(props(1, 10, 3)).collect(newRun(100), List.of(p1));

        assertEquals(StopReason.EXHAUSTED, summary.stopReason());
        assertEquals(3, remote.fetchCount(m1));
        FrontierEntry entry = repo.entry(EntityKind.MATCH, REGION, "M1").orElseThrow();
        assertEquals(FrontierState.FAILED, entry.state());
        assertEquals(3, entry.attempts());
        assertEquals(1L, summary.failuresByReason().get(CrawlCollector.REASON_TRANSIENT));
    }

    @Test
    void rateLimits_doNotCountAgainstAttempts() {
        remote.withMatch(match("M1", T0, true, p1)).withPlayerMatches(p1, m1);
        remote.failFetch(m1,
                new RemoteMatchClient.RateLimitedException(Duration.ofMillis(2)),
                new RemoteMatchClient.RateLimitedException(Duration.ofMillis(2)),
                new RemoteMatchClient.RateLimitedException(Duration.ofMillis(2)));

        var summary = collector(props(1, 10, 2)).collect(newRun(100), List.of(p1));

        assertEquals(StopReason.EXHAUSTED, summary.stopReason());
        assertEquals(List.of(m1), repo.storedMatches());
        assertEquals(0, repo.entry(EntityKind.MATCH, REGION, "M1").orElseThrow().attempts());
    }

    @Test
    void resume_reclaimsInFlightWork_andSkipsStoredMatches() {
        var longAgo = clock.instant().minus(Duration.ofHours(2));
        MatchRecord stored = match("M3", T0, true, p1);
        repo.putMatch(stored);
        repo.putPlayer(new PlayerRecord(p1, longAgo, 3));
        repo.seedFrontier(new FrontierEntry(null, EntityKind.PLAYER, REGION, "P1", longAgo, 0,
                FrontierState.DONE, longAgo, null, null));
        repo.seedFrontier(new FrontierEntry(null, EntityKind.MATCH, REGION, "M1", longAgo, 0,
                FrontierState.IN_FLIGHT, longAgo, longAgo, null));
        repo.seedFrontier(new FrontierEntry(null, EntityKind.MATCH, REGION, "M2", longAgo, 0,
                FrontierState.PENDING, longAgo, null, null));
        repo.seedFrontier(new FrontierEntry(null, EntityKind.MATCH, REGION, "M3", longAgo, 0,
                FrontierState.DONE, longAgo, null, null));
        remote.withMatch(match("M1", T0, true, p1)).withMatch(match("M2", T0, false, p1)).withMatch(stored);

        var summary = collector(props(2, 10, 3)).collect(newRun(100), List.of(p1));

        assertEquals(StopReason.EXHAUSTED, summary.stopReason());
        assertEquals(Set.of(m1, m2, matchRef("M3")), Set.copyOf(repo.storedMatches()));
        assertEquals(0, remote.fetchCount(matchRef("M3")));
        assertEquals(0, remote.listingCount(p1));
        assertEquals(2, summary.matchesStored());
    }

    @Test
    void storedMatchLeftInFlight_isCompletedWithoutRefetch_andItsPlayersEnqueued() {
        var longAgo = clock.instant().minus(Duration.ofHours(2));
        repo.putMatch(match("M1", T0, true, p1, p2));
        repo.putPlayer(new PlayerRecord(p1, longAgo, 1));
        repo.seedFrontier(new FrontierEntry(null, EntityKind.PLAYER, REGION, "P1", longAgo, 0,
                FrontierState.DONE, longAgo, null, null));
        repo.seedFrontier(new FrontierEntry(null, EntityKind.MATCH, REGION, "M1", longAgo, 0,
                FrontierState.IN_FLIGHT, longAgo, longAgo, null));

        var summary = collector(props(1, 10, 3)).collect(newRun(100), List.of());

        assertEquals(StopReason.EXHAUSTED, summary.stopReason());
        assertEquals(FrontierState.DONE, repo.state(EntityKind.MATCH, REGION, "M1"));
        assertEquals(FrontierState.DONE, repo.state(EntityKind.PLAYER, REGION, "P2"));
        assertEquals(1, remote.listingCount(p2));
        assertEquals(0, remote.fetchCount(m1));
        assertEquals(0, summary.matchesStored());
    }

    @Test
    void playerDiscoveryFailure_afterMatchStored_requeuesEntry_andLaterEnqueuesPlayers() {
        var longAgo = clock.instant().minus(Duration.ofHours(2));
        remote.withMatch(match("M1", T0, true, p1, p2));
        repo.seedFrontier(new FrontierEntry(null, EntityKind.MATCH, REGION, "M1", longAgo, 0,
                FrontierState.PENDING, longAgo, null, null));
        var boom = new StorageException("putFrontierEntries", "deadlock", null);
        repo.failOn("putFrontierEntries", boom, boom, boom);

        var summary = collector(props(1, 10, 3)).collect(newRun(100), List.of());

        assertEquals(StopReason.EXHAUSTED, summary.stopReason());
        assertEquals(List.of(m1), repo.storedMatches());
        assertEquals(1, remote.fetchCount(m1));
        FrontierEntry entry = repo.entry(EntityKind.MATCH, REGION, "M1").orElseThrow();
        assertEquals(FrontierState.DONE, entry.state());
        assertEquals(1, entry.attempts());
        assertEquals(FrontierState.DONE, repo.state(EntityKind.PLAYER, REGION, "P1"));
        assertEquals(FrontierState.DONE, repo.state(EntityKind.PLAYER, REGION, "P2"));
        assertTrue(summary.failuresByReason().isEmpty());
        assertEquals(1, summary.matchesStored());
    }

    @Test
    void failedMatchEntry_whoseMatchIsStored_recoversItsPlayersAfterReset() {
        var longAgo = clock.instant().minus(Duration.ofHours(2));
        repo.putMatch(match("M1", T0, true, p1, p2));
        repo.seedFrontier(new FrontierEntry(null, EntityKind.MATCH, REGION, "M1", longAgo, 3,
                FrontierState.FAILED, longAgo, null, CrawlCollector.REASON_STORAGE));

        assertEquals(1, repo.resetFailed(EntityKind.MATCH));
        var summary = collector(props(1, 10, 3)).collect(newRun(100), List.of());

        assertEquals(StopReason.EXHAUSTED, summary.stopReason());
        assertEquals(FrontierState.DONE, repo.state(EntityKind.MATCH, REGION, "M1"));
        assertEquals(FrontierState.DONE, repo.state(EntityKind.PLAYER, REGION, "P2"));
        assertEquals(0, remote.fetchCount(m1));
    }

    @Test
    void shutdownRequest_finishesBatchInHand_andClaimsNothingMore() {
        PlayerRef p3 = player("P3");
        remote.withMatch(match("M1", T0, true, p1, p2))
                .withMatch(match("M2", T0.plusSeconds(60), true, p2, p3))
                .withPlayerMatches(p1, m1);
        var run = newRun(100);
        remote.onFetch(ref -> run.requestShutdown());

        var summary = collector(props(1, 10, 3)).collect(run, List.of(p1));

        assertEquals(StopReason.SHUTDOWN, summary.stopReason());
        assertEquals(List.of(m1), repo.storedMatches());
        assertEquals(0, repo.frontierStats().total(FrontierState.IN_FLIGHT));
        assertEquals(FrontierState.PENDING, repo.state(EntityKind.PLAYER, REGION, "P2"));
    }

    @Test
    void rejectedCredentials_haltRun_andReleaseTheEntry() {
        remote.withMatch(match("M1", T0, true, p1)).withPlayerMatches(p1, m1);
        remote.failFetch(m1, new RemoteMatchClient.UpstreamRejectedException(403, "forbidden"));

        var summary = collector(props(1, 10, 3)).collect(newRun(100), List.of(p1));

        assertEquals(StopReason.REMOTE_REJECTED, summary.stopReason());
        assertTrue(repo.storedMatches().isEmpty());
        FrontierEntry entry = repo.entry(EntityKind.MATCH, REGION, "M1").orElseThrow();
        assertEquals(FrontierState.PENDING, entry.state());
        assertEquals(0, entry.attempts());
        assertEquals(CrawlCollector.REASON_REMOTE + ": forbidden", entry.lastError());
    }

    @Test
    void storageFailure_afterRetries_failsEntry_andRunContinues() {
        remote.withMatch(match("M1", T0, true, p1)).withMatch(match("M2", T0, true, p1)).withPlayerMatches(p1, m1, m2);
        var boom = new StorageException("putMatch", "deadlock", null);
        repo.failOn("putMatch", boom, boom, boom);

        var summary = collector(props(1, 10, 3)).collect(newRun(100), List.of(p1));

        assertEquals(StopReason.EXHAUSTED, summary.stopReason());
        assertEquals(FrontierState.FAILED, repo.state(EntityKind.MATCH, REGION, "M1"));
        assertEquals(List.of(m2), repo.storedMatches());
        assertEquals(1L, summary.failuresByReason().get(CrawlCollector.REASON_STORAGE));
    }

    @Test
    void transientStorageFailure_isRetriedTransparently() {
        remote.withMatch(match("M1", T0, true, p1)).withPlayerMatches(p1, m1);
        repo.failOn("putMatch", new StorageException("putMatch", "serialization failure", null));

        var summary = collector(props(1, 10, 3)).collect(newRun(100), List.of(p1));

        assertEquals(List.of(m1), repo.storedMatches());
        assertTrue(summary.failuresByReason().isEmpty());
    }

    @Test
    void unavailableStore_haltsRun_andLeavesClaimInFlight() {
        remote.withMatch(match("M1", T0, true, p1)).withPlayerMatches(p1, m1);
        repo.failOn("putMatch", new StorageUnavailableException("putMatch", "connection refused", null));

        var summary = collector(props(1, 10, 3)).collect(newRun(100), List.of(p1));

        assertEquals(StopReason.STORAGE_UNAVAILABLE, summary.stopReason());
        assertEquals(FrontierState.IN_FLIGHT, repo.state(EntityKind.MATCH, REGION, "M1"));
    }

    @Test
    void pastDeadline_stopsBeforeClaiming() {
        remote.withMatch(match("M1", T0, true, p1)).withPlayerMatches(p1, m1);
        var now = clock.instant();
        var run = new CrawlRun("late", now, now.minusSeconds(1), 100, 0, 50);

        var summary = collector(props(2, 10, 3)).collect(run, List.of(p1));

        assertEquals(StopReason.DEADLINE, summary.stopReason());
        assertEquals(0, remote.listingCount(p1));
        assertEquals(FrontierState.PENDING, repo.state(EntityKind.PLAYER, REGION, "P1"));
    }

    @Test
    void matchOutsideQueue_isSkipped_andNotStored() {
        var aram = new MatchRecord(m1, T0, Duration.ofMinutes(20), 450, "14.1.1",
                match("M1", T0, true, p1).participants(), "{}", T0);
        remote.withMatch(aram).withPlayerMatches(p1, m1);

        var summary = collector(props(1, 10, 3)).collect(newRun(100), List.of(p1));

        assertTrue(repo.storedMatches().isEmpty());
        assertEquals(FrontierState.DONE, repo.state(EntityKind.MATCH, REGION, "M1"));
        assertEquals(1, summary.matchesSkipped());
        assertNull(repo.state(EntityKind.PLAYER, REGION, "P2"));
    }

    @Test
    void repair_overwritesStoredMatch() {
        repo.putMatch(match("M1", T0, true, p1));
        var fresh = match("M1", T0, false, p1, p2);
        remote.withMatch(fresh);

        var repaired = collector(props(1, 10, 3)).repair(m1);

        assertEquals(fresh, repaired);
        var stored = repo.iterateMatches(null).findFirst().orElseThrow();
        assertEquals(p2, stored.participants().get(1).player());
    }
}
