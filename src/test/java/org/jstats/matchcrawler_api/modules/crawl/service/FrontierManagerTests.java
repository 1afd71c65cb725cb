package org.jstats.matchcrawler_api.modules.crawl.service;

import org.jstats.matchcrawler_api.modules.crawl.model.EntityKind;
import org.jstats.matchcrawler_api.modules.crawl.model.FrontierEntry;
import org.jstats.matchcrawler_api.modules.crawl.model.FrontierState;
import org.jstats.matchcrawler_api.modules.crawl.model.FrontierStats;
import org.jstats.matchcrawler_api.modules.crawl.repository.CrawlRepository;
import org.jstats.matchcrawler_api.modules.crawl.repository.StorageException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Collection;
import java.util.List;
import java.util.Optional;

import static org.jstats.matchcrawler_api.modules.crawl.support.TestMatches.REGION;
import static org.jstats.matchcrawler_api.modules.crawl.support.TestMatches.matchRef;
import static org.jstats.matchcrawler_api.modules.crawl.support.TestMatches.player;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class FrontierManagerTests {

    private static final Instant NOW = Instant.parse("2024-10-01T12:00:00Z");

    CrawlRepository repo;
    Clock clock;
    FrontierManager frontier;

    @BeforeEach
    void setUp() {
        repo = mock(CrawlRepository.class);
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        frontier = new FrontierManager(repo, CrawlCollectorTests.props(1, 10, 3), clock);
    }

    private CrawlRun run(int maxMatches, long baseline) {
        return new CrawlRun("r", NOW.minusSeconds(10), NOW.plusSeconds(60), maxMatches, baseline, 10);
    }

    private static FrontierEntry inFlight(EntityKind kind, String id) {
        return new FrontierEntry(1L, kind, REGION, id, NOW, 0, FrontierState.IN_FLIGHT, NOW, NOW, null);
    }

    @Test
    @SuppressWarnings("unchecked")
    void discoverMatches_skipsStoredAndDuplicateRefs() {
        when(repo.exists(EntityKind.MATCH, REGION, "M1")).thenReturn(true);
        when(repo.putFrontierEntries(any())).thenReturn(1);

        int added = frontier.discoverMatches(List.of(matchRef("M1"), matchRef("M2"), matchRef("M2")));

        assertEquals(1, added);
        ArgumentCaptor<Collection<FrontierEntry>> captor = ArgumentCaptor.forClass(Collection.class);
        verify(repo).putFrontierEntries(captor.capture());
        var entries = List.copyOf(captor.getValue());
        assertEquals(1, entries.size());
        assertEquals("M2", entries.get(0).refId());
        assertEquals(FrontierState.PENDING, entries.get(0).state());
        assertEquals(NOW, entries.get(0).discoveredAt());
    }

    @Test
    void discoverPlayers_whenAllKnown_doesNotWrite() {
        when(repo.exists(eq(EntityKind.PLAYER), eq(REGION), any())).thenReturn(true);

        assertEquals(0, frontier.discoverPlayers(List.of(player("P1"), player("P2"))));
        verify(repo, never()).putFrontierEntries(any());
    }

    @Test
    void claimNextBatch_prefersMatches_boundedByRemainingBudget() {
        var m = inFlight(EntityKind.MATCH, "M1");
        when(repo.claimNextBatch(EntityKind.MATCH, 3, NOW)).thenReturn(List.of(m));
        var run = run(10, 7);

        var batch = frontier.claimNextBatch(run, 5);

        assertEquals(List.of(m), batch);
        assertEquals(1, run.reservedMatches());
        verify(repo, never()).claimNextBatch(eq(EntityKind.PLAYER), anyInt(), any());
    }

    @Test
    void claimNextBatch_withoutPendingMatches_claimsPlayers_andReleasesSlots() {
        var p = inFlight(EntityKind.PLAYER, "P1");
        when(repo.claimNextBatch(EntityKind.MATCH, 5, NOW)).thenReturn(List.of());
        when(repo.claimNextBatch(EntityKind.PLAYER, 5, NOW)).thenReturn(List.of(p));
        var run = run(100, 0);

        assertEquals(List.of(p), frontier.claimNextBatch(run, 5));
        assertEquals(0, run.reservedMatches());
    }

    @Test
    void claimNextBatch_whenBudgetFullyReserved_claimsNothing() {
        var run = run(2, 0);
        assertEquals(2, run.reserveMatchSlots(2));

        assertTrue(frontier.claimNextBatch(run, 5).isEmpty());
        verify(repo, never()).claimNextBatch(any(), anyInt(), any());
    }

    @Test
    void claimNextBatch_whenBudgetUsedUp_claimsNothing() {
        var run = run(3, 3);

        assertTrue(frontier.claimNextBatch(run, 5).isEmpty());
        verify(repo, never()).claimNextBatch(any(), anyInt(), any());
    }

    @Test
    void claimNextBatch_whenClaimFails_releasesReservation() {
        when(repo.claimNextBatch(EntityKind.MATCH, 4, NOW)).thenThrow(new StorageException("claimNextBatch", "boom", null));
        var run = run(4, 0);

        assertThrows(StorageException.class, () -> frontier.claimNextBatch(run, 10));
        assertEquals(0, run.reservedMatches());
    }

    @Test
    void checkStop_deadlineWinsOverCeiling() {
        var run = new CrawlRun("r", NOW.minusSeconds(60), NOW, 1, 5, 10);
        assertEquals(Optional.of(StopReason.DEADLINE), frontier.checkStop(run));
    }

    @Test
    void checkStop_ceilingCountsMatchesStoredBeforeTheRun() {
        assertEquals(Optional.of(StopReason.CEILING), frontier.checkStop(run(5, 5)));
    }

    @Test
    void checkStop_exhaustedOnlyWhenNothingPendingOrInFlight() {
        when(repo.frontierStats()).thenReturn(new FrontierStats(List.of(
                new FrontierStats.Count(EntityKind.MATCH, FrontierState.IN_FLIGHT, 1),
                new FrontierStats.Count(EntityKind.PLAYER, FrontierState.DONE, 4))));
        assertEquals(Optional.empty(), frontier.checkStop(run(10, 0)));

        when(repo.frontierStats()).thenReturn(new FrontierStats(List.of(
                new FrontierStats.Count(EntityKind.MATCH, FrontierState.FAILED, 1),
                new FrontierStats.Count(EntityKind.PLAYER, FrontierState.DONE, 4))));
        assertEquals(Optional.of(StopReason.EXHAUSTED), frontier.checkStop(run(10, 0)));
    }

    @Test
    void reclaimStale_usesInFlightTimeout() {
        frontier.reclaimStale();
        verify(repo).reclaimStale(NOW.minus(Duration.ofMinutes(10)));
    }
}
