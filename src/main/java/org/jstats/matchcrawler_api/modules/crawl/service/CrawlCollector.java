package org.jstats.matchcrawler_api.modules.crawl.service;

import org.jspecify.annotations.NullMarked;
import org.jstats.matchcrawler_api.modules.crawl.config.CrawlProperties;
import org.jstats.matchcrawler_api.modules.crawl.model.EntityKind;
import org.jstats.matchcrawler_api.modules.crawl.model.FrontierEntry;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchRecord;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchRef;
import org.jstats.matchcrawler_api.modules.crawl.model.ParticipantRecord;
import org.jstats.matchcrawler_api.modules.crawl.model.PlayerRecord;
import org.jstats.matchcrawler_api.modules.crawl.model.PlayerRef;
import org.jstats.matchcrawler_api.modules.crawl.remote.MatchWindow;
import org.jstats.matchcrawler_api.modules.crawl.remote.RemoteMatchClient;
import org.jstats.matchcrawler_api.modules.crawl.remote.RemoteMatchClient.NotFoundException;
import org.jstats.matchcrawler_api.modules.crawl.remote.RemoteMatchClient.RateLimitedException;
import org.jstats.matchcrawler_api.modules.crawl.remote.RemoteMatchClient.RemoteClientException;
import org.jstats.matchcrawler_api.modules.crawl.remote.RemoteMatchClient.TransientException;
import org.jstats.matchcrawler_api.modules.crawl.remote.RemoteMatchClient.UpstreamPayloadException;
import org.jstats.matchcrawler_api.modules.crawl.remote.RemoteMatchClient.UpstreamRejectedException;
import org.jstats.matchcrawler_api.modules.crawl.repository.CrawlRepository;
import org.jstats.matchcrawler_api.modules.crawl.repository.StorageException;
import org.jstats.matchcrawler_api.modules.crawl.repository.StorageUnavailableException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.retry.support.RetryTemplate;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Runs the discovery / fetch loop of a crawl on a bounded worker pool.
 * <p>
 * Per entry: {@code PENDING -> IN_FLIGHT -> DONE | FAILED | PENDING (retry)}. Every transition is
 * written to the repository as it happens, so a restarted run resumes from stored state.
 */
@Service
@NullMarked
public class CrawlCollector {

    private static final Logger log = LoggerFactory.getLogger(CrawlCollector.class);

    static final int TEAM_SIZE = 5;

    static final String REASON_NOT_FOUND = "NOT_FOUND";
    static final String REASON_PAYLOAD = "PAYLOAD";
    static final String REASON_TRANSIENT = "TRANSIENT";
    static final String REASON_REMOTE = "REMOTE";
    static final String REASON_STORAGE = "STORAGE";
    static final String REASON_RATE_LIMITED = "RATE_LIMITED";
    static final String REASON_RELEASED = "RELEASED";

    private enum BatchControl {
        CONTINUE,
        /** return the remaining entries of the batch to pending */
        RELEASE_REST,
        /** leave the remaining entries in flight; the store is gone */
        ABANDON_REST
    }

    private final FrontierManager frontier;
    private final CrawlRepository repository;
    private final RemoteMatchClient client;
    private final RetryTemplate storageRetry;
    private final CrawlProperties props;
    private final BackoffPolicy backoff;
    private final Clock clock;

    public CrawlCollector(
            FrontierManager frontier,
            CrawlRepository repository,
            RemoteMatchClient client,
            @Qualifier("crawlStorageRetryTemplate") RetryTemplate storageRetry,
            CrawlProperties props,
            Clock clock) {
        this.frontier = frontier;
        this.repository = repository;
        this.client = client;
        this.storageRetry = storageRetry;
        this.props = props;
        this.backoff = new BackoffPolicy(props.baseBackoff(), props.maxBackoff());
        this.clock = clock;
    }

    /**
     * Runs the crawl until a stop condition and returns the final summary. Blocks the caller.
     */
    public CrawlRunSummary collect(CrawlRun run, Collection<PlayerRef> seeds) {
        log.info("Crawl run {} starting: {} seeds, maxMatches={}, deadline={}, workers={}",
                run.id(), seeds.size(), run.maxMatches(), run.deadline(), props.workers());
        ExecutorService pool = null;
        try {
            // this process is the only crawler: anything still in flight belongs to a dead run
            frontier.reclaimClaimedBefore(clock.instant());
            frontier.seed(seeds);

            pool = Executors.newFixedThreadPool(props.workers(), new CustomizableThreadFactory("crawl-worker-"));
            List<Future<?>> workers = new ArrayList<>();
            for (int i = 0; i < props.workers(); i++) {
                workers.add(pool.submit(() -> workerLoop(run)));
            }
            for (Future<?> worker : workers) {
                try {
                    worker.get();
                } catch (ExecutionException e) {
                    log.error("Crawl worker of run {} died", run.id(), e.getCause());
                    run.fail(e.getCause());
                }
            }
        } catch (StorageUnavailableException e) {
            log.error("Crawl run {} cannot reach the store: {}", run.id(), e.getMessage());
            run.stop(StopReason.STORAGE_UNAVAILABLE);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.requestShutdown();
            run.stop(StopReason.SHUTDOWN);
        } catch (RuntimeException e) {
            log.error("Crawl run {} failed", run.id(), e);
            run.fail(e);
        } finally {
            if (pool != null) {
                pool.shutdown();
                awaitWorkers(pool);
            }
        }
        run.finish(clock.instant(), totalMatches(run));
        var summary = run.summary();
        log.info("Crawl run {} finished: reason={}, stored={}, skipped={}, players={}, failures={}, totalMatches={}",
                summary.runId(), summary.stopReason(), summary.matchesStored(), summary.matchesSkipped(),
                summary.playersCrawled(), summary.failuresByReason(), summary.totalMatchesInStore());
        return summary;
    }

    /**
     * Re-fetches a stored (or missing) match and overwrites it with the fresh payload.
     */
    public MatchRecord repair(MatchRef ref) {
        var match = client.fetchMatch(ref);
        storage(() -> {
            repository.replaceMatch(match);
            return null;
        });
        log.info("Repaired match {} ({} participants)", ref, match.participants().size());
        return match;
    }

    // ---------- worker ----------

    private void workerLoop(CrawlRun run) {
        while (!run.isStopped()) {
            if (run.isShutdownRequested()) {
                run.stop(StopReason.SHUTDOWN);
                return;
            }
            List<FrontierEntry> batch;
            try {
                var stop = frontier.checkStop(run);
                if (stop.isPresent()) {
                    if (run.stop(stop.get())) {
                        log.info("Crawl run {} stopping: {}", run.id(), stop.get());
                    }
                    return;
                }
                batch = frontier.claimNextBatch(run, props.batchSize());
                if (batch.isEmpty()) {
                    frontier.reclaimStale();
                    TimeUnit.MILLISECONDS.sleep(props.pollInterval().toMillis());
                    continue;
                }
            } catch (StorageUnavailableException e) {
                log.error("Store unavailable, halting run {}: {}", run.id(), e.getMessage());
                run.stop(StopReason.STORAGE_UNAVAILABLE);
                return;
            } catch (StorageException e) {
                // claim/stop checks are idempotent: back off and try again
                log.warn("Frontier query failed in run {}: {}", run.id(), e.getMessage());
                if (!pause(run)) {
                    return;
                }
                continue;
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                run.requestShutdown();
                run.stop(StopReason.SHUTDOWN);
                return;
            }
            processBatch(run, batch);
        }
    }

    private void processBatch(CrawlRun run, List<FrontierEntry> batch) {
        for (int i = 0; i < batch.size(); i++) {
            var entry = batch.get(i);
            BatchControl control;
            try {
                control = process(run, entry);
            } catch (StorageUnavailableException e) {
                log.error("Store unavailable while recording {}, halting run {}: {}", entry.key(), run.id(), e.getMessage());
                run.stop(StopReason.STORAGE_UNAVAILABLE);
                control = BatchControl.ABANDON_REST;
            } catch (StorageException e) {
                log.error("Could not record the outcome of {}, it stays in flight until reclaimed: {}", entry.key(), e.getMessage());
                control = BatchControl.RELEASE_REST;
            }
            if (control == BatchControl.CONTINUE) {
                continue;
            }
            List<FrontierEntry> rest = batch.subList(i + 1, batch.size());
            if (control == BatchControl.RELEASE_REST) {
                release(run, rest);
            } else {
                rest.stream().filter(e -> e.kind() == EntityKind.MATCH).forEach(e -> run.releaseMatchSlot(false));
                log.warn("Left {} entries in flight for run {}; they are reclaimed after {}",
                        rest.size(), run.id(), props.inFlightTimeout());
            }
            return;
        }
    }

    private BatchControl process(CrawlRun run, FrontierEntry entry) {
        try {
            if (entry.kind() == EntityKind.PLAYER) {
                crawlPlayer(run, entry);
                return BatchControl.CONTINUE;
            }
            return crawlMatch(run, entry);
        } catch (NotFoundException e) {
            fail(run, entry, REASON_NOT_FOUND, e);
            return BatchControl.CONTINUE;
        } catch (UpstreamPayloadException e) {
            fail(run, entry, REASON_PAYLOAD, e);
            return BatchControl.CONTINUE;
        } catch (RateLimitedException e) {
            // not the entry's fault: the attempt counter stays as is
            requeue(entry, clock.instant().plus(e.retryAfter), REASON_RATE_LIMITED);
            return BatchControl.CONTINUE;
        } catch (TransientException e) {
            int attempts = entry.attempts() + 1;
            var counted = entry.withAttempts(attempts);
            if (attempts >= props.maxAttempts()) {
                fail(run, counted, REASON_TRANSIENT, e);
            } else {
                var delay = backoff.delay(attempts);
                if (log.isDebugEnabled()) {
                    log.debug("Transient failure {}/{} for {}, retry in {} ms: {}",
                            attempts, props.maxAttempts(), entry.key(), delay.toMillis(), e.getMessage());
                }
                requeue(counted, clock.instant().plus(delay), REASON_TRANSIENT + ": " + e.getMessage());
            }
            return BatchControl.CONTINUE;
        } catch (UpstreamRejectedException e) {
            log.error("Remote API rejected the credentials (HTTP {}), halting run {}", e.status, run.id());
            requeue(entry, clock.instant(), REASON_REMOTE + ": " + e.getMessage());
            run.stop(StopReason.REMOTE_REJECTED);
            return BatchControl.RELEASE_REST;
        } catch (RemoteClientException e) {
            fail(run, entry, REASON_REMOTE, e);
            return BatchControl.CONTINUE;
        } catch (StorageUnavailableException e) {
            log.error("Store unavailable while processing {}, halting run {}: {}", entry.key(), run.id(), e.getMessage());
            run.stop(StopReason.STORAGE_UNAVAILABLE);
            return BatchControl.ABANDON_REST;
        } catch (StorageException e) {
            log.error("Storage failed for {} after retries: {}", entry.key(), e.getMessage());
            fail(run, entry, REASON_STORAGE, e);
            return BatchControl.RELEASE_REST;
        }
    }

    private void crawlPlayer(CrawlRun run, FrontierEntry entry) {
        PlayerRef player = entry.playerRef();
        Instant now = clock.instant();
        var window = new MatchWindow(now.minus(props.window()), props.matchesPerPlayer(), props.queueId());
        List<MatchRef> ids = client.listMatchIds(player, window);
        int added = storage(() -> frontier.discoverMatches(ids));
        storage(() -> {
            repository.putPlayer(new PlayerRecord(player, now, ids.size()));
            return null;
        });
        markDone(entry);
        run.playerCrawled();
        if (log.isDebugEnabled()) {
            log.debug("Player {}: {} match ids, {} new", player, ids.size(), added);
        }
    }

    private BatchControl crawlMatch(CrawlRun run, FrontierEntry entry) {
        MatchRef ref = entry.matchRef();
        boolean slotHeld = true;
        try {
            if (storage(() -> repository.exists(EntityKind.MATCH, ref.region(), ref.id()))) {
                // an earlier pass may have stored the match and died before enqueuing its players
                return discoverParticipants(run, entry, storage(() -> repository.matchParticipants(ref)), false);
            }
            MatchRecord match = client.fetchMatch(ref);
            String rejection = rejection(match);
            if (rejection != null) {
                if (log.isDebugEnabled()) {
                    log.debug("Skipping match {}: {}", ref, rejection);
                }
                markDone(entry);
                run.matchSkipped();
                return BatchControl.CONTINUE;
            }
            boolean inserted = storage(() -> repository.putMatch(match));
            run.releaseMatchSlot(inserted);
            slotHeld = false;
            return discoverParticipants(run, entry, match.participantRefs(), inserted);
        } finally {
            if (slotHeld) {
                run.releaseMatchSlot(false);
            }
        }
    }

    /**
     * Enqueues the players of a stored match, then completes its entry. The match is already in the
     * store, so a discovery failure sends the entry back to pending instead of failing it.
     */
    private BatchControl discoverParticipants(CrawlRun run, FrontierEntry entry, List<PlayerRef> players, boolean inserted) {
        int added;
        try {
            added = storage(() -> frontier.discoverPlayers(players));
        } catch (StorageUnavailableException e) {
            throw e;
        } catch (StorageException e) {
            int attempts = entry.attempts() + 1;
            var counted = entry.withAttempts(attempts);
            if (attempts >= props.maxAttempts()) {
                fail(run, counted, REASON_STORAGE, e);
            } else {
                log.warn("Match {} is stored but its players were not enqueued, retrying the entry: {}",
                        entry.key(), e.getMessage());
                requeue(counted, clock.instant().plus(backoff.delay(attempts)), REASON_STORAGE + ": " + e.getMessage());
            }
            return BatchControl.RELEASE_REST;
        }
        markDone(entry);
        if (log.isDebugEnabled()) {
            log.debug("Match {} inserted={}, {} new players", entry.key(), inserted, added);
        }
        return BatchControl.CONTINUE;
    }

    /**
     * @return why the match is not kept, or null to keep it
     */
    private String rejection(MatchRecord match) {
        if (props.queueId() != null && !props.queueId().equals(match.queueId())) {
            return "queue " + match.queueId() + " != " + props.queueId();
        }
        long blue = match.countTeam(ParticipantRecord.BLUE_TEAM);
        long red = match.countTeam(ParticipantRecord.RED_TEAM);
        if (blue != TEAM_SIZE || red != TEAM_SIZE) {
            return "incomplete roster " + blue + "v" + red;
        }
        return null;
    }

    // ---------- transitions ----------

    private void markDone(FrontierEntry entry) {
        if (!storage(() -> repository.markDone(entry))) {
            log.warn("{} was no longer in flight when marking it done", entry.key());
        }
    }

    private void fail(CrawlRun run, FrontierEntry entry, String reason, Exception cause) {
        String detail = reason + ": " + cause.getMessage();
        log.warn("Frontier entry {} failed after {} attempt(s): {}", entry.key(), Math.max(1, entry.attempts()), detail);
        storage(() -> repository.markFailed(entry, detail));
        run.recordFailure(entry, reason, cause.getMessage());
    }

    private void requeue(FrontierEntry entry, Instant notBefore, String reason) {
        if (!storage(() -> repository.requeue(entry, notBefore, reason))) {
            log.warn("{} was no longer in flight when requeueing it", entry.key());
        }
    }

    private void release(CrawlRun run, List<FrontierEntry> rest) {
        if (rest.isEmpty()) {
            return;
        }
        Instant now = clock.instant();
        rest.stream().filter(e -> e.kind() == EntityKind.MATCH).forEach(e -> run.releaseMatchSlot(false));
        for (FrontierEntry entry : rest) {
            try {
                requeue(entry, now, REASON_RELEASED);
            } catch (StorageUnavailableException e) {
                log.error("Store unavailable while releasing {}: {}", entry.key(), e.getMessage());
                run.stop(StopReason.STORAGE_UNAVAILABLE);
                return;
            } catch (StorageException e) {
                log.error("Could not release {}, it stays in flight until reclaimed: {}", entry.key(), e.getMessage());
            }
        }
        log.info("Released {} unprocessed entries of run {} back to pending", rest.size(), run.id());
    }

    private <T> T storage(Supplier<T> operation) {
        return storageRetry.execute(ctx -> operation.get());
    }

    private boolean pause(CrawlRun run) {
        try {
            TimeUnit.MILLISECONDS.sleep(props.pollInterval().toMillis());
            return true;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            run.requestShutdown();
            run.stop(StopReason.SHUTDOWN);
            return false;
        }
    }

    private long totalMatches(CrawlRun run) {
        try {
            return repository.countMatches();
        } catch (StorageException e) {
            log.warn("Could not count stored matches at the end of run {}: {}", run.id(), e.getMessage());
            return run.storedTotal();
        }
    }

    private static void awaitWorkers(ExecutorService pool) {
        try {
            if (!pool.awaitTermination(30, TimeUnit.SECONDS)) {
                pool.shutdownNow();
            }
        } catch (InterruptedException e) {
            pool.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }
}
