package org.jstats.matchcrawler_api.modules.crawl.service;

import org.jstats.matchcrawler_api.modules.crawl.model.FrontierEntry;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.atomic.AtomicReference;

/**
 * In-memory state of one crawl run. Counters are reporting only; durable progress lives
 * in the repository. The one piece of coordination kept here is the match budget: workers
 * reserve match slots before claiming match entries so concurrent fetches can never push
 * the store past {@link #maxMatches()}.
 */
public class CrawlRun {

    private final String id;
    private final Instant startedAt;
    private final Instant deadline;
    private final int maxMatches;
    private final long baselineMatches;
    private final int failedRefsCap;

    private final AtomicReference<StopReason> stopReason = new AtomicReference<>();
    private final AtomicLong matchesStored = new AtomicLong();
    private final AtomicLong matchesSkipped = new AtomicLong();
    private final AtomicLong playersCrawled = new AtomicLong();
    private final Map<String, AtomicLong> failuresByReason = new ConcurrentHashMap<>();
    private final List<CrawlRunSummary.FailedRef> failedRefs = new ArrayList<>();

    private volatile boolean shutdownRequested;
    private volatile Instant finishedAt;
    private volatile String error;
    private volatile Long totalMatchesInStore;

    // guarded by this
    private int reservedMatches;

    public CrawlRun(String id, Instant startedAt, Instant deadline, int maxMatches, long baselineMatches, int failedRefsCap) {
        this.id = id;
        this.startedAt = startedAt;
        this.deadline = deadline;
        this.maxMatches = maxMatches;
        this.baselineMatches = baselineMatches;
        this.failedRefsCap = failedRefsCap;
    }

    public String id() {
        return id;
    }

    public Instant startedAt() {
        return startedAt;
    }

    public Instant deadline() {
        return deadline;
    }

    public int maxMatches() {
        return maxMatches;
    }

    // ---------- match budget ----------

    /**
     * Matches in the store as far as this run knows: the count at start plus what it stored.
     */
    public long storedTotal() {
        return baselineMatches + matchesStored.get();
    }

    /**
     * Reserves up to {@code wanted} match slots.
     *
     * @return the number of slots granted, 0 when the budget is used up or fully reserved
     */
    public synchronized int reserveMatchSlots(int wanted) {
        long free = maxMatches - storedTotal() - reservedMatches;
        int granted = (int) Math.max(0, Math.min(wanted, free));
        reservedMatches += granted;
        return granted;
    }

    /**
     * Gives back a reserved slot; {@code stored} turns it into a stored match.
     */
    public synchronized void releaseMatchSlot(boolean stored) {
        if (reservedMatches > 0) {
            reservedMatches--;
        }
        if (stored) {
            matchesStored.incrementAndGet();
        }
    }

    public synchronized void releaseMatchSlots(int count) {
        reservedMatches = Math.max(0, reservedMatches - count);
    }

    public synchronized int reservedMatches() {
        return reservedMatches;
    }

    // ---------- lifecycle ----------

    public void requestShutdown() {
        shutdownRequested = true;
    }

    public boolean isShutdownRequested() {
        return shutdownRequested;
    }

    /**
     * Records the reason the run stops. The first reason wins.
     *
     * @return true if this call set the reason
     */
    public boolean stop(StopReason reason) {
        return stopReason.compareAndSet(null, reason);
    }

    public void fail(Throwable cause) {
        if (stop(StopReason.ERROR)) {
            error = cause.getClass().getSimpleName() + ": " + cause.getMessage();
        }
    }

    public boolean isStopped() {
        return stopReason.get() != null;
    }

    public StopReason stopReason() {
        return stopReason.get();
    }

    public void finish(Instant at, long totalMatches) {
        totalMatchesInStore = totalMatches;
        finishedAt = at;
    }

    public boolean isRunning() {
        return finishedAt == null;
    }

    // ---------- counters ----------

    public void matchSkipped() {
        matchesSkipped.incrementAndGet();
    }

    public void playerCrawled() {
        playersCrawled.incrementAndGet();
    }

    public void recordFailure(FrontierEntry entry, String reason, String detail) {
        failuresByReason.computeIfAbsent(reason, r -> new AtomicLong()).incrementAndGet();
        synchronized (failedRefs) {
            if (failedRefs.size() < failedRefsCap) {
                failedRefs.add(new CrawlRunSummary.FailedRef(entry.kind(), entry.region(), entry.refId(), reason, detail));
            }
        }
    }

    public CrawlRunSummary summary() {
        Map<String, Long> failures = new TreeMap<>();
        failuresByReason.forEach((reason, count) -> failures.put(reason, count.get()));
        List<CrawlRunSummary.FailedRef> refs;
        synchronized (failedRefs) {
            refs = List.copyOf(failedRefs);
        }
        Long total = totalMatchesInStore;
        return new CrawlRunSummary(
                id,
                startedAt,
                finishedAt,
                deadline,
                maxMatches,
                isRunning(),
                stopReason.get(),
                error,
                matchesStored.get(),
                matchesSkipped.get(),
                playersCrawled.get(),
                failures,
                refs,
                total != null ? total : storedTotal());
    }
}
