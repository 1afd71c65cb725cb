package org.jstats.matchcrawler_api.modules.crawl.service;

import jakarta.annotation.PreDestroy;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.matchcrawler_api.modules.crawl.config.CrawlProperties;
import org.jstats.matchcrawler_api.modules.crawl.model.PlayerRef;
import org.jstats.matchcrawler_api.modules.crawl.remote.RemoteMatchClient;
import org.jstats.matchcrawler_api.modules.crawl.repository.CrawlRepository;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.scheduling.concurrent.CustomizableThreadFactory;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;

/**
 * Owns the lifecycle of crawl runs: at most one at a time, started in the background.
 */
@Service
@NullMarked
public class CrawlRunner {

    private static final Logger log = LoggerFactory.getLogger(CrawlRunner.class);

    private final CrawlCollector collector;
    private final CrawlRepository repository;
    private final RemoteMatchClient client;
    private final CrawlProperties props;
    private final Clock clock;
    private final ExecutorService executor =
            Executors.newSingleThreadExecutor(new CustomizableThreadFactory("crawl-run-"));

    private volatile @Nullable CrawlRun current;

    public CrawlRunner(
            CrawlCollector collector,
            CrawlRepository repository,
            RemoteMatchClient client,
            CrawlProperties props,
            Clock clock) {
        this.collector = collector;
        this.repository = repository;
        this.client = client;
        this.props = props;
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void startOnReady() {
        if (props.runOnStartup()) {
            log.info("crawler.run-on-startup is set, starting a crawl run");
            start(CrawlRequest.defaults());
        }
    }

    /**
     * Starts a run in the background.
     *
     * @throws CrawlAlreadyRunningException when a run is active
     */
    public synchronized CrawlRunSummary start(CrawlRequest request) {
        var active = current;
        if (active != null && active.isRunning()) {
            throw new CrawlAlreadyRunningException(active.id());
        }
        // parse before starting so a bad seed answers 400
        List<PlayerRef> requestedSeeds = request.seeds().stream()
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .map(props::toPlayerRef)
                .toList();

        Instant now = clock.instant();
        Duration duration = request.maxRunDuration() != null ? request.maxRunDuration() : props.maxRunDuration();
        Instant deadline = now.plus(duration);
        if (props.deadline() != null && props.deadline().isBefore(deadline)) {
            deadline = props.deadline();
        }
        int maxMatches = request.maxMatches() != null ? request.maxMatches() : props.maxMatches();

        var run = new CrawlRun(UUID.randomUUID().toString(), now, deadline, maxMatches,
                repository.countMatches(), props.failedRefsCap());
        current = run;
        executor.submit(() -> {
            try {
                collector.collect(run, requestedSeeds.isEmpty() ? configuredSeeds() : requestedSeeds);
            } catch (RuntimeException e) {
                log.error("Crawl run {} aborted", run.id(), e);
                run.fail(e);
                run.finish(clock.instant(), run.storedTotal());
            }
        });
        log.info("Crawl run {} submitted (maxMatches={}, deadline={})", run.id(), maxMatches, deadline);
        return run.summary();
    }

    public Optional<CrawlRunSummary> current() {
        var run = current;
        return run == null ? Optional.empty() : Optional.of(run.summary());
    }

    /**
     * Asks the active run to finish its batches in hand and stop.
     */
    public Optional<CrawlRunSummary> requestStop() {
        var run = current;
        if (run == null) {
            return Optional.empty();
        }
        if (run.isRunning()) {
            log.info("Stop requested for crawl run {}", run.id());
            run.requestShutdown();
        }
        return Optional.of(run.summary());
    }

    @PreDestroy
    void shutdown() {
        requestStop();
        executor.shutdown();
        try {
            if (!executor.awaitTermination(60, TimeUnit.SECONDS)) {
                log.warn("Crawl run did not stop within 60s, interrupting");
                executor.shutdownNow();
            }
        } catch (InterruptedException e) {
            executor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    List<PlayerRef> configuredSeeds() {
        Set<PlayerRef> seeds = new LinkedHashSet<>(props.seedRefs());
        for (String tier : props.ladderTiers()) {
            seeds.addAll(client.listLadderPlayers(tier));
        }
        if (seeds.isEmpty()) {
            log.warn("No seeds configured (crawler.seeds / crawler.ladder-tiers); the run resumes the stored frontier only");
        }
        return List.copyOf(seeds);
    }
}
