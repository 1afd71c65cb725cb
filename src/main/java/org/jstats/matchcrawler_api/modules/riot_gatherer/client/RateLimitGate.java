package org.jstats.matchcrawler_api.modules.riot_gatherer.client;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Client-side rate limiter shared by every outgoing request.
 * <p>
 * Callers take a permit with {@link #acquire()} before each request. Permits are handed out
 * one caller at a time, in arrival order, against sliding-window buckets (e.g. 20 per second and
 * 100 per two minutes). A {@link #pause(Duration) pause} blocks every caller until it elapses,
 * which is how a single 429 stops the whole pipeline. Bucket limits follow the
 * {@code X-App-Rate-Limit} headers observed on responses.
 */
public class RateLimitGate {

    private static final Logger log = LoggerFactory.getLogger(RateLimitGate.class);

    @FunctionalInterface
    public interface Sleeper {
        void sleep(Duration duration) throws InterruptedException;
    }

    public record RateLimit(int permits, Duration window) {

        public RateLimit {
            if (permits <= 0 || window.isZero() || window.isNegative()) {
                throw new IllegalArgumentException("Invalid rate limit " + permits + " per " + window);
            }
        }

        /** Parses {@code "20:1"} as 20 permits per 1 second. */
        public static RateLimit parse(String spec) {
            String[] parts = spec.trim().split(":");
            if (parts.length != 2) {
                throw new IllegalArgumentException("Rate limit must look like permits:seconds, got " + spec);
            }
            try {
                return new RateLimit(Integer.parseInt(parts[0].trim()), Duration.ofSeconds(Long.parseLong(parts[1].trim())));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("Rate limit must look like permits:seconds, got " + spec, e);
            }
        }

        @Override
        public String toString() {
            return permits + ":" + window.toSeconds();
        }
    }

    private static final class Bucket {
        final RateLimit limit;
        final Deque<Instant> issued = new ArrayDeque<>();

        Bucket(RateLimit limit) {
            this.limit = limit;
        }

        Duration waitTime(Instant now) {
            Instant horizon = now.minus(limit.window());
            while (!issued.isEmpty() && !issued.peekFirst().isAfter(horizon)) {
                issued.pollFirst();
            }
            if (issued.size() < limit.permits()) {
                return Duration.ZERO;
            }
            return Duration.between(now, issued.peekFirst().plus(limit.window()));
        }
    }

    private final Clock clock;
    private final Sleeper sleeper;
    private final ReentrantLock turn = new ReentrantLock(true);
    private final Object bucketsMonitor = new Object();
    private final AtomicReference<Instant> cooldownUntil = new AtomicReference<>(Instant.EPOCH);
    private List<Bucket> buckets;

    public RateLimitGate(List<RateLimit> limits, Clock clock, Sleeper sleeper) {
        this.clock = clock;
        this.sleeper = sleeper;
        this.buckets = limits.stream().map(Bucket::new).toList();
    }

    public static RateLimitGate fromSpecs(List<String> specs, Clock clock) {
        return new RateLimitGate(
                specs.stream().map(RateLimit::parse).toList(),
                clock,
                d -> TimeUnit.MILLISECONDS.sleep(Math.max(1, d.toMillis())));
    }

    /**
     * Blocks until the caller may send one request.
     */
    public void acquire() throws InterruptedException {
        turn.lockInterruptibly();
        try {
            while (true) {
                Instant now = clock.instant();
                Duration wait = waitTime(now);
                if (wait.isZero() || wait.isNegative()) {
                    synchronized (bucketsMonitor) {
                        for (Bucket bucket : buckets) {
                            bucket.issued.addLast(now);
                        }
                    }
                    return;
                }
                if (log.isDebugEnabled()) {
                    log.debug("Rate limit gate closed, waiting {} ms", wait.toMillis());
                }
                sleeper.sleep(wait);
            }
        } finally {
            turn.unlock();
        }
    }

    /**
     * Closes the gate for every caller for at least the given duration.
     */
    public void pause(Duration duration) {
        Instant until = clock.instant().plus(duration);
        Instant effective = cooldownUntil.accumulateAndGet(until, (a, b) -> a.isAfter(b) ? a : b);
        log.warn("Rate limit cooldown for {} ms (gate closed until {})", duration.toMillis(), effective);
    }

    Instant cooldownUntil() {
        return cooldownUntil.get();
    }

    boolean isCoolingDown() {
        return cooldownUntil.get().isAfter(clock.instant());
    }

    public List<RateLimit> limits() {
        synchronized (bucketsMonitor) {
            return buckets.stream().map(b -> b.limit).toList();
        }
    }

    /**
     * Applies the rate limit headers of a response: {@code limitHeader} like {@code "20:1,100:120"}
     * (permits:seconds) and {@code countHeader} like {@code "3:1,57:120"} (used:seconds).
     * Buckets are replaced when the advertised limits differ; an exhausted bucket pauses the gate
     * for its window.
     */
    public void observe(String limitHeader, String countHeader) {
        if (limitHeader == null || limitHeader.isBlank()) {
            return;
        }
        List<RateLimit> advertised;
        try {
            advertised = parseHeader(limitHeader);
        } catch (IllegalArgumentException e) {
            log.warn("Ignoring malformed rate limit header '{}': {}", limitHeader, e.getMessage());
            return;
        }
        synchronized (bucketsMonitor) {
            List<RateLimit> current = buckets.stream().map(b -> b.limit).toList();
            if (!current.equals(advertised)) {
                Map<Duration, Bucket> byWindow = new LinkedHashMap<>();
                for (Bucket b : buckets) {
                    byWindow.put(b.limit.window(), b);
                }
                List<Bucket> next = new ArrayList<>();
                for (RateLimit limit : advertised) {
                    Bucket replacement = new Bucket(limit);
                    Bucket previous = byWindow.get(limit.window());
                    if (previous != null) {
                        replacement.issued.addAll(previous.issued);
                    }
                    next.add(replacement);
                }
                log.info("Rate limit buckets updated from response headers: {} -> {}", current, advertised);
                buckets = List.copyOf(next);
            }
        }
        if (countHeader == null || countHeader.isBlank()) {
            return;
        }
        Map<Duration, Integer> used = new LinkedHashMap<>();
        for (String part : countHeader.split(",")) {
            String[] kv = part.trim().split(":");
            if (kv.length == 2) {
                try {
                    used.put(Duration.ofSeconds(Long.parseLong(kv[1].trim())), Integer.parseInt(kv[0].trim()));
                } catch (NumberFormatException ignore) {
                    // malformed count entries are skipped
                }
            }
        }
        for (RateLimit limit : advertised) {
            Integer count = used.get(limit.window());
            if (count != null && count >= limit.permits()) {
                pause(limit.window());
            }
        }
    }

    private Duration waitTime(Instant now) {
        Duration wait = Duration.between(now, cooldownUntil.get());
        if (wait.isNegative()) {
            wait = Duration.ZERO;
        }
        synchronized (bucketsMonitor) {
            for (Bucket bucket : buckets) {
                Duration bucketWait = bucket.waitTime(now);
                if (bucketWait.compareTo(wait) > 0) {
                    wait = bucketWait;
                }
            }
        }
        return wait;
    }

    private static List<RateLimit> parseHeader(String header) {
        List<RateLimit> limits = new ArrayList<>();
        for (String part : header.split(",")) {
            if (!part.isBlank()) {
                limits.add(RateLimit.parse(part));
            }
        }
        return List.copyOf(limits);
    }
}
