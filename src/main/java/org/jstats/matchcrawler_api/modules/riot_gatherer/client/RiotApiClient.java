package org.jstats.matchcrawler_api.modules.riot_gatherer.client;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NullMarked;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchRecord;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchRef;
import org.jstats.matchcrawler_api.modules.crawl.model.PlayerRef;
import org.jstats.matchcrawler_api.modules.crawl.remote.MatchWindow;
import org.jstats.matchcrawler_api.modules.crawl.remote.RemoteMatchClient;
import org.jstats.matchcrawler_api.modules.riot_gatherer.config.RiotApiProperties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpStatusCode;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.converter.HttpMessageConversionException;
import org.springframework.retry.annotation.Backoff;
import org.springframework.retry.annotation.Recover;
import org.springframework.retry.annotation.Retryable;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpClientErrorException;
import org.springframework.web.client.HttpServerErrorException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestClient;

import java.nio.charset.StandardCharsets;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Riot Games API implementation of {@link RemoteMatchClient}.
 * <p>
 * Every request passes the shared {@link RateLimitGate} first. Status codes map onto the
 * {@link RemoteMatchClient} error taxonomy:
 * <ul>
 *     <li>404 -> {@link NotFoundException}</li>
 *     <li>429 -> gate paused for Retry-After, then {@link RateLimitedException}</li>
 *     <li>401/403 -> {@link UpstreamRejectedException}</li>
 *     <li>5xx and I/O errors -> {@link TransientException}</li>
 *     <li>unparseable 2xx body -> {@link UpstreamPayloadException}</li>
 * </ul>
 */
@Component
@NullMarked
public class RiotApiClient implements RemoteMatchClient {

    private static final Logger log = LoggerFactory.getLogger(RiotApiClient.class);

    static final String APP_RATE_LIMIT = "X-App-Rate-Limit";
    static final String APP_RATE_LIMIT_COUNT = "X-App-Rate-Limit-Count";
    static final int MAX_IDS_PER_PAGE = 100;

    private static final Set<String> LADDER_TIERS = Set.of("challenger", "grandmaster", "master");

    private final RestClient regional;
    private final RestClient platform;
    private final RateLimitGate gate;
    private final RiotApiProperties props;
    private final ObjectMapper mapper;
    private final Clock clock;

    public RiotApiClient(
            @Qualifier("riotregional") RestClient regional,
            @Qualifier("riotplatform") RestClient platform,
            RateLimitGate gate,
            RiotApiProperties props,
            ObjectMapper mapper,
            Clock clock) {
        this.regional = regional;
        this.platform = platform;
        this.gate = gate;
        this.props = props;
        this.mapper = mapper;
        this.clock = clock;
    }

    /**
     * GET /lol/match/v5/matches/by-puuid/{puuid}/ids, paged by 100 until the window limit is reached.
     * The start of the window is clamped to the retention horizon of the API.
     */
    @Override
    public List<MatchRef> listMatchIds(PlayerRef player, MatchWindow window) {
        Instant horizon = clock.instant().minus(props.retention());
        Instant since = window.since().isBefore(horizon) ? horizon : window.since();

        List<MatchRef> refs = new ArrayList<>();
        int start = 0;
        while (refs.size() < window.limit()) {
            int count = Math.min(MAX_IDS_PER_PAGE, window.limit() - refs.size());
            int offset = start;
            String[] page = call("match ids of " + player, () -> handle(regional.get()
                    .uri(u -> {
                        u.path("/lol/match/v5/matches/by-puuid/{puuid}/ids")
                                .queryParam("startTime", since.getEpochSecond())
                                .queryParam("start", offset)
                                .queryParam("count", count);
                        if (window.queueId() != null) {
                            u.queryParam("queue", window.queueId());
                        }
                        return u.build(player.id());
                    })
                    .accept(MediaType.APPLICATION_JSON)
                    .retrieve())
                    .toEntity(String[].class));
            if (page == null || page.length == 0) {
                break;
            }
            for (String id : page) {
                refs.add(new MatchRef(player.region(), id));
            }
            if (page.length < count) {
                break;
            }
            start += page.length;
        }
        if (log.isDebugEnabled()) {
            log.debug("Listed {} match ids for {} since {}", refs.size(), player, since);
        }
        return refs;
    }

    /**
     * GET /lol/match/v5/matches/{matchId}. The body is kept verbatim as the raw payload.
     */
    @Override
    public MatchRecord fetchMatch(MatchRef match) {
        String body = call("match " + match, () -> handle(regional.get()
                .uri("/lol/match/v5/matches/{matchId}", match.id())
                .accept(MediaType.APPLICATION_JSON)
                .retrieve())
                .toEntity(String.class));
        if (body == null || body.isBlank()) {
            throw new UpstreamPayloadException("Empty body for match " + match);
        }
        RiotPayload.Match payload;
        try {
            payload = mapper.readValue(body, RiotPayload.Match.class);
        } catch (JsonProcessingException e) {
            if (log.isErrorEnabled()) {
                log.error("Failed to parse match {}: {}", match, e.getOriginalMessage());
            }
            throw new UpstreamPayloadException("Unparseable body for match " + match + ": " + e.getOriginalMessage());
        }
        if (payload.metadata() != null && payload.metadata().matchId() != null
                && !payload.metadata().matchId().equals(match.id())) {
            log.warn("Match {} answered with metadata.matchId {}", match, payload.metadata().matchId());
        }
        return RiotMatchMapper.toRecord(match, payload, body, clock.instant());
    }

    /**
     * GET /lol/league/v4/{tier}leagues/by-queue/RANKED_SOLO_5x5 on the platform host.
     * Rate limits and transient failures are retried; anything left over yields an empty ladder.
     */
    @Override
    @Retryable(
            retryFor = {TransientException.class, RateLimitedException.class},
            maxAttemptsExpression = "${riot.api.seed-retry.max-attempts:3}",
            backoff = @Backoff(
                    delayExpression = "${riot.api.seed-retry.delay-ms:1000}",
                    multiplier = 2.0,
                    maxDelayExpression = "${riot.api.seed-retry.max-delay-ms:8000}")
    )
    public List<PlayerRef> listLadderPlayers(String tier) {
        String normalized = tier.trim().toLowerCase(Locale.ROOT);
        if (!LADDER_TIERS.contains(normalized)) {
            throw new RemoteClientException("Unsupported ladder tier '" + tier + "', expected one of " + LADDER_TIERS);
        }
        RiotPayload.League league = call("ladder " + normalized, () -> handle(platform.get()
                .uri("/lol/league/v4/{tier}leagues/by-queue/RANKED_SOLO_5x5", normalized)
                .accept(MediaType.APPLICATION_JSON)
                .retrieve())
                .toEntity(RiotPayload.League.class));
        if (league == null || league.entries() == null) {
            return List.of();
        }
        List<PlayerRef> players = new ArrayList<>();
        int withoutPuuid = 0;
        for (var entry : league.entries()) {
            if (entry.puuid() == null || entry.puuid().isBlank()) {
                withoutPuuid++;
                continue;
            }
            players.add(new PlayerRef(props.platform(), entry.puuid()));
        }
        if (withoutPuuid > 0) {
            log.warn("Ladder {} returned {} entries without puuid; skipped", normalized, withoutPuuid);
        }
        log.info("Ladder {} on {}: {} players", normalized, props.platform(), players.size());
        return players;
    }

    @Recover
    public List<PlayerRef> recoverLadder(RemoteClientException ex, String tier) {
        if (log.isWarnEnabled()) {
            log.warn("Giving up on ladder {}: {}", tier, ex.getMessage());
        }
        return List.of();
    }

    // ---------- request plumbing ----------

    private RestClient.ResponseSpec handle(RestClient.ResponseSpec spec) {
        return spec
                .onStatus(s -> s.value() == 404, (req, res) -> {
                    throw new NotFoundException("Not found: " + req.getURI().getPath());
                })
                .onStatus(s -> s.value() == 429, (req, res) -> {
                    var retryAfter = parseRetryAfter(res.getHeaders(), props.defaultRetryAfter());
                    gate.pause(retryAfter);
                    throw new RateLimitedException(retryAfter);
                })
                .onStatus(s -> s.value() == 401 || s.value() == 403, (req, res) -> {
                    throw new UpstreamRejectedException(res.getStatusCode().value(),
                            "Riot API rejected the credentials (HTTP " + res.getStatusCode().value() + ")");
                })
                .onStatus(HttpStatusCode::is5xxServerError, (req, res) -> {
                    throw new TransientException("Upstream HTTP " + res.getStatusCode().value()
                            + " for " + req.getURI().getPath());
                });
    }

    private <T> T call(String what, Supplier<ResponseEntity<T>> request) {
        try {
            gate.acquire();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new TransientException("Interrupted while waiting for the rate limit gate (" + what + ")", e);
        }
        try {
            var response = request.get();
            gate.observe(response.getHeaders().getFirst(APP_RATE_LIMIT),
                    response.getHeaders().getFirst(APP_RATE_LIMIT_COUNT));
            return response.getBody();
        } catch (RemoteClientException e) {
            if (log.isDebugEnabled()) {
                log.debug("Riot API call for {} failed: {}", what, e.getMessage());
            }
            throw e;
        } catch (ResourceAccessException e) {
            throw new TransientException("I/O error while fetching " + what + ": " + e.getMessage(), e);
        } catch (HttpServerErrorException e) {
            throw new TransientException("Upstream HTTP " + e.getStatusCode().value() + " for " + what, e);
        } catch (HttpClientErrorException e) {
            var bodyBytes = e.getResponseBodyAsByteArray();
            var preview = new String(bodyBytes, 0, Math.min(bodyBytes.length, 500), StandardCharsets.UTF_8);
            if (log.isWarnEnabled()) {
                log.warn("Riot API client error {} for {}. Body: {}", e.getStatusCode().value(), what, preview);
            }
            throw new RemoteClientException("Upstream HTTP " + e.getStatusCode().value() + " for " + what, e);
        } catch (HttpMessageConversionException e) {
            var msg = (e.getCause() instanceof JsonProcessingException jp) ? jp.getOriginalMessage() : e.getMessage();
            if (log.isErrorEnabled()) {
                log.error("Failed to parse Riot API JSON for {}: {}", what, msg);
            }
            throw new UpstreamPayloadException("Unparseable body for " + what + ": " + msg);
        }
    }

    static Duration parseRetryAfter(HttpHeaders headers, Duration fallback) {
        var ra = headers.getFirst(HttpHeaders.RETRY_AFTER);
        if (ra == null || ra.isBlank()) {
            return fallback;
        }
        try {
            return Duration.ofSeconds(Math.max(1, Long.parseLong(ra.trim())));
        } catch (NumberFormatException ignore) {
            return fallback;
        }
    }
}
