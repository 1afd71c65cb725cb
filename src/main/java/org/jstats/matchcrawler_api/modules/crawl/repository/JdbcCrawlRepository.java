package org.jstats.matchcrawler_api.modules.crawl.repository;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NullMarked;
import org.jspecify.annotations.Nullable;
import org.jstats.matchcrawler_api.modules.crawl.model.EntityKind;
import org.jstats.matchcrawler_api.modules.crawl.model.FrontierEntry;
import org.jstats.matchcrawler_api.modules.crawl.model.FrontierState;
import org.jstats.matchcrawler_api.modules.crawl.model.FrontierStats;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchRecord;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchRef;
import org.jstats.matchcrawler_api.modules.crawl.model.ParticipantRecord;
import org.jstats.matchcrawler_api.modules.crawl.model.PlayerRecord;
import org.jstats.matchcrawler_api.modules.crawl.model.PlayerRef;
import org.postgresql.util.PGobject;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.dao.DataAccessException;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.jdbc.core.RowMapper;
import org.springframework.jdbc.core.namedparam.MapSqlParameterSource;
import org.springframework.jdbc.core.namedparam.NamedParameterJdbcTemplate;
import org.springframework.jdbc.core.namedparam.SqlParameterSource;
import org.springframework.stereotype.Repository;
import org.springframework.transaction.CannotCreateTransactionException;
import org.springframework.transaction.TransactionException;
import org.springframework.transaction.support.TransactionTemplate;

import java.sql.ResultSet;
import java.sql.SQLException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;
import java.util.function.Supplier;
import java.util.stream.Stream;

@Repository
@NullMarked
public class JdbcCrawlRepository implements CrawlRepository {

    private static final Logger log = LoggerFactory.getLogger(JdbcCrawlRepository.class);

    private static final TypeReference<TreeMap<String, Double>> STATS_TYPE = new TypeReference<>() {};

    private static final String FRONTIER_COLUMNS =
            "id, kind, region, ref_id, discovered_at, attempts, state, not_before, claimed_at, last_error";

    private static final String MATCH_COLUMNS =
            "region, match_id, game_start, duration_seconds, queue_id, game_version, payload::text AS payload, fetched_at";

    private final NamedParameterJdbcTemplate jdbc;
    private final TransactionTemplate tx;
    private final ObjectMapper mapper;
    private final Clock clock;
    private final int pageSize;

    public JdbcCrawlRepository(
            NamedParameterJdbcTemplate jdbc,
            TransactionTemplate tx,
            ObjectMapper mapper,
            Clock clock,
            @Value("${crawler.storage.page-size:500}") int pageSize) {
        this.jdbc = jdbc;
        this.tx = tx;
        this.mapper = mapper;
        this.clock = clock;
        this.pageSize = pageSize;
    }

    @Override
    public boolean exists(EntityKind kind, String region, String refId) {
        var sql = switch (kind) {
            case MATCH -> "SELECT EXISTS(SELECT 1 FROM crawl_match WHERE region = :region AND match_id = :refId)";
            case PLAYER -> "SELECT EXISTS(SELECT 1 FROM crawl_player WHERE region = :region AND puuid = :refId)";
        };
        var params = new MapSqlParameterSource()
                .addValue("region", region)
                .addValue("refId", refId);
        return storage("exists", () -> Boolean.TRUE.equals(jdbc.queryForObject(sql, params, Boolean.class)));
    }

    @Override
    public List<PlayerRef> matchParticipants(MatchRef match) {
        final var sql = """
                SELECT puuid
                FROM crawl_participant
                WHERE region = :region AND match_id = :matchId
                ORDER BY participant_id
                """;
        var params = new MapSqlParameterSource()
                .addValue("region", match.region())
                .addValue("matchId", match.id());
        return storage("matchParticipants", () -> jdbc.query(sql, params,
                (rs, i) -> new PlayerRef(match.region(), rs.getString("puuid"))));
    }

    @Override
    public boolean putMatch(MatchRecord match) {
        return storage("putMatch", () -> Boolean.TRUE.equals(tx.execute(status -> {
            final var sql = """
                    INSERT INTO crawl_match
                      (region, match_id, game_start, duration_seconds, queue_id, game_version, payload, fetched_at)
                    VALUES
                      (:region, :matchId, :gameStart, :durationSeconds, :queueId, :gameVersion, :payload, :fetchedAt)
                    ON CONFLICT (region, match_id)
                    DO NOTHING
                    """;
            int inserted = jdbc.update(sql, matchParams(match));
            if (inserted == 0) {
                if (log.isDebugEnabled()) {
                    log.debug("Match {} already stored, skipping", match.ref());
                }
                return false;
            }
            insertParticipants(match);
            return true;
        })));
    }

    @Override
    public void replaceMatch(MatchRecord match) {
        storage("replaceMatch", () -> tx.execute(status -> {
            jdbc.update("DELETE FROM crawl_participant WHERE region = :region AND match_id = :matchId",
                    new MapSqlParameterSource()
                            .addValue("region", match.ref().region())
                            .addValue("matchId", match.ref().id()));
            final var sql = """
                    INSERT INTO crawl_match
                      (region, match_id, game_start, duration_seconds, queue_id, game_version, payload, fetched_at)
                    VALUES
                      (:region, :matchId, :gameStart, :durationSeconds, :queueId, :gameVersion, :payload, :fetchedAt)
                    ON CONFLICT (region, match_id)
                    DO UPDATE SET game_start = EXCLUDED.game_start,
                                  duration_seconds = EXCLUDED.duration_seconds,
                                  queue_id = EXCLUDED.queue_id,
                                  game_version = EXCLUDED.game_version,
                                  payload = EXCLUDED.payload,
                                  fetched_at = EXCLUDED.fetched_at
                    """;
            jdbc.update(sql, matchParams(match));
            insertParticipants(match);
            return null;
        }));
    }

    @Override
    public void putPlayer(PlayerRecord player) {
        final var sql = """
                INSERT INTO crawl_player (region, puuid, crawled_at, matches_listed)
                VALUES (:region, :puuid, :crawledAt, :matchesListed)
                ON CONFLICT (region, puuid)
                DO UPDATE SET crawled_at = EXCLUDED.crawled_at,
                              matches_listed = EXCLUDED.matches_listed
                """;
        var params = new MapSqlParameterSource()
                .addValue("region", player.ref().region())
                .addValue("puuid", player.ref().id())
                .addValue("crawledAt", ts(player.crawledAt()))
                .addValue("matchesListed", player.matchesListed());
        storage("putPlayer", () -> jdbc.update(sql, params));
    }

    @Override
    public int putFrontierEntries(Collection<FrontierEntry> entries) {
        if (entries.isEmpty()) {
            return 0;
        }
        Map<String, FrontierEntry> unique = new LinkedHashMap<>();
        for (FrontierEntry entry : entries) {
            unique.putIfAbsent(entry.key(), entry);
        }
        final var sql = """
                INSERT INTO crawl_frontier
                  (kind, region, ref_id, state, discovered_at, attempts, not_before, updated_at)
                VALUES
                  (:kind, :region, :refId, 'PENDING', :discoveredAt, 0, :notBefore, :discoveredAt)
                ON CONFLICT (kind, region, ref_id)
                DO NOTHING
                """;
        SqlParameterSource[] batch = unique.values().stream()
                .map(e -> new MapSqlParameterSource()
                        .addValue("kind", e.kind().name())
                        .addValue("region", e.region())
                        .addValue("refId", e.refId())
                        .addValue("discoveredAt", ts(e.discoveredAt()))
                        .addValue("notBefore", ts(e.notBefore())))
                .toArray(SqlParameterSource[]::new);
        int[] counts = storage("putFrontierEntries", () -> jdbc.batchUpdate(sql, batch));
        int inserted = 0;
        for (int c : counts) {
            if (c > 0) {
                inserted += c;
            }
        }
        return inserted;
    }

    @Override
    public List<FrontierEntry> claimNextBatch(EntityKind kind, int limit, Instant now) {
        if (limit <= 0) {
            return List.of();
        }
        final var sql = """
                UPDATE crawl_frontier
                SET state = 'IN_FLIGHT', claimed_at = :now, updated_at = :now
                WHERE id IN (
                    SELECT id
                    FROM crawl_frontier
                    WHERE kind = :kind
                      AND state = 'PENDING'
                      AND not_before <= :now
                    ORDER BY discovered_at, id
                    LIMIT :limit
                    FOR UPDATE SKIP LOCKED)
                RETURNING %s
                """.formatted(FRONTIER_COLUMNS);
        var params = new MapSqlParameterSource()
                .addValue("kind", kind.name())
                .addValue("now", ts(now))
                .addValue("limit", limit);
        List<FrontierEntry> claimed = new ArrayList<>(storage("claimNextBatch", () -> jdbc.query(sql, params, FRONTIER_ROW)));
        // RETURNING does not preserve the sub-select order
        claimed.sort((a, b) -> {
            int byTime = a.discoveredAt().compareTo(b.discoveredAt());
            return byTime != 0 ? byTime : Long.compare(a.id(), b.id());
        });
        return claimed;
    }

    @Override
    public boolean markDone(FrontierEntry entry) {
        final var sql = """
                UPDATE crawl_frontier
                SET state = 'DONE', claimed_at = NULL, last_error = NULL, updated_at = :now
                WHERE id = :id AND state = 'IN_FLIGHT'
                """;
        var params = new MapSqlParameterSource()
                .addValue("id", entry.id())
                .addValue("now", ts(clock.instant()));
        return transition("markDone", entry, sql, params);
    }

    @Override
    public boolean markFailed(FrontierEntry entry, String reason) {
        final var sql = """
                UPDATE crawl_frontier
                SET state = 'FAILED', attempts = :attempts, claimed_at = NULL,
                    last_error = :reason, updated_at = :now
                WHERE id = :id AND state = 'IN_FLIGHT'
                """;
        var params = new MapSqlParameterSource()
                .addValue("id", entry.id())
                .addValue("attempts", entry.attempts())
                .addValue("reason", truncate(reason))
                .addValue("now", ts(clock.instant()));
        return transition("markFailed", entry, sql, params);
    }

    @Override
    public boolean requeue(FrontierEntry entry, Instant notBefore, String reason) {
        final var sql = """
                UPDATE crawl_frontier
                SET state = 'PENDING', attempts = :attempts, not_before = :notBefore, claimed_at = NULL,
                    last_error = :reason, updated_at = :now
                WHERE id = :id AND state = 'IN_FLIGHT'
                """;
        var params = new MapSqlParameterSource()
                .addValue("id", entry.id())
                .addValue("attempts", entry.attempts())
                .addValue("notBefore", ts(notBefore))
                .addValue("reason", truncate(reason))
                .addValue("now", ts(clock.instant()));
        return transition("requeue", entry, sql, params);
    }

    @Override
    public int reclaimStale(Instant claimedBefore) {
        final var sql = """
                UPDATE crawl_frontier
                SET state = 'PENDING', claimed_at = NULL, last_error = 'reclaimed after in-flight timeout', updated_at = :now
                WHERE state = 'IN_FLIGHT' AND claimed_at < :cutoff
                """;
        var params = new MapSqlParameterSource()
                .addValue("cutoff", ts(claimedBefore))
                .addValue("now", ts(clock.instant()));
        return storage("reclaimStale", () -> jdbc.update(sql, params));
    }

    @Override
    public int resetFailed(EntityKind kind) {
        final var sql = """
                UPDATE crawl_frontier
                SET state = 'PENDING', attempts = 0, not_before = :now, claimed_at = NULL, updated_at = :now
                WHERE kind = :kind AND state = 'FAILED'
                """;
        var params = new MapSqlParameterSource()
                .addValue("kind", kind.name())
                .addValue("now", ts(clock.instant()));
        return storage("resetFailed", () -> jdbc.update(sql, params));
    }

    @Override
    public long countMatches() {
        return storage("countMatches", () -> {
            Long count = jdbc.queryForObject("SELECT count(*) FROM crawl_match", new MapSqlParameterSource(), Long.class);
            return count == null ? 0L : count;
        });
    }

    @Override
    public FrontierStats frontierStats() {
        final var sql = "SELECT kind, state, count(*) AS n FROM crawl_frontier GROUP BY kind, state";
        return storage("frontierStats", () -> new FrontierStats(jdbc.query(sql, new MapSqlParameterSource(),
                (rs, i) -> new FrontierStats.Count(
                        EntityKind.valueOf(rs.getString("kind")),
                        FrontierState.valueOf(rs.getString("state")),
                        rs.getLong("n")))));
    }

    @Override
    public List<FrontierEntry> failedEntries(int limit) {
        final var sql = """
                SELECT %s
                FROM crawl_frontier
                WHERE state = 'FAILED'
                ORDER BY updated_at DESC, id DESC
                LIMIT :limit
                """.formatted(FRONTIER_COLUMNS);
        var params = new MapSqlParameterSource().addValue("limit", limit);
        return storage("failedEntries", () -> jdbc.query(sql, params, FRONTIER_ROW));
    }

    @Override
    public Stream<MatchRecord> iterateMatches(@Nullable MatchRef after) {
        return Stream.iterate(
                        loadPage(after),
                        page -> !page.isEmpty(),
                        page -> page.size() < pageSize ? List.of() : loadPage(page.get(page.size() - 1).ref()))
                .flatMap(List::stream);
    }

    // ---------- helpers ----------

    private List<MatchRecord> loadPage(@Nullable MatchRef after) {
        var params = new MapSqlParameterSource().addValue("limit", pageSize);
        String sql;
        if (after == null) {
            sql = "SELECT " + MATCH_COLUMNS + " FROM crawl_match ORDER BY region, match_id LIMIT :limit";
        } else {
            sql = """
                    SELECT %s
                    FROM crawl_match
                    WHERE (region, match_id) > (:afterRegion, :afterId)
                    ORDER BY region, match_id
                    LIMIT :limit
                    """.formatted(MATCH_COLUMNS);
            params.addValue("afterRegion", after.region()).addValue("afterId", after.id());
        }
        return storage("iterateMatches", () -> {
            List<MatchHeader> headers = jdbc.query(sql, params, MATCH_HEADER_ROW);
            if (headers.isEmpty()) {
                return List.of();
            }
            Map<MatchRef, List<ParticipantRecord>> participants = loadParticipants(
                    headers.get(0).ref(), headers.get(headers.size() - 1).ref());
            return headers.stream()
                    .map(h -> h.toRecord(participants.getOrDefault(h.ref(), List.of())))
                    .toList();
        });
    }

    private Map<MatchRef, List<ParticipantRecord>> loadParticipants(MatchRef first, MatchRef last) {
        final var sql = """
                SELECT region, match_id, participant_id, puuid, team_id, role, champion, win, stats::text AS stats
                FROM crawl_participant
                WHERE (region, match_id) >= (:firstRegion, :firstId)
                  AND (region, match_id) <= (:lastRegion, :lastId)
                ORDER BY region, match_id, participant_id
                """;
        var params = new MapSqlParameterSource()
                .addValue("firstRegion", first.region())
                .addValue("firstId", first.id())
                .addValue("lastRegion", last.region())
                .addValue("lastId", last.id());
        Map<MatchRef, List<ParticipantRecord>> byMatch = new LinkedHashMap<>();
        jdbc.query(sql, params, rs -> {
            var ref = new MatchRef(rs.getString("region"), rs.getString("match_id"));
            byMatch.computeIfAbsent(ref, k -> new ArrayList<>()).add(new ParticipantRecord(
                    new PlayerRef(ref.region(), rs.getString("puuid")),
                    rs.getInt("participant_id"),
                    rs.getInt("team_id"),
                    rs.getString("role"),
                    rs.getString("champion"),
                    rs.getBoolean("win"),
                    readStats(rs.getString("stats"))));
        });
        return byMatch;
    }

    private void insertParticipants(MatchRecord match) {
        if (match.participants().isEmpty()) {
            return;
        }
        final var sql = """
                INSERT INTO crawl_participant
                  (region, match_id, participant_id, puuid, team_id, role, champion, win, stats)
                VALUES
                  (:region, :matchId, :participantId, :puuid, :teamId, :role, :champion, :win, :stats)
                """;
        SqlParameterSource[] batch = match.participants().stream()
                .map(p -> new MapSqlParameterSource()
                        .addValue("region", match.ref().region())
                        .addValue("matchId", match.ref().id())
                        .addValue("participantId", p.participantId())
                        .addValue("puuid", p.player().id())
                        .addValue("teamId", p.teamId())
                        .addValue("role", p.role())
                        .addValue("champion", p.champion())
                        .addValue("win", p.win())
                        .addValue("stats", jsonb(writeStats(p.stats()))))
                .toArray(SqlParameterSource[]::new);
        jdbc.batchUpdate(sql, batch);
    }

    private MapSqlParameterSource matchParams(MatchRecord match) {
        return new MapSqlParameterSource()
                .addValue("region", match.ref().region())
                .addValue("matchId", match.ref().id())
                .addValue("gameStart", ts(match.gameStart()))
                .addValue("durationSeconds", match.duration().toSeconds())
                .addValue("queueId", match.queueId())
                .addValue("gameVersion", match.gameVersion())
                .addValue("payload", match.rawPayload().isEmpty() ? null : jsonb(match.rawPayload()))
                .addValue("fetchedAt", ts(match.fetchedAt()));
    }

    private boolean transition(String operation, FrontierEntry entry, String sql, MapSqlParameterSource params) {
        int updated = storage(operation, () -> jdbc.update(sql, params));
        if (updated == 0 && log.isWarnEnabled()) {
            log.warn("{} ignored for {}: entry is no longer in flight", operation, entry.key());
        }
        return updated > 0;
    }

    private String writeStats(Map<String, Double> stats) {
        try {
            return mapper.writeValueAsString(stats);
        } catch (JsonProcessingException e) {
            throw new StorageException("writeStats", e.getOriginalMessage(), e);
        }
    }

    private Map<String, Double> readStats(@Nullable String json) {
        if (json == null || json.isBlank()) {
            return Map.of();
        }
        try {
            return mapper.readValue(json, STATS_TYPE);
        } catch (JsonProcessingException e) {
            throw new StorageException("readStats", e.getOriginalMessage(), e);
        }
    }

    private static PGobject jsonb(String json) {
        var jsonb = new PGobject();
        jsonb.setType("jsonb");
        try {
            jsonb.setValue(json);
        } catch (SQLException e) {
            throw new IllegalArgumentException("Failed to set JSONB payload", e);
        }
        return jsonb;
    }

    private static @Nullable OffsetDateTime ts(@Nullable Instant instant) {
        return instant == null ? null : OffsetDateTime.ofInstant(instant, ZoneOffset.UTC);
    }

    private static @Nullable Instant instant(ResultSet rs, String column) throws SQLException {
        OffsetDateTime value = rs.getObject(column, OffsetDateTime.class);
        return value == null ? null : value.toInstant();
    }

    private static @Nullable String truncate(@Nullable String reason) {
        if (reason == null) {
            return null;
        }
        return reason.length() > 512 ? reason.substring(0, 512) : reason;
    }

    private static <T> T storage(String operation, Supplier<T> action) {
        try {
            return action.get();
        } catch (DataAccessResourceFailureException | CannotCreateTransactionException ex) {
            log.error("Storage unreachable during {}: {}", operation, ex.getMessage());
            throw new StorageUnavailableException(operation, String.valueOf(ex.getMessage()), ex);
        } catch (DataAccessException | TransactionException ex) {
            log.error("Storage failure during {}: {}", operation, ex.getMessage());
            throw new StorageException(operation, String.valueOf(ex.getMessage()), ex);
        }
    }

    private static final RowMapper<FrontierEntry> FRONTIER_ROW = (rs, i) -> new FrontierEntry(
            rs.getLong("id"),
            EntityKind.valueOf(rs.getString("kind")),
            rs.getString("region"),
            rs.getString("ref_id"),
            instant(rs, "discovered_at"),
            rs.getInt("attempts"),
            FrontierState.valueOf(rs.getString("state")),
            instant(rs, "not_before"),
            instant(rs, "claimed_at"),
            rs.getString("last_error"));

    private record MatchHeader(
            MatchRef ref,
            Instant gameStart,
            Duration duration,
            @Nullable Integer queueId,
            @Nullable String gameVersion,
            @Nullable String payload,
            Instant fetchedAt) {

        MatchRecord toRecord(List<ParticipantRecord> participants) {
            return new MatchRecord(ref, gameStart, duration, queueId, gameVersion, participants, payload, fetchedAt);
        }
    }

    private static final RowMapper<MatchHeader> MATCH_HEADER_ROW = (rs, i) -> new MatchHeader(
            new MatchRef(rs.getString("region"), rs.getString("match_id")),
            instant(rs, "game_start"),
            Duration.ofSeconds(rs.getLong("duration_seconds")),
            rs.getObject("queue_id", Integer.class),
            rs.getString("game_version"),
            rs.getString("payload"),
            instant(rs, "fetched_at"));
}
