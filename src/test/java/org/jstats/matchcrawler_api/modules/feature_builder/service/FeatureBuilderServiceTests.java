package org.jstats.matchcrawler_api.modules.feature_builder.service;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchRecord;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchRef;
import org.jstats.matchcrawler_api.modules.crawl.repository.StorageException;
import org.jstats.matchcrawler_api.modules.crawl.support.InMemoryCrawlRepository;
import org.jstats.matchcrawler_api.modules.feature_builder.config.FeatureProperties;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.Timeout;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Stream;

import static org.jstats.matchcrawler_api.modules.crawl.support.TestMatches.match;
import static org.jstats.matchcrawler_api.modules.crawl.support.TestMatches.player;
import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class FeatureBuilderServiceTests {

    private static final Instant T0 = Instant.parse("2024-05-01T10:00:00Z");

    private final ObjectMapper mapper = new ObjectMapper();
    private final Clock clock = Clock.fixed(Instant.parse("2024-10-01T12:00:00Z"), ZoneOffset.UTC);

    @TempDir
    Path tmp;

    private FeatureBuilderService service(InMemoryCrawlRepository repo, Path dir) {
        var props = new FeatureProperties(dir, 10, Map.of());
        return new FeatureBuilderService(repo, ImputationPolicy.withOverrides(props.imputation()), props, mapper, clock);
    }

    private static List<MatchRecord> fixtures() {
        return List.of(
                match("EUW1_3", T0.plus(Duration.ofHours(2)), true, player("a"), player("b")),
                match("EUW1_1", T0, false, player("a")),
                match("EUW1_2", T0.plus(Duration.ofHours(1)), true, player("b"), player("c"), player("d"),
                        player("e"), player("f"), player("a")));
    }

    private static InMemoryCrawlRepository repoWith(List<MatchRecord> matches) {
        var repo = new InMemoryCrawlRepository();
        matches.forEach(repo::putMatch);
        return repo;
    }

    @Test
    void build_writesOneRowPerMatch_inKeyOrder_withSchema() throws Exception {
        var dir = tmp.resolve("out");

        var report = service(repoWith(fixtures()), dir).build();

        assertEquals(3, report.matchesRead());
        assertEquals(3, report.rowsWritten());
        assertEquals(0, report.matchesSkipped());
        List<String> lines = Files.readAllLines(dir.resolve(FeatureDatasetWriter.DATA_FILE));
        assertEquals(3, lines.size());
        List<String> ids = new ArrayList<>();
        for (String line : lines) {
            ids.add(mapper.readTree(line).get("match_id").asText());
        }
        assertEquals(List.of("EUW1_1", "EUW1_2", "EUW1_3"), ids);

        JsonNode first = mapper.readTree(lines.get(0));
        List<String> keys = new ArrayList<>();
        first.fieldNames().forEachRemaining(keys::add);
        assertEquals(List.of("region", "match_id", "game_start", "label", "blue_1_role"), keys.subList(0, 5));
        assertEquals(4 + FeatureExtractor.columns().size(), keys.size());

        JsonNode schema = mapper.readTree(dir.resolve(FeatureDatasetWriter.SCHEMA_FILE).toFile());
        assertEquals(FeatureBuilderService.SCHEMA_VERSION, schema.get("version").asInt());
        assertEquals(FeatureExtractor.columns().size(), schema.get("columns").size());
        assertEquals("blue_1_role", schema.get("columns").get(0).get("name").asText());
    }

    @Test
    void build_usesOnlyEarlierGamesOfEachPlayer() throws Exception {
        var dir = tmp.resolve("out");

        service(repoWith(fixtures()), dir).build();

        List<String> lines = Files.readAllLines(dir.resolve(FeatureDatasetWriter.DATA_FILE));
        // EUW1_1 is a's first game, EUW1_3 is a's third
        assertEquals(0, mapper.readTree(lines.get(0)).get("blue_1_history_games").asInt());
        assertEquals(2, mapper.readTree(lines.get(2)).get("blue_1_history_games").asInt());
    }

    @Test
    void build_isDeterministic_regardlessOfInsertionOrder() throws Exception {
        var first = tmp.resolve("first");
        var second = tmp.resolve("second");
        var reversed = new ArrayList<>(fixtures());
        Collections.reverse(reversed);

        service(repoWith(fixtures()), first).build();
        service(repoWith(reversed), second).build();
        service(repoWith(reversed), second).build();

        assertArrayEquals(Files.readAllBytes(first.resolve(FeatureDatasetWriter.DATA_FILE)),
                Files.readAllBytes(second.resolve(FeatureDatasetWriter.DATA_FILE)));
        assertArrayEquals(Files.readAllBytes(first.resolve(FeatureDatasetWriter.SCHEMA_FILE)),
                Files.readAllBytes(second.resolve(FeatureDatasetWriter.SCHEMA_FILE)));
        try (Stream<Path> files = Files.list(second)) {
            assertEquals(2, files.count(), "no temporary files left behind");
        }
    }

    @Test
    void build_emptyStore_writesEmptyDatasetAndSchema() throws Exception {
        var dir = tmp.resolve("empty");

        var report = service(new InMemoryCrawlRepository(), dir).build();

        assertEquals(0, report.rowsWritten());
        assertEquals(0, Files.size(dir.resolve(FeatureDatasetWriter.DATA_FILE)));
        assertTrue(Files.exists(dir.resolve(FeatureDatasetWriter.SCHEMA_FILE)));
    }

    @Test
    void build_storageFailure_propagates_andKeepsPreviousFiles() throws Exception {
        var dir = tmp.resolve("out");
        var repo = repoWith(fixtures());
        var service = service(repo, dir);
        service.build();
        byte[] before = Files.readAllBytes(dir.resolve(FeatureDatasetWriter.DATA_FILE));

        repo.failOn("iterateMatches", new StorageException("iterateMatches", "connection reset", null));
        assertThrows(StorageException.class, service::build);

        assertArrayEquals(before, Files.readAllBytes(dir.resolve(FeatureDatasetWriter.DATA_FILE)));
        // lock released
        assertEquals(3, service.build().rowsWritten());
    }

    @Test
    @Timeout(10)
    void concurrentBuild_isRejected() throws Exception {
        var entered = new CountDownLatch(1);
        var release = new CountDownLatch(1);
        var repo = new InMemoryCrawlRepository() {
            @Override
            public synchronized Stream<MatchRecord> iterateMatches(MatchRef after) {
                entered.countDown();
                try {
                    release.await(5, TimeUnit.SECONDS);
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.iterateMatches(after);
            }
        };
        var service = service(repo, tmp.resolve("out"));

        var running = CompletableFuture.supplyAsync(service::build);
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        assertThrows(FeatureBuildInProgressException.class, service::build);

        release.countDown();
        assertFalse(running.get(5, TimeUnit.SECONDS).dataFile().isEmpty());
    }
}
