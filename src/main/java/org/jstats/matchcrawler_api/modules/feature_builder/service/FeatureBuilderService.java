package org.jstats.matchcrawler_api.modules.feature_builder.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.jspecify.annotations.NullMarked;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchRecord;
import org.jstats.matchcrawler_api.modules.crawl.repository.CrawlRepository;
import org.jstats.matchcrawler_api.modules.feature_builder.config.FeatureProperties;
import org.jstats.matchcrawler_api.modules.feature_builder.model.FeatureRecord;
import org.jstats.matchcrawler_api.modules.feature_builder.model.FeatureSchema;
import org.jstats.matchcrawler_api.modules.feature_builder.model.Role;
import org.jstats.matchcrawler_api.modules.feature_builder.model.SlotFeature;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.stream.Stream;

/**
 * Rebuilds the feature dataset from the repository: a first pass indexes every player's games,
 * a second pass emits one row per match in (region, matchId) order. Identical repository content
 * gives byte-identical files.
 */
@Service
@NullMarked
public class FeatureBuilderService {

    private static final Logger log = LoggerFactory.getLogger(FeatureBuilderService.class);

    static final int SCHEMA_VERSION = 1;

    private final CrawlRepository repository;
    private final FeatureProperties props;
    private final FeatureExtractor extractor;
    private final FeatureDatasetWriter writer;
    private final Clock clock;
    private final ReentrantLock building = new ReentrantLock();

    public FeatureBuilderService(
            CrawlRepository repository,
            ImputationPolicy imputation,
            FeatureProperties props,
            ObjectMapper mapper,
            Clock clock) {
        this.repository = repository;
        this.props = props;
        this.extractor = new FeatureExtractor(imputation, props.historySize());
        this.writer = new FeatureDatasetWriter(mapper);
        this.clock = clock;
    }

    /**
     * @throws FeatureBuildInProgressException when another build is running
     * @throws FeatureBuildException           when the files cannot be written
     */
    public FeatureBuildReport build() {
        if (!building.tryLock()) {
            throw new FeatureBuildInProgressException();
        }
        try {
            Instant startedAt = clock.instant();
            Path dir = props.outputDir();
            log.info("Building feature dataset into {} (history size {})", dir.toAbsolutePath(), props.historySize());

            var history = new PlayerHistoryIndex();
            var matchesRead = new AtomicLong();
            try (Stream<MatchRecord> matches = repository.iterateMatches(null)) {
                matches.forEach(m -> {
                    history.add(m);
                    matchesRead.incrementAndGet();
                });
            }
            history.seal();
            if (log.isDebugEnabled()) {
                log.debug("History index holds {} players over {} matches", history.players(), matchesRead.get());
            }

            var skipped = new AtomicLong();
            long rows;
            try (Stream<MatchRecord> matches = repository.iterateMatches(null)) {
                Iterator<FeatureRecord> records = matches
                        .map(m -> {
                            Optional<FeatureRecord> row = extractor.extract(m, history);
                            if (row.isEmpty()) {
                                skipped.incrementAndGet();
                                log.warn("Skipping match {}: a team has more than {} participants",
                                        m.ref(), FeatureExtractor.SLOTS_PER_TEAM);
                            }
                            return row;
                        })
                        .flatMap(Optional::stream)
                        .iterator();
                rows = writer.writeRows(dir, records);
                writer.writeSchema(dir, schema());
            } catch (IOException e) {
                log.error("Failed to write the feature dataset to {}: {}", dir, e.getMessage());
                throw new FeatureBuildException("Could not write the feature dataset to " + dir, e);
            }

            var report = new FeatureBuildReport(
                    dir.resolve(FeatureDatasetWriter.DATA_FILE).toString(),
                    dir.resolve(FeatureDatasetWriter.SCHEMA_FILE).toString(),
                    matchesRead.get(),
                    rows,
                    skipped.get(),
                    history.players(),
                    startedAt,
                    clock.instant());
            log.info("Feature dataset built: {} rows from {} matches ({} skipped)",
                    report.rowsWritten(), report.matchesRead(), report.matchesSkipped());
            return report;
        } finally {
            building.unlock();
        }
    }

    FeatureSchema schema() {
        List<FeatureSchema.Column> columns = new ArrayList<>();
        SlotFeature[] features = SlotFeature.values();
        List<String> names = FeatureExtractor.columns();
        for (int i = 0; i < names.size(); i++) {
            SlotFeature feature = features[i % features.length];
            String type = feature == SlotFeature.ROLE || feature == SlotFeature.HISTORY_GAMES ? "int" : "float";
            columns.add(new FeatureSchema.Column(names.get(i), type, extractor.imputation().defaultFor(feature)));
        }
        return new FeatureSchema(
                SCHEMA_VERSION,
                List.of("region", "match_id", "game_start"),
                FeatureRecord.LABEL,
                FeatureExtractor.GOLD_SHARE_WEIGHT + " * blue_gold_share + " + FeatureExtractor.WIN_WEIGHT + " * blue_win",
                FeatureExtractor.SLOTS_PER_TEAM,
                props.historySize(),
                Arrays.stream(Role.values()).map(Role::name).toList(),
                columns);
    }
}
