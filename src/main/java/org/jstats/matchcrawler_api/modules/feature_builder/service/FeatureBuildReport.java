package org.jstats.matchcrawler_api.modules.feature_builder.service;

import java.time.Instant;

/**
 * Outcome of one dataset build.
 *
 * @param dataFile       written JSON Lines file
 * @param schemaFile     written schema file
 * @param matchesRead    stored matches seen
 * @param rowsWritten    dataset rows
 * @param matchesSkipped matches with an oversized team
 * @param players        distinct players in the history index
 */
public record FeatureBuildReport(
        String dataFile,
        String schemaFile,
        long matchesRead,
        long rowsWritten,
        long matchesSkipped,
        int players,
        Instant startedAt,
        Instant finishedAt
) {
}
