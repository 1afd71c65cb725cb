package org.jstats.matchcrawler_api.modules.feature_builder.model;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * One dataset row: a match, its label and its flat feature columns in schema order.
 */
public record FeatureRecord(
        String region,
        String matchId,
        Instant gameStart,
        double label,
        Map<String, Double> features
) {

    public static final String LABEL = "label";

    public FeatureRecord {
        Objects.requireNonNull(region, "region is required");
        Objects.requireNonNull(matchId, "matchId is required");
        Objects.requireNonNull(gameStart, "gameStart is required");
        features = Collections.unmodifiableMap(new LinkedHashMap<>(features));
    }

    /**
     * The row as written: keys first, then label, then features.
     */
    public Map<String, Object> toRow() {
        Map<String, Object> row = new LinkedHashMap<>();
        row.put("region", region);
        row.put("match_id", matchId);
        row.put("game_start", gameStart.toString());
        row.put(LABEL, label);
        row.putAll(features);
        return row;
    }
}
