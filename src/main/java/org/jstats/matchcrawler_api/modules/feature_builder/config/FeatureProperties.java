package org.jstats.matchcrawler_api.modules.feature_builder.config;

import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.boot.context.properties.bind.DefaultValue;
import org.springframework.validation.annotation.Validated;

import java.nio.file.Path;
import java.util.Map;

/**
 * Dataset build settings.
 *
 * @param outputDir   directory receiving features.jsonl and features.schema.json
 * @param historySize prior matches of a player aggregated into its slot features
 * @param imputation  per-column overrides of the imputation defaults, keyed by column name (kills_avg, ...)
 */
@Validated
@ConfigurationProperties(prefix = "features")
public record FeatureProperties(
        @DefaultValue("data/features") Path outputDir,
        @Positive @DefaultValue("10") int historySize,
        @DefaultValue Map<String, Double> imputation
) {
}
