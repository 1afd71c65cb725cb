package org.jstats.matchcrawler_api.modules.feature_builder.service;

import org.jstats.matchcrawler_api.modules.feature_builder.model.SlotFeature;

import java.util.Arrays;
import java.util.EnumMap;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Value used for a slot feature when the player has no usable history (or the slot is padding).
 */
public final class ImputationPolicy {

    private final Map<SlotFeature, Double> defaults;

    private ImputationPolicy(Map<SlotFeature, Double> defaults) {
        this.defaults = defaults;
    }

    public static ImputationPolicy standard() {
        return withOverrides(Map.of());
    }

    /**
     * @param overrides values keyed by column name
     * @throws IllegalArgumentException on an unknown column or a non-finite value
     */
    public static ImputationPolicy withOverrides(Map<String, Double> overrides) {
        Map<SlotFeature, Double> defaults = new EnumMap<>(SlotFeature.class);
        for (SlotFeature feature : SlotFeature.values()) {
            defaults.put(feature, feature.defaultValue());
        }
        Map<String, SlotFeature> byColumn = Arrays.stream(SlotFeature.values())
                .collect(Collectors.toMap(SlotFeature::column, f -> f));
        overrides.forEach((column, value) -> {
            SlotFeature feature = byColumn.get(column);
            if (feature == null) {
                throw new IllegalArgumentException("Unknown feature column in features.imputation: " + column
                        + " (known: " + byColumn.keySet() + ")");
            }
            if (value == null || !Double.isFinite(value)) {
                throw new IllegalArgumentException("Imputation default of " + column + " must be a finite number");
            }
            defaults.put(feature, value);
        });
        return new ImputationPolicy(defaults);
    }

    public double defaultFor(SlotFeature feature) {
        return defaults.get(feature);
    }
}
