package org.jstats.matchcrawler_api.modules.feature_builder.model;

import com.fasterxml.jackson.annotation.JsonPropertyOrder;

import java.util.List;

/**
 * Content of {@code features.schema.json}.
 */
@JsonPropertyOrder({"version", "keys", "label", "labelFormula", "slotsPerTeam", "historySize", "roleCodes", "columns"})
public record FeatureSchema(
        int version,
        List<String> keys,
        String label,
        String labelFormula,
        int slotsPerTeam,
        int historySize,
        List<String> roleCodes,
        List<Column> columns
) {

    @JsonPropertyOrder({"name", "type", "imputedDefault"})
    public record Column(String name, String type, double imputedDefault) {
    }
}
