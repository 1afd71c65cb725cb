package org.jstats.matchcrawler_api.modules.feature_builder.model;

/**
 * Per-slot feature columns in output order, each with its imputation default.
 * Defaults sit near the ranked solo-queue median so a missing history does not look like
 * an extreme player; zero is only used where zero is the true value (no history).
 */
public enum SlotFeature {
    ROLE("role", Role.UNKNOWN.code()),
    HISTORY_GAMES("history_games", 0.0),
    KILLS_AVG("kills_avg", 5.0),
    DEATHS_AVG("deaths_avg", 5.0),
    ASSISTS_AVG("assists_avg", 7.0),
    KDA("kda", 2.4),
    GOLD_PER_MIN("gold_per_min", 380.0),
    CS_PER_MIN("cs_per_min", 5.5),
    VISION_SCORE_AVG("vision_score_avg", 20.0),
    DAMAGE_TO_CHAMPS_AVG("damage_to_champs_avg", 18000.0),
    WIN_RATE_RECENT("win_rate_recent", 0.5);

    private final String column;
    private final double defaultValue;

    SlotFeature(String column, double defaultValue) {
        this.column = column;
        this.defaultValue = defaultValue;
    }

    public String column() {
        return column;
    }

    public double defaultValue() {
        return defaultValue;
    }
}
