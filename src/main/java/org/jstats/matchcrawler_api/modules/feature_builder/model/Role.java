package org.jstats.matchcrawler_api.modules.feature_builder.model;

import java.util.Locale;

/**
 * Team positions in canonical slot order. The code is the numeric value written to the dataset
 * and never changes for an existing constant.
 */
public enum Role {
    TOP(0),
    JUNGLE(1),
    MIDDLE(2),
    BOTTOM(3),
    UTILITY(4),
    UNKNOWN(5);

    private final int code;

    Role(int code) {
        this.code = code;
    }

    public int code() {
        return code;
    }

    /**
     * Maps a raw position string onto a role; blank or unseen values become {@link #UNKNOWN}.
     */
    public static Role parse(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        return switch (raw.trim().toUpperCase(Locale.ROOT)) {
            case "TOP" -> TOP;
            case "JUNGLE" -> JUNGLE;
            case "MIDDLE", "MID" -> MIDDLE;
            case "BOTTOM", "BOT", "ADC", "CARRY" -> BOTTOM;
            case "UTILITY", "SUPPORT" -> UTILITY;
            default -> UNKNOWN;
        };
    }
}
