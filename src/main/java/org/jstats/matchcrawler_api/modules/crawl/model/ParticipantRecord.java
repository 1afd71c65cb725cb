package org.jstats.matchcrawler_api.modules.crawl.model;

import java.util.Collections;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * One player's line in a match.
 *
 * @param player        the participant
 * @param participantId 1-based slot id assigned by the remote API
 * @param teamId        100 (blue) or 200 (red)
 * @param role          raw team position, may be blank
 * @param champion      champion name, may be blank
 * @param win           outcome flag for the participant's team
 * @param stats         numeric stats keyed by stat name; a stat the payload did not carry is absent
 */
public record ParticipantRecord(
        PlayerRef player,
        int participantId,
        int teamId,
        String role,
        String champion,
        boolean win,
        Map<String, Double> stats
) {

    public static final int BLUE_TEAM = 100;
    public static final int RED_TEAM = 200;

    public ParticipantRecord {
        Objects.requireNonNull(player, "player is required");
        role = role == null ? "" : role;
        champion = champion == null ? "" : champion;
        stats = stats == null ? Map.of() : Collections.unmodifiableSortedMap(new TreeMap<>(stats));
    }

    public Optional<Double> stat(String name) {
        return Optional.ofNullable(stats.get(name));
    }
}
