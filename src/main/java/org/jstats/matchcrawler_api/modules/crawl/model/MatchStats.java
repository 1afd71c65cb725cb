package org.jstats.matchcrawler_api.modules.crawl.model;

import java.util.List;

/**
 * Names of the participant stats kept in {@link ParticipantRecord#stats()}.
 * They match the field names of the remote match payload.
 */
public final class MatchStats {

    public static final String KILLS = "kills";
    public static final String DEATHS = "deaths";
    public static final String ASSISTS = "assists";
    public static final String GOLD_EARNED = "goldEarned";
    public static final String DAMAGE_TO_CHAMPIONS = "totalDamageDealtToChampions";
    public static final String VISION_SCORE = "visionScore";
    public static final String MINIONS_KILLED = "totalMinionsKilled";
    public static final String NEUTRAL_MINIONS_KILLED = "neutralMinionsKilled";
    public static final String CHAMP_LEVEL = "champLevel";
    public static final String WARDS_PLACED = "wardsPlaced";
    public static final String DAMAGE_TO_OBJECTIVES = "damageDealtToObjectives";
    public static final String TIME_PLAYED = "timePlayed";

    public static final List<String> ALL = List.of(
            KILLS, DEATHS, ASSISTS, GOLD_EARNED, DAMAGE_TO_CHAMPIONS, VISION_SCORE,
            MINIONS_KILLED, NEUTRAL_MINIONS_KILLED, CHAMP_LEVEL, WARDS_PLACED,
            DAMAGE_TO_OBJECTIVES, TIME_PLAYED);

    private MatchStats() {
    }
}
