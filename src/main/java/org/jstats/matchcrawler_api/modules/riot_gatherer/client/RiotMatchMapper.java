package org.jstats.matchcrawler_api.modules.riot_gatherer.client;

import org.jstats.matchcrawler_api.modules.crawl.model.MatchRecord;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchRef;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchStats;
import org.jstats.matchcrawler_api.modules.crawl.model.ParticipantRecord;
import org.jstats.matchcrawler_api.modules.crawl.model.PlayerRef;
import org.jstats.matchcrawler_api.modules.crawl.remote.RemoteMatchClient.UpstreamPayloadException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Maps a match-v5 body onto {@link MatchRecord}.
 */
final class RiotMatchMapper {

    private static final Logger log = LoggerFactory.getLogger(RiotMatchMapper.class);

    private RiotMatchMapper() {
    }

    static MatchRecord toRecord(MatchRef ref, RiotPayload.Match payload, String rawJson, Instant fetchedAt) {
        var info = payload.info();
        if (info == null) {
            throw new UpstreamPayloadException("Match " + ref + " has no info section");
        }
        Long start = info.gameStartTimestamp() != null ? info.gameStartTimestamp() : info.gameCreation();
        if (start == null) {
            throw new UpstreamPayloadException("Match " + ref + " has no start timestamp");
        }
        // Before patch 11.20 gameDuration was reported in milliseconds; gameEndTimestamp arrived with the switch to seconds.
        Duration duration;
        if (info.gameDuration() == null) {
            duration = Duration.ZERO;
        } else if (info.gameEndTimestamp() != null) {
            duration = Duration.ofSeconds(info.gameDuration());
        } else {
            duration = Duration.ofMillis(info.gameDuration());
        }

        Map<Integer, Boolean> teamWin = new HashMap<>();
        if (info.teams() != null) {
            for (var team : info.teams()) {
                if (team.teamId() != null && team.win() != null) {
                    teamWin.put(team.teamId(), team.win());
                }
            }
        }

        List<ParticipantRecord> participants = new ArrayList<>();
        if (info.participants() != null) {
            int position = 0;
            for (var p : info.participants()) {
                position++;
                if (p.puuid() == null || p.puuid().isBlank() || p.teamId() == null) {
                    if (log.isDebugEnabled()) {
                        log.debug("Skipping participant #{} of {} without puuid or team", position, ref);
                    }
                    continue;
                }
                boolean win = p.win() != null ? p.win() : teamWin.getOrDefault(p.teamId(), false);
                participants.add(new ParticipantRecord(
                        new PlayerRef(ref.region(), p.puuid()),
                        p.participantId() != null ? p.participantId() : position,
                        p.teamId(),
                        p.teamPosition() != null && !p.teamPosition().isBlank() ? p.teamPosition() : p.individualPosition(),
                        p.championName(),
                        win,
                        stats(p)));
            }
        }

        return new MatchRecord(ref, Instant.ofEpochMilli(start), duration, info.queueId(),
                info.gameVersion(), participants, rawJson, fetchedAt);
    }

    private static Map<String, Double> stats(RiotPayload.Match.Participant p) {
        Map<String, Double> stats = new LinkedHashMap<>();
        put(stats, MatchStats.KILLS, p.kills());
        put(stats, MatchStats.DEATHS, p.deaths());
        put(stats, MatchStats.ASSISTS, p.assists());
        put(stats, MatchStats.GOLD_EARNED, p.goldEarned());
        put(stats, MatchStats.DAMAGE_TO_CHAMPIONS, p.totalDamageDealtToChampions());
        put(stats, MatchStats.VISION_SCORE, p.visionScore());
        put(stats, MatchStats.MINIONS_KILLED, p.totalMinionsKilled());
        put(stats, MatchStats.NEUTRAL_MINIONS_KILLED, p.neutralMinionsKilled());
        put(stats, MatchStats.CHAMP_LEVEL, p.champLevel());
        put(stats, MatchStats.WARDS_PLACED, p.wardsPlaced());
        put(stats, MatchStats.DAMAGE_TO_OBJECTIVES, p.damageDealtToObjectives());
        put(stats, MatchStats.TIME_PLAYED, p.timePlayed());
        return stats;
    }

    private static void put(Map<String, Double> stats, String name, Double value) {
        if (value != null && !value.isNaN()) {
            stats.put(name, value);
        }
    }
}
