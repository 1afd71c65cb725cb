package org.jstats.matchcrawler_api.modules.riot_gatherer.client;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.List;

/**
 * Subsets of the Riot API response bodies the crawler reads. Unknown fields are ignored;
 * the full match body is kept verbatim next to the mapped record.
 */
public final class RiotPayload {

    private RiotPayload() {
    }

    @JsonInclude(JsonInclude.Include.NON_NULL)
    @JsonIgnoreProperties(ignoreUnknown = true)
    public record Match(Metadata metadata, Info info) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Metadata(String matchId, List<String> participants) {
        }

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Info(
                Long gameCreation,
                Long gameStartTimestamp,
                Long gameEndTimestamp,
                Long gameDuration,
                Integer queueId,
                String gameVersion,
                String platformId,
                List<Participant> participants,
                List<Team> teams
        ) {
        }

        /**
         * Numeric stats are boxed so a field the payload omits stays distinguishable from zero.
         */
        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Participant(
                String puuid,
                Integer participantId,
                Integer teamId,
                String teamPosition,
                String individualPosition,
                String championName,
                Boolean win,
                Double kills,
                Double deaths,
                Double assists,
                Double goldEarned,
                Double totalDamageDealtToChampions,
                Double visionScore,
                Double totalMinionsKilled,
                Double neutralMinionsKilled,
                Double champLevel,
                Double wardsPlaced,
                Double damageDealtToObjectives,
                Double timePlayed
        ) {
        }

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record Team(Integer teamId, Boolean win) {
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public record League(String tier, String queue, List<LeagueEntry> entries) {

        @JsonIgnoreProperties(ignoreUnknown = true)
        public record LeagueEntry(String puuid, String summonerId, Integer leaguePoints) {
        }
    }
}
