package org.jstats.matchcrawler_api.modules.feature_builder.service;

import org.jstats.matchcrawler_api.modules.crawl.model.MatchRecord;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchRef;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchStats;
import org.jstats.matchcrawler_api.modules.crawl.model.ParticipantRecord;
import org.jstats.matchcrawler_api.modules.crawl.model.PlayerRef;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Per-player game lines of every stored match, ordered by game start. Built in one pass
 * over the repository; answers "the last n games of this player before that instant".
 */
public final class PlayerHistoryIndex {

    /**
     * One player's line in one game, reduced to what the slot aggregates read.
     * Stats the payload did not carry are NaN.
     */
    public record Game(
            MatchRef match,
            Instant gameStart,
            double minutes,
            boolean win,
            double kills,
            double deaths,
            double assists,
            double gold,
            double minions,
            double neutralMinions,
            double visionScore,
            double damageToChampions
    ) {

        static Game of(MatchRecord match, ParticipantRecord p) {
            return new Game(
                    match.ref(),
                    match.gameStart(),
                    Math.max(1.0, match.duration().toSeconds() / 60.0),
                    p.win(),
                    stat(p, MatchStats.KILLS),
                    stat(p, MatchStats.DEATHS),
                    stat(p, MatchStats.ASSISTS),
                    stat(p, MatchStats.GOLD_EARNED),
                    stat(p, MatchStats.MINIONS_KILLED),
                    stat(p, MatchStats.NEUTRAL_MINIONS_KILLED),
                    stat(p, MatchStats.VISION_SCORE),
                    stat(p, MatchStats.DAMAGE_TO_CHAMPIONS));
        }

        private static double stat(ParticipantRecord p, String name) {
            return p.stat(name).orElse(Double.NaN);
        }
    }

    private static final Comparator<Game> ORDER =
            Comparator.comparing(Game::gameStart).thenComparing(Game::match);

    private final Map<PlayerRef, List<Game>> games = new HashMap<>();
    private boolean sealed;

    public void add(MatchRecord match) {
        if (sealed) {
            throw new IllegalStateException("History index is sealed");
        }
        for (ParticipantRecord p : match.participants()) {
            games.computeIfAbsent(p.player(), k -> new ArrayList<>()).add(Game.of(match, p));
        }
    }

    /**
     * Sorts the per-player lists; call once after the last {@link #add}.
     */
    public PlayerHistoryIndex seal() {
        games.values().forEach(list -> list.sort(ORDER));
        sealed = true;
        return this;
    }

    /**
     * Up to {@code limit} games of the player that started strictly before {@code before},
     * most recent last.
     */
    public List<Game> recent(PlayerRef player, Instant before, int limit) {
        if (!sealed) {
            throw new IllegalStateException("History index must be sealed before reading");
        }
        List<Game> all = games.get(player);
        if (all == null || all.isEmpty()) {
            return List.of();
        }
        int end = lowerBound(all, before);
        return List.copyOf(all.subList(Math.max(0, end - limit), end));
    }

    public int players() {
        return games.size();
    }

    // first index whose game starts at or after the instant
    private static int lowerBound(List<Game> sorted, Instant instant) {
        int lo = 0;
        int hi = sorted.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (sorted.get(mid).gameStart().isBefore(instant)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }
}
