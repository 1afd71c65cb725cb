package org.jstats.matchcrawler_api.modules.feature_builder.service;

import org.jstats.matchcrawler_api.modules.crawl.model.MatchRecord;
import org.jstats.matchcrawler_api.modules.crawl.model.MatchStats;
import org.jstats.matchcrawler_api.modules.crawl.model.ParticipantRecord;
import org.jstats.matchcrawler_api.modules.feature_builder.model.FeatureRecord;
import org.jstats.matchcrawler_api.modules.feature_builder.model.Role;
import org.jstats.matchcrawler_api.modules.feature_builder.model.SlotFeature;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.ToDoubleFunction;

/**
 * Turns one stored match into a dataset row. Pure: the same match and history always give the
 * same row.
 * <p>
 * Slots: blue team (100) then red team (200), five each, ordered by role
 * (TOP, JUNGLE, MIDDLE, BOTTOM, UTILITY, UNKNOWN) then participant id. A short team is padded
 * with imputed slots; a team with more than five participants makes the match unusable.
 * <p>
 * Label: {@code 0.55 * blue gold share + 0.45 * blue win}.
 */
public class FeatureExtractor {

    public static final int SLOTS_PER_TEAM = 5;
    public static final double GOLD_SHARE_WEIGHT = 0.55;
    public static final double WIN_WEIGHT = 0.45;

    private static final List<Team> TEAMS = List.of(
            new Team("blue", ParticipantRecord.BLUE_TEAM),
            new Team("red", ParticipantRecord.RED_TEAM));

    private static final Comparator<ParticipantRecord> SLOT_ORDER =
            Comparator.comparing((ParticipantRecord p) -> Role.parse(p.role()))
                    .thenComparingInt(ParticipantRecord::participantId);

    private record Team(String prefix, int teamId) {
    }

    private final ImputationPolicy imputation;
    private final int historySize;

    public FeatureExtractor(ImputationPolicy imputation, int historySize) {
        this.imputation = imputation;
        this.historySize = historySize;
    }

    public ImputationPolicy imputation() {
        return imputation;
    }

    /**
     * Column names of the feature part of a row, in output order.
     */
    public static List<String> columns() {
        List<String> columns = new ArrayList<>();
        for (Team team : TEAMS) {
            for (int slot = 1; slot <= SLOTS_PER_TEAM; slot++) {
                for (SlotFeature feature : SlotFeature.values()) {
                    columns.add(column(team.prefix(), slot, feature));
                }
            }
        }
        return columns;
    }

    /**
     * @return the row, or empty when a team has more than {@value #SLOTS_PER_TEAM} participants
     */
    public Optional<FeatureRecord> extract(MatchRecord match, PlayerHistoryIndex history) {
        Map<String, Double> features = new LinkedHashMap<>();
        for (Team team : TEAMS) {
            List<ParticipantRecord> members = match.participants().stream()
                    .filter(p -> p.teamId() == team.teamId())
                    .sorted(SLOT_ORDER)
                    .toList();
            if (members.size() > SLOTS_PER_TEAM) {
                return Optional.empty();
            }
            for (int slot = 1; slot <= SLOTS_PER_TEAM; slot++) {
                Map<SlotFeature, Double> values = slot <= members.size()
                        ? slotFeatures(members.get(slot - 1), match, history)
                        : padding();
                for (SlotFeature feature : SlotFeature.values()) {
                    features.put(column(team.prefix(), slot, feature), values.get(feature));
                }
            }
        }
        return Optional.of(new FeatureRecord(match.ref().region(), match.ref().id(), match.gameStart(),
                label(match), features));
    }

    /**
     * {@code 0.55 * gold(blue) / (gold(blue) + gold(red)) + 0.45 * win(blue)}; the gold share is 0.5
     * when no gold was recorded.
     */
    public static double label(MatchRecord match) {
        double blueGold = 0;
        double redGold = 0;
        boolean blueWin = false;
        for (ParticipantRecord p : match.participants()) {
            double gold = p.stat(MatchStats.GOLD_EARNED).orElse(0.0);
            if (p.teamId() == ParticipantRecord.BLUE_TEAM) {
                blueGold += gold;
                blueWin |= p.win();
            } else if (p.teamId() == ParticipantRecord.RED_TEAM) {
                redGold += gold;
            }
        }
        double total = blueGold + redGold;
        double share = total > 0 ? blueGold / total : 0.5;
        return GOLD_SHARE_WEIGHT * share + WIN_WEIGHT * (blueWin ? 1.0 : 0.0);
    }

    private Map<SlotFeature, Double> slotFeatures(ParticipantRecord p, MatchRecord match, PlayerHistoryIndex history) {
        List<PlayerHistoryIndex.Game> games = history.recent(p.player(), match.gameStart(), historySize);
        Map<SlotFeature, Double> values = new LinkedHashMap<>();
        values.put(SlotFeature.ROLE, (double) Role.parse(p.role()).code());
        values.put(SlotFeature.HISTORY_GAMES, (double) games.size());

        double kills = mean(games, PlayerHistoryIndex.Game::kills);
        double deaths = mean(games, PlayerHistoryIndex.Game::deaths);
        double assists = mean(games, PlayerHistoryIndex.Game::assists);
        put(values, SlotFeature.KILLS_AVG, kills);
        put(values, SlotFeature.DEATHS_AVG, deaths);
        put(values, SlotFeature.ASSISTS_AVG, assists);
        put(values, SlotFeature.KDA, (kills + assists) / Math.max(1.0, deaths));
        put(values, SlotFeature.GOLD_PER_MIN, mean(games, g -> g.gold() / g.minutes()));
        put(values, SlotFeature.CS_PER_MIN, mean(games, g -> Double.isNaN(g.minions())
                ? Double.NaN
                : (g.minions() + (Double.isNaN(g.neutralMinions()) ? 0.0 : g.neutralMinions())) / g.minutes()));
        put(values, SlotFeature.VISION_SCORE_AVG, mean(games, PlayerHistoryIndex.Game::visionScore));
        put(values, SlotFeature.DAMAGE_TO_CHAMPS_AVG, mean(games, PlayerHistoryIndex.Game::damageToChampions));
        put(values, SlotFeature.WIN_RATE_RECENT, mean(games, g -> g.win() ? 1.0 : 0.0));
        return values;
    }

    private Map<SlotFeature, Double> padding() {
        Map<SlotFeature, Double> values = new LinkedHashMap<>();
        for (SlotFeature feature : SlotFeature.values()) {
            values.put(feature, imputation.defaultFor(feature));
        }
        return values;
    }

    // NaN (no usable history) falls back to the imputation default
    private void put(Map<SlotFeature, Double> values, SlotFeature feature, double value) {
        values.put(feature, Double.isFinite(value) ? value : imputation.defaultFor(feature));
    }

    private static double mean(List<PlayerHistoryIndex.Game> games, ToDoubleFunction<PlayerHistoryIndex.Game> value) {
        double sum = 0;
        int n = 0;
        for (PlayerHistoryIndex.Game game : games) {
            double v = value.applyAsDouble(game);
            if (!Double.isNaN(v)) {
                sum += v;
                n++;
            }
        }
        return n == 0 ? Double.NaN : sum / n;
    }

    private static String column(String team, int slot, SlotFeature feature) {
        return team + "_" + slot + "_" + feature.column();
    }
}
