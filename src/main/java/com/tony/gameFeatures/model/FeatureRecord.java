package com.tony.gameFeatures.model;

import lombok.Builder;
import lombok.Value;
import lombok.With;

import java.time.LocalDateTime;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Une ligne du dataset : les stats des deux participants au moment du coup d'envoi.
 * {@code outcome} est null en inférence (match pas encore joué).
 */
@Value
@Builder
public class FeatureRecord {

    public static final List<String> FEATURE_COLUMNS = List.of(
            "a_win_pct", "a_avg_scored", "a_avg_allowed", "a_point_diff", "a_games_played",
            "b_win_pct", "b_avg_scored", "b_avg_allowed", "b_point_diff", "b_games_played",
            "h2h_games", "h2h_draws", "a_h2h_win_pct",
            "a_rest_days", "b_rest_days", "a_b2b", "b_b2b",
            "a_streak", "b_streak",
            "a_home_win_pct", "a_away_win_pct", "b_home_win_pct", "b_away_win_pct",
            "a_is_home"
    );

    public static final List<String> TARGET_COLUMNS = List.of("home_win", "score_a", "score_b");

    String eventId;
    LocalDateTime timestamp;
    String participantAId;
    String participantBId;
    Side homeSide;

    ParticipantFeatures featuresA;
    ParticipantFeatures featuresB;
    HeadToHeadStats headToHead;

    @With
    GameOutcome outcome;

    public boolean hasOutcome() {
        return outcome != null;
    }

    /**
     * Vecteur numérique dans l'ordre de {@link #FEATURE_COLUMNS}.
     */
    public Map<String, Double> toFeatureVector() {
        Map<String, Double> v = new LinkedHashMap<>();
        putForm(v, "a_", featuresA.getForm());
        putForm(v, "b_", featuresB.getForm());

        v.put("h2h_games", (double) headToHead.getGames());
        v.put("h2h_draws", (double) headToHead.getDraws());
        v.put("a_h2h_win_pct", headToHead.getWinPctA());

        v.put("a_rest_days", (double) featuresA.getRestDays());
        v.put("b_rest_days", (double) featuresB.getRestDays());
        v.put("a_b2b", featuresA.isBackToBack() ? 1.0 : 0.0);
        v.put("b_b2b", featuresB.isBackToBack() ? 1.0 : 0.0);

        v.put("a_streak", (double) featuresA.getStreak());
        v.put("b_streak", (double) featuresB.getStreak());

        v.put("a_home_win_pct", featuresA.getSplit().getHomeWinPct());
        v.put("a_away_win_pct", featuresA.getSplit().getAwayWinPct());
        v.put("b_home_win_pct", featuresB.getSplit().getHomeWinPct());
        v.put("b_away_win_pct", featuresB.getSplit().getAwayWinPct());

        v.put("a_is_home", homeSide == Side.A ? 1.0 : 0.0);
        return v;
    }

    public double[] toFeatureArray() {
        return toFeatureVector().values().stream().mapToDouble(Double::doubleValue).toArray();
    }

    public double target(String name) {
        if (outcome == null) {
            throw new IllegalArgumentException("Pas de résultat pour le match " + eventId);
        }
        return switch (name) {
            case "home_win" -> outcome.getHomeWin();
            case "score_a" -> outcome.getScoreA();
            case "score_b" -> outcome.getScoreB();
            default -> throw new IllegalArgumentException("Cible inconnue : " + name);
        };
    }

    private static void putForm(Map<String, Double> v, String prefix, FormStats form) {
        v.put(prefix + "win_pct", form.getWinPct());
        v.put(prefix + "avg_scored", form.getAvgScored());
        v.put(prefix + "avg_allowed", form.getAvgAllowed());
        v.put(prefix + "point_diff", form.getAvgDifferential());
        v.put(prefix + "games_played", (double) form.getGamesPlayed());
    }
}
