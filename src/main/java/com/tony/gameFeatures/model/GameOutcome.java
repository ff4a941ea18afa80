package com.tony.gameFeatures.model;

import lombok.Value;

/**
 * Résultat réel d'un match (label pour l'entraînement).
 */
@Value
public class GameOutcome {
    double scoreA;
    double scoreB;
    int homeWin; // 1 si l'équipe à domicile a gagné, 0 sinon (nul compris)

    public static GameOutcome of(GameEvent event) {
        double home = event.scoreOf(event.getHomeSide());
        double away = event.scoreOf(event.getHomeSide().opposite());
        return new GameOutcome(event.getScoreA(), event.getScoreB(), home > away ? 1 : 0);
    }
}
