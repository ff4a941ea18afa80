package com.tony.gameFeatures.model;

import lombok.Builder;
import lombok.Value;

/**
 * Forme récente d'un participant sur les N derniers matchs avant la date de coupure.
 */
@Value
@Builder
public class FormStats {

    int gamesPlayed;
    int wins;
    int draws;

    // wins / matchs décidés (les nuls sont exclus du dénominateur)
    double winPct;

    double avgScored;
    double avgAllowed;
    double avgDifferential;

    public static FormStats empty() {
        return new FormStats(0, 0, 0, 0.0, 0.0, 0.0, 0.0);
    }
}
