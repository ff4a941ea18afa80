package com.tony.gameFeatures.model;

import lombok.Builder;
import lombok.Value;

/**
 * Historique des confrontations directes entre A et B.
 * {@code games} ne compte que les matchs décidés : winsA + winsB == games.
 */
@Value
@Builder
public class HeadToHeadStats {
    int games;
    int winsA;
    int winsB;
    int draws;
    double winPctA;

    public static HeadToHeadStats empty() {
        return new HeadToHeadStats(0, 0, 0, 0, 0.0);
    }
}
