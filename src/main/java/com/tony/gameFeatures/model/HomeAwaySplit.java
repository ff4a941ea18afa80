package com.tony.gameFeatures.model;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class HomeAwaySplit {

    public static final double DEFAULT_WIN_PCT = 0.0;

    int homeGames;
    double homeWinPct;
    int awayGames;
    double awayWinPct;

    public static HomeAwaySplit empty() {
        return new HomeAwaySplit(0, DEFAULT_WIN_PCT, 0, DEFAULT_WIN_PCT);
    }
}
