package com.tony.gameFeatures.service;

import com.tony.gameFeatures.config.FeatureProperties;
import lombok.Builder;
import lombok.Value;

/**
 * Paramètres d'un passage d'assemblage.
 */
@Value
@Builder(toBuilder = true)
public class AssemblyOptions {

    @Builder.Default
    int windowSize = 10;

    @Builder.Default
    int h2hWindowSize = 10;

    @Builder.Default
    int minHistoryGames = 0;

    @Builder.Default
    boolean includeOutcome = true;

    @Builder.Default
    boolean parallel = false;

    public static AssemblyOptions from(FeatureProperties properties) {
        return AssemblyOptions.builder()
                .windowSize(properties.getWindowSize())
                .h2hWindowSize(properties.getH2hWindowSize())
                .minHistoryGames(properties.getMinHistoryGames())
                .includeOutcome(properties.isIncludeOutcome())
                .parallel(properties.isParallel())
                .build();
    }

    void validate() {
        if (windowSize < 1 || h2hWindowSize < 1) {
            throw new IllegalArgumentException("Les fenêtres doivent être >= 1 (forme=" + windowSize
                    + ", h2h=" + h2hWindowSize + ")");
        }
        if (minHistoryGames < 0) {
            throw new IllegalArgumentException("minHistoryGames doit être >= 0 : " + minHistoryGames);
        }
    }
}
