package com.tony.gameFeatures.service;

import com.tony.gameFeatures.model.FeatureRecord;
import com.tony.gameFeatures.model.ParticipantFeatures;
import com.tony.gameFeatures.model.Side;
import com.tony.gameFeatures.service.aggregator.FormAggregator;
import com.tony.gameFeatures.service.aggregator.HeadToHeadAggregator;
import com.tony.gameFeatures.service.aggregator.HomeAwaySplitAggregator;
import com.tony.gameFeatures.service.aggregator.RestAggregator;
import com.tony.gameFeatures.service.aggregator.StreakAggregator;
import com.tony.gameFeatures.store.PairIndex;
import com.tony.gameFeatures.store.ParticipantHistory;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Calcul d'une ligne de features pour une affiche (A vs B) à une date de coupure donnée.
 * Même chemin de code pour l'assemblage du dataset et pour l'inférence sur un match à venir.
 */
@Service
@RequiredArgsConstructor
public class GameFeatureCalculator {

    private final FormAggregator formAggregator;
    private final StreakAggregator streakAggregator;
    private final RestAggregator restAggregator;
    private final HomeAwaySplitAggregator splitAggregator;
    private final HeadToHeadAggregator headToHeadAggregator;

    public FeatureRecord compute(ParticipantHistory history, PairIndex pairIndex, String eventId,
                                 String aId, String bId, Side homeSide, LocalDateTime cutoff,
                                 AssemblyOptions options) {
        return FeatureRecord.builder()
                .eventId(eventId)
                .timestamp(cutoff)
                .participantAId(aId)
                .participantBId(bId)
                .homeSide(homeSide)
                .featuresA(participantFeatures(history, aId, cutoff, options.getWindowSize()))
                .featuresB(participantFeatures(history, bId, cutoff, options.getWindowSize()))
                .headToHead(headToHeadAggregator.compute(pairIndex, history.store(), aId, bId, cutoff,
                        options.getH2hWindowSize()))
                .build();
    }

    public ParticipantFeatures participantFeatures(ParticipantHistory history, String participantId,
                                                   LocalDateTime cutoff, int windowSize) {
        int rest = restAggregator.compute(history, participantId, cutoff);
        return ParticipantFeatures.builder()
                .participantId(participantId)
                .form(formAggregator.compute(history, participantId, cutoff, windowSize))
                .streak(streakAggregator.compute(history, participantId, cutoff))
                .restDays(rest)
                .backToBack(RestAggregator.isBackToBack(rest))
                .split(splitAggregator.compute(history, participantId, cutoff, windowSize))
                .build();
    }
}
