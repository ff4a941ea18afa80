package com.tony.gameFeatures.service;

import com.tony.gameFeatures.model.FeatureRecord;
import com.tony.gameFeatures.model.Side;
import com.tony.gameFeatures.store.EventStore;
import com.tony.gameFeatures.store.PairIndex;
import com.tony.gameFeatures.store.ParticipantIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;

/**
 * Features d'un match à venir (inférence), sans passer par l'assemblage complet.
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class MatchupFeatureService {

    public static final String UPCOMING_EVENT_ID = "upcoming";

    private final GameFeatureCalculator calculator;

    /**
     * Indices déjà construits (cas d'un service qui répond à plusieurs requêtes sur le même journal).
     */
    public FeatureRecord featuresFor(ParticipantIndex participantIndex, PairIndex pairIndex,
                                     String aId, String bId, Side homeSide, LocalDateTime now,
                                     AssemblyOptions options) {
        if (aId.equals(bId)) {
            throw new IllegalArgumentException("Un participant ne peut pas s'affronter lui-même : " + aId);
        }
        options.validate();
        log.debug("Features à la volée : {} vs {} au {}", aId, bId, now);
        return calculator.compute(participantIndex, pairIndex, UPCOMING_EVENT_ID, aId, bId, homeSide, now, options);
    }

    public FeatureRecord featuresFor(EventStore store, String aId, String bId, Side homeSide,
                                     LocalDateTime now, AssemblyOptions options) {
        ParticipantIndex participantIndex = ParticipantIndex.build(store);
        return featuresFor(participantIndex, PairIndex.build(participantIndex), aId, bId, homeSide, now, options);
    }
}
