package com.tony.gameFeatures.service;

import com.tony.gameFeatures.model.FeatureRecord;
import com.tony.gameFeatures.model.GameEvent;
import com.tony.gameFeatures.model.GameOutcome;
import com.tony.gameFeatures.store.EventStore;
import com.tony.gameFeatures.store.HistoryCursor;
import com.tony.gameFeatures.store.PairIndex;
import com.tony.gameFeatures.store.ParticipantHistory;
import com.tony.gameFeatures.store.ParticipantIndex;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.stream.IntStream;

/**
 * Construit le dataset : une ligne par match éligible, chaque stat calculée strictement avant
 * la date du match (aucune fuite du futur).
 */
@Service
@RequiredArgsConstructor
@Slf4j
public class FeatureAssemblerService {

    private final GameFeatureCalculator calculator;

    public List<FeatureRecord> assemble(EventStore store, int minHistoryGames, int windowSize) {
        return assemble(store, AssemblyOptions.builder()
                .minHistoryGames(minHistoryGames)
                .windowSize(windowSize)
                .h2hWindowSize(windowSize)
                .build());
    }

    public List<FeatureRecord> assemble(EventStore store, AssemblyOptions options) {
        options.validate();
        long start = System.currentTimeMillis();

        // Index construits une fois puis figés : lecture seule pendant tout le passage
        ParticipantIndex participantIndex = ParticipantIndex.build(store);
        PairIndex pairIndex = PairIndex.build(participantIndex);

        List<FeatureRecord> records = options.isParallel()
                ? assembleParallel(store, participantIndex, pairIndex, options)
                : assembleSequential(store, participantIndex, pairIndex, options);

        log.info("📊 Features : {} lignes sur {} matchs ({} ignorés, historique < {}) en {} ms",
                records.size(), store.size(), store.size() - records.size(),
                options.getMinHistoryGames(), System.currentTimeMillis() - start);
        return records;
    }

    private List<FeatureRecord> assembleSequential(EventStore store, ParticipantIndex participantIndex,
                                                   PairIndex pairIndex, AssemblyOptions options) {
        // Parcours chronologique : les coupures ne décroissent jamais, le curseur avance en O(1) amorti
        HistoryCursor cursor = participantIndex.cursor();
        List<FeatureRecord> records = new ArrayList<>();
        for (GameEvent event : store.sortedEvents()) {
            FeatureRecord record = recordFor(event, cursor, pairIndex, options);
            if (record != null) {
                records.add(record);
            }
        }
        if (cursor.getFallbacks() > 0) {
            log.debug("Curseur : {} requêtes hors ordre", cursor.getFallbacks());
        }
        return records;
    }

    private List<FeatureRecord> assembleParallel(EventStore store, ParticipantIndex participantIndex,
                                                 PairIndex pairIndex, AssemblyOptions options) {
        // Stream ordonné : la sortie garde l'ordre chronologique du store
        return IntStream.range(0, store.size())
                .parallel()
                .mapToObj(position -> recordFor(store.get(position), participantIndex, pairIndex, options))
                .filter(Objects::nonNull)
                .toList();
    }

    private FeatureRecord recordFor(GameEvent event, ParticipantHistory history, PairIndex pairIndex,
                                    AssemblyOptions options) {
        String a = event.getParticipantAId();
        String b = event.getParticipantBId();

        int minHistory = options.getMinHistoryGames();
        if (minHistory > 0
                && (history.countBefore(a, event.getTimestamp()) < minHistory
                || history.countBefore(b, event.getTimestamp()) < minHistory)) {
            log.debug("Match {} ignoré : historique insuffisant", event.getId());
            return null;
        }

        FeatureRecord record = calculator.compute(history, pairIndex, event.getId(), a, b,
                event.getHomeSide(), event.getTimestamp(), options);
        return options.isIncludeOutcome() ? record.withOutcome(GameOutcome.of(event)) : record;
    }
}
