package com.tony.gameFeatures.service.aggregator;

import com.tony.gameFeatures.model.EventRef;
import com.tony.gameFeatures.model.HeadToHeadStats;
import com.tony.gameFeatures.model.Outcome;
import com.tony.gameFeatures.store.EventStore;
import com.tony.gameFeatures.store.PairIndex;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

@Service
public class HeadToHeadAggregator {

    /**
     * Bilan des {@code windowSize} dernières confrontations A/B avant {@code cutoff}, vu depuis A.
     * Les nuls sont comptés à part : winsA + winsB == games.
     */
    public HeadToHeadStats compute(PairIndex pairIndex, EventStore store, String aId, String bId,
                                   LocalDateTime cutoff, int windowSize) {
        List<EventRef> shared = pairIndex.eventsBefore(aId, bId, cutoff, windowSize);
        if (shared.isEmpty()) {
            return HeadToHeadStats.empty();
        }

        int winsA = 0;
        int winsB = 0;
        int draws = 0;
        for (EventRef ref : shared) {
            Outcome outcome = store.resolve(ref).outcomeFor(aId);
            switch (outcome) {
                case WIN -> winsA++;
                case LOSS -> winsB++;
                case DRAW -> draws++;
            }
        }

        int games = winsA + winsB;
        return HeadToHeadStats.builder()
                .games(games)
                .winsA(winsA)
                .winsB(winsB)
                .draws(draws)
                .winPctA(games > 0 ? (double) winsA / games : 0.0)
                .build();
    }
}
