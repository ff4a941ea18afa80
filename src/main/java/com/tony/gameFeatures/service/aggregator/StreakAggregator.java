package com.tony.gameFeatures.service.aggregator;

import com.tony.gameFeatures.model.EventRef;
import com.tony.gameFeatures.model.Outcome;
import com.tony.gameFeatures.store.ParticipantHistory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

@Service
public class StreakAggregator {

    /**
     * Série en cours juste avant {@code cutoff} : +n victoires consécutives, -n défaites, 0 sans historique.
     * Un nul casse la série (et donne 0 s'il s'agit du dernier match).
     */
    public int compute(ParticipantHistory history, String participantId, LocalDateTime cutoff) {
        List<EventRef> prior = history.eventsBefore(participantId, cutoff, Integer.MAX_VALUE);
        if (prior.isEmpty()) {
            return 0;
        }

        Outcome first = outcome(history, prior.get(prior.size() - 1), participantId);
        if (first == Outcome.DRAW) {
            return 0;
        }

        int count = 0;
        // Du plus récent au plus ancien
        for (int i = prior.size() - 1; i >= 0; i--) {
            if (outcome(history, prior.get(i), participantId) != first) break;
            count++;
        }
        return first == Outcome.WIN ? count : -count;
    }

    private Outcome outcome(ParticipantHistory history, EventRef ref, String participantId) {
        return history.store().resolve(ref).outcomeFor(participantId);
    }
}
