package com.tony.gameFeatures.service.aggregator;

import com.tony.gameFeatures.model.EventRef;
import com.tony.gameFeatures.store.ParticipantHistory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.List;

@Service
public class RestAggregator {

    // Valeur sentinelle : aucun match précédent
    public static final int NO_PRIOR_EVENT = 999;

    /**
     * Jours pleins écoulés depuis le dernier match avant {@code cutoff}.
     */
    public int compute(ParticipantHistory history, String participantId, LocalDateTime cutoff) {
        List<EventRef> last = history.eventsBefore(participantId, cutoff, 1);
        if (last.isEmpty()) {
            return NO_PRIOR_EVENT;
        }
        return (int) ChronoUnit.DAYS.between(last.get(0).getTimestamp(), cutoff);
    }

    public static boolean isBackToBack(int restDays) {
        return restDays == 1;
    }
}
