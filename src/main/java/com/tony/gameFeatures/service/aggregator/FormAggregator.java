package com.tony.gameFeatures.service.aggregator;

import com.tony.gameFeatures.model.EventRef;
import com.tony.gameFeatures.model.FormStats;
import com.tony.gameFeatures.model.GameEvent;
import com.tony.gameFeatures.model.Outcome;
import com.tony.gameFeatures.store.ParticipantHistory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

@Service
public class FormAggregator {

    /**
     * Forme sur les {@code windowSize} derniers matchs avant {@code cutoff}.
     * Points marqués / encaissés pris du côté où le participant jouait.
     * Aucun historique : {@link FormStats#empty()} (cas normal d'un nouveau participant).
     */
    public FormStats compute(ParticipantHistory history, String participantId, LocalDateTime cutoff, int windowSize) {
        List<EventRef> window = history.eventsBefore(participantId, cutoff, windowSize);
        if (window.isEmpty()) {
            return FormStats.empty();
        }

        int wins = 0;
        int draws = 0;
        double scored = 0.0;
        double allowed = 0.0;

        for (EventRef ref : window) {
            GameEvent e = history.store().resolve(ref);
            double my = e.scoreFor(participantId);
            double opp = e.scoreAgainst(participantId);
            scored += my;
            allowed += opp;

            Outcome outcome = Outcome.of(my, opp);
            if (outcome == Outcome.WIN) wins++;
            else if (outcome == Outcome.DRAW) draws++;
        }

        int games = window.size();
        int decided = games - draws;
        double avgScored = scored / games;
        double avgAllowed = allowed / games;

        return FormStats.builder()
                .gamesPlayed(games)
                .wins(wins)
                .draws(draws)
                .winPct(decided > 0 ? (double) wins / decided : 0.0)
                .avgScored(avgScored)
                .avgAllowed(avgAllowed)
                .avgDifferential(avgScored - avgAllowed)
                .build();
    }
}
