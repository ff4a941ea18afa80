package com.tony.gameFeatures.service.aggregator;

import com.tony.gameFeatures.model.EventRef;
import com.tony.gameFeatures.model.HomeAwaySplit;
import com.tony.gameFeatures.model.Outcome;
import com.tony.gameFeatures.store.ParticipantHistory;
import org.springframework.stereotype.Service;

import java.time.LocalDateTime;
import java.util.List;

@Service
public class HomeAwaySplitAggregator {

    /**
     * % de victoires à domicile et à l'extérieur, chacun sur ses propres {@code windowSize} derniers matchs.
     */
    public HomeAwaySplit compute(ParticipantHistory history, String participantId, LocalDateTime cutoff, int windowSize) {
        List<EventRef> home = history.homeEventsBefore(participantId, cutoff, windowSize);
        List<EventRef> away = history.awayEventsBefore(participantId, cutoff, windowSize);

        return HomeAwaySplit.builder()
                .homeGames(home.size())
                .homeWinPct(winPct(history, home, participantId))
                .awayGames(away.size())
                .awayWinPct(winPct(history, away, participantId))
                .build();
    }

    private double winPct(ParticipantHistory history, List<EventRef> refs, String participantId) {
        int wins = 0;
        int decided = 0;
        for (EventRef ref : refs) {
            Outcome outcome = history.store().resolve(ref).outcomeFor(participantId);
            if (outcome == Outcome.DRAW) continue;
            decided++;
            if (outcome == Outcome.WIN) wins++;
        }
        return decided > 0 ? (double) wins / decided : HomeAwaySplit.DEFAULT_WIN_PCT;
    }
}
