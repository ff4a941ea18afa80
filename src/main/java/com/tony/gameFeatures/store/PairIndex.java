package com.tony.gameFeatures.store;

import com.tony.gameFeatures.model.EventRef;
import com.tony.gameFeatures.model.GameEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Index des confrontations directes : paire -> matchs triés entre exactement ces deux participants.
 * Chaque match n'alimente qu'un seul seau, la construction est donc en O(n).
 */
@Slf4j
public final class PairIndex {

    private final Map<PairKey, List<EventRef>> buckets;

    private PairIndex(Map<PairKey, List<EventRef>> buckets) {
        this.buckets = buckets;
    }

    public static PairIndex build(ParticipantIndex participantIndex) {
        EventStore store = participantIndex.store();
        Map<PairKey, List<EventRef>> working = new HashMap<>();
        for (EventRef ref : store.refs()) {
            GameEvent e = store.resolve(ref);
            working.computeIfAbsent(PairKey.of(e.getParticipantAId(), e.getParticipantBId()),
                    k -> new ArrayList<>()).add(ref);
        }

        Map<PairKey, List<EventRef>> frozen = new HashMap<>();
        working.forEach((key, refs) -> frozen.put(key, List.copyOf(refs)));
        log.debug("PairIndex : {} paires", frozen.size());
        return new PairIndex(Map.copyOf(frozen));
    }

    public List<EventRef> eventsBefore(String aId, String bId, LocalDateTime cutoff, int maxCount) {
        List<EventRef> refs = allEvents(aId, bId);
        return Timeline.window(refs, Timeline.lowerBound(refs, cutoff), maxCount);
    }

    public List<EventRef> allEvents(String aId, String bId) {
        return buckets.getOrDefault(PairKey.of(aId, bId), List.of());
    }

    int pairCount() {
        return buckets.size();
    }
}
