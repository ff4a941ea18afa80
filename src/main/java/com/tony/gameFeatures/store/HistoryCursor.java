package com.tony.gameFeatures.store;

import com.tony.gameFeatures.model.EventRef;

import java.time.LocalDateTime;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Vue sur un {@link ParticipantIndex} qui garde un pointeur par participant et par rôle.
 * Tant que les coupures d'un participant ne décroissent pas, chaque requête avance le pointeur
 * (O(1) amorti). Une coupure plus ancienne retombe sur la recherche dichotomique, sans toucher au pointeur.
 * <p>
 * Non thread-safe : un curseur par passage. L'index sous-jacent n'est jamais modifié.
 */
public final class HistoryCursor implements ParticipantHistory {

    private final ParticipantIndex index;
    private final Map<String, Map<Timeline.Partition, Position>> positions = new HashMap<>();
    private long fallbacks;

    HistoryCursor(ParticipantIndex index) {
        this.index = index;
    }

    @Override
    public EventStore store() {
        return index.store();
    }

    @Override
    public List<EventRef> eventsBefore(String participantId, LocalDateTime cutoff, int maxCount) {
        return before(participantId, Timeline.Partition.ALL, cutoff, maxCount);
    }

    @Override
    public List<EventRef> homeEventsBefore(String participantId, LocalDateTime cutoff, int maxCount) {
        return before(participantId, Timeline.Partition.HOME, cutoff, maxCount);
    }

    @Override
    public List<EventRef> awayEventsBefore(String participantId, LocalDateTime cutoff, int maxCount) {
        return before(participantId, Timeline.Partition.AWAY, cutoff, maxCount);
    }

    @Override
    public int countBefore(String participantId, LocalDateTime cutoff) {
        return seek(participantId, Timeline.Partition.ALL, cutoff);
    }

    /**
     * Nombre de requêtes servies par recherche dichotomique (coupure hors ordre).
     */
    public long getFallbacks() {
        return fallbacks;
    }

    private List<EventRef> before(String participantId, Timeline.Partition partition,
                                  LocalDateTime cutoff, int maxCount) {
        Timeline.checkMaxCount(maxCount);
        int end = seek(participantId, partition, cutoff);
        return Timeline.window(index.refs(participantId, partition), end, maxCount);
    }

    private int seek(String participantId, Timeline.Partition partition, LocalDateTime cutoff) {
        List<EventRef> refs = index.refs(participantId, partition);
        if (refs.isEmpty()) return 0;

        Position pos = positions
                .computeIfAbsent(participantId, k -> new EnumMap<>(Timeline.Partition.class))
                .computeIfAbsent(partition, k -> new Position());

        if (pos.lastCutoff != null && cutoff.isBefore(pos.lastCutoff)) {
            fallbacks++;
            return Timeline.lowerBound(refs, cutoff);
        }

        int i = pos.pointer;
        while (i < refs.size() && refs.get(i).getTimestamp().isBefore(cutoff)) {
            i++;
        }
        pos.pointer = i;
        pos.lastCutoff = cutoff;
        return i;
    }

    private static final class Position {
        int pointer;
        LocalDateTime lastCutoff;
    }
}
