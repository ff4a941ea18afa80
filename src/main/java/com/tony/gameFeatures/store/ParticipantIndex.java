package com.tony.gameFeatures.store;

import com.tony.gameFeatures.model.EventRef;
import com.tony.gameFeatures.model.GameEvent;
import lombok.extern.slf4j.Slf4j;

import java.time.LocalDateTime;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Index participant -> matchs triés, construit en un seul passage sur l'EventStore (déjà trié).
 * Les requêtes utilisent une recherche dichotomique ; {@link #cursor()} donne une variante à pointeur
 * monotone pour un parcours chronologique.
 */
@Slf4j
public final class ParticipantIndex implements ParticipantHistory {

    private final EventStore store;
    private final Map<String, Timeline> timelines;

    private ParticipantIndex(EventStore store, Map<String, Timeline> timelines) {
        this.store = store;
        this.timelines = Collections.unmodifiableMap(timelines);
    }

    public static ParticipantIndex build(EventStore store) {
        Map<String, List<EventRef>> all = new HashMap<>();
        Map<String, List<EventRef>> home = new HashMap<>();
        Map<String, List<EventRef>> away = new HashMap<>();

        // Le store est trié : l'ordre d'insertion suffit à garder chaque liste triée
        for (EventRef ref : store.refs()) {
            GameEvent e = store.resolve(ref);
            for (String participant : List.of(e.getParticipantAId(), e.getParticipantBId())) {
                all.computeIfAbsent(participant, k -> new ArrayList<>()).add(ref);
                Map<String, List<EventRef>> byRole = e.isHome(participant) ? home : away;
                byRole.computeIfAbsent(participant, k -> new ArrayList<>()).add(ref);
            }
        }

        Map<String, Timeline> timelines = new HashMap<>();
        for (Map.Entry<String, List<EventRef>> entry : all.entrySet()) {
            String id = entry.getKey();
            timelines.put(id, new Timeline(entry.getValue(),
                    home.getOrDefault(id, List.of()),
                    away.getOrDefault(id, List.of())));
        }
        log.debug("ParticipantIndex : {} participants pour {} matchs", timelines.size(), store.size());
        return new ParticipantIndex(store, timelines);
    }

    @Override
    public EventStore store() {
        return store;
    }

    public Set<String> participantIds() {
        return timelines.keySet();
    }

    /**
     * Tous les matchs du participant, sans coupure.
     */
    public List<EventRef> allEvents(String participantId) {
        return refs(participantId, Timeline.Partition.ALL);
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
        return Timeline.lowerBound(allEvents(participantId), cutoff);
    }

    /**
     * Nouveau curseur pour un parcours où les dates de coupure ne décroissent pas.
     */
    public HistoryCursor cursor() {
        return new HistoryCursor(this);
    }

    List<EventRef> refs(String participantId, Timeline.Partition partition) {
        Timeline timeline = timelines.get(participantId);
        return timeline == null ? List.of() : timeline.get(partition);
    }

    private List<EventRef> before(String participantId, Timeline.Partition partition,
                                  LocalDateTime cutoff, int maxCount) {
        List<EventRef> refs = refs(participantId, partition);
        return Timeline.window(refs, Timeline.lowerBound(refs, cutoff), maxCount);
    }
}
