package com.tony.gameFeatures.store;

import com.tony.gameFeatures.exception.EventValidationException;
import com.tony.gameFeatures.model.EventRef;
import com.tony.gameFeatures.model.GameEvent;
import lombok.extern.slf4j.Slf4j;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.Comparator;
import java.util.HashMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Journal de matchs trié (date puis id) et figé après construction.
 * Chaque match reçoit une position stable 0..n-1.
 */
@Slf4j
public final class EventStore {

    public static final Comparator<GameEvent> CHRONOLOGICAL =
            Comparator.comparing(GameEvent::getTimestamp).thenComparing(GameEvent::getId);

    private final List<GameEvent> events;
    private final List<EventRef> refs;
    private final Map<String, Integer> positionById;

    private EventStore(List<GameEvent> sorted) {
        List<EventRef> refList = new ArrayList<>(sorted.size());
        Map<String, Integer> positions = new HashMap<>();
        for (int i = 0; i < sorted.size(); i++) {
            GameEvent e = sorted.get(i);
            refList.add(new EventRef(i, e.getId(), e.getTimestamp()));
            positions.put(e.getId(), i);
        }
        this.events = Collections.unmodifiableList(sorted);
        this.refs = Collections.unmodifiableList(refList);
        this.positionById = Collections.unmodifiableMap(positions);
    }

    /**
     * Valide puis trie les matchs. Rien n'est construit si un seul match est invalide.
     *
     * @throws EventValidationException avec la liste complète des problèmes détectés
     */
    public static EventStore build(Collection<GameEvent> input) {
        List<String> problems = new ArrayList<>();
        Set<String> seenIds = new HashSet<>();

        for (GameEvent e : input) {
            if (e == null) {
                problems.add("match null");
                continue;
            }
            validate(e, problems);
            if (e.getId() != null && !seenIds.add(e.getId())) {
                problems.add("id en double : " + e.getId());
            }
        }

        if (!problems.isEmpty()) {
            log.warn("Rejet du journal : {} problème(s)", problems.size());
            throw new EventValidationException(problems);
        }

        List<GameEvent> sorted = new ArrayList<>(input);
        sorted.sort(CHRONOLOGICAL);
        log.debug("EventStore construit : {} matchs", sorted.size());
        return new EventStore(sorted);
    }

    private static void validate(GameEvent e, List<String> problems) {
        String label = e.getId() != null ? e.getId() : "<sans id>";

        if (e.getId() == null || e.getId().isBlank()) problems.add("match sans id");
        if (e.getTimestamp() == null) problems.add(label + " : date manquante");
        if (e.getHomeSide() == null) problems.add(label + " : côté domicile manquant");

        String a = e.getParticipantAId();
        String b = e.getParticipantBId();
        if (a == null || a.isBlank() || b == null || b.isBlank()) {
            problems.add(label + " : participant manquant");
        } else if (a.equals(b)) {
            problems.add(label + " : participants identiques (" + a + ")");
        }

        if (!isValidScore(e.getScoreA()) || !isValidScore(e.getScoreB())) {
            problems.add(label + " : score négatif ou invalide (" + e.getScoreA() + " - " + e.getScoreB() + ")");
        }
    }

    private static boolean isValidScore(double score) {
        return Double.isFinite(score) && score >= 0;
    }

    /**
     * Vue en lecture seule, ordre chronologique. Peut être parcourue autant de fois que voulu.
     */
    public List<GameEvent> sortedEvents() {
        return events;
    }

    public List<EventRef> refs() {
        return refs;
    }

    public GameEvent get(int position) {
        return events.get(position);
    }

    public GameEvent resolve(EventRef ref) {
        return events.get(ref.getPosition());
    }

    public EventRef ref(int position) {
        return refs.get(position);
    }

    Optional<GameEvent> findById(String eventId) {
        Integer position = positionById.get(eventId);
        return position == null ? Optional.empty() : Optional.of(events.get(position));
    }

    public int size() {
        return events.size();
    }

    public boolean isEmpty() {
        return events.isEmpty();
    }
}
