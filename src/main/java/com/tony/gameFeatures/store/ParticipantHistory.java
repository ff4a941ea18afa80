package com.tony.gameFeatures.store;

import com.tony.gameFeatures.model.EventRef;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Accès "point-in-time" à l'historique d'un participant : uniquement les matchs dont la date est
 * strictement antérieure à {@code cutoff}, au plus {@code maxCount}, du plus ancien au plus récent.
 * Un participant inconnu donne une liste vide.
 */
public interface ParticipantHistory {

    EventStore store();

    List<EventRef> eventsBefore(String participantId, LocalDateTime cutoff, int maxCount);

    List<EventRef> homeEventsBefore(String participantId, LocalDateTime cutoff, int maxCount);

    List<EventRef> awayEventsBefore(String participantId, LocalDateTime cutoff, int maxCount);

    int countBefore(String participantId, LocalDateTime cutoff);
}
