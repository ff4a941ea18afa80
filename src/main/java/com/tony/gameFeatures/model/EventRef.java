package com.tony.gameFeatures.model;

import lombok.Value;

import java.time.LocalDateTime;

/**
 * Référence légère vers un événement de l'EventStore (position + id + date).
 */
@Value
public class EventRef {
    int position;
    String eventId;
    LocalDateTime timestamp;
}
