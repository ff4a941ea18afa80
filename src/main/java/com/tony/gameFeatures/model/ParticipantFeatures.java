package com.tony.gameFeatures.model;

import lombok.Builder;
import lombok.Value;

/**
 * Toutes les stats d'un participant calculées strictement avant un match.
 */
@Value
@Builder
public class ParticipantFeatures {
    String participantId;
    FormStats form;
    int streak;      // > 0 : série de victoires, < 0 : série de défaites
    int restDays;    // 999 si aucun match précédent
    boolean backToBack;
    HomeAwaySplit split;
}
