package com.tony.gameFeatures.model;

import lombok.Builder;
import lombok.Value;

import java.time.LocalDateTime;

/**
 * Un match terminé entre deux participants.
 * Les invariants (participants distincts, scores positifs) sont vérifiés par EventStore.build.
 */
@Value
@Builder
public class GameEvent {

    String id;
    LocalDateTime timestamp;

    String participantAId;
    String participantBId;

    double scoreA;
    double scoreB;

    // Qui recevait (A par défaut, comme "home_team" dans les CSV)
    @Builder.Default
    Side homeSide = Side.A;

    public Side sideOf(String participantId) {
        if (participantAId.equals(participantId)) return Side.A;
        if (participantBId.equals(participantId)) return Side.B;
        throw new IllegalArgumentException("Participant " + participantId + " absent du match " + id);
    }

    public double scoreOf(Side side) {
        return side == Side.A ? scoreA : scoreB;
    }

    public double scoreFor(String participantId) {
        return scoreOf(sideOf(participantId));
    }

    public double scoreAgainst(String participantId) {
        return scoreOf(sideOf(participantId).opposite());
    }

    public Outcome outcomeFor(String participantId) {
        return Outcome.of(scoreFor(participantId), scoreAgainst(participantId));
    }

    public boolean isHome(String participantId) {
        return sideOf(participantId) == homeSide;
    }
}
