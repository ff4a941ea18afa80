package com.tony.gameFeatures.model;

/**
 * Côté d'un participant dans un événement : A ou B.
 * Sert aussi de drapeau "domicile" sur {@link GameEvent}.
 */
public enum Side {
    A, B;

    public Side opposite() {
        return this == A ? B : A;
    }
}
