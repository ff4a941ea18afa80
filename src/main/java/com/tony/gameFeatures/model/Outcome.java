package com.tony.gameFeatures.model;

/**
 * Résultat d'un match vu par un participant.
 * Une égalité de score est un DRAW pour les deux camps (ni victoire, ni défaite).
 */
public enum Outcome {
    WIN, LOSS, DRAW;

    public static Outcome of(double scored, double allowed) {
        if (scored > allowed) return WIN;
        if (scored < allowed) return LOSS;
        return DRAW;
    }
}
