package com.tony.gameFeatures.store;

import lombok.Value;

/**
 * Clé non ordonnée d'une paire de participants : (min, max) selon l'ordre des chaînes.
 */
@Value
public class PairKey {
    String low;
    String high;

    public static PairKey of(String a, String b) {
        return a.compareTo(b) <= 0 ? new PairKey(a, b) : new PairKey(b, a);
    }
}
