package com.tony.gameFeatures.store;

import com.tony.gameFeatures.model.EventRef;

import java.time.LocalDateTime;
import java.util.List;

/**
 * Historique trié d'un participant (tous ses matchs, puis à domicile, puis à l'extérieur).
 */
final class Timeline {

    enum Partition { ALL, HOME, AWAY }

    private final List<EventRef> all;
    private final List<EventRef> home;
    private final List<EventRef> away;

    Timeline(List<EventRef> all, List<EventRef> home, List<EventRef> away) {
        this.all = List.copyOf(all);
        this.home = List.copyOf(home);
        this.away = List.copyOf(away);
    }

    List<EventRef> get(Partition partition) {
        return switch (partition) {
            case ALL -> all;
            case HOME -> home;
            case AWAY -> away;
        };
    }

    /**
     * Premier indice dont la date est >= cutoff, donc aussi le nombre de matchs strictement antérieurs.
     */
    static int lowerBound(List<EventRef> refs, LocalDateTime cutoff) {
        int lo = 0;
        int hi = refs.size();
        while (lo < hi) {
            int mid = (lo + hi) >>> 1;
            if (refs.get(mid).getTimestamp().isBefore(cutoff)) {
                lo = mid + 1;
            } else {
                hi = mid;
            }
        }
        return lo;
    }

    /**
     * Les {@code maxCount} dernières références avant l'indice {@code end}, ordre chronologique.
     */
    static List<EventRef> window(List<EventRef> refs, int end, int maxCount) {
        checkMaxCount(maxCount);
        int start = Math.max(0, end - maxCount);
        return refs.subList(start, end);
    }

    static void checkMaxCount(int maxCount) {
        if (maxCount < 0) {
            throw new IllegalArgumentException("maxCount doit être >= 0 : " + maxCount);
        }
    }
}
