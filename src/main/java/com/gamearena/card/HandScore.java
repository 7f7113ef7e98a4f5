package com.gamearena.card;

import java.util.List;

/**
 * Score of a poker hand: category, then tiebreak values, most significant first.
 * Ordering compares the category and then the tiebreak lists lexicographically.
 */
public record HandScore(HandCategory category, List<Integer> tiebreak) implements Comparable<HandScore> {

    public HandScore {
        tiebreak = List.copyOf(tiebreak);
    }

    @Override
    public int compareTo(HandScore other) {
        int cmp = Integer.compare(category.rank(), other.category.rank());
        if (cmp != 0) {
            return cmp;
        }
        int n = Math.min(tiebreak.size(), other.tiebreak.size());
        for (int i = 0; i < n; i++) {
            cmp = Integer.compare(tiebreak.get(i), other.tiebreak.get(i));
            if (cmp != 0) {
                return cmp;
            }
        }
        return Integer.compare(tiebreak.size(), other.tiebreak.size());
    }

    public boolean beats(HandScore other) {
        return compareTo(other) > 0;
    }

    @Override
    public String toString() {
        return category.getDisplayName() + " " + tiebreak;
    }
}
