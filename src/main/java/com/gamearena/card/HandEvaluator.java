package com.gamearena.card;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Best-five-of-N poker hand scoring.
 *
 * <p>Every 5-card subset is scored on its own and the maximum kept.
 * There are no shortcuts: 7 cards means 21 subsets.
 */
public final class HandEvaluator {

    private static final List<Integer> WHEEL = List.of(14, 5, 4, 3, 2);

    private HandEvaluator() {
        // Utility class - prevent instantiation
    }

    /**
     * Score the best 5-card hand among the given cards.
     * With fewer than five cards the result is high card over what was given.
     */
    public static HandScore score(List<Card> cards) {
        if (cards.size() < 5) {
            return new HandScore(HandCategory.HIGH_CARD, valuesDescending(cards));
        }

        HandScore best = null;
        Card[] combo = new Card[5];
        int n = cards.size();
        for (int a = 0; a < n - 4; a++) {
            combo[0] = cards.get(a);
            for (int b = a + 1; b < n - 3; b++) {
                combo[1] = cards.get(b);
                for (int c = b + 1; c < n - 2; c++) {
                    combo[2] = cards.get(c);
                    for (int d = c + 1; d < n - 1; d++) {
                        combo[3] = cards.get(d);
                        for (int e = d + 1; e < n; e++) {
                            combo[4] = cards.get(e);
                            HandScore candidate = scoreFive(List.of(combo));
                            if (best == null || candidate.beats(best)) {
                                best = candidate;
                            }
                        }
                    }
                }
            }
        }
        return best;
    }

    /**
     * Score exactly five cards.
     */
    public static HandScore scoreFive(List<Card> cards) {
        if (cards.size() != 5) {
            throw new IllegalArgumentException("Expected 5 cards, got " + cards.size());
        }

        List<Integer> values = valuesDescending(cards);
        boolean flush = cards.stream().allMatch(c -> c.suit() == cards.get(0).suit());
        List<Integer> straight = straightValues(values);

        if (flush && straight != null) {
            HandCategory category = straight.get(0) == 14
                    ? HandCategory.ROYAL_FLUSH
                    : HandCategory.STRAIGHT_FLUSH;
            return new HandScore(category, straight);
        }

        // value -> count, then group by count desc, value desc
        Map<Integer, Integer> freq = new TreeMap<>(Comparator.reverseOrder());
        for (int v : values) {
            freq.merge(v, 1, Integer::sum);
        }
        List<Map.Entry<Integer, Integer>> groups = new ArrayList<>(freq.entrySet());
        groups.sort((x, y) -> {
            int cmp = Integer.compare(y.getValue(), x.getValue());
            return cmp != 0 ? cmp : Integer.compare(y.getKey(), x.getKey());
        });
        List<Integer> grouped = new ArrayList<>(groups.size());
        List<Integer> counts = new ArrayList<>(groups.size());
        for (Map.Entry<Integer, Integer> g : groups) {
            grouped.add(g.getKey());
            counts.add(g.getValue());
        }

        if (counts.equals(List.of(4, 1))) {
            return new HandScore(HandCategory.FOUR_OF_A_KIND, grouped);
        }
        if (counts.equals(List.of(3, 2))) {
            return new HandScore(HandCategory.FULL_HOUSE, grouped);
        }
        if (flush) {
            return new HandScore(HandCategory.FLUSH, values);
        }
        if (straight != null) {
            return new HandScore(HandCategory.STRAIGHT, straight);
        }
        if (counts.equals(List.of(3, 1, 1))) {
            return new HandScore(HandCategory.THREE_OF_A_KIND, grouped);
        }
        if (counts.equals(List.of(2, 2, 1))) {
            return new HandScore(HandCategory.TWO_PAIR, grouped);
        }
        if (counts.equals(List.of(2, 1, 1, 1))) {
            return new HandScore(HandCategory.PAIR, grouped);
        }
        return new HandScore(HandCategory.HIGH_CARD, values);
    }

    /**
     * Tiebreak values for a straight, or null if the values are not one.
     * The wheel (A-5-4-3-2) plays its ace low: [5, 4, 3, 2, 1].
     */
    private static List<Integer> straightValues(List<Integer> values) {
        if (values.stream().distinct().count() != 5) {
            return null;
        }
        if (values.get(0) - values.get(4) == 4) {
            return values;
        }
        if (values.equals(WHEEL)) {
            return List.of(5, 4, 3, 2, 1);
        }
        return null;
    }

    private static List<Integer> valuesDescending(List<Card> cards) {
        List<Integer> values = new ArrayList<>(cards.size());
        for (Card card : cards) {
            values.add(card.rank());
        }
        values.sort(Comparator.reverseOrder());
        return values;
    }
}
