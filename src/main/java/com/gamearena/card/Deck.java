package com.gamearena.card;

import com.gamearena.rng.GameRng;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

/**
 * A standard 52-card deck. Top of the deck is the head of the deque,
 * so dealing is O(1) per card.
 */
public class Deck {
    public static final int SIZE = 52;

    private final Deque<Card> cards;
    private final GameRng rng;

    /**
     * Create a full deck shuffled by the given generator.
     */
    public Deck(GameRng rng) {
        this.cards = new ArrayDeque<>(SIZE);
        this.rng = rng;
        reset();
    }

    /**
     * Restore all 52 cards and shuffle them.
     */
    public void reset() {
        List<Card> fresh = new ArrayList<>(SIZE);
        for (Suit suit : Suit.values()) {
            for (int rank = Card.MIN_RANK; rank <= Card.MAX_RANK; rank++) {
                fresh.add(new Card(rank, suit));
            }
        }
        rng.shuffle(fresh);
        cards.clear();
        cards.addAll(fresh);
    }

    /**
     * Deal {@code n} cards from the top, without replacement.
     *
     * @throws IllegalStateException if fewer than n cards remain
     */
    public List<Card> deal(int n) {
        if (n > cards.size()) {
            throw new IllegalStateException("Cannot deal " + n + " cards, only " + cards.size() + " remain");
        }
        List<Card> dealt = new ArrayList<>(n);
        for (int i = 0; i < n; i++) {
            dealt.add(cards.removeFirst());
        }
        return dealt;
    }

    public int remaining() {
        return cards.size();
    }

    /**
     * Snapshot of the remaining cards, top first.
     */
    public List<Card> peekAll() {
        return new ArrayList<>(cards);
    }
}
