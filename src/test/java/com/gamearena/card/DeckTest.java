package com.gamearena.card;

import com.gamearena.rng.GameRng;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DeckTest {

    @Test
    void testFreshDeckHas52UniqueCards() {
        Deck deck = new Deck(new GameRng(1));
        assertEquals(Deck.SIZE, deck.remaining());
        Set<Card> unique = new HashSet<>(deck.peekAll());
        assertEquals(Deck.SIZE, unique.size(), "Deck should hold 52 distinct cards");
    }

    @Test
    void testDealWithoutReplacement() {
        Deck deck = new Deck(new GameRng(2));
        List<Card> first = deck.deal(5);
        assertEquals(47, deck.remaining());
        for (Card card : first) {
            assertFalse(deck.peekAll().contains(card), "Dealt card should leave the deck");
        }
    }

    @Test
    void testDealTooManyFails() {
        Deck deck = new Deck(new GameRng(3));
        deck.deal(50);
        assertThrows(IllegalStateException.class, () -> deck.deal(3));
        assertEquals(2, deck.remaining(), "Failed deal should not remove cards");
    }

    @Test
    void testResetRestoresAllCards() {
        Deck deck = new Deck(new GameRng(4));
        deck.deal(20);
        deck.reset();
        assertEquals(Deck.SIZE, deck.remaining());
        assertEquals(Deck.SIZE, new HashSet<>(deck.peekAll()).size());
    }

    @Test
    void testSameSeedSameOrder() {
        assertEquals(new Deck(new GameRng(5)).peekAll(), new Deck(new GameRng(5)).peekAll());
        assertNotEquals(new Deck(new GameRng(5)).peekAll(), new Deck(new GameRng(6)).peekAll());
    }
}
