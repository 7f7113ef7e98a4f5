package com.gamearena.card;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

import java.util.ArrayList;
import java.util.List;

/**
 * A playing card. Rank runs 2..14 where 11=J, 12=Q, 13=K, 14=A.
 * Serializes as its two-character text form, e.g. "Ah" or "Td".
 */
public record Card(int rank, Suit suit) {

    public static final int MIN_RANK = 2;
    public static final int MAX_RANK = 14;

    private static final String RANK_SYMBOLS = "23456789TJQKA";

    public Card {
        if (rank < MIN_RANK || rank > MAX_RANK) {
            throw new IllegalArgumentException("Rank out of range: " + rank);
        }
        if (suit == null) {
            throw new IllegalArgumentException("Suit cannot be null");
        }
    }

    /**
     * Parse the two-character form ("Ah", "Td", "2c").
     */
    @JsonCreator
    public static Card parse(String text) {
        if (text == null || text.length() != 2) {
            throw new IllegalArgumentException("Invalid card: " + text);
        }
        int idx = RANK_SYMBOLS.indexOf(Character.toUpperCase(text.charAt(0)));
        if (idx < 0) {
            throw new IllegalArgumentException("Invalid rank in card: " + text);
        }
        return new Card(idx + MIN_RANK, Suit.fromSymbol(text.charAt(1)));
    }

    /**
     * Parse a whitespace- or comma-separated list of cards.
     */
    public static List<Card> parseAll(String text) {
        List<Card> cards = new ArrayList<>();
        for (String token : text.trim().split("[\\s,]+")) {
            if (!token.isEmpty()) {
                cards.add(parse(token));
            }
        }
        return cards;
    }

    public char rankSymbol() {
        return RANK_SYMBOLS.charAt(rank - MIN_RANK);
    }

    @JsonValue
    @Override
    public String toString() {
        return "" + rankSymbol() + suit.getSymbol();
    }

    /**
     * Join cards as "Ah, Kd", or "none" when empty.
     */
    public static String describe(List<Card> cards) {
        if (cards.isEmpty()) {
            return "none";
        }
        StringBuilder sb = new StringBuilder();
        for (Card card : cards) {
            if (sb.length() > 0) {
                sb.append(", ");
            }
            sb.append(card);
        }
        return sb.toString();
    }
}
