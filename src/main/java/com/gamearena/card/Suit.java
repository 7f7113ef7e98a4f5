package com.gamearena.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * The four French suits, in deck-building order.
 */
public enum Suit {
    HEARTS('h'),
    DIAMONDS('d'),
    CLUBS('c'),
    SPADES('s');

    private final char symbol;

    Suit(char symbol) {
        this.symbol = symbol;
    }

    @JsonValue
    public char getSymbol() {
        return symbol;
    }

    public static Suit fromSymbol(char symbol) {
        return switch (Character.toLowerCase(symbol)) {
            case 'h' -> HEARTS;
            case 'd' -> DIAMONDS;
            case 'c' -> CLUBS;
            case 's' -> SPADES;
            default -> throw new IllegalArgumentException("Unknown suit: " + symbol);
        };
    }
}
