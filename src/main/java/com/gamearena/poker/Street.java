package com.gamearena.poker;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Betting streets of a hold'em hand, with the board cards each one deals.
 */
public enum Street {
    PREFLOP("preflop", 0),
    FLOP("flop", 3),
    TURN("turn", 1),
    RIVER("river", 1);

    private final String label;
    private final int cardsToDeal;

    Street(String label, int cardsToDeal) {
        this.label = label;
        this.cardsToDeal = cardsToDeal;
    }

    @JsonValue
    public String getName() {
        return label;
    }

    public int getCardsToDeal() {
        return cardsToDeal;
    }
}
