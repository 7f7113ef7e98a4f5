package com.gamearena.card;

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Poker hand categories in ascending strength. The ordinal is the category rank.
 */
public enum HandCategory {
    HIGH_CARD("High Card"),
    PAIR("Pair"),
    TWO_PAIR("Two Pair"),
    THREE_OF_A_KIND("Three Of A Kind"),
    STRAIGHT("Straight"),
    FLUSH("Flush"),
    FULL_HOUSE("Full House"),
    FOUR_OF_A_KIND("Four Of A Kind"),
    STRAIGHT_FLUSH("Straight Flush"),
    ROYAL_FLUSH("Royal Flush");

    private final String displayName;

    HandCategory(String displayName) {
        this.displayName = displayName;
    }

    @JsonValue
    public String getDisplayName() {
        return displayName;
    }

    public int rank() {
        return ordinal();
    }
}
