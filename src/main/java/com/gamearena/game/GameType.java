package com.gamearena.game;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * The three game kinds the arena can simulate.
 */
public enum GameType {
    POKER("poker"),
    AUCTION("auction"),
    COMBAT("combat");

    private final String jsonValue;

    GameType(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    public static GameType fromString(String value) {
        if (value == null) {
            throw new IllegalArgumentException("Game type cannot be null");
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "poker" -> POKER;
            case "auction" -> AUCTION;
            case "combat", "rpg", "rpg_battle" -> COMBAT;
            default -> throw new IllegalArgumentException("Unknown game type: " + value);
        };
    }
}
