package com.gamearena.decision;

import com.fasterxml.jackson.annotation.JsonValue;

import java.util.Locale;

/**
 * Legal poker responses. A check is a call with nothing owed.
 */
public enum PokerAction {
    FOLD("fold"),
    CALL("call"),
    RAISE("raise");

    private final String jsonValue;

    PokerAction(String jsonValue) {
        this.jsonValue = jsonValue;
    }

    @JsonValue
    public String getJsonValue() {
        return jsonValue;
    }

    /**
     * Parse a provider's action text, or return null if it names nothing legal.
     */
    public static PokerAction fromString(String value) {
        if (value == null) {
            return null;
        }
        return switch (value.trim().toLowerCase(Locale.ROOT)) {
            case "fold" -> FOLD;
            case "call" -> CALL;
            case "raise" -> RAISE;
            default -> null;
        };
    }
}
