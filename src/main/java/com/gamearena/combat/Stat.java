package com.gamearena.combat;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Fighter stats that timed modifiers can touch.
 */
public enum Stat {
    ATTACK("atk"),
    DEFENSE("defense"),
    SPEED("speed");

    private final String key;

    Stat(String key) {
        this.key = key;
    }

    @JsonValue
    public String getKey() {
        return key;
    }

    @JsonCreator
    public static Stat fromKey(String key) {
        for (Stat stat : values()) {
            if (stat.key.equalsIgnoreCase(key)) {
                return stat;
            }
        }
        throw new IllegalArgumentException("Unknown stat: " + key);
    }
}
