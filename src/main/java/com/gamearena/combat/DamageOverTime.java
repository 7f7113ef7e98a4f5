package com.gamearena.combat;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Damage dealt to the carrier at the start of each of its own sub-turns.
 */
public record DamageOverTime(
        @JsonProperty("damage") int damage,
        @JsonProperty("turns") int turns
) {
    public DamageOverTime {
        if (damage < 0) {
            throw new IllegalArgumentException("DoT damage cannot be negative: " + damage);
        }
        if (turns < 1) {
            throw new IllegalArgumentException("DoT must last at least one turn: " + turns);
        }
    }

    DamageOverTime tick() {
        return turns > 1 ? new DamageOverTime(damage, turns - 1) : null;
    }

    public String describe() {
        return damage + " dmg/turn for " + turns + "t";
    }
}
