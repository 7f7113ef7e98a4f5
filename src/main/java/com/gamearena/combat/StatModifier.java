package com.gamearena.combat;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.Locale;

/**
 * A timed, signed change to one stat. Several modifiers on the same stat
 * stack and expire independently.
 */
public record StatModifier(
        @JsonProperty("stat") Stat stat,
        @JsonProperty("amount") int amount,
        @JsonProperty("turns") int turns
) {
    public StatModifier {
        if (stat == null) {
            throw new IllegalArgumentException("Modifier needs a stat");
        }
        if (turns < 1) {
            throw new IllegalArgumentException("Modifier must last at least one turn: " + turns);
        }
    }

    @JsonIgnore
    public boolean isNegative() {
        return amount < 0;
    }

    /**
     * One turn older, or null once it has run out.
     */
    StatModifier tick() {
        return turns > 1 ? new StatModifier(stat, amount, turns - 1) : null;
    }

    /**
     * e.g. "atk -3 for 2t"
     */
    public String describe() {
        return String.format(Locale.ROOT, "%s %+d for %dt", stat.getKey(), amount, turns);
    }

    /**
     * e.g. "atk-3(2t)"
     */
    public String shortForm() {
        return String.format(Locale.ROOT, "%s%+d(%dt)", stat.getKey(), amount, turns);
    }
}
