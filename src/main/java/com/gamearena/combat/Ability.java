package com.gamearena.combat;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.gamearena.decision.AbilityOption;

/**
 * A named move in an archetype's kit.
 */
public record Ability(
        @JsonProperty("name") String name,
        @JsonProperty("description") String description,
        @JsonProperty("mp_cost") int mpCost,
        @JsonProperty("effect") AbilityEffect effect
) {
    public Ability {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Ability needs a name");
        }
        if (mpCost < 0) {
            throw new IllegalArgumentException("MP cost cannot be negative for " + name);
        }
        if (effect == null) {
            throw new IllegalArgumentException("Ability " + name + " has no effect");
        }
        if (description == null) {
            description = "";
        }
    }

    @JsonIgnore
    public boolean isDefend() {
        return effect instanceof AbilityEffect.Defend;
    }

    public AbilityOption toOption() {
        return new AbilityOption(name, description, mpCost, effect.power());
    }
}
