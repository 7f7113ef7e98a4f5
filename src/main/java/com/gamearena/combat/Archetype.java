package com.gamearena.combat;

import com.fasterxml.jackson.annotation.JsonProperty;

import java.util.ArrayList;
import java.util.List;

/**
 * A fighter class: base stats and an ordered ability kit.
 * Every kit contains a defend ability, the fallback when nothing else is affordable.
 */
public record Archetype(
        @JsonProperty("key") String key,
        @JsonProperty("name") String displayName,
        @JsonProperty("hp") int hp,
        @JsonProperty("mp") int mp,
        @JsonProperty("attack") int attack,
        @JsonProperty("defense") int defense,
        @JsonProperty("speed") int speed,
        @JsonProperty("abilities") List<Ability> abilities
) {
    public Archetype {
        if (key == null || key.isBlank()) {
            throw new IllegalArgumentException("Archetype needs a key");
        }
        if (hp < 1 || mp < 0) {
            throw new IllegalArgumentException("Invalid HP/MP for " + key);
        }
        abilities = List.copyOf(abilities == null ? List.of() : abilities);
        if (abilities.stream().noneMatch(Ability::isDefend)) {
            throw new IllegalArgumentException("Archetype " + key + " has no defend ability");
        }
        if (displayName == null || displayName.isBlank()) {
            displayName = key;
        }
    }

    /**
     * Look up an ability by name.
     * @throws IllegalArgumentException if the kit has no such ability
     */
    public Ability ability(String name) {
        for (Ability ability : abilities) {
            if (ability.name().equals(name)) {
                return ability;
            }
        }
        throw new IllegalArgumentException(key + " has no ability " + name);
    }

    public Ability defendAbility() {
        for (Ability ability : abilities) {
            if (ability.isDefend()) {
                return ability;
            }
        }
        throw new IllegalStateException("Archetype " + key + " has no defend ability");
    }

    /**
     * Abilities costing at most {@code mp}, in kit order. Never empty: with no
     * MP for anything the defend ability is the only choice.
     */
    public List<Ability> affordable(int mp) {
        List<Ability> result = new ArrayList<>();
        for (Ability ability : abilities) {
            if (ability.mpCost() <= mp) {
                result.add(ability);
            }
        }
        if (result.isEmpty()) {
            result.add(defendAbility());
        }
        return result;
    }
}
