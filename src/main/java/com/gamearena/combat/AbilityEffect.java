package com.gamearena.combat;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;
import com.fasterxml.jackson.annotation.JsonValue;

/**
 * What an ability does when resolved.
 * Uses Jackson polymorphic deserialization based on the "type" field.
 */
@JsonTypeInfo(
    use = JsonTypeInfo.Id.NAME,
    include = JsonTypeInfo.As.PROPERTY,
    property = "type"
)
@JsonSubTypes({
    @JsonSubTypes.Type(value = AbilityEffect.Strike.class, name = "strike"),
    @JsonSubTypes.Type(value = AbilityEffect.Heal.class, name = "heal"),
    @JsonSubTypes.Type(value = AbilityEffect.Defend.class, name = "defend"),
    @JsonSubTypes.Type(value = AbilityEffect.Cleanse.class, name = "cleanse")
})
public sealed interface AbilityEffect
        permits AbilityEffect.Strike, AbilityEffect.Heal, AbilityEffect.Defend, AbilityEffect.Cleanse {

    /**
     * Label used in turn logs: "physical", "magic", "heal", "defend" or "cleanse".
     */
    String label();

    /**
     * Nominal damage, 0 for non-damaging effects.
     */
    default int power() {
        return 0;
    }

    enum DamageKind {
        PHYSICAL("physical"),
        MAGICAL("magic");

        private final String key;

        DamageKind(String key) {
            this.key = key;
        }

        @JsonValue
        public String getKey() {
            return key;
        }

        @JsonCreator
        public static DamageKind fromKey(String key) {
            for (DamageKind kind : values()) {
                if (kind.key.equalsIgnoreCase(key)) {
                    return kind;
                }
            }
            throw new IllegalArgumentException("Unknown damage kind: " + key);
        }
    }

    /**
     * Direct damage, optionally followed by a debuff on the target, a debuff
     * on the user and a damage-over-time on the target.
     *
     * @param speedBonus damage multiplier applied when the user is faster; 1 means none
     */
    record Strike(
            @JsonProperty("kind") DamageKind kind,
            @JsonProperty("power") int power,
            @JsonProperty("speed_bonus") double speedBonus,
            @JsonProperty("debuff") StatModifier debuff,
            @JsonProperty("self_debuff") StatModifier selfDebuff,
            @JsonProperty("dot") DamageOverTime dot
    ) implements AbilityEffect {
        public Strike {
            if (kind == null) {
                throw new IllegalArgumentException("Strike needs a damage kind");
            }
            if (power < 0) {
                throw new IllegalArgumentException("Strike power cannot be negative: " + power);
            }
            if (speedBonus <= 0) {
                speedBonus = 1.0;
            }
        }

        public Strike(DamageKind kind, int power) {
            this(kind, power, 1.0, null, null, null);
        }

        public boolean hasSpeedBonus() {
            return speedBonus > 1.0;
        }

        @Override
        public String label() {
            return kind.getKey();
        }
    }

    record Heal(@JsonProperty("amount") int amount) implements AbilityEffect {
        @Override
        public String label() {
            return "heal";
        }
    }

    /**
     * Halve incoming strike damage until the user's next sub-turn and regain MP.
     */
    record Defend(@JsonProperty("mp_restore") int mpRestore) implements AbilityEffect {
        @Override
        public String label() {
            return "defend";
        }
    }

    /**
     * Drop every damage-over-time and negative modifier, then heal.
     */
    record Cleanse(@JsonProperty("heal_amount") int healAmount) implements AbilityEffect {
        @Override
        public String label() {
            return "cleanse";
        }
    }
}
