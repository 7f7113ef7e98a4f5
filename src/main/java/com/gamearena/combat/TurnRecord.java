package com.gamearena.combat;

/**
 * One resolved combat action. Fields that do not apply to the ability's
 * effect are 0 or null.
 *
 * @param effectType "physical", "magic", "heal", "defend" or "cleanse"
 * @param defenderHp defender HP after a strike, otherwise null
 */
public record TurnRecord(
        int turn,
        String actor,
        String archetype,
        String ability,
        String effectType,
        int damage,
        Integer defenderHp,
        int healed,
        int mpRestored,
        String debuff,
        String selfDebuff,
        String dot,
        String effect
) {
}
