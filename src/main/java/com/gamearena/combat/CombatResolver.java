package com.gamearena.combat;

/**
 * Applies one ability to a pair of fighters. Pure arithmetic over fighter
 * state; turn order and provider calls live in {@link CombatSimulator}.
 */
public final class CombatResolver {

    private CombatResolver() {
        // Utility class - prevent instantiation
    }

    /**
     * Physical damage scales with attack and is blunted by defense.
     */
    public static int physicalDamage(int power, int attack, int defense) {
        double scaled = power * (attack / 15.0) - power * (defense / 20.0) * 0.3;
        return Math.max(1, (int) scaled);
    }

    /**
     * Magical damage leans on the ability's power and barely on defense.
     */
    public static int magicalDamage(int power, int attack, int defense) {
        double scaled = power * 0.9 + attack * 0.2 - defense * 0.15;
        return Math.max(1, (int) scaled);
    }

    /**
     * Pay the ability's MP cost, then apply its effect.
     */
    public static TurnRecord resolve(int turn, Ability ability, Fighter attacker, Fighter defender) {
        attacker.spendMp(ability.mpCost());
        AbilityEffect effect = ability.effect();

        if (effect instanceof AbilityEffect.Defend defend) {
            attacker.setDefending(true);
            int restored = attacker.restoreMp(defend.mpRestore());
            return new TurnRecord(turn, attacker.getPlayer(), attacker.getArchetype().key(), ability.name(),
                    effect.label(), 0, null, 0, restored, null, null, null,
                    "defending (+" + restored + " MP)");
        }

        if (effect instanceof AbilityEffect.Heal heal) {
            int healed = attacker.heal(heal.amount());
            return new TurnRecord(turn, attacker.getPlayer(), attacker.getArchetype().key(), ability.name(),
                    effect.label(), 0, null, healed, 0, null, null, null,
                    "healed " + healed + " HP");
        }

        if (effect instanceof AbilityEffect.Cleanse cleanse) {
            attacker.cleanse();
            int healed = attacker.heal(cleanse.healAmount());
            return new TurnRecord(turn, attacker.getPlayer(), attacker.getArchetype().key(), ability.name(),
                    effect.label(), 0, null, healed, 0, null, null, null,
                    "cleansed all debuffs, healed " + healed);
        }

        AbilityEffect.Strike strike = (AbilityEffect.Strike) effect;
        return strike(turn, ability, strike, attacker, defender);
    }

    private static TurnRecord strike(int turn, Ability ability, AbilityEffect.Strike strike,
                                     Fighter attacker, Fighter defender) {
        int attack = attacker.effective(Stat.ATTACK);
        int defense = defender.effective(Stat.DEFENSE);
        int damage = strike.kind() == AbilityEffect.DamageKind.PHYSICAL
                ? physicalDamage(strike.power(), attack, defense)
                : magicalDamage(strike.power(), attack, defense);

        if (strike.hasSpeedBonus() && attacker.effective(Stat.SPEED) > defender.effective(Stat.SPEED)) {
            damage = (int) (damage * strike.speedBonus());
        }
        if (defender.isDefending()) {
            damage = Math.max(1, damage / 2);
        }
        defender.takeDamage(damage);

        String debuff = null;
        String selfDebuff = null;
        String dot = null;
        if (strike.debuff() != null) {
            defender.addModifier(strike.debuff());
            debuff = strike.debuff().describe();
        }
        if (strike.selfDebuff() != null) {
            attacker.addModifier(strike.selfDebuff());
            selfDebuff = strike.selfDebuff().describe();
        }
        if (strike.dot() != null) {
            defender.addDot(strike.dot());
            dot = strike.dot().describe();
        }

        return new TurnRecord(turn, attacker.getPlayer(), attacker.getArchetype().key(), ability.name(),
                strike.label(), damage, defender.getHp(), 0, 0, debuff, selfDebuff, dot,
                damage + " dmg");
    }
}
