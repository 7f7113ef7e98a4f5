package com.gamearena.combat;

import com.gamearena.decision.FighterStatus;

import java.util.ArrayList;
import java.util.List;

/**
 * A combatant for the length of one duel.
 *
 * <p>HP and MP stay within [0, max] through every mutator. Modifiers and
 * damage-over-time entries are independent: each counts down and expires
 * on its own.
 */
public class Fighter {
    private final String player;
    private final Archetype archetype;

    private int hp;
    private int mp;
    private final List<StatModifier> modifiers = new ArrayList<>();
    private final List<DamageOverTime> dots = new ArrayList<>();
    private boolean defending;

    public Fighter(String player, Archetype archetype) {
        if (archetype == null) {
            throw new IllegalArgumentException("Fighter needs an archetype");
        }
        this.player = player;
        this.archetype = archetype;
        this.hp = archetype.hp();
        this.mp = archetype.mp();
    }

    public String getPlayer() {
        return player;
    }

    public Archetype getArchetype() {
        return archetype;
    }

    public int getHp() {
        return hp;
    }

    public int getMaxHp() {
        return archetype.hp();
    }

    public int getMp() {
        return mp;
    }

    public int getMaxMp() {
        return archetype.mp();
    }

    public boolean isAlive() {
        return hp > 0;
    }

    public boolean isDefending() {
        return defending;
    }

    public void setDefending(boolean defending) {
        this.defending = defending;
    }

    public List<StatModifier> getModifiers() {
        return List.copyOf(modifiers);
    }

    public List<DamageOverTime> getDots() {
        return List.copyOf(dots);
    }

    private int base(Stat stat) {
        return switch (stat) {
            case ATTACK -> archetype.attack();
            case DEFENSE -> archetype.defense();
            case SPEED -> archetype.speed();
        };
    }

    /**
     * Base stat plus every active modifier on it, never below 1.
     */
    public int effective(Stat stat) {
        int total = base(stat);
        for (StatModifier modifier : modifiers) {
            if (modifier.stat() == stat) {
                total += modifier.amount();
            }
        }
        return Math.max(1, total);
    }

    /**
     * @return the damage actually removed
     */
    public int takeDamage(int amount) {
        int dealt = Math.min(Math.max(amount, 0), hp);
        hp -= dealt;
        return dealt;
    }

    /**
     * @return the HP actually restored
     */
    public int heal(int amount) {
        int restored = Math.min(Math.max(amount, 0), getMaxHp() - hp);
        hp += restored;
        return restored;
    }

    public void spendMp(int cost) {
        mp = Math.max(0, mp - Math.max(cost, 0));
    }

    /**
     * @return the MP actually restored
     */
    public int restoreMp(int amount) {
        int restored = Math.min(Math.max(amount, 0), getMaxMp() - mp);
        mp += restored;
        return restored;
    }

    public void addModifier(StatModifier modifier) {
        modifiers.add(modifier);
    }

    public void addDot(DamageOverTime dot) {
        dots.add(dot);
    }

    /**
     * Apply every damage-over-time entry once, age them, and drop the expired ones.
     *
     * @return total damage taken
     */
    public int tickDamageOverTime() {
        int total = 0;
        List<DamageOverTime> remaining = new ArrayList<>();
        for (DamageOverTime dot : dots) {
            total += dot.damage();
            DamageOverTime next = dot.tick();
            if (next != null) {
                remaining.add(next);
            }
        }
        dots.clear();
        dots.addAll(remaining);
        takeDamage(total);
        return total;
    }

    public void tickModifiers() {
        List<StatModifier> remaining = new ArrayList<>();
        for (StatModifier modifier : modifiers) {
            StatModifier next = modifier.tick();
            if (next != null) {
                remaining.add(next);
            }
        }
        modifiers.clear();
        modifiers.addAll(remaining);
    }

    /**
     * Remove all damage-over-time and negative modifiers. Buffs stay.
     */
    public void cleanse() {
        dots.clear();
        modifiers.removeIf(StatModifier::isNegative);
    }

    public List<Ability> affordableAbilities() {
        return archetype.affordable(mp);
    }

    private List<String> effectTags() {
        List<String> tags = new ArrayList<>();
        if (!dots.isEmpty()) {
            tags.add("DoT:" + dots.stream().mapToInt(DamageOverTime::damage).sum() + "/turn");
        }
        for (StatModifier modifier : modifiers) {
            tags.add(modifier.shortForm());
        }
        return tags;
    }

    /**
     * e.g. "Warrior HP:120/120 MP:40/40 ATK:18 DEF:14 [atk-3(2t)]"
     */
    public String statusLine() {
        StringBuilder sb = new StringBuilder();
        sb.append(archetype.displayName())
                .append(" HP:").append(hp).append('/').append(getMaxHp())
                .append(" MP:").append(mp).append('/').append(getMaxMp())
                .append(" ATK:").append(effective(Stat.ATTACK))
                .append(" DEF:").append(effective(Stat.DEFENSE));
        List<String> tags = effectTags();
        if (!tags.isEmpty()) {
            sb.append(" [").append(String.join(", ", tags)).append(']');
        }
        return sb.toString();
    }

    public FighterStatus toStatus() {
        return new FighterStatus(
                archetype.key(),
                hp,
                getMaxHp(),
                mp,
                getMaxMp(),
                effective(Stat.ATTACK),
                effective(Stat.DEFENSE),
                effective(Stat.SPEED),
                defending,
                effectTags(),
                statusLine()
        );
    }

    @Override
    public String toString() {
        return player + " " + statusLine();
    }
}
