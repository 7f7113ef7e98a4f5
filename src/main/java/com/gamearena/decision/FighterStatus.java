package com.gamearena.decision;

import java.util.List;

/**
 * A fighter as the provider sees it. Attack, defense and speed are effective values.
 *
 * @param effects active modifiers and damage-over-time entries, e.g. "atk-3(2t)"
 * @param summary one-line status, e.g. "Warrior HP:120/120 MP:40/40 ATK:18 DEF:14"
 */
public record FighterStatus(
        String archetype,
        int hp,
        int maxHp,
        int mp,
        int maxMp,
        int attack,
        int defense,
        int speed,
        boolean defending,
        List<String> effects,
        String summary
) {
    public FighterStatus {
        effects = List.copyOf(effects);
    }
}
