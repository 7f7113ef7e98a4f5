package com.gamearena.decision;

import java.util.List;

/**
 * Snapshot shown to the provider before a combat action.
 * Abilities are listed in catalog order and are all affordable.
 */
public record CombatAbilityRequest(
        String player,
        FighterStatus self,
        FighterStatus opponent,
        List<AbilityOption> abilities,
        int turn,
        int maxTurns
) {
    public CombatAbilityRequest {
        abilities = List.copyOf(abilities);
    }
}
