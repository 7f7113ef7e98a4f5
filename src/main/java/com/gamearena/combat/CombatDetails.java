package com.gamearena.combat;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.gamearena.game.GameDetails;

import java.util.List;

/**
 * Combat-specific result details.
 *
 * @param turns     last turn reached
 * @param winMethod "KO" or "HP advantage"
 */
@JsonTypeName("combat")
public record CombatDetails(
        String archetypeA,
        String archetypeB,
        int finalHpA,
        int finalHpB,
        int maxHpA,
        int maxHpB,
        int finalMpA,
        int finalMpB,
        int turns,
        String winMethod,
        List<TurnRecord> turnLog
) implements GameDetails {

    public static final String KO = "KO";
    public static final String HP_ADVANTAGE = "HP advantage";

    public CombatDetails {
        turnLog = List.copyOf(turnLog);
    }
}
