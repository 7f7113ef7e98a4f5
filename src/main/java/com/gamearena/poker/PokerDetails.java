package com.gamearena.poker;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.gamearena.card.HandScore;
import com.gamearena.game.GameDetails;

import java.util.List;

/**
 * Poker-specific result details. Hand scores are null when the hand ended in a fold.
 */
@JsonTypeName("poker")
public record PokerDetails(
        String handA,
        String handB,
        String handAName,
        String handBName,
        String board,
        double pot,
        double smallBlind,
        double bigBlind,
        double stackA,
        double stackB,
        HandScore scoreA,
        HandScore scoreB,
        String winMethod,
        List<PokerActionRecord> actions
) implements GameDetails {

    public static final String FOLD = "fold";
    public static final String SHOWDOWN = "showdown";

    public PokerDetails {
        actions = List.copyOf(actions);
    }
}
