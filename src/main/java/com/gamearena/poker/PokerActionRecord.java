package com.gamearena.poker;

import com.gamearena.decision.PokerAction;

/**
 * One applied betting action.
 *
 * @param amountPaid total moved into the pot, call plus raise
 * @param raiseAmount the part of the payment that was a raise
 * @param potAfter pot size after the action
 */
public record PokerActionRecord(
        Street street,
        String player,
        PokerAction action,
        double amountPaid,
        double raiseAmount,
        double potAfter,
        double bluffProbability
) {
}
