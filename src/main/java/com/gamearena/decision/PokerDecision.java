package com.gamearena.decision;

/**
 * A poker answer after validation; safe to apply.
 */
public record PokerDecision(
        PokerAction action,
        double raiseAmount,
        double confidence,
        double bluffProbability,
        double estimatedWinProb,
        String reasoning
) {
}
