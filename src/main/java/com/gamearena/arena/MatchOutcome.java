package com.gamearena.arena;

import com.gamearena.game.GameResult;

/**
 * One match of a batch: either a result or the reason it was aborted.
 */
public record MatchOutcome(int index, long seed, GameResult result, String error) {

    public static MatchOutcome completed(int index, long seed, GameResult result) {
        return new MatchOutcome(index, seed, result, null);
    }

    public static MatchOutcome aborted(int index, long seed, String error) {
        return new MatchOutcome(index, seed, null, error);
    }

    public boolean isAborted() {
        return result == null;
    }
}
