package com.gamearena.game;

/**
 * A two-player game whose moves come from a decision provider.
 *
 * <p>An instance runs one match at a time. All match state lives inside the
 * instance and is rebuilt at the start of every {@link #play} call.
 */
public interface GameSimulator {

    GameType getGameType();

    /**
     * Play a complete match.
     *
     * @param playerA first seat; wins exact ties
     * @param playerB second seat
     * @param wager   stake per player; also the starting stack or budget
     * @return the immutable result, including the full decision log
     * @throws MatchAbortedException if the decision provider fails
     */
    GameResult play(String playerA, String playerB, double wager) throws MatchAbortedException;

    /**
     * Human-readable summary of the current (or last) match state.
     */
    String getStateSummary();
}
