package com.gamearena.decision;

/**
 * Optional text fed into a player's requests by collaborators that track
 * opponents and bankrolls. The simulators never interpret it.
 */
public record PlayerContext(String opponentSummary, String bankrollSummary) {

    private static final String NO_OPPONENT_DATA = "No opponent data yet.";
    private static final String NO_BANKROLL_DATA = "No bankroll data.";

    public static final PlayerContext NONE = new PlayerContext(NO_OPPONENT_DATA, NO_BANKROLL_DATA);

    public PlayerContext {
        if (opponentSummary == null || opponentSummary.isBlank()) {
            opponentSummary = NO_OPPONENT_DATA;
        }
        if (bankrollSummary == null || bankrollSummary.isBlank()) {
            bankrollSummary = NO_BANKROLL_DATA;
        }
    }
}
