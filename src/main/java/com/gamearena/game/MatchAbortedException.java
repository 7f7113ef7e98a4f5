package com.gamearena.game;

/**
 * A match could not be completed because its decision provider failed,
 * timed out or returned nothing usable. The pending action was not applied.
 * Callers decide whether to replay the whole match or give up.
 */
public class MatchAbortedException extends Exception {
    private final String player;

    public MatchAbortedException(String player, String message, Throwable cause) {
        super(message, cause);
        this.player = player;
    }

    /**
     * The player whose decision failed.
     */
    public String getPlayer() {
        return player;
    }
}
