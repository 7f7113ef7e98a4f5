package com.gamearena.game;

/**
 * Receiver for live match events, e.g. a spectator feed.
 * Called synchronously on the simulating thread. Exceptions thrown here are
 * logged and dropped; they never reach the simulation.
 */
@FunctionalInterface
public interface MatchEventSink {

    MatchEventSink NONE = event -> { };

    void onEvent(MatchEvent event);
}
