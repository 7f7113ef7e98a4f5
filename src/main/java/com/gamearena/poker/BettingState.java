package com.gamearena.poker;

/**
 * Per-street betting bookkeeping for the two seats (0 = small blind, 1 = big blind).
 * A street is complete only when both seats have acted and neither owes anything.
 */
public class BettingState {
    private final double[] toCall = new double[2];
    private final boolean[] hasActed = new boolean[2];

    /**
     * @param smallBlindToCall what seat 0 owes when the street opens
     */
    public BettingState(double smallBlindToCall) {
        this.toCall[0] = Math.max(0.0, smallBlindToCall);
    }

    public double getToCall(int seat) {
        return toCall[seat];
    }

    public void setToCall(int seat, double amount) {
        toCall[seat] = Math.max(0.0, amount);
    }

    public boolean hasActed(int seat) {
        return hasActed[seat];
    }

    public void markActed(int seat) {
        hasActed[seat] = true;
    }

    /**
     * True when the seat has nothing left to do on this street.
     */
    public boolean isSettled(int seat) {
        return hasActed[seat] && toCall[seat] <= 0;
    }

    public boolean isComplete() {
        return isSettled(0) && isSettled(1);
    }
}
