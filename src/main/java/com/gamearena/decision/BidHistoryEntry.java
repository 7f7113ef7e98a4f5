package com.gamearena.decision;

/**
 * One of a bidder's own earlier rounds. The true value is only known
 * to the bidder for rounds they won, so it is null otherwise.
 */
public record BidHistoryEntry(
        int round,
        String item,
        double yourBid,
        double winningBid,
        boolean won,
        Double trueValue
) {
}
