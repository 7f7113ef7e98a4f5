package com.gamearena.decision;

import java.util.List;

/**
 * Snapshot shown to the provider before a sealed bid.
 */
public record AuctionBidRequest(
        String player,
        String itemDescription,
        double estimatedValue,
        double minValue,
        double maxValue,
        double budget,
        int numBidders,
        int round,
        int totalRounds,
        List<BidHistoryEntry> bidHistory,
        String opponentContext,
        String bankrollContext
) {
    public AuctionBidRequest {
        bidHistory = List.copyOf(bidHistory);
    }
}
