package com.gamearena.decision;

/**
 * A bid after validation; always within [minimum bid, budget] unless the
 * budget itself is below the minimum.
 */
public record AuctionBid(double bidAmount, double confidence, String strategy, String reasoning) {
}
