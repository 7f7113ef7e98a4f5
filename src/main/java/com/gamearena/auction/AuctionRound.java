package com.gamearena.auction;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One settled sealed-bid round. Bids are keyed by player in bidding order.
 *
 * @param profit true value minus winning bid, credited to the winner; may be negative
 */
public record AuctionRound(
        int round,
        String item,
        double minValue,
        double maxValue,
        double trueValue,
        Map<String, Double> bids,
        String winner,
        double winningBid,
        double profit
) {
    public AuctionRound {
        bids = Collections.unmodifiableMap(new LinkedHashMap<>(bids));
    }
}
