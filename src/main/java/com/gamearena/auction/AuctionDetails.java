package com.gamearena.auction;

import com.fasterxml.jackson.annotation.JsonTypeName;
import com.gamearena.game.GameDetails;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Auction-specific result details.
 */
@JsonTypeName("auction")
public record AuctionDetails(
        List<AuctionRound> rounds,
        Map<String, Double> profits,
        Map<String, Double> budgetsRemaining,
        String winMethod
) implements GameDetails {

    public static final String PROFIT = "profit";

    public AuctionDetails {
        rounds = List.copyOf(rounds);
        profits = Collections.unmodifiableMap(new LinkedHashMap<>(profits));
        budgetsRemaining = Collections.unmodifiableMap(new LinkedHashMap<>(budgetsRemaining));
    }
}
