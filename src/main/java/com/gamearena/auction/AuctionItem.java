package com.gamearena.auction;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Something up for auction. Its true value is hidden and drawn uniformly
 * from [minValue, maxValue] each time it comes up.
 */
public record AuctionItem(
        @JsonProperty("name") String name,
        @JsonProperty("min_value") double minValue,
        @JsonProperty("max_value") double maxValue
) {
    @JsonCreator
    public AuctionItem {
        if (name == null || name.isBlank()) {
            throw new IllegalArgumentException("Auction item needs a name");
        }
        if (minValue < 0 || maxValue < minValue) {
            throw new IllegalArgumentException(
                    "Invalid value range for " + name + ": " + minValue + ".." + maxValue);
        }
    }

    /**
     * Midpoint of the range, shown to bidders as the estimate.
     */
    public double estimatedValue() {
        return (minValue + maxValue) / 2;
    }
}
