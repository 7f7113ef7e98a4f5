package com.gamearena.decision;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw bid answer. Any field may be missing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record AuctionBidResponse(
        @JsonProperty("bid_amount") Double bidAmount,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("strategy") String strategy,
        @JsonProperty("reasoning") String reasoning
) {
    public static AuctionBidResponse of(double bidAmount) {
        return new AuctionBidResponse(bidAmount, null, null, null);
    }
}
