package com.gamearena.decision;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw poker answer. Any field may be missing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record PokerActionResponse(
        @JsonProperty("action") String action,
        @JsonProperty("raise_amount") Double raiseAmount,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("bluff_probability") Double bluffProbability,
        @JsonProperty("estimated_win_prob") Double estimatedWinProb,
        @JsonProperty("reasoning") String reasoning
) {
    public static PokerActionResponse of(String action, double raiseAmount) {
        return new PokerActionResponse(action, raiseAmount, null, null, null, null);
    }
}
