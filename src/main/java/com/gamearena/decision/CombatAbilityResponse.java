package com.gamearena.decision;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * Raw combat answer. Any field may be missing.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record CombatAbilityResponse(
        @JsonProperty("ability") String ability,
        @JsonProperty("confidence") Double confidence,
        @JsonProperty("reasoning") String reasoning
) {
    public static CombatAbilityResponse of(String ability) {
        return new CombatAbilityResponse(ability, null, null);
    }
}
