package com.gamearena.game;

import java.util.List;

/**
 * One decision point: what the provider was shown and the validated answer.
 *
 * @param player    who decided
 * @param phase     street name, round number or turn, as text
 * @param request   the exact request snapshot
 * @param response  the response after defaults, clamping and coercion
 * @param coercions notes for every correction applied to the raw response
 */
public record DecisionRecord<Q, R>(
        String player,
        String phase,
        Q request,
        R response,
        List<String> coercions
) {
    public DecisionRecord {
        coercions = List.copyOf(coercions);
    }

    public boolean wasCoerced() {
        return !coercions.isEmpty();
    }
}
