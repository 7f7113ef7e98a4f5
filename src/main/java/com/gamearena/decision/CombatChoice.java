package com.gamearena.decision;

/**
 * A combat answer after validation; the ability is always affordable.
 */
public record CombatChoice(String ability, double confidence, String reasoning) {
}
