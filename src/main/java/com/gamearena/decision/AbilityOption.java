package com.gamearena.decision;

/**
 * An ability the fighter can afford this turn.
 */
public record AbilityOption(String name, String description, int mpCost, int power) {
}
