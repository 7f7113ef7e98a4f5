package com.gamearena.game;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.SerializationFeature;

import java.util.List;

/**
 * Result of a completed match. Immutable once returned; this is the only
 * artifact that settlement and statistics consumers see.
 */
public record GameResult(
    GameType gameType,
    String winner,
    String loser,
    double wager,
    GameDetails details,

    /**
     * Logged poker actions, auction rounds, or resolved combat actions.
     */
    int roundsPlayed,

    /**
     * Every decision in causal order.
     */
    List<DecisionRecord<?, ?>> decisionLog
) {
    private static final ObjectMapper EXPORT_MAPPER = new ObjectMapper()
            .setPropertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
            .enable(SerializationFeature.INDENT_OUTPUT);

    public GameResult {
        decisionLog = List.copyOf(decisionLog);
    }

    /**
     * Decisions made by one player, in order.
     */
    public List<DecisionRecord<?, ?>> decisionsBy(String player) {
        return decisionLog.stream()
                .filter(d -> d.player().equals(player))
                .toList();
    }

    /**
     * Export as indented snake_case JSON.
     */
    public String toJson() {
        try {
            return EXPORT_MAPPER.writeValueAsString(this);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to serialize game result: " + e.getMessage(), e);
        }
    }
}
