package com.gamearena.arena;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Tunables shared by every simulator the arena builds.
 * Defaults ship as {@value #DEFAULT_RESOURCE}; a user file overrides any subset of keys.
 *
 * @param threads worker threads for batch runs; 0 means one per available processor
 */
public record ArenaSettings(
        @JsonProperty("blind_fraction") double blindFraction,
        @JsonProperty("auction_rounds") int auctionRounds,
        @JsonProperty("combat_max_turns") int combatMaxTurns,
        @JsonProperty("threads") int threads
) {
    public static final String DEFAULT_RESOURCE = "arena-defaults.json";

    private static final ObjectMapper MAPPER = new ObjectMapper();

    /**
     * Thrown when settings cannot be read or hold out-of-range values.
     */
    public static class SettingsException extends Exception {
        public SettingsException(String message) {
            super(message);
        }

        public SettingsException(String message, Throwable cause) {
            super(message, cause);
        }
    }

    public ArenaSettings {
        if (blindFraction <= 0 || blindFraction >= 0.5) {
            throw new IllegalArgumentException("blind_fraction must be in (0, 0.5): " + blindFraction);
        }
        if (auctionRounds < 1) {
            throw new IllegalArgumentException("auction_rounds must be positive: " + auctionRounds);
        }
        if (combatMaxTurns < 1) {
            throw new IllegalArgumentException("combat_max_turns must be positive: " + combatMaxTurns);
        }
        if (threads < 0) {
            throw new IllegalArgumentException("threads cannot be negative: " + threads);
        }
    }

    /**
     * Thread count with 0 resolved to the processor count.
     */
    public int effectiveThreads() {
        return threads > 0 ? threads : Runtime.getRuntime().availableProcessors();
    }

    /**
     * The bundled defaults.
     */
    public static ArenaSettings defaults() throws SettingsException {
        return bind(loadDefaultTree());
    }

    /**
     * Defaults overlaid with the keys present in a JSON file.
     */
    public static ArenaSettings fromFile(String path) throws SettingsException {
        try {
            return fromJson(Files.readString(Path.of(path)));
        } catch (IOException e) {
            throw new SettingsException("IO error reading " + path + ": " + e.getMessage(), e);
        }
    }

    /**
     * Defaults overlaid with the keys present in a JSON object string.
     */
    public static ArenaSettings fromJson(String json) throws SettingsException {
        JsonNode overrides;
        try {
            overrides = MAPPER.readTree(json);
        } catch (IOException e) {
            throw new SettingsException("JSON parsing error: " + e.getMessage(), e);
        }
        if (overrides == null || !overrides.isObject()) {
            throw new SettingsException("Settings must be a JSON object");
        }
        ObjectNode merged = loadDefaultTree();
        merged.setAll((ObjectNode) overrides);
        return bind(merged);
    }

    private static ObjectNode loadDefaultTree() throws SettingsException {
        try (InputStream is = ArenaSettings.class.getClassLoader().getResourceAsStream(DEFAULT_RESOURCE)) {
            if (is == null) {
                throw new SettingsException("Resource not found: " + DEFAULT_RESOURCE);
            }
            JsonNode tree = MAPPER.readTree(is);
            if (!(tree instanceof ObjectNode)) {
                throw new SettingsException(DEFAULT_RESOURCE + " must be a JSON object");
            }
            return (ObjectNode) tree;
        } catch (IOException e) {
            throw new SettingsException("JSON parsing error: " + e.getMessage(), e);
        }
    }

    private static ArenaSettings bind(ObjectNode tree) throws SettingsException {
        try {
            return MAPPER.treeToValue(tree, ArenaSettings.class);
        } catch (IOException | IllegalArgumentException e) {
            throw new SettingsException("Invalid settings: " + e.getMessage(), e);
        }
    }
}
