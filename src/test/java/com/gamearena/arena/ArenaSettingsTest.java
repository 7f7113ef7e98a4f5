package com.gamearena.arena;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ArenaSettingsTest {

    @Test
    void testDefaults() throws ArenaSettings.SettingsException {
        ArenaSettings settings = ArenaSettings.defaults();

        assertEquals(0.05, settings.blindFraction(), 1e-12);
        assertEquals(5, settings.auctionRounds());
        assertEquals(20, settings.combatMaxTurns());
        assertEquals(0, settings.threads());
        assertEquals(Runtime.getRuntime().availableProcessors(), settings.effectiveThreads());
    }

    @Test
    void testPartialOverride() throws ArenaSettings.SettingsException {
        ArenaSettings settings = ArenaSettings.fromJson("{\"auction_rounds\": 8, \"threads\": 2}");

        assertEquals(8, settings.auctionRounds());
        assertEquals(2, settings.effectiveThreads());
        assertEquals(0.05, settings.blindFraction(), 1e-12, "Unset keys keep their defaults");
        assertEquals(20, settings.combatMaxTurns());
    }

    @Test
    void testFromFile(@TempDir Path dir) throws IOException, ArenaSettings.SettingsException {
        Path file = dir.resolve("arena.json");
        Files.writeString(file, "{\"blind_fraction\": 0.1}");

        assertEquals(0.1, ArenaSettings.fromFile(file.toString()).blindFraction(), 1e-12);
        assertThrows(ArenaSettings.SettingsException.class,
                () -> ArenaSettings.fromFile(dir.resolve("missing.json").toString()));
    }

    @Test
    void testRejectsBadInput() {
        assertThrows(ArenaSettings.SettingsException.class,
                () -> ArenaSettings.fromJson("{\"blind_fraction\": 0.7}"), "Out of range");
        assertThrows(ArenaSettings.SettingsException.class,
                () -> ArenaSettings.fromJson("{\"combat_max_turns\": 0}"));
        assertThrows(ArenaSettings.SettingsException.class,
                () -> ArenaSettings.fromJson("{\"big_blind\": 2}"), "Unknown key");
        assertThrows(ArenaSettings.SettingsException.class, () -> ArenaSettings.fromJson("[1, 2]"));
        assertThrows(ArenaSettings.SettingsException.class, () -> ArenaSettings.fromJson("{oops"));
    }
}
