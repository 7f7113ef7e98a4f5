package com.gamearena;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import picocli.CommandLine;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Exit codes of the command-line front end.
 */
class MainTest {

    private static int execute(String... args) {
        return new CommandLine(new Main()).execute(args);
    }

    @Test
    void testPlayEachGame() {
        assertEquals(0, execute("play", "poker", "--seed", "7"));
        assertEquals(0, execute("play", "auction", "--seed", "7", "--json"));
        assertEquals(0, execute("play", "combat", "--seed", "7", "--class-a", "mage", "--class-b", "rogue"));
    }

    @Test
    void testRunSmallBatch() {
        assertEquals(0, execute("run", "combat", "-n", "4", "--seed", "1"));
    }

    @Test
    void testCatalog() {
        assertEquals(0, execute("catalog"));
    }

    @Test
    void testBadInputFails() {
        assertEquals(1, execute("play", "chess"));
        assertEquals(1, execute("play", "combat", "--class-a", "paladin"));
        assertEquals(1, execute("play", "poker", "--wager", "0"));
        assertEquals(1, execute("run", "poker", "-n", "0"));
        assertEquals(1, execute("play", "poker", "--config", "/no/such/arena.json"));
    }

    @Test
    void testCustomSettingsFile(@TempDir Path dir) throws IOException {
        Path config = dir.resolve("arena.json");
        Files.writeString(config, "{\"auction_rounds\": 2, \"threads\": 2}");

        assertEquals(0, execute("run", "auction", "-n", "3", "--seed", "5", "--config", config.toString()));
    }
}
