package com.gamearena;

import ch.qos.logback.classic.Level;
import com.gamearena.arena.ArenaSettings;
import com.gamearena.arena.BatchSummary;
import com.gamearena.arena.MatchOutcome;
import com.gamearena.arena.MatchRunner;
import com.gamearena.arena.SimulatorFactory;
import com.gamearena.auction.AuctionCatalog;
import com.gamearena.auction.AuctionDetails;
import com.gamearena.auction.AuctionItem;
import com.gamearena.auction.AuctionRound;
import com.gamearena.combat.Ability;
import com.gamearena.combat.Archetype;
import com.gamearena.combat.ArchetypeCatalog;
import com.gamearena.combat.CombatDetails;
import com.gamearena.decision.DecisionProvider;
import com.gamearena.decision.RandomDecisionProvider;
import com.gamearena.game.CatalogException;
import com.gamearena.game.GameDetails;
import com.gamearena.game.GameResult;
import com.gamearena.game.GameType;
import com.gamearena.game.MatchAbortedException;
import com.gamearena.poker.PokerDetails;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import picocli.CommandLine;
import picocli.CommandLine.*;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.Callable;

/**
 * Game Arena CLI - Main entry point.
 * Every match here is played by the seeded random decision provider.
 */
@Command(name = "game-arena",
        mixinStandardHelpOptions = true,
        version = "1.0",
        description = "Two-player poker, auction and combat simulators",
        subcommands = {
                Main.PlayCommand.class,
                Main.RunCommand.class,
                Main.CatalogCommand.class
        })
public class Main implements Runnable {

    // Keeps the provider's stream apart from the simulator's for the same match seed
    static final long PROVIDER_SEED_OFFSET = 0x5DEECE66DL;

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public void run() {
        // Show help if no subcommand
        CommandLine.usage(this, System.out);
    }

    static DecisionProvider randomProvider(long seed) {
        return new RandomDecisionProvider(seed + PROVIDER_SEED_OFFSET);
    }

    /**
     * Options shared by the commands that build simulators.
     */
    static class ArenaOptions {
        @Option(names = {"--config"}, description = "Settings JSON overriding the bundled defaults")
        String configPath;

        @Option(names = {"--items"}, description = "Auction item catalog JSON (defaults to the bundled items)")
        String itemsPath;

        @Option(names = {"-v", "--verbose"}, description = "Log every action (DEBUG)")
        boolean verbose;

        void applyLogging() {
            if (verbose) {
                Logger root = LoggerFactory.getLogger(Logger.ROOT_LOGGER_NAME);
                if (root instanceof ch.qos.logback.classic.Logger) {
                    ((ch.qos.logback.classic.Logger) root).setLevel(Level.DEBUG);
                }
            }
        }

        ArenaSettings loadSettings() throws ArenaSettings.SettingsException {
            return configPath != null ? ArenaSettings.fromFile(configPath) : ArenaSettings.defaults();
        }

        AuctionCatalog loadItems() throws CatalogException {
            return itemsPath != null ? AuctionCatalog.fromFile(itemsPath) : AuctionCatalog.standard();
        }

        SimulatorFactory buildFactory(Map<String, String> overrides)
                throws ArenaSettings.SettingsException, CatalogException {
            return new SimulatorFactory(loadSettings(), ArchetypeCatalog.standard(), loadItems(),
                    overrides, Map.of());
        }
    }

    /**
     * Player names and combat archetype choices.
     */
    static class PlayerOptions {
        @Option(names = {"--player-a"}, defaultValue = "player_a", description = "Name of player A")
        String playerA;

        @Option(names = {"--player-b"}, defaultValue = "player_b", description = "Name of player B")
        String playerB;

        @Option(names = {"--class-a"}, description = "Combat archetype for player A")
        String classA;

        @Option(names = {"--class-b"}, description = "Combat archetype for player B")
        String classB;

        @Option(names = {"-w", "--wager"}, defaultValue = "0.01", description = "Wager (and budget) per player")
        double wager;

        Map<String, String> overrides() {
            Map<String, String> overrides = new LinkedHashMap<>();
            if (classA != null) {
                overrides.put(playerA, classA);
            }
            if (classB != null) {
                overrides.put(playerB, classB);
            }
            return overrides;
        }
    }

    // ========== PLAY COMMAND ==========
    @Command(name = "play", description = "Play one match")
    static class PlayCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "poker, auction or combat")
        String game;

        @Option(names = {"-s", "--seed"}, description = "Random seed (optional)")
        Long seed;

        @Option(names = {"--json"}, description = "Print the full result as JSON")
        boolean json;

        @Mixin
        ArenaOptions arena;

        @Mixin
        PlayerOptions players;

        @Override
        public Integer call() {
            arena.applyLogging();
            GameType type;
            SimulatorFactory factory;
            try {
                type = GameType.fromString(game);
                factory = arena.buildFactory(players.overrides());
            } catch (ArenaSettings.SettingsException | CatalogException | IllegalArgumentException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }

            long matchSeed = seed != null ? seed : System.nanoTime();
            MatchRunner runner = new MatchRunner(factory, Main::randomProvider, 1);
            GameResult result;
            try {
                result = runner.playOne(type, players.playerA, players.playerB, players.wager, matchSeed);
            } catch (MatchAbortedException e) {
                System.err.println("✗ Match aborted: " + e.getMessage());
                return 1;
            } catch (IllegalArgumentException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }

            if (json) {
                System.out.println(result.toJson());
            } else {
                printResult(result, matchSeed);
            }
            return 0;
        }
    }

    // ========== RUN COMMAND ==========
    @Command(name = "run", description = "Run many matches in parallel")
    static class RunCommand implements Callable<Integer> {
        @Parameters(index = "0", description = "poker, auction or combat")
        String game;

        @Option(names = {"-n", "--num-games"}, defaultValue = "1000", description = "Number of matches")
        int numGames;

        @Option(names = {"-s", "--seed"}, description = "Base seed; match i uses seed + i (optional)")
        Long seed;

        @Mixin
        ArenaOptions arena;

        @Mixin
        PlayerOptions players;

        @Override
        public Integer call() {
            arena.applyLogging();
            GameType type;
            SimulatorFactory factory;
            try {
                type = GameType.fromString(game);
                factory = arena.buildFactory(players.overrides());
            } catch (ArenaSettings.SettingsException | CatalogException | IllegalArgumentException e) {
                System.err.println("✗ " + e.getMessage());
                return 1;
            }
            if (numGames < 1) {
                System.err.println("✗ Number of matches must be positive");
                return 1;
            }

            long baseSeed = seed != null ? seed : System.nanoTime();
            MatchRunner runner = new MatchRunner(factory, Main::randomProvider);

            System.out.println("\n=== Game Arena: " + type.getJsonValue() + " ===\n");
            System.out.println("Matches: " + numGames);
            System.out.println("Base seed: " + baseSeed);
            System.out.println("Threads: " + factory.getSettings().effectiveThreads());
            System.out.println();

            long startTime = System.currentTimeMillis();
            List<MatchOutcome> outcomes = runner.runBatch(type, players.playerA, players.playerB, players.wager,
                    numGames, baseSeed);
            long elapsed = System.currentTimeMillis() - startTime;

            printSummary(BatchSummary.of(outcomes, players.playerA), players, elapsed);
            return 0;
        }
    }

    // ========== CATALOG COMMAND ==========
    @Command(name = "catalog", description = "List combat archetypes and auction items")
    static class CatalogCommand implements Callable<Integer> {
        @Option(names = {"--items"}, description = "Auction item catalog JSON (defaults to the bundled items)")
        String itemsPath;

        @Override
        public Integer call() {
            ArchetypeCatalog archetypes;
            AuctionCatalog items;
            try {
                archetypes = ArchetypeCatalog.standard();
                items = itemsPath != null ? AuctionCatalog.fromFile(itemsPath) : AuctionCatalog.standard();
            } catch (CatalogException e) {
                System.err.println("✗ Failed to load catalog: " + e.getMessage());
                return 1;
            }

            System.out.println("\n=== Archetypes ===\n");
            for (Archetype archetype : archetypes.all()) {
                System.out.printf("%s (%s)  HP:%d MP:%d ATK:%d DEF:%d SPD:%d%n",
                        archetype.displayName(), archetype.key(), archetype.hp(), archetype.mp(),
                        archetype.attack(), archetype.defense(), archetype.speed());
                for (Ability ability : archetype.abilities()) {
                    System.out.printf("  %-14s %3d MP  %-8s %s%n", ability.name(), ability.mpCost(),
                            ability.effect().label(), ability.description());
                }
                System.out.println();
            }

            System.out.println("Personalities:");
            archetypes.getPersonalities().forEach((personality, key) ->
                    System.out.println("  " + personality + " -> " + key));

            System.out.println("\n=== Auction Items ===\n");
            for (AuctionItem item : items.getItems()) {
                System.out.printf(Locale.ROOT, "  %-26s %.4f - %.4f%n", item.name(), item.minValue(), item.maxValue());
            }
            return 0;
        }
    }

    // ========== HELPER METHODS ==========

    /**
     * Print a single match result.
     */
    private static void printResult(GameResult result, long seed) {
        GameDetails details = result.details();
        System.out.println("\n=== " + result.gameType().getJsonValue() + " ===\n");
        System.out.println("Seed: " + seed);

        if (details instanceof PokerDetails poker) {
            System.out.println("Hands: " + poker.handA() + " (" + poker.handAName() + ") vs "
                    + poker.handB() + " (" + poker.handBName() + ")");
            System.out.println("Board: " + poker.board());
            System.out.printf(Locale.ROOT, "Pot: %.4f (blinds %.4f/%.4f)%n",
                    poker.pot(), poker.smallBlind(), poker.bigBlind());
        } else if (details instanceof AuctionDetails auction) {
            for (AuctionRound round : auction.rounds()) {
                System.out.printf(Locale.ROOT, "  Round %d: %-26s value %.4f -> %s at %.4f (%+.4f)%n",
                        round.round(), round.item(), round.trueValue(), round.winner(),
                        round.winningBid(), round.profit());
            }
            auction.profits().forEach((player, profit) ->
                    System.out.printf(Locale.ROOT, "Profit %s: %+.4f%n", player, profit));
        } else if (details instanceof CombatDetails combat) {
            System.out.printf("%s HP %d/%d vs %s HP %d/%d after %d turns%n",
                    combat.archetypeA(), combat.finalHpA(), combat.maxHpA(),
                    combat.archetypeB(), combat.finalHpB(), combat.maxHpB(), combat.turns());
        }

        System.out.println();
        System.out.println("Winner: " + result.winner() + " by " + details.winMethod());
        System.out.println("Rounds played: " + result.roundsPlayed());
        long coerced = result.decisionLog().stream().filter(d -> d.wasCoerced()).count();
        System.out.println("Decisions: " + result.decisionLog().size() + " (" + coerced + " coerced)");
    }

    /**
     * Print batch statistics.
     */
    private static void printSummary(BatchSummary summary, PlayerOptions players, long elapsedMs) {
        System.out.println("=== Results ===\n");
        System.out.printf(Locale.ROOT, "%s win rate: %.1f%% (%d/%d)%n", players.playerA,
                summary.winRateA() * 100.0, summary.winsA(), summary.completed());
        System.out.printf(Locale.ROOT, "%s win rate: %.1f%% (%d/%d)%n", players.playerB,
                summary.winRateB() * 100.0, summary.winsB(), summary.completed());
        if (summary.aborted() > 0) {
            System.out.println("Aborted: " + summary.aborted());
        }
        System.out.println();

        System.out.println("Win methods:");
        for (Map.Entry<String, Integer> entry : summary.winMethods().entrySet()) {
            double pct = summary.completed() == 0 ? 0.0 : (double) entry.getValue() / summary.completed() * 100.0;
            String bar = "█".repeat((int) (pct / 2.0));
            System.out.printf(Locale.ROOT, "  %-14s %5.1f%% %s (%d)%n", entry.getKey(), pct, bar, entry.getValue());
        }

        System.out.println();
        double elapsedSec = elapsedMs / 1000.0;
        double gamesPerSec = elapsedSec > 0 ? summary.total() / elapsedSec : 0;
        System.out.printf(Locale.ROOT, "Completed in %.2fs (%.0f matches/sec)%n", elapsedSec, gamesPerSec);
    }
}
