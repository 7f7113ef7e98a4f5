package com.gamearena.arena;

import com.gamearena.auction.AuctionCatalog;
import com.gamearena.auction.AuctionSimulator;
import com.gamearena.combat.ArchetypeCatalog;
import com.gamearena.combat.CombatDetails;
import com.gamearena.combat.CombatSimulator;
import com.gamearena.decision.DecisionException;
import com.gamearena.decision.PokerActionResponse;
import com.gamearena.decision.RandomDecisionProvider;
import com.gamearena.decision.ScriptedDecisionProvider;
import com.gamearena.game.GameResult;
import com.gamearena.game.GameType;
import com.gamearena.game.MatchAbortedException;
import com.gamearena.game.MatchEvent;
import com.gamearena.poker.PokerSimulator;
import com.gamearena.rng.GameRng;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.concurrent.CopyOnWriteArrayList;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the simulator factory and the parallel batch runner.
 */
class MatchRunnerTest {

    private static SimulatorFactory factory;

    @BeforeAll
    static void setUp() throws Exception {
        factory = new SimulatorFactory(ArenaSettings.defaults(), ArchetypeCatalog.standard(),
                AuctionCatalog.standard());
    }

    @Test
    void testFactoryBuildsEachGame() {
        ScriptedDecisionProvider provider = new ScriptedDecisionProvider();
        assertInstanceOf(PokerSimulator.class, factory.create(GameType.POKER, provider, new GameRng(1)));
        assertInstanceOf(CombatSimulator.class, factory.create(GameType.COMBAT, provider, new GameRng(1)));
        AuctionSimulator auction = (AuctionSimulator) factory.create(GameType.AUCTION, provider, new GameRng(1));
        assertEquals(5, auction.getTotalRounds());
    }

    @Test
    void testFactoryAppliesOverrides() throws Exception {
        SimulatorFactory custom = new SimulatorFactory(ArenaSettings.fromJson("{\"combat_max_turns\": 4}"),
                factory.getArchetypes(), factory.getAuctionItems(),
                Map.of("alice", "rogue"), Map.of("bob", "conservative"));

        CombatSimulator combat = (CombatSimulator) custom.create(GameType.COMBAT,
                new ScriptedDecisionProvider(), new GameRng(1));
        GameResult result = combat.play("alice", "bob", 0.05);

        CombatDetails d = (CombatDetails) result.details();
        assertEquals("rogue", d.archetypeA());
        assertEquals("healer", d.archetypeB());
        assertTrue(d.turns() <= 4);
        assertThrows(IllegalArgumentException.class, () -> new SimulatorFactory(factory.getSettings(),
                factory.getArchetypes(), factory.getAuctionItems(), Map.of("alice", "paladin"), Map.of()));
    }

    @Test
    void testBatchKeepsSubmissionOrderAndSeeds() {
        MatchRunner runner = new MatchRunner(factory, RandomDecisionProvider::new, 3);

        List<MatchOutcome> outcomes = runner.runBatch(GameType.POKER, "alice", "bob", 0.05, 7, 100);

        assertEquals(7, outcomes.size());
        for (int i = 0; i < outcomes.size(); i++) {
            MatchOutcome outcome = outcomes.get(i);
            assertEquals(i, outcome.index());
            assertEquals(100 + i, outcome.seed());
            assertFalse(outcome.isAborted());
            assertNull(outcome.error());
        }
    }

    @Test
    void testBatchMatchReplaysAlone() throws MatchAbortedException {
        MatchRunner runner = new MatchRunner(factory, RandomDecisionProvider::new, 4);

        List<MatchOutcome> outcomes = runner.runBatch(GameType.COMBAT, "alice", "bob", 0.05, 6, 40);
        GameResult replay = runner.playOne(GameType.COMBAT, "alice", "bob", 0.05, 43);

        assertEquals(outcomes.get(3).result().toJson(), replay.toJson());
    }

    @Test
    void testAbortedMatchesAreReported() {
        MatchRunner runner = new MatchRunner(factory, seed -> new ScriptedDecisionProvider().onPoker(r -> {
            if (seed % 2 == 0) {
                throw new DecisionException("provider offline");
            }
            return PokerActionResponse.of("call", 0.0);
        }), 2);

        List<MatchOutcome> outcomes = runner.runBatch(GameType.POKER, "alice", "bob", 0.05, 4, 10);

        assertEquals(4, outcomes.size());
        assertTrue(outcomes.get(0).isAborted());
        assertTrue(outcomes.get(0).error().contains("provider offline"));
        assertFalse(outcomes.get(1).isAborted());
        assertTrue(outcomes.get(2).isAborted());

        BatchSummary summary = BatchSummary.of(outcomes, "alice");
        assertEquals(4, summary.total());
        assertEquals(2, summary.aborted());
        assertEquals(2, summary.completed());
        assertEquals(2, summary.winsA() + summary.winsB());
        assertEquals(1.0, summary.winRateA() + summary.winRateB(), 1e-12);
    }

    @Test
    void testEventSinkSeesEveryMatch() {
        List<MatchEvent> events = new CopyOnWriteArrayList<>();
        MatchRunner runner = new MatchRunner(factory, RandomDecisionProvider::new, 2);
        runner.setEventSink(events::add);

        runner.runBatch(GameType.AUCTION, "alice", "bob", 0.05, 3, 1);

        assertEquals(3, events.stream().filter(e -> e.type().equals("auction_end")).count());
        assertEquals(15, events.stream().filter(e -> e.type().equals("auction_round")).count());
    }

    @Test
    void testSummaryCountsWinMethods() {
        MatchRunner runner = new MatchRunner(factory, RandomDecisionProvider::new, 2);

        List<MatchOutcome> outcomes = runner.runBatch(GameType.AUCTION, "alice", "bob", 0.05, 5, 7);
        BatchSummary summary = BatchSummary.of(outcomes, "alice");

        assertEquals(0, summary.aborted());
        assertEquals(5, summary.winsA() + summary.winsB());
        assertEquals(Map.of("profit", 5), summary.winMethods());
    }

    @Test
    void testRejectsBadCounts() {
        assertThrows(IllegalArgumentException.class,
                () -> new MatchRunner(factory, RandomDecisionProvider::new, 0));
        MatchRunner runner = new MatchRunner(factory, RandomDecisionProvider::new);
        assertThrows(IllegalArgumentException.class,
                () -> runner.runBatch(GameType.POKER, "alice", "bob", 0.05, 0, 1));
    }
}
