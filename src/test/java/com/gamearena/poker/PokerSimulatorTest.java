package com.gamearena.poker;

import com.gamearena.decision.DecisionException;
import com.gamearena.decision.PlayerContext;
import com.gamearena.decision.PokerAction;
import com.gamearena.decision.PokerActionRequest;
import com.gamearena.decision.PokerActionResponse;
import com.gamearena.decision.RandomDecisionProvider;
import com.gamearena.decision.ScriptedDecisionProvider;
import com.gamearena.game.DecisionRecord;
import com.gamearena.game.GameResult;
import com.gamearena.game.GameType;
import com.gamearena.game.MatchAbortedException;
import com.gamearena.game.MatchEvent;
import com.gamearena.rng.GameRng;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for the heads-up hold'em simulator.
 */
class PokerSimulatorTest {

    private static final String ALICE = "alice";
    private static final String BOB = "bob";

    private static PokerDetails details(GameResult result) {
        return (PokerDetails) result.details();
    }

    private static void assertChipsConserved(GameResult result) {
        PokerDetails d = details(result);
        assertEquals(2 * result.wager(), d.pot() + d.stackA() + d.stackB(), 1e-9, "Chips must be conserved");
        assertTrue(d.stackA() >= 0 && d.stackB() >= 0, "Stacks cannot go negative");
    }

    @Test
    void testAlwaysCallReachesShowdown() throws MatchAbortedException {
        ScriptedDecisionProvider provider = new ScriptedDecisionProvider();
        PokerSimulator sim = new PokerSimulator(provider, new GameRng(11));

        GameResult result = sim.play(ALICE, BOB, 0.2);

        PokerDetails d = details(result);
        assertEquals(GameType.POKER, result.gameType());
        assertEquals(PokerDetails.SHOWDOWN, d.winMethod());
        assertEquals(5, boardSize(d.board()));
        assertNotNull(d.scoreA());
        assertNotNull(d.scoreB());
        assertFalse(d.handAName().isEmpty());
        assertEquals(8, result.roundsPlayed(), "Two checks or calls on each of four streets");
        assertEquals(8, result.decisionLog().size());
        assertEquals(0.04, d.pot(), 1e-9);
        assertChipsConserved(result);
    }

    private static int boardSize(String board) {
        return board.split(", ").length;
    }

    @Test
    void testPreflopPotAfterCallIsTwiceBigBlind() throws MatchAbortedException {
        ScriptedDecisionProvider provider = new ScriptedDecisionProvider();
        PokerSimulator sim = new PokerSimulator(provider, new GameRng(12));

        GameResult result = sim.play(ALICE, BOB, 0.2);

        PokerActionRequest first = provider.pokerRequests.get(0);
        assertEquals(ALICE, first.player());
        assertEquals("SB", first.position());
        assertEquals(0.01, first.toCall(), 1e-12, "Small blind owes the difference to the big blind");
        assertEquals(0.03, first.pot(), 1e-12);
        assertEquals(0.02, first.bigBlind(), 1e-12);
        assertEquals(2, first.privateCards().size());
        assertTrue(first.sharedCards().isEmpty());

        PokerActionRecord call = details(result).actions().get(0);
        assertEquals(Street.PREFLOP, call.street());
        assertEquals(0.04, call.potAfter(), 1e-12);

        PokerActionRequest second = provider.pokerRequests.get(1);
        assertEquals(BOB, second.player());
        assertEquals(0.0, second.toCall(), 1e-12, "Big blind gets the option to check");
    }

    @Test
    void testFoldWithNothingToCallBecomesCheck() throws MatchAbortedException {
        ScriptedDecisionProvider provider = new ScriptedDecisionProvider()
                .onPoker(r -> PokerActionResponse.of(r.player().equals(BOB) ? "fold" : "call", 0.0));
        PokerSimulator sim = new PokerSimulator(provider, new GameRng(13));

        GameResult result = sim.play(ALICE, BOB, 0.2);

        assertEquals(PokerDetails.SHOWDOWN, details(result).winMethod(), "Bob never owed anything, so never folded");
        List<DecisionRecord<?, ?>> bobs = result.decisionsBy(BOB);
        assertEquals(4, bobs.size());
        for (DecisionRecord<?, ?> record : bobs) {
            assertTrue(record.wasCoerced());
            assertTrue(record.coercions().get(0).contains("check"));
        }
        for (PokerActionRecord action : details(result).actions()) {
            assertEquals(PokerAction.CALL, action.action());
        }
    }

    @Test
    void testFoldEndsHandImmediately() throws MatchAbortedException {
        ScriptedDecisionProvider provider = new ScriptedDecisionProvider()
                .onPoker(r -> PokerActionResponse.of("fold", 0.0));
        PokerSimulator sim = new PokerSimulator(provider, new GameRng(14));

        GameResult result = sim.play(ALICE, BOB, 0.2);

        PokerDetails d = details(result);
        assertEquals(BOB, result.winner());
        assertEquals(ALICE, result.loser());
        assertEquals(PokerDetails.FOLD, d.winMethod());
        assertEquals("folded", d.handAName());
        assertEquals("", d.handBName());
        assertEquals("none", d.board());
        assertNull(d.scoreA());
        assertEquals(1, result.roundsPlayed());
        assertEquals(1, provider.pokerRequests.size());
        assertChipsConserved(result);
    }

    @Test
    void testUnknownActionDefaultsToFold() throws MatchAbortedException {
        ScriptedDecisionProvider provider = new ScriptedDecisionProvider()
                .onPoker(r -> PokerActionResponse.of("all-in please", 0.0));
        PokerSimulator sim = new PokerSimulator(provider, new GameRng(15));

        GameResult result = sim.play(ALICE, BOB, 0.2);

        assertEquals(BOB, result.winner());
        assertTrue(result.decisionLog().get(0).wasCoerced());
    }

    @Test
    void testOversizedRaiseClampedToStack() throws MatchAbortedException {
        ScriptedDecisionProvider provider = new ScriptedDecisionProvider()
                .onPoker(r -> r.player().equals(ALICE)
                        ? PokerActionResponse.of("raise", 1000.0)
                        : PokerActionResponse.of("call", 0.0));
        PokerSimulator sim = new PokerSimulator(provider, new GameRng(16));

        GameResult result = sim.play(ALICE, BOB, 0.2);

        PokerDetails d = details(result);
        PokerActionRecord raise = d.actions().get(0);
        assertEquals(PokerAction.RAISE, raise.action());
        assertEquals(0.18, raise.raiseAmount(), 1e-9, "Raise limited to what is left after the call");
        assertEquals(0.19, raise.amountPaid(), 1e-9);
        assertTrue(result.decisionLog().get(0).wasCoerced());

        assertEquals(0.0, d.stackA(), 1e-9);
        assertEquals(0.0, d.stackB(), 1e-9);
        assertEquals(0.4, d.pot(), 1e-9);
        assertEquals(2, result.roundsPlayed(), "All-in players are not asked on later streets");
        assertEquals(PokerDetails.SHOWDOWN, d.winMethod());
        assertChipsConserved(result);
    }

    @Test
    void testSmallRaiseLiftedToBigBlind() throws MatchAbortedException {
        List<Boolean> raised = new ArrayList<>();
        ScriptedDecisionProvider provider = new ScriptedDecisionProvider()
                .onPoker(r -> {
                    if (r.player().equals(ALICE) && raised.isEmpty()) {
                        raised.add(true);
                        return PokerActionResponse.of("raise", 0.0);
                    }
                    return PokerActionResponse.of("call", 0.0);
                });
        PokerSimulator sim = new PokerSimulator(provider, new GameRng(17));

        GameResult result = sim.play(ALICE, BOB, 0.2);

        PokerActionRecord raise = details(result).actions().get(0);
        assertEquals(0.02, raise.raiseAmount(), 1e-12);
        PokerActionRequest bobFacing = provider.pokerRequests.get(1);
        assertEquals(0.02, bobFacing.toCall(), 1e-12);
        assertChipsConserved(result);
    }

    @Test
    void testRaiseWarIsCappedAndStreetSettles() throws MatchAbortedException {
        ScriptedDecisionProvider provider = new ScriptedDecisionProvider()
                .onPoker(r -> PokerActionResponse.of("raise", r.bigBlind()));
        PokerSimulator sim = new PokerSimulator(provider, new GameRng(18));

        GameResult result = sim.play(ALICE, BOB, 100.0);

        List<PokerActionRecord> preflop = details(result).actions().stream()
                .filter(a -> a.street() == Street.PREFLOP)
                .toList();
        assertEquals(7, preflop.size(), "Three raising passes then a forced call");
        assertEquals(PokerAction.CALL, preflop.get(6).action());

        double paidA = 5.0;
        double paidB = 10.0;
        for (PokerActionRecord action : preflop) {
            if (action.player().equals(ALICE)) {
                paidA += action.amountPaid();
            } else {
                paidB += action.amountPaid();
            }
        }
        assertEquals(paidA, paidB, 1e-9, "Both seats put in the same amount by the end of the street");

        boolean capNoted = result.decisionLog().stream()
                .flatMap(d -> d.coercions().stream())
                .anyMatch(note -> note.contains("raise cap"));
        assertTrue(capNoted);
        assertChipsConserved(result);
    }

    @Test
    void testProviderFailureAbortsMatch() {
        ScriptedDecisionProvider provider = new ScriptedDecisionProvider()
                .onPoker(r -> {
                    throw new DecisionException("timeout");
                });
        PokerSimulator sim = new PokerSimulator(provider, new GameRng(19));

        MatchAbortedException e = assertThrows(MatchAbortedException.class, () -> sim.play(ALICE, BOB, 0.2));
        assertEquals(ALICE, e.getPlayer());
        assertInstanceOf(DecisionException.class, e.getCause());
    }

    @Test
    void testNullOrCrashingProviderAbortsMatch() {
        ScriptedDecisionProvider nullProvider = new ScriptedDecisionProvider().onPoker(r -> null);
        assertThrows(MatchAbortedException.class,
                () -> new PokerSimulator(nullProvider, new GameRng(20)).play(ALICE, BOB, 0.2));

        ScriptedDecisionProvider crashing = new ScriptedDecisionProvider()
                .onPoker(r -> {
                    throw new IllegalStateException("boom");
                });
        MatchAbortedException e = assertThrows(MatchAbortedException.class,
                () -> new PokerSimulator(crashing, new GameRng(20)).play(ALICE, BOB, 0.2));
        assertInstanceOf(IllegalStateException.class, e.getCause());
    }

    @Test
    void testEventsEmittedInOrder() throws MatchAbortedException {
        List<MatchEvent> events = new ArrayList<>();
        PokerSimulator sim = new PokerSimulator(new ScriptedDecisionProvider(), new GameRng(21));
        sim.setEventSink(events::add);

        sim.play(ALICE, BOB, 0.2);

        assertEquals("poker_init", events.get(0).type());
        assertEquals("poker_end", events.get(events.size() - 1).type());
        assertEquals(4, events.stream().filter(e -> e.type().equals("poker_street")).count());
        assertEquals(8, events.stream().filter(e -> e.type().equals("poker_action")).count());
    }

    @Test
    void testFailingEventSinkDoesNotStopMatch() throws MatchAbortedException {
        PokerSimulator sim = new PokerSimulator(new ScriptedDecisionProvider(), new GameRng(22));
        sim.setEventSink(event -> {
            throw new IllegalStateException("spectator feed down");
        });

        GameResult result = sim.play(ALICE, BOB, 0.2);
        assertEquals(PokerDetails.SHOWDOWN, details(result).winMethod());
    }

    @Test
    void testPlayerContextReachesRequests() throws MatchAbortedException {
        ScriptedDecisionProvider provider = new ScriptedDecisionProvider();
        PokerSimulator sim = new PokerSimulator(provider, new GameRng(23));
        sim.setPlayerContext(ALICE, new PlayerContext("bob bluffs often", "up 0.3"));

        sim.play(ALICE, BOB, 0.2);

        assertEquals("bob bluffs often", provider.pokerRequests.get(0).opponentContext());
        assertEquals("up 0.3", provider.pokerRequests.get(0).bankrollContext());
        assertEquals(PlayerContext.NONE.opponentSummary(), provider.pokerRequests.get(1).opponentContext());
    }

    @Test
    void testSameSeedReplaysHand() throws MatchAbortedException {
        GameResult first = new PokerSimulator(new RandomDecisionProvider(5), new GameRng(24)).play(ALICE, BOB, 1.0);
        GameResult second = new PokerSimulator(new RandomDecisionProvider(5), new GameRng(24)).play(ALICE, BOB, 1.0);

        assertEquals(details(first).board(), details(second).board());
        assertEquals(details(first).handA(), details(second).handA());
        assertEquals(first.winner(), second.winner());
        assertEquals(first.roundsPlayed(), second.roundsPlayed());
        assertChipsConserved(first);
    }

    @Test
    void testRandomPlayConservesChips() throws MatchAbortedException {
        for (long seed = 0; seed < 50; seed++) {
            PokerSimulator sim = new PokerSimulator(new RandomDecisionProvider(seed), new GameRng(seed));
            assertChipsConserved(sim.play(ALICE, BOB, 0.5));
        }
    }

    @Test
    void testStateSummaryAndValidation() throws MatchAbortedException {
        PokerSimulator sim = new PokerSimulator(new ScriptedDecisionProvider(), new GameRng(25));
        sim.play(ALICE, BOB, 0.2);
        assertTrue(sim.getStateSummary().startsWith("Pot: 0.0400 | Board: "));

        assertThrows(IllegalArgumentException.class, () -> sim.play(ALICE, ALICE, 0.2));
        assertThrows(IllegalArgumentException.class, () -> sim.play(ALICE, BOB, 0.0));
    }
}
