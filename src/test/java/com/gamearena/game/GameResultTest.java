package com.gamearena.game;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.gamearena.auction.AuctionDetails;
import com.gamearena.combat.ArchetypeCatalog;
import com.gamearena.combat.CombatSimulator;
import com.gamearena.decision.ScriptedDecisionProvider;
import com.gamearena.poker.PokerSimulator;
import com.gamearena.rng.GameRng;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

/**
 * JSON export and decision-log access on results.
 */
class GameResultTest {

    private static final ObjectMapper MAPPER = new ObjectMapper();

    @Test
    void testPokerResultExportsSnakeCaseWithGameTag() throws Exception {
        GameResult result = new PokerSimulator(new ScriptedDecisionProvider(), new GameRng(11))
                .play("alice", "bob", 0.2);

        JsonNode json = MAPPER.readTree(result.toJson());

        assertEquals("poker", json.get("game_type").asText());
        assertEquals(result.winner(), json.get("winner").asText());
        assertEquals(8, json.get("rounds_played").asInt());
        assertEquals(8, json.get("decision_log").size());

        JsonNode details = json.get("details");
        assertEquals("poker", details.get("game").asText());
        assertEquals("showdown", details.get("win_method").asText());
        assertTrue(details.has("hand_a_name"), "Fields are snake_case");
        assertEquals("preflop", details.get("actions").get(0).get("street").asText());

        JsonNode decision = json.get("decision_log").get(0);
        assertEquals("alice", decision.get("player").asText());
        assertEquals("preflop", decision.get("phase").asText());
        assertEquals(2, decision.get("request").get("private_cards").size());
    }

    @Test
    void testCombatResultExport() throws Exception {
        CombatSimulator sim = new CombatSimulator(new ScriptedDecisionProvider(), new GameRng(2),
                ArchetypeCatalog.standard(), 3);
        GameResult result = sim.play("alice", "bob", 0.05);

        JsonNode details = MAPPER.readTree(result.toJson()).get("details");

        assertEquals("combat", details.get("game").asText());
        assertTrue(details.get("turn_log").isArray());
        assertEquals(result.roundsPlayed(), details.get("turn_log").size());
        assertTrue(details.has("final_hp_a"));
    }

    @Test
    void testAuctionDetailsTag() throws Exception {
        AuctionDetails details = new AuctionDetails(List.of(), Map.of("alice", 0.0, "bob", 0.0),
                Map.of("alice", 0.05, "bob", 0.05), AuctionDetails.PROFIT);
        GameResult result = new GameResult(GameType.AUCTION, "alice", "bob", 0.05, details, 0, List.of());

        JsonNode json = MAPPER.readTree(result.toJson());

        assertEquals("auction", json.get("game_type").asText());
        assertEquals("auction", json.get("details").get("game").asText());
        assertEquals(0.05, json.get("details").get("budgets_remaining").get("bob").asDouble(), 1e-12);
        assertEquals(0.05, json.get("wager").asDouble(), 1e-12);
    }

    @Test
    void testDecisionsByPlayer() throws MatchAbortedException {
        GameResult result = new PokerSimulator(new ScriptedDecisionProvider(), new GameRng(11))
                .play("alice", "bob", 0.2);

        List<DecisionRecord<?, ?>> alice = result.decisionsBy("alice");
        assertEquals(4, alice.size());
        assertTrue(alice.stream().allMatch(d -> d.player().equals("alice")));
        assertTrue(result.decisionsBy("carol").isEmpty());
        assertThrows(UnsupportedOperationException.class, () -> result.decisionLog().clear());
    }
}
