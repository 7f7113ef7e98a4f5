package com.gamearena.game;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class MatchEventsTest {

    @Test
    void testDelivered() {
        List<MatchEvent> received = new ArrayList<>();
        Map<String, Object> data = new HashMap<>();
        data.put("pot", 0.03);

        assertTrue(MatchEvents.emit(received::add, "poker_action", data));

        assertEquals(1, received.size());
        assertEquals("poker_action", received.get(0).type());
        data.put("pot", 1.0);
        assertEquals(0.03, received.get(0).data().get("pot"), "Event data is a snapshot");
        assertThrows(UnsupportedOperationException.class, () -> received.get(0).data().put("x", 1));
    }

    @Test
    void testFailingSinkIsContained() {
        MatchEventSink broken = event -> {
            throw new IllegalStateException("spectator feed down");
        };

        assertFalse(MatchEvents.emit(broken, "combat_turn", Map.of("turn", 1)));
    }

    @Test
    void testNoSink() {
        assertTrue(MatchEvents.emit(MatchEventSink.NONE, "auction_end", Map.of()));
        assertTrue(MatchEvents.emit(null, "auction_end", Map.of()));
    }
}
