package com.gamearena.game;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Map;

/**
 * Fire-and-forget delivery of match events.
 */
public final class MatchEvents {
    private static final Logger logger = LoggerFactory.getLogger(MatchEvents.class);

    private MatchEvents() {
        // Utility class - prevent instantiation
    }

    /**
     * Deliver an event. A failing sink is logged and otherwise ignored.
     *
     * @return true if the sink accepted the event
     */
    public static boolean emit(MatchEventSink sink, String type, Map<String, Object> data) {
        if (sink == null || sink == MatchEventSink.NONE) {
            return true;
        }
        try {
            sink.onEvent(new MatchEvent(type, data));
            return true;
        } catch (RuntimeException e) {
            logger.warn("Event sink rejected {} event: {}", type, e.toString());
            return false;
        }
    }
}
