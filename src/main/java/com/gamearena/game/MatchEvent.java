package com.gamearena.game;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * A real-time notification emitted while a match is in progress.
 */
public record MatchEvent(String type, Map<String, Object> data) {

    public MatchEvent {
        data = Collections.unmodifiableMap(new LinkedHashMap<>(data));
    }
}
