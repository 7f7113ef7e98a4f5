package com.gamearena.game;

import com.gamearena.decision.DecisionException;
import com.gamearena.decision.DecisionProvider;
import com.gamearena.decision.DecisionValidator;
import com.gamearena.decision.PlayerContext;
import com.gamearena.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Shared plumbing for simulators: consulting the provider, the decision log,
 * per-player context and live events.
 */
public abstract class BaseSimulator implements GameSimulator {
    private static final Logger logger = LoggerFactory.getLogger(BaseSimulator.class);

    protected final DecisionProvider provider;
    protected final GameRng rng;

    private final Map<String, PlayerContext> contexts = new HashMap<>();
    private final List<DecisionRecord<?, ?>> decisionLog = new ArrayList<>();
    private MatchEventSink eventSink = MatchEventSink.NONE;

    protected BaseSimulator(DecisionProvider provider, GameRng rng) {
        if (provider == null) {
            throw new IllegalArgumentException("Decision provider cannot be null");
        }
        this.provider = provider;
        this.rng = rng != null ? rng : new GameRng();
    }

    /**
     * A provider call that may fail.
     */
    @FunctionalInterface
    protected interface DecisionCall<Q, R> {
        R call(Q request) throws DecisionException;
    }

    public void setEventSink(MatchEventSink eventSink) {
        this.eventSink = eventSink != null ? eventSink : MatchEventSink.NONE;
    }

    /**
     * Attach opponent and bankroll text to every request made for a player.
     */
    public void setPlayerContext(String player, PlayerContext context) {
        contexts.put(player, context);
    }

    public PlayerContext getPlayerContext(String player) {
        return contexts.getOrDefault(player, PlayerContext.NONE);
    }

    /**
     * Reset per-match bookkeeping. Call first thing in {@link #play}.
     */
    protected void beginMatch() {
        decisionLog.clear();
    }

    /**
     * Snapshot of the decisions made so far in this match.
     */
    protected List<DecisionRecord<?, ?>> decisions() {
        return List.copyOf(decisionLog);
    }

    /**
     * Ask the provider. No state has been touched yet when this fails,
     * so the match is aborted rather than retried.
     */
    protected <Q, R> R consult(String player, Q request, DecisionCall<Q, R> call) throws MatchAbortedException {
        R response;
        try {
            response = call.call(request);
        } catch (DecisionException | RuntimeException e) {
            throw new MatchAbortedException(player,
                    getGameType().getJsonValue() + " decision failed for " + player + ": " + e.getMessage(), e);
        }
        if (response == null) {
            throw new MatchAbortedException(player,
                    getGameType().getJsonValue() + " decision for " + player + " returned nothing", null);
        }
        return response;
    }

    /**
     * Append a validated decision to the log.
     */
    protected <Q, R> void record(String player, String phase, Q request, DecisionValidator.Validated<R> validated) {
        if (!validated.coercions().isEmpty()) {
            logger.debug("{} {} coerced: {}", player, phase, validated.coercions());
        }
        decisionLog.add(new DecisionRecord<>(player, phase, request, validated.value(), validated.coercions()));
    }

    protected void emit(String type, Map<String, Object> data) {
        MatchEvents.emit(eventSink, type, data);
    }
}
