package com.gamearena.arena;

import com.gamearena.decision.DecisionProvider;
import com.gamearena.game.BaseSimulator;
import com.gamearena.game.GameResult;
import com.gamearena.game.GameType;
import com.gamearena.game.MatchAbortedException;
import com.gamearena.game.MatchEventSink;
import com.gamearena.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.function.LongFunction;

/**
 * Runs matches, one fresh simulator each, on a fixed thread pool.
 *
 * <p>Match {@code i} of a batch uses seed {@code baseSeed + i} for the
 * simulator, and the provider built for that same seed, so any single match
 * can be replayed on its own.
 */
public class MatchRunner {
    private static final Logger logger = LoggerFactory.getLogger(MatchRunner.class);

    private final SimulatorFactory factory;
    private final LongFunction<DecisionProvider> providers;
    private final int threads;
    private MatchEventSink eventSink = MatchEventSink.NONE;

    /**
     * @param providers builds the decision provider for a match seed
     */
    public MatchRunner(SimulatorFactory factory, LongFunction<DecisionProvider> providers, int threads) {
        if (threads < 1) {
            throw new IllegalArgumentException("Thread count must be positive: " + threads);
        }
        this.factory = factory;
        this.providers = providers;
        this.threads = threads;
    }

    public MatchRunner(SimulatorFactory factory, LongFunction<DecisionProvider> providers) {
        this(factory, providers, factory.getSettings().effectiveThreads());
    }

    /**
     * Sink attached to every simulator this runner creates. Must be thread-safe for batches.
     */
    public void setEventSink(MatchEventSink eventSink) {
        this.eventSink = eventSink != null ? eventSink : MatchEventSink.NONE;
    }

    /**
     * Play a single match on the calling thread.
     */
    public GameResult playOne(GameType type, String playerA, String playerB, double wager, long seed)
            throws MatchAbortedException {
        BaseSimulator simulator = factory.create(type, providers.apply(seed), new GameRng(seed));
        simulator.setEventSink(eventSink);
        return simulator.play(playerA, playerB, wager);
    }

    /**
     * Play {@code count} matches in parallel.
     *
     * @return outcomes in submission order; aborted matches are included, not dropped
     */
    public List<MatchOutcome> runBatch(GameType type, String playerA, String playerB, double wager,
                                       int count, long baseSeed) {
        if (count < 1) {
            throw new IllegalArgumentException("Match count must be positive: " + count);
        }
        ExecutorService executor = Executors.newFixedThreadPool(Math.min(threads, count));
        try {
            List<Future<MatchOutcome>> futures = new ArrayList<>();
            for (int i = 0; i < count; i++) {
                final int index = i;
                final long seed = baseSeed + i;
                futures.add(executor.submit(() -> {
                    try {
                        return MatchOutcome.completed(index, seed, playOne(type, playerA, playerB, wager, seed));
                    } catch (MatchAbortedException e) {
                        logger.warn("Match {} (seed {}) aborted: {}", index, seed, e.getMessage());
                        return MatchOutcome.aborted(index, seed, e.getMessage());
                    }
                }));
            }

            List<MatchOutcome> outcomes = new ArrayList<>();
            for (Future<MatchOutcome> future : futures) {
                outcomes.add(await(future));
            }
            return outcomes;
        } finally {
            executor.shutdownNow();
        }
    }

    private static MatchOutcome await(Future<MatchOutcome> future) {
        try {
            return future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while waiting for a match", e);
        } catch (ExecutionException e) {
            Throwable cause = e.getCause();
            if (cause instanceof RuntimeException) {
                throw (RuntimeException) cause;
            }
            throw new IllegalStateException("Match failed: " + cause, cause);
        }
    }
}
