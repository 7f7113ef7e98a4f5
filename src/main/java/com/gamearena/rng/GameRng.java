package com.gamearena.rng;

import java.security.SecureRandom;
import java.util.Collections;
import java.util.List;

/**
 * Seeded random number generator for reproducible matches.
 * Uses the Mulberry32 PRNG so a seed replays a match draw for draw:
 * the same shuffle, the same auction items, the same coin flips.
 *
 * Not thread-safe. Each simulator owns its own instance.
 */
public class GameRng {
    private long state;
    private final long seed;

    /**
     * Create a new GameRng with the specified seed.
     * Only the lower 32 bits of the seed are used.
     */
    public GameRng(long seed) {
        this.seed = seed;
        this.state = seed & 0xFFFFFFFFL;
    }

    /**
     * Create a new GameRng with a random seed from SecureRandom.
     */
    public GameRng() {
        this(new SecureRandom().nextLong());
    }

    /**
     * Generate next random number in [0, 1).
     */
    public double next() {
        state = (state + 0x6D2B79F5L) & 0xFFFFFFFFL;
        long t = state;

        t = ((t ^ (t >>> 15)) * (t | 1)) & 0xFFFFFFFFL;
        t = (t ^ (t + ((t ^ (t >>> 7)) * (t | 61)) & 0xFFFFFFFFL)) & 0xFFFFFFFFL;

        long result = (t ^ (t >>> 14)) & 0xFFFFFFFFL;
        return result / 4294967296.0;
    }

    /**
     * Generate a random integer in range [0, bound).
     */
    public int nextInt(int bound) {
        if (bound <= 0) {
            throw new IllegalArgumentException("bound must be positive: " + bound);
        }
        return (int) (next() * bound);
    }

    /**
     * Uniform double in [min, max). Returns min when the range is empty.
     */
    public double uniform(double min, double max) {
        return min + (max - min) * next();
    }

    /**
     * Unweighted coin flip.
     */
    public boolean coinFlip() {
        return next() < 0.5;
    }

    /**
     * Pick one element uniformly.
     */
    public <T> T pick(List<T> options) {
        if (options.isEmpty()) {
            throw new IllegalArgumentException("Cannot pick from an empty list");
        }
        return options.get(nextInt(options.size()));
    }

    /**
     * Fisher-Yates shuffle in place.
     */
    public <T> void shuffle(List<T> list) {
        for (int i = list.size() - 1; i >= 1; i--) {
            int j = (int) Math.floor(next() * (i + 1));
            Collections.swap(list, i, j);
        }
    }

    /**
     * The seed this generator was created with.
     */
    public long getSeed() {
        return seed;
    }
}
