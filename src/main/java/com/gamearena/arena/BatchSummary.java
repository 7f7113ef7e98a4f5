package com.gamearena.arena;

import com.gamearena.game.GameResult;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate view of a batch: seat win counts and how matches were decided.
 */
public record BatchSummary(int total, int aborted, int winsA, int winsB, Map<String, Integer> winMethods) {

    public static BatchSummary of(List<MatchOutcome> outcomes, String playerA) {
        int aborted = 0;
        int winsA = 0;
        int winsB = 0;
        Map<String, Integer> methods = new TreeMap<>();
        for (MatchOutcome outcome : outcomes) {
            if (outcome.isAborted()) {
                aborted++;
                continue;
            }
            GameResult result = outcome.result();
            if (result.winner().equals(playerA)) {
                winsA++;
            } else {
                winsB++;
            }
            methods.merge(result.details().winMethod(), 1, Integer::sum);
        }
        return new BatchSummary(outcomes.size(), aborted, winsA, winsB, methods);
    }

    public int completed() {
        return total - aborted;
    }

    public double winRateA() {
        return completed() == 0 ? 0.0 : (double) winsA / completed();
    }

    public double winRateB() {
        return completed() == 0 ? 0.0 : (double) winsB / completed();
    }
}
