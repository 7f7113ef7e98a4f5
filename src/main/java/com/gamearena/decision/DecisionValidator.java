package com.gamearena.decision;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * Turns raw provider answers into legal moves.
 *
 * <p>Missing fields get documented defaults, numbers are clamped into range,
 * and illegal choices are replaced with a safe one. Nothing here is fatal;
 * every correction is reported as a note so it lands in the decision log.
 */
public final class DecisionValidator {

    /**
     * Smallest bid the auction accepts.
     */
    public static final double MIN_BID = 0.001;

    public static final double DEFAULT_CONFIDENCE = 0.5;
    public static final double DEFAULT_WIN_PROB = 0.5;
    public static final String DEFAULT_STRATEGY = "value";

    private DecisionValidator() {
        // Utility class - prevent instantiation
    }

    /**
     * A validated value plus the corrections it took to get there.
     */
    public record Validated<T>(T value, List<String> coercions) {
        public Validated {
            coercions = List.copyOf(coercions);
        }
    }

    /**
     * Validate a poker answer.
     *
     * @param toCall       what the player owes right now
     * @param minRaise     smallest raise on top of the call (the big blind)
     * @param maxRaise     stack left after paying the call
     * @param raiseAllowed false on the final pass of a street
     */
    public static Validated<PokerDecision> validatePoker(PokerActionResponse raw, double toCall,
                                                        double minRaise, double maxRaise,
                                                        boolean raiseAllowed) {
        List<String> notes = new ArrayList<>();

        PokerAction action = PokerAction.fromString(raw.action());
        if (action == null) {
            notes.add(raw.action() == null
                    ? "missing action defaulted to fold"
                    : "unknown action '" + raw.action() + "' defaulted to fold");
            action = PokerAction.FOLD;
        }

        if (action == PokerAction.FOLD && toCall <= 0) {
            notes.add("fold with nothing to call rewritten to check");
            action = PokerAction.CALL;
        }

        if (action == PokerAction.RAISE && !raiseAllowed) {
            notes.add("raise cap reached, raise rewritten to call");
            action = PokerAction.CALL;
        }

        double raiseAmount = finiteOr(raw.raiseAmount(), 0.0);
        if (action == PokerAction.RAISE) {
            double clamped = Math.min(Math.max(raiseAmount, minRaise), maxRaise);
            if (clamped != raiseAmount) {
                notes.add(String.format(Locale.ROOT, "raise amount %.4f clamped to %.4f", raiseAmount, clamped));
            }
            raiseAmount = clamped;
        } else {
            raiseAmount = 0.0;
        }

        PokerDecision decision = new PokerDecision(
                action,
                raiseAmount,
                finiteOr(raw.confidence(), DEFAULT_CONFIDENCE),
                finiteOr(raw.bluffProbability(), 0.0),
                finiteOr(raw.estimatedWinProb(), DEFAULT_WIN_PROB),
                raw.reasoning()
        );
        return new Validated<>(decision, notes);
    }

    /**
     * Validate a bid: clamp to the budget, lift to the minimum bid, then cap at
     * the budget again so a nearly empty budget bids what is left.
     */
    public static Validated<AuctionBid> validateBid(AuctionBidResponse raw, double budget) {
        List<String> notes = new ArrayList<>();

        double requested = finiteOr(raw.bidAmount(), 0.0);
        if (raw.bidAmount() == null) {
            notes.add("missing bid_amount defaulted to 0");
        }
        double bid = Math.max(Math.min(requested, budget), MIN_BID);
        if (bid != requested) {
            notes.add(String.format(Locale.ROOT, "bid %.4f clamped to %.4f", requested, bid));
        }
        // Never spend past the budget, even to meet the minimum
        double affordable = Math.max(budget, 0.0);
        if (bid > affordable) {
            notes.add(String.format(Locale.ROOT, "bid %.4f exceeds budget %.4f, capped", bid, affordable));
            bid = affordable;
        }

        String strategy = raw.strategy() == null || raw.strategy().isBlank()
                ? DEFAULT_STRATEGY
                : raw.strategy();
        AuctionBid validated = new AuctionBid(
                bid,
                finiteOr(raw.confidence(), DEFAULT_CONFIDENCE),
                strategy,
                raw.reasoning()
        );
        return new Validated<>(validated, notes);
    }

    /**
     * Validate an ability choice against the affordable set (catalog order).
     * Anything outside the set becomes its first member.
     */
    public static Validated<CombatChoice> validateAbility(CombatAbilityResponse raw, List<String> affordable) {
        if (affordable.isEmpty()) {
            throw new IllegalArgumentException("Affordable ability set cannot be empty");
        }
        List<String> notes = new ArrayList<>();

        String ability = raw.ability() == null ? "" : raw.ability().trim();
        if (!affordable.contains(ability)) {
            String fallback = affordable.get(0);
            notes.add(ability.isEmpty()
                    ? "missing ability defaulted to " + fallback
                    : "ability '" + ability + "' not available, replaced with " + fallback);
            ability = fallback;
        }

        CombatChoice choice = new CombatChoice(ability, finiteOr(raw.confidence(), DEFAULT_CONFIDENCE), raw.reasoning());
        return new Validated<>(choice, notes);
    }

    private static double finiteOr(Double value, double fallback) {
        if (value == null || value.isNaN() || value.isInfinite()) {
            return fallback;
        }
        return value;
    }
}
