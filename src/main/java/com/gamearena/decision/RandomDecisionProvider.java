package com.gamearena.decision;

import com.gamearena.rng.GameRng;

import java.util.List;

/**
 * Seeded fallback policy for players without a real decision-maker.
 *
 * <ul>
 *   <li>Poker: call or raise one big blind, evenly.</li>
 *   <li>Auction: uniform between 80% of the item's minimum and 70% of its maximum, capped at budget.</li>
 *   <li>Combat: any affordable ability, evenly.</li>
 * </ul>
 */
public class RandomDecisionProvider implements DecisionProvider {
    private static final List<String> POKER_ACTIONS = List.of("call", "raise");

    private final GameRng rng;

    public RandomDecisionProvider(GameRng rng) {
        this.rng = rng;
    }

    public RandomDecisionProvider(long seed) {
        this(new GameRng(seed));
    }

    @Override
    public PokerActionResponse decidePokerAction(PokerActionRequest request) {
        String action = rng.pick(POKER_ACTIONS);
        return new PokerActionResponse(action, request.bigBlind(), 0.5, 0.0, 0.5, "random choice");
    }

    @Override
    public AuctionBidResponse decideAuctionBid(AuctionBidRequest request) {
        double bid = rng.uniform(request.minValue() * 0.8, request.maxValue() * 0.7);
        return new AuctionBidResponse(Math.min(bid, request.budget()), 0.5, "random", "random choice");
    }

    @Override
    public CombatAbilityResponse decideCombatAbility(CombatAbilityRequest request) {
        AbilityOption choice = rng.pick(request.abilities());
        return new CombatAbilityResponse(choice.name(), 0.5, "random choice");
    }
}
