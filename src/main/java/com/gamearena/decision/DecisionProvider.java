package com.gamearena.decision;

/**
 * The external decision-maker consulted at every choice point.
 *
 * <p>Calls are synchronous and block the simulating thread. Responses may be
 * incomplete or illegal; simulators validate them with {@link DecisionValidator}
 * before applying anything. Throwing aborts the match.
 */
public interface DecisionProvider {

    PokerActionResponse decidePokerAction(PokerActionRequest request) throws DecisionException;

    AuctionBidResponse decideAuctionBid(AuctionBidRequest request) throws DecisionException;

    CombatAbilityResponse decideCombatAbility(CombatAbilityRequest request) throws DecisionException;
}
