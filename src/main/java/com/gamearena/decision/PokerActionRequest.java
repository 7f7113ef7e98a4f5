package com.gamearena.decision;

import com.gamearena.card.Card;

import java.util.List;

/**
 * Snapshot shown to the provider before a poker action.
 */
public record PokerActionRequest(
        String player,
        List<Card> privateCards,
        List<Card> sharedCards,
        double pot,
        double stack,
        double opponentStack,
        String position,
        double toCall,
        double bigBlind,
        String street,
        String opponentContext,
        String bankrollContext
) {
    public PokerActionRequest {
        privateCards = List.copyOf(privateCards);
        sharedCards = List.copyOf(sharedCards);
    }
}
