package com.gamearena.arena;

import com.gamearena.auction.AuctionCatalog;
import com.gamearena.auction.AuctionSimulator;
import com.gamearena.combat.ArchetypeCatalog;
import com.gamearena.combat.CombatSimulator;
import com.gamearena.decision.DecisionProvider;
import com.gamearena.game.BaseSimulator;
import com.gamearena.game.GameType;
import com.gamearena.poker.PokerSimulator;
import com.gamearena.rng.GameRng;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Builds fresh simulators wired to shared settings and catalogs.
 * Catalogs are immutable, so one factory can feed many threads.
 */
public class SimulatorFactory {
    private final ArenaSettings settings;
    private final ArchetypeCatalog archetypes;
    private final AuctionCatalog auctionItems;
    private final Map<String, String> archetypeOverrides;
    private final Map<String, String> personalities;

    public SimulatorFactory(ArenaSettings settings, ArchetypeCatalog archetypes, AuctionCatalog auctionItems,
                            Map<String, String> archetypeOverrides, Map<String, String> personalities) {
        if (settings == null || archetypes == null || auctionItems == null) {
            throw new IllegalArgumentException("Settings and catalogs are required");
        }
        for (String key : archetypeOverrides.values()) {
            archetypes.get(key);
        }
        this.settings = settings;
        this.archetypes = archetypes;
        this.auctionItems = auctionItems;
        this.archetypeOverrides = Collections.unmodifiableMap(new LinkedHashMap<>(archetypeOverrides));
        this.personalities = Collections.unmodifiableMap(new LinkedHashMap<>(personalities));
    }

    public SimulatorFactory(ArenaSettings settings, ArchetypeCatalog archetypes, AuctionCatalog auctionItems) {
        this(settings, archetypes, auctionItems, Map.of(), Map.of());
    }

    public ArenaSettings getSettings() {
        return settings;
    }

    public ArchetypeCatalog getArchetypes() {
        return archetypes;
    }

    public AuctionCatalog getAuctionItems() {
        return auctionItems;
    }

    /**
     * A new simulator for one match. Never share the result between threads.
     */
    public BaseSimulator create(GameType type, DecisionProvider provider, GameRng rng) {
        return switch (type) {
            case POKER -> new PokerSimulator(provider, rng, settings.blindFraction());
            case AUCTION -> new AuctionSimulator(provider, rng, auctionItems, settings.auctionRounds());
            case COMBAT -> {
                CombatSimulator combat = new CombatSimulator(provider, rng, archetypes, settings.combatMaxTurns());
                archetypeOverrides.forEach(combat::setArchetypeOverride);
                personalities.forEach(combat::setPersonality);
                yield combat;
            }
        };
    }
}
