package com.gamearena.combat;

import com.gamearena.decision.AbilityOption;
import com.gamearena.decision.CombatAbilityRequest;
import com.gamearena.decision.CombatAbilityResponse;
import com.gamearena.decision.CombatChoice;
import com.gamearena.decision.DecisionProvider;
import com.gamearena.decision.DecisionValidator;
import com.gamearena.game.BaseSimulator;
import com.gamearena.game.GameResult;
import com.gamearena.game.GameType;
import com.gamearena.game.MatchAbortedException;
import com.gamearena.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Turn-based duel between two fighters.
 *
 * <p>Each turn both fighters act once, the faster first (A on a tie). A
 * fighter's sub-turn starts by ticking its damage-over-time and modifiers
 * and dropping its guard, then the provider picks one affordable ability.
 * The duel ends on a knockout or after the turn cap, where higher HP wins
 * and A takes an exact tie.
 */
public class CombatSimulator extends BaseSimulator {
    private static final Logger logger = LoggerFactory.getLogger(CombatSimulator.class);

    public static final int DEFAULT_MAX_TURNS = 20;

    private final ArchetypeCatalog catalog;
    private final int maxTurns;
    private final Map<String, String> overrides = new HashMap<>();
    private final Map<String, String> personalities = new HashMap<>();

    // Fighters of the current or last duel, in seat order
    private final Map<String, Fighter> fighters = new LinkedHashMap<>();

    public CombatSimulator(DecisionProvider provider, GameRng rng, ArchetypeCatalog catalog, int maxTurns) {
        super(provider, rng);
        if (catalog == null) {
            throw new IllegalArgumentException("Archetype catalog cannot be null");
        }
        if (maxTurns < 1) {
            throw new IllegalArgumentException("Max turns must be positive: " + maxTurns);
        }
        this.catalog = catalog;
        this.maxTurns = maxTurns;
    }

    public CombatSimulator(DecisionProvider provider, GameRng rng, ArchetypeCatalog catalog) {
        this(provider, rng, catalog, DEFAULT_MAX_TURNS);
    }

    @Override
    public GameType getGameType() {
        return GameType.COMBAT;
    }

    @Override
    public String getStateSummary() {
        if (fighters.isEmpty()) {
            return "No battle in progress";
        }
        List<String> parts = new ArrayList<>();
        for (Fighter fighter : fighters.values()) {
            parts.add(fighter.statusLine());
        }
        return String.join(" | ", parts);
    }

    /**
     * Force a player's archetype, ahead of any personality.
     * @throws IllegalArgumentException if the archetype is unknown
     */
    public void setArchetypeOverride(String player, String archetypeKey) {
        overrides.put(player, catalog.get(archetypeKey).key());
    }

    /**
     * Record a player's personality, used to pick an archetype when there is no override.
     */
    public void setPersonality(String player, String personality) {
        personalities.put(player, personality);
    }

    /**
     * Override first, then personality, then a seeded random pick.
     */
    Archetype pickArchetype(String player) {
        String override = overrides.get(player);
        if (override != null) {
            return catalog.get(override);
        }
        return catalog.forPersonality(personalities.get(player))
                .orElseGet(() -> catalog.get(rng.pick(catalog.keys())));
    }

    @Override
    public GameResult play(String playerA, String playerB, double wager) throws MatchAbortedException {
        if (playerA == null || playerB == null || playerA.equals(playerB)) {
            throw new IllegalArgumentException("Two distinct players are required");
        }
        if (wager <= 0) {
            throw new IllegalArgumentException("Wager must be positive: " + wager);
        }

        beginMatch();
        fighters.clear();
        Fighter fighterA = new Fighter(playerA, pickArchetype(playerA));
        Fighter fighterB = new Fighter(playerB, pickArchetype(playerB));
        fighters.put(playerA, fighterA);
        fighters.put(playerB, fighterB);
        List<TurnRecord> turnLog = new ArrayList<>();

        logger.info("Combat: {} ({}) vs {} ({}), wager={}", playerA, fighterA.getArchetype().displayName(),
                playerB, fighterB.getArchetype().displayName(), String.format(Locale.ROOT, "%.4f", wager));

        Map<String, Object> init = new LinkedHashMap<>();
        init.put("player_a", playerA);
        init.put("player_b", playerB);
        init.put("archetype_a", fighterA.getArchetype().key());
        init.put("archetype_b", fighterB.getArchetype().key());
        init.put("max_hp_a", fighterA.getMaxHp());
        init.put("max_hp_b", fighterB.getMaxHp());
        emit("combat_init", init);

        int turnsElapsed = 0;
        for (int turn = 1; turn <= maxTurns; turn++) {
            turnsElapsed = turn;
            List<Fighter> order = fighterA.effective(Stat.SPEED) >= fighterB.effective(Stat.SPEED)
                    ? List.of(fighterA, fighterB)
                    : List.of(fighterB, fighterA);

            for (Fighter attacker : order) {
                Fighter defender = attacker == fighterA ? fighterB : fighterA;
                if (!attacker.isAlive() || !defender.isAlive()) {
                    break;
                }

                int dotDamage = attacker.tickDamageOverTime();
                if (dotDamage > 0) {
                    logger.debug("  Turn {}: {} takes {} DoT damage (HP: {})", turn, attacker.getPlayer(),
                            dotDamage, attacker.getHp());
                    if (!attacker.isAlive()) {
                        break;
                    }
                }
                attacker.tickModifiers();
                attacker.setDefending(false);

                Ability ability = chooseAbility(attacker, defender, turn);
                TurnRecord record = CombatResolver.resolve(turn, ability, attacker, defender);
                turnLog.add(record);
                logger.debug("  Turn {}: {} uses {} -> {} ({} | {})", turn, attacker.getPlayer(), ability.name(),
                        record.effect(), fighterA.statusLine(), fighterB.statusLine());

                Map<String, Object> event = new LinkedHashMap<>();
                event.put("turn", turn);
                event.put("actor", attacker.getPlayer());
                event.put("ability", ability.name());
                event.put("effect", record.effect());
                event.put("damage", record.damage());
                event.put("hp_a", fighterA.getHp());
                event.put("hp_b", fighterB.getHp());
                event.put("mp_a", fighterA.getMp());
                event.put("mp_b", fighterB.getMp());
                emit("combat_turn", event);

                if (!defender.isAlive()) {
                    break;
                }
            }

            if (!fighterA.isAlive() || !fighterB.isAlive()) {
                break;
            }
        }

        Fighter winner;
        if (fighterA.isAlive() != fighterB.isAlive()) {
            winner = fighterA.isAlive() ? fighterA : fighterB;
        } else {
            // Equal HP goes to A
            winner = fighterB.getHp() > fighterA.getHp() ? fighterB : fighterA;
        }
        Fighter loser = winner == fighterA ? fighterB : fighterA;
        String winMethod = loser.isAlive() ? CombatDetails.HP_ADVANTAGE : CombatDetails.KO;

        logger.info("  WINNER: {} by {}", winner.getPlayer(), winMethod);
        logger.debug("  Final: {} | {}", fighterA.statusLine(), fighterB.statusLine());

        Map<String, Object> end = new LinkedHashMap<>();
        end.put("winner", winner.getPlayer());
        end.put("win_method", winMethod);
        end.put("final_hp_a", fighterA.getHp());
        end.put("final_hp_b", fighterB.getHp());
        emit("combat_end", end);

        CombatDetails details = new CombatDetails(
                fighterA.getArchetype().key(),
                fighterB.getArchetype().key(),
                fighterA.getHp(),
                fighterB.getHp(),
                fighterA.getMaxHp(),
                fighterB.getMaxHp(),
                fighterA.getMp(),
                fighterB.getMp(),
                turnsElapsed,
                winMethod,
                turnLog
        );
        return new GameResult(GameType.COMBAT, winner.getPlayer(), loser.getPlayer(), wager, details,
                turnLog.size(), decisions());
    }

    private Ability chooseAbility(Fighter attacker, Fighter defender, int turn) throws MatchAbortedException {
        List<Ability> affordable = attacker.affordableAbilities();
        List<AbilityOption> options = new ArrayList<>();
        List<String> names = new ArrayList<>();
        for (Ability ability : affordable) {
            options.add(ability.toOption());
            names.add(ability.name());
        }

        String player = attacker.getPlayer();
        CombatAbilityRequest request = new CombatAbilityRequest(
                player, attacker.toStatus(), defender.toStatus(), options, turn, maxTurns);
        CombatAbilityResponse raw = consult(player, request, provider::decideCombatAbility);
        DecisionValidator.Validated<CombatChoice> validated = DecisionValidator.validateAbility(raw, names);
        record(player, "turn " + turn, request, validated);
        return attacker.getArchetype().ability(validated.value().ability());
    }
}
