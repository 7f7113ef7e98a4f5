package com.gamearena.poker;

import com.gamearena.card.Card;
import com.gamearena.card.Deck;
import com.gamearena.card.HandEvaluator;
import com.gamearena.card.HandScore;
import com.gamearena.decision.DecisionProvider;
import com.gamearena.decision.DecisionValidator;
import com.gamearena.decision.PlayerContext;
import com.gamearena.decision.PokerAction;
import com.gamearena.decision.PokerActionRequest;
import com.gamearena.decision.PokerActionResponse;
import com.gamearena.decision.PokerDecision;
import com.gamearena.game.BaseSimulator;
import com.gamearena.game.GameResult;
import com.gamearena.game.GameType;
import com.gamearena.game.MatchAbortedException;
import com.gamearena.rng.GameRng;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Heads-up Texas Hold'em: one hand over four streets.
 *
 * <p>Player A posts the small blind and acts first on every street; player B
 * posts the big blind. Each street allows at most {@value #MAX_PASSES} passes
 * over both players, and raises on the last pass are turned into calls, so a
 * street always closes with nothing owed. An exact showdown tie goes to A.
 */
public class PokerSimulator extends BaseSimulator {
    private static final Logger logger = LoggerFactory.getLogger(PokerSimulator.class);

    public static final double DEFAULT_BLIND_FRACTION = 0.05;
    public static final int MAX_PASSES = 4;

    // Stack remainders smaller than this are swept into the pot
    private static final double CHIP_DUST = 1e-9;

    private static final int SEAT_A = 0;
    private static final int SEAT_B = 1;

    private final double blindFraction;
    private final Deck deck;

    // Per-hand state, rebuilt by play()
    private final String[] players = new String[2];
    private final double[] stacks = new double[2];
    private final List<List<Card>> hands = new ArrayList<>(List.of(List.of(), List.of()));
    private final List<Card> board = new ArrayList<>();
    private final List<PokerActionRecord> actions = new ArrayList<>();
    private double pot;
    private double smallBlind;
    private double bigBlind;
    private double preflopShortfall;

    public PokerSimulator(DecisionProvider provider, GameRng rng, double blindFraction) {
        super(provider, rng);
        if (blindFraction <= 0 || blindFraction >= 0.5) {
            throw new IllegalArgumentException("Blind fraction must be in (0, 0.5): " + blindFraction);
        }
        this.blindFraction = blindFraction;
        this.deck = new Deck(this.rng);
    }

    public PokerSimulator(DecisionProvider provider, GameRng rng) {
        this(provider, rng, DEFAULT_BLIND_FRACTION);
    }

    @Override
    public GameType getGameType() {
        return GameType.POKER;
    }

    @Override
    public String getStateSummary() {
        return String.format(Locale.ROOT, "Pot: %.4f | Board: %s", pot, Card.describe(board));
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
        deck.reset();
        board.clear();
        actions.clear();
        players[SEAT_A] = playerA;
        players[SEAT_B] = playerB;
        stacks[SEAT_A] = wager;
        stacks[SEAT_B] = wager;
        hands.set(SEAT_A, deck.deal(2));
        hands.set(SEAT_B, deck.deal(2));

        smallBlind = wager * blindFraction;
        bigBlind = smallBlind * 2;
        double sbPosted = Math.min(smallBlind, stacks[SEAT_A]);
        double bbPosted = Math.min(bigBlind, stacks[SEAT_B]);
        stacks[SEAT_A] -= sbPosted;
        stacks[SEAT_B] -= bbPosted;
        pot = sbPosted + bbPosted;
        preflopShortfall = Math.max(0.0, bbPosted - sbPosted);

        logger.info("Poker: {} vs {}, wager={}", playerA, playerB, fmt(wager));
        logger.debug("  Hands: {}=[{}] {}=[{}]", playerA, Card.describe(hands.get(SEAT_A)),
                playerB, Card.describe(hands.get(SEAT_B)));
        logger.debug("  Blinds: SB={} BB={}", fmt(sbPosted), fmt(bbPosted));

        Map<String, Object> init = new LinkedHashMap<>();
        init.put("player_a", playerA);
        init.put("player_b", playerB);
        init.put("wager", wager);
        init.put("small_blind", sbPosted);
        init.put("big_blind", bbPosted);
        emit("poker_init", init);

        Integer folded = null;
        for (Street street : Street.values()) {
            if (street.getCardsToDeal() > 0) {
                board.addAll(deck.deal(street.getCardsToDeal()));
            }
            logger.debug("  --- {} --- board=[{}] pot={}", street.getName().toUpperCase(Locale.ROOT),
                    Card.describe(board), fmt(pot));
            emit("poker_street", Map.of("street", street.getName(), "board", Card.describe(board), "pot", pot));

            folded = runBettingRound(street);
            if (folded != null) {
                break;
            }
        }

        return finish(wager, folded);
    }

    /**
     * Run one street of betting.
     *
     * @return the seat that folded, or null if the street closed normally
     */
    private Integer runBettingRound(Street street) throws MatchAbortedException {
        BettingState betting = new BettingState(street == Street.PREFLOP ? preflopShortfall : 0.0);

        for (int pass = 0; pass < MAX_PASSES; pass++) {
            boolean raiseAllowed = pass < MAX_PASSES - 1;

            for (int seat = SEAT_A; seat <= SEAT_B; seat++) {
                int opponent = 1 - seat;

                if (betting.isSettled(seat)) {
                    continue;
                }
                if (stacks[seat] <= 0) {
                    // All-in: nothing more to pay, nothing to decide
                    betting.setToCall(seat, 0.0);
                    betting.markActed(seat);
                    continue;
                }

                String player = players[seat];
                double owed = betting.getToCall(seat);
                PlayerContext context = getPlayerContext(player);
                PokerActionRequest request = new PokerActionRequest(
                        player,
                        hands.get(seat),
                        board,
                        pot,
                        stacks[seat],
                        stacks[opponent],
                        seat == SEAT_A ? "SB" : "BB",
                        owed,
                        bigBlind,
                        street.getName(),
                        context.opponentSummary(),
                        context.bankrollSummary()
                );

                PokerActionResponse raw = consult(player, request, provider::decidePokerAction);
                double callAmount = Math.min(owed, stacks[seat]);
                DecisionValidator.Validated<PokerDecision> validated = DecisionValidator.validatePoker(
                        raw, owed, bigBlind, stacks[seat] - callAmount, raiseAllowed);
                record(player, street.getName(), request, validated);
                PokerDecision decision = validated.value();

                double paid = 0.0;
                switch (decision.action()) {
                    case FOLD -> {
                        logger.debug("    {}: FOLD", player);
                    }
                    case CALL -> {
                        paid = pay(seat, callAmount);
                        betting.setToCall(seat, 0.0);
                        betting.markActed(seat);
                        if (paid > 0) {
                            logger.debug("    {}: CALL {} (pot={})", player, fmt(paid), fmt(pot));
                        } else {
                            logger.debug("    {}: CHECK", player);
                        }
                    }
                    case RAISE -> {
                        paid = pay(seat, callAmount);
                        double raised = pay(seat, decision.raiseAmount());
                        paid += raised;
                        betting.setToCall(opponent, raised);
                        betting.setToCall(seat, 0.0);
                        betting.markActed(seat);
                        logger.debug("    {}: RAISE {} (pot={})", player, fmt(raised), fmt(pot));
                    }
                }

                PokerActionRecord applied = new PokerActionRecord(street, player, decision.action(), paid,
                        decision.raiseAmount(), pot, decision.bluffProbability());
                actions.add(applied);

                Map<String, Object> event = new LinkedHashMap<>();
                event.put("street", street.getName());
                event.put("player", player);
                event.put("action", decision.action().getJsonValue());
                event.put("amount", paid);
                event.put("pot", pot);
                emit("poker_action", event);

                if (decision.action() == PokerAction.FOLD) {
                    return seat;
                }
            }

            if (betting.isComplete()) {
                break;
            }
        }
        return null;
    }

    private double pay(int seat, double amount) {
        double moved = Math.min(Math.max(amount, 0.0), stacks[seat]);
        if (stacks[seat] - moved < CHIP_DUST) {
            moved = stacks[seat];
        }
        stacks[seat] -= moved;
        pot += moved;
        return moved;
    }

    private GameResult finish(double wager, Integer folded) {
        String playerA = players[SEAT_A];
        String playerB = players[SEAT_B];
        int winnerSeat;
        String winMethod;
        String handAName;
        String handBName;
        HandScore scoreA = null;
        HandScore scoreB = null;

        if (folded != null) {
            winnerSeat = 1 - folded;
            winMethod = PokerDetails.FOLD;
            handAName = folded == SEAT_A ? "folded" : "";
            handBName = folded == SEAT_B ? "folded" : "";
        } else {
            scoreA = HandEvaluator.score(concat(hands.get(SEAT_A), board));
            scoreB = HandEvaluator.score(concat(hands.get(SEAT_B), board));
            handAName = scoreA.category().getDisplayName();
            handBName = scoreB.category().getDisplayName();
            // Exact tie goes to A
            winnerSeat = scoreB.beats(scoreA) ? SEAT_B : SEAT_A;
            winMethod = PokerDetails.SHOWDOWN;
            logger.debug("  SHOWDOWN: {}=[{}] {} vs {}=[{}] {}",
                    playerA, Card.describe(hands.get(SEAT_A)), handAName,
                    playerB, Card.describe(hands.get(SEAT_B)), handBName);
        }

        String winner = players[winnerSeat];
        String loser = players[1 - winnerSeat];
        logger.info("  WINNER: {} by {}, pot={}", winner, winMethod, fmt(pot));

        Map<String, Object> end = new LinkedHashMap<>();
        end.put("winner", winner);
        end.put("win_method", winMethod);
        end.put("pot", pot);
        emit("poker_end", end);

        PokerDetails details = new PokerDetails(
                Card.describe(hands.get(SEAT_A)),
                Card.describe(hands.get(SEAT_B)),
                handAName,
                handBName,
                Card.describe(board),
                pot,
                smallBlind,
                bigBlind,
                stacks[SEAT_A],
                stacks[SEAT_B],
                scoreA,
                scoreB,
                winMethod,
                actions
        );
        return new GameResult(GameType.POKER, winner, loser, wager, details, actions.size(), decisions());
    }

    private static List<Card> concat(List<Card> hole, List<Card> shared) {
        List<Card> all = new ArrayList<>(hole);
        all.addAll(shared);
        return all;
    }

    private static String fmt(double amount) {
        return String.format(Locale.ROOT, "%.4f", amount);
    }
}
