package com.gamearena.auction;

import com.gamearena.decision.AuctionBid;
import com.gamearena.decision.AuctionBidRequest;
import com.gamearena.decision.AuctionBidResponse;
import com.gamearena.decision.BidHistoryEntry;
import com.gamearena.decision.DecisionProvider;
import com.gamearena.decision.DecisionValidator;
import com.gamearena.decision.PlayerContext;
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
 * Multi-round sealed-bid auction between two players.
 *
 * <p>Both players start with the wager as budget. Each round draws an item
 * and a hidden true value; the higher bid wins and pays its bid, and the
 * winner books {@code trueValue - bid} as profit. Whoever ends with more
 * profit wins the match, A on a tie.
 */
public class AuctionSimulator extends BaseSimulator {
    private static final Logger logger = LoggerFactory.getLogger(AuctionSimulator.class);

    public static final int DEFAULT_ROUNDS = 5;
    private static final int NUM_BIDDERS = 2;

    private final AuctionCatalog catalog;
    private final int totalRounds;
    private final List<AuctionRound> completed = new ArrayList<>();

    public AuctionSimulator(DecisionProvider provider, GameRng rng, AuctionCatalog catalog, int rounds) {
        super(provider, rng);
        if (catalog == null) {
            throw new IllegalArgumentException("Auction catalog cannot be null");
        }
        if (rounds < 1) {
            throw new IllegalArgumentException("An auction needs at least one round: " + rounds);
        }
        this.catalog = catalog;
        this.totalRounds = rounds;
    }

    public AuctionSimulator(DecisionProvider provider, GameRng rng, AuctionCatalog catalog) {
        this(provider, rng, catalog, DEFAULT_ROUNDS);
    }

    @Override
    public GameType getGameType() {
        return GameType.AUCTION;
    }

    @Override
    public String getStateSummary() {
        return "Auction: " + completed.size() + "/" + totalRounds + " rounds completed";
    }

    public int getTotalRounds() {
        return totalRounds;
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
        completed.clear();
        List<String> players = List.of(playerA, playerB);
        Map<String, Double> budgets = new LinkedHashMap<>();
        Map<String, Double> profits = new LinkedHashMap<>();
        Map<String, List<BidHistoryEntry>> histories = new LinkedHashMap<>();
        for (String player : players) {
            budgets.put(player, wager);
            profits.put(player, 0.0);
            histories.put(player, new ArrayList<>());
        }

        logger.info("Auction: {} vs {}, budget={} each", playerA, playerB, fmt(wager));

        for (int round = 1; round <= totalRounds; round++) {
            AuctionItem item = rng.pick(catalog.getItems());
            double trueValue = rng.uniform(item.minValue(), item.maxValue());
            logger.debug("  Round {}: {} (true value {}, range {}-{})", round, item.name(),
                    fmt(trueValue), item.minValue(), item.maxValue());

            Map<String, Double> bids = new LinkedHashMap<>();
            for (String player : players) {
                PlayerContext context = getPlayerContext(player);
                AuctionBidRequest request = new AuctionBidRequest(
                        player,
                        item.name(),
                        item.estimatedValue(),
                        item.minValue(),
                        item.maxValue(),
                        budgets.get(player),
                        NUM_BIDDERS,
                        round,
                        totalRounds,
                        histories.get(player),
                        context.opponentSummary(),
                        context.bankrollSummary()
                );
                AuctionBidResponse raw = consult(player, request, provider::decideAuctionBid);
                DecisionValidator.Validated<AuctionBid> validated =
                        DecisionValidator.validateBid(raw, budgets.get(player));
                record(player, "round " + round, request, validated);
                bids.put(player, validated.value().bidAmount());
            }

            double bidA = bids.get(playerA);
            double bidB = bids.get(playerB);
            String roundWinner;
            if (bidA > bidB) {
                roundWinner = playerA;
            } else if (bidB > bidA) {
                roundWinner = playerB;
            } else {
                roundWinner = rng.coinFlip() ? playerA : playerB;
            }
            double winningBid = bids.get(roundWinner);
            double profit = trueValue - winningBid;
            profits.merge(roundWinner, profit, Double::sum);
            budgets.merge(roundWinner, -winningBid, Double::sum);

            logger.debug("    Bids: {}={} {}={}", playerA, fmt(bidA), playerB, fmt(bidB));
            logger.debug("    Winner: {} (bid={}, value={}, profit={})", roundWinner, fmt(winningBid),
                    fmt(trueValue), String.format(Locale.ROOT, "%+.4f", profit));

            AuctionRound settled = new AuctionRound(round, item.name(), item.minValue(), item.maxValue(),
                    trueValue, bids, roundWinner, winningBid, profit);
            completed.add(settled);

            for (String player : players) {
                boolean won = player.equals(roundWinner);
                histories.get(player).add(new BidHistoryEntry(
                        round, item.name(), bids.get(player), winningBid, won, won ? trueValue : null));
            }

            Map<String, Object> event = new LinkedHashMap<>();
            event.put("round", round);
            event.put("item", item.name());
            event.put("bids", new LinkedHashMap<>(bids));
            event.put("winner", roundWinner);
            event.put("winning_bid", winningBid);
            event.put("true_value", trueValue);
            event.put("profit", profit);
            emit("auction_round", event);
        }

        double profitA = profits.get(playerA);
        double profitB = profits.get(playerB);
        // Equal profit goes to A
        String winner = profitB > profitA ? playerB : playerA;
        String loser = winner.equals(playerA) ? playerB : playerA;

        logger.info("  Final: {} profit={}, {} profit={}; winner {}", playerA,
                String.format(Locale.ROOT, "%+.4f", profitA), playerB,
                String.format(Locale.ROOT, "%+.4f", profitB), winner);

        Map<String, Object> end = new LinkedHashMap<>();
        end.put("winner", winner);
        end.put("profits", new LinkedHashMap<>(profits));
        emit("auction_end", end);

        AuctionDetails details = new AuctionDetails(completed, profits, budgets, AuctionDetails.PROFIT);
        return new GameResult(GameType.AUCTION, winner, loser, wager, details, totalRounds, decisions());
    }

    private static String fmt(double amount) {
        return String.format(Locale.ROOT, "%.4f", amount);
    }
}
