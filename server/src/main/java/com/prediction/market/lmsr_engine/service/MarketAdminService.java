package com.prediction.market.lmsr_engine.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.prediction.market.lmsr_engine.cache.BetStore;
import com.prediction.market.lmsr_engine.cache.MarketStore;
import com.prediction.market.lmsr_engine.engine.PricingEngine;
import com.prediction.market.lmsr_engine.entity.Bet;
import com.prediction.market.lmsr_engine.entity.BetStatus;
import com.prediction.market.lmsr_engine.entity.Market;
import com.prediction.market.lmsr_engine.entity.MarketStatus;
import com.prediction.market.lmsr_engine.entity.Money;
import com.prediction.market.lmsr_engine.entity.Side;
import com.prediction.market.lmsr_engine.entity.TradeKind;
import com.prediction.market.lmsr_engine.entity.TradeRequest;
import com.prediction.market.lmsr_engine.entity.TradeResult;
import com.prediction.market.lmsr_engine.entity.User;
import com.prediction.market.lmsr_engine.exception.MarketException;
import com.prediction.market.lmsr_engine.exception.NotFoundException;
import com.prediction.market.lmsr_engine.exception.ValidationException;
import com.prediction.market.lmsr_engine.execution.MarketExecutionRegistry;
import com.prediction.market.lmsr_engine.model.ActivityItem;
import com.prediction.market.lmsr_engine.model.BalanceView;
import com.prediction.market.lmsr_engine.model.MarketSummary;
import com.prediction.market.lmsr_engine.model.UserDeletion;
import com.prediction.market.lmsr_engine.model.UserSummary;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Operator actions: the market catalog, wallet administration and the
 * recent-activity feed.
 *
 * Position sales made while deleting a wallet go through the market's
 * executor like any other trade.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class MarketAdminService {
    private static final int RECENT_ACTIVITY_LIMIT = 50;
    private static final Duration SALE_TIMEOUT = Duration.ofSeconds(30);

    private final MarketStore marketStore;
    private final BetStore betStore;
    private final LedgerService ledgerService;
    private final PricingEngine pricingEngine;
    private final MarketExecutionRegistry registry;
    private final Clock clock;

    public Market createMarket(String question, String description, String category, String createdBy, Long endTime) {
        return marketStore.createMarket(question, description, category, createdBy, endTime);
    }

    /**
     * Newest first.
     *
     * @param status only markets in this status, or all when null
     */
    public List<MarketSummary> listMarkets(MarketStatus status) {
        return marketStore.listMarkets(status).stream()
                .map(this::summarize)
                .toList();
    }

    public MarketSummary getMarketSummary(String marketId) {
        return summarize(marketStore.getMarket(marketId));
    }

    public BalanceView creditWallet(String wallet, BigDecimal amount) {
        if (amount == null) {
            throw new ValidationException("Amount is required");
        }
        ledgerService.adminCredit(wallet, Money.of(amount));
        return ledgerService.balanceOf(wallet);
    }

    /**
     * Every wallet with its betting totals, newest wallet first.
     */
    public List<UserSummary> listUsers() {
        List<Market> markets = marketStore.listMarkets(null);
        List<String> marketIds = markets.stream().map(Market::getId).toList();
        Set<String> openMarkets = idsOf(marketStore.listMarkets(MarketStatus.OPEN));
        return ledgerService.allUsers().stream()
                .map(user -> summarize(user, marketIds, openMarkets))
                .toList();
    }

    /**
     * The latest bets placed on open markets, newest first, with each market's
     * current YES probability.
     */
    public List<ActivityItem> recentActivity() {
        return marketStore.listMarkets(MarketStatus.OPEN).stream()
                .flatMap(market -> {
                    double probability = Math.round(
                            pricingEngine.getPrices(marketStore.snapshot(market.getId())).yesPrice() * 1000) / 10.0;
                    return betStore.betsForMarket(market.getId()).stream()
                            .filter(bet -> bet.getStatus() != BetStatus.VOID)
                            .map(bet -> new ActivityItem(bet.getId(), market.getId(), market.getQuestion(),
                                    bet.getSide(), bet.getOriginalAmount(), bet.getOriginalShares(),
                                    bet.getWallet(), probability, bet.getCreatedAt()));
                })
                .sorted(Comparator.comparingLong(ActivityItem::createdAt).reversed())
                .limit(RECENT_ACTIVITY_LIMIT)
                .toList();
    }

    /**
     * Sell every open position of the wallet at market, then remove its bets
     * and the wallet itself. A sale that fails is logged and counted; the
     * deletion still goes ahead.
     *
     * @throws NotFoundException if the wallet was never provisioned
     */
    public UserDeletion deleteUser(String wallet) {
        String key = LedgerService.normalize(wallet);
        if (ledgerService.findUser(key).isEmpty()) {
            throw new NotFoundException("User not found: " + key);
        }
        List<String> marketIds = marketStore.listMarkets(null).stream().map(Market::getId).toList();
        List<String> openMarkets = List.copyOf(idsOf(marketStore.listMarkets(MarketStatus.OPEN)));

        List<Bet> positions = betStore.betsForWallet(key, openMarkets).stream()
                .filter(Bet::isOpen)
                .toList();
        int sold = 0;
        int failed = 0;
        for (Bet bet : positions) {
            TradeResult result = sellPosition(key, bet);
            if (result.isSuccess()) {
                sold++;
            } else {
                failed++;
                log.warn("Could not sell bet {} of wallet {}: {} {}", bet.getId(), key,
                        result.getErrorKind(), result.getMessage());
            }
        }

        long removed = betStore.removeWallet(key, marketIds);
        ledgerService.deleteWallet(key);
        log.info("Deleted user {}: {} positions sold, {} sales failed, {} bets removed", key, sold, failed, removed);
        return new UserDeletion(key, sold, failed, (int) removed);
    }

    private TradeResult sellPosition(String wallet, Bet bet) {
        TradeRequest sale = TradeRequest.builder()
                .requestId(UUID.randomUUID().toString())
                .kind(TradeKind.SELL)
                .wallet(wallet)
                .marketId(bet.getMarketId())
                .side(bet.getSide())
                .betId(bet.getId())
                .shares(bet.getShares())
                .submittedAt(clock.millis())
                .build();
        try {
            return registry.submitTrackedTrade(sale).get(SALE_TIMEOUT.toMillis(), TimeUnit.MILLISECONDS);
        } catch (MarketException e) {
            return TradeResult.queued(sale).failed(e.getKind(), e.getMessage(), clock.millis());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new IllegalStateException("Interrupted while selling bet " + bet.getId(), e);
        } catch (ExecutionException e) {
            throw new IllegalStateException("Sale of bet " + bet.getId() + " failed", e.getCause());
        } catch (TimeoutException e) {
            throw new IllegalStateException("Timed out selling bet " + bet.getId(), e);
        }
    }

    private UserSummary summarize(User user, List<String> marketIds, Set<String> openMarkets) {
        Money staked = Money.ZERO;
        int totalBets = 0;
        int openPositions = 0;
        for (Bet bet : betStore.betsForWallet(user.getWallet(), marketIds)) {
            if (bet.getStatus() == BetStatus.VOID) {
                continue;
            }
            totalBets++;
            staked = staked.add(Money.ofNullable(bet.getOriginalAmount()));
            if (bet.isOpen() && openMarkets.contains(bet.getMarketId())) {
                openPositions++;
            }
        }
        return new UserSummary(user.getWallet(), user.getBalance(), user.getAuthStatus(), totalBets,
                staked.toBigDecimal(), openPositions, user.getCreatedAt(), user.getLastSeenAt());
    }

    private static Set<String> idsOf(List<Market> markets) {
        return markets.stream().map(Market::getId).collect(Collectors.toSet());
    }

    /**
     * Volume counts every bet that still stands; undone bets are excluded.
     */
    private MarketSummary summarize(Market market) {
        Money yesTotal = Money.ZERO;
        Money noTotal = Money.ZERO;
        int betCount = 0;
        for (Bet bet : betStore.betsForMarket(market.getId())) {
            if (bet.getStatus() == BetStatus.VOID) {
                continue;
            }
            Money original = Money.ofNullable(bet.getOriginalAmount());
            if (bet.getSide() == Side.YES) {
                yesTotal = yesTotal.add(original);
            } else {
                noTotal = noTotal.add(original);
            }
            betCount++;
        }
        return new MarketSummary(market.getId(), market.getQuestion(), market.getDescription(),
                market.getCategory(), market.getEndTime(), market.getStatus(), market.getResolution(),
                pricingEngine.getPrices(marketStore.snapshot(market.getId())),
                yesTotal.toBigDecimal(), noTotal.toBigDecimal(), betCount, market.getCreatedAt());
    }
}
