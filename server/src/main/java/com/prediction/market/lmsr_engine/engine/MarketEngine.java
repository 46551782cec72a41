package com.prediction.market.lmsr_engine.engine;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.UUID;

import com.prediction.market.lmsr_engine.cache.BetStore;
import com.prediction.market.lmsr_engine.cache.MarketStore;
import com.prediction.market.lmsr_engine.entity.Bet;
import com.prediction.market.lmsr_engine.entity.BetStatus;
import com.prediction.market.lmsr_engine.entity.LedgerEntryType;
import com.prediction.market.lmsr_engine.entity.Market;
import com.prediction.market.lmsr_engine.entity.Money;
import com.prediction.market.lmsr_engine.entity.Side;
import com.prediction.market.lmsr_engine.entity.TradeRequest;
import com.prediction.market.lmsr_engine.entity.TradeResult;
import com.prediction.market.lmsr_engine.entity.TradeStatus;
import com.prediction.market.lmsr_engine.exception.InsufficientSharesException;
import com.prediction.market.lmsr_engine.exception.MarketClosedException;
import com.prediction.market.lmsr_engine.exception.NotFoundException;
import com.prediction.market.lmsr_engine.exception.UndoNotAllowedException;
import com.prediction.market.lmsr_engine.model.BuyQuote;
import com.prediction.market.lmsr_engine.model.MarketSnapshot;
import com.prediction.market.lmsr_engine.model.SellQuote;
import com.prediction.market.lmsr_engine.service.LedgerService;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Executes one trade request against market state, bets and the ledger.
 *
 * Called only from the market's executor thread, and always under the market
 * lock, so the state a trade reads is exactly the state the previous trade
 * left behind. Failures are thrown as {@code MarketException}s and turned into
 * failed results by the executor.
 */
@Slf4j
@RequiredArgsConstructor
public class MarketEngine {
    // Aggregate holdings may trail the requested amount by float noise.
    private static final double SHARE_TOLERANCE = 1e-9;

    private final MarketStore marketStore;
    private final BetStore betStore;
    private final LedgerService ledgerService;
    private final PricingEngine pricingEngine;
    private final Clock clock;

    public TradeResult executeTrade(TradeRequest request) {
        return marketStore.withLock(request.getMarketId(), () -> switch (request.getKind()) {
            case BUY -> executeBuy(request);
            case SELL -> executeSell(request);
            case UNDO -> executeUndo(request);
        });
    }

    /**
     * Debit, move exposure, record the bet. Either all three happen or none.
     */
    private TradeResult executeBuy(TradeRequest request) {
        String marketId = request.getMarketId();
        String wallet = request.getWallet();
        Side side = request.getSide();
        requireOpen(marketId);

        Money amount = Money.of(request.getAmount());
        MarketSnapshot before = marketStore.snapshot(marketId);
        BuyQuote quote = pricingEngine.quoteBuy(before, side, amount.toDouble());

        String betId = UUID.randomUUID().toString();
        Money balanceAfter = ledgerService.debit(wallet, amount, LedgerEntryType.BUY, marketId,
                request.getRequestId(), betId);

        MarketSnapshot after = null;
        try {
            after = marketStore.apply(marketId, deltaYes(side, quote.shares()), deltaNo(side, quote.shares()));

            long now = clock.millis();
            Bet bet = Bet.builder()
                    .id(betId)
                    .marketId(marketId)
                    .wallet(wallet)
                    .side(side)
                    .amount(amount.toBigDecimal())
                    .originalAmount(amount.toBigDecimal())
                    .shares(quote.shares())
                    .originalShares(quote.shares())
                    .averagePrice(quote.averagePrice())
                    .realizedProceeds(Money.ZERO.toBigDecimal())
                    .marketSequence(after.sequence())
                    .exposureBefore(before.exposure(side))
                    .requestId(request.getRequestId())
                    .createdAt(now)
                    .updatedAt(now)
                    .build();
            betStore.add(bet);

            log.info("Bet placed: market={}, side={}, amount={}, shares={}, avgPrice={}, wallet={}",
                    marketId, side, amount, String.format("%.4f", quote.shares()),
                    String.format("%.4f", quote.averagePrice()), wallet);

            return completed(request, bet.getId(), quote.shares(), quote.averagePrice(), amount, balanceAfter, after);
        } catch (RuntimeException e) {
            // Compensate whatever already happened so the buy has no partial effect
            if (after != null) {
                marketStore.restore(marketId, side, before.exposure(side));
            }
            ledgerService.credit(wallet, amount, LedgerEntryType.UNDO_REFUND, marketId, request.getRequestId(), betId);
            log.error("Buy failed after debit, compensated: requestId={}, market={}", request.getRequestId(), marketId, e);
            throw e;
        }
    }

    /**
     * Return shares to the market. Draws from the named bet, or from the
     * wallet's open bets on that side oldest first.
     */
    private TradeResult executeSell(TradeRequest request) {
        String marketId = request.getMarketId();
        String wallet = request.getWallet();
        requireOpen(marketId);

        List<Bet> sources;
        Side side;
        if (request.getBetId() != null) {
            Bet bet = ownedBet(request.getBetId(), wallet, marketId);
            if (!bet.isOpen()) {
                throw new InsufficientSharesException("Bet " + bet.getId() + " has no open shares (" + bet.getStatus() + ")");
            }
            side = bet.getSide();
            sources = List.of(bet);
        } else {
            side = request.getSide();
            sources = betStore.openBets(marketId, wallet, side);
        }

        double held = sources.stream().mapToDouble(Bet::getShares).sum();
        double requested = request.getShares();
        if (requested > held + SHARE_TOLERANCE) {
            throw new InsufficientSharesException(String.format(
                    "Cannot sell %.4f %s shares, holding %.4f", requested, side, held));
        }
        double shares = Math.min(requested, held);

        MarketSnapshot before = marketStore.snapshot(marketId);
        SellQuote quote = pricingEngine.quoteSell(before, side, shares);
        Money proceeds = Money.of(quote.proceeds());
        List<Allocation> allocations = allocate(sources, shares, proceeds);

        MarketSnapshot after = marketStore.apply(marketId, -deltaYes(side, shares), -deltaNo(side, shares));
        List<Allocation> credited = new ArrayList<>();
        Money balanceAfter = null;
        try {
            for (Allocation allocation : allocations) {
                balanceAfter = ledgerService.credit(wallet, allocation.proceeds(), LedgerEntryType.SELL, marketId,
                        request.getRequestId(), allocation.bet().getId());
                credited.add(allocation);
            }
            long now = clock.millis();
            for (Allocation allocation : allocations) {
                allocation.bet().reduce(allocation.shares(), allocation.proceeds(), now);
                betStore.markModified(allocation.bet());
            }
        } catch (RuntimeException e) {
            marketStore.restore(marketId, side, before.exposure(side));
            reverseCredits(wallet, marketId, request.getRequestId(), credited, e);
            log.error("Sell failed after pricing, compensated: requestId={}, market={}",
                    request.getRequestId(), marketId, e);
            throw e;
        }

        log.info("Shares sold: market={}, side={}, shares={}, proceeds={}, wallet={}",
                marketId, side, String.format("%.4f", shares), proceeds, wallet);

        String betId = sources.size() == 1 ? sources.get(0).getId() : null;
        return completed(request, betId, shares, quote.averagePrice(), proceeds, balanceAfter, after);
    }

    /**
     * Compensate a buy: put its side's exposure back and refund its amount.
     *
     * Only the most recent mutation of a market can be reversed this way. Once
     * another trade has run, reversing the buy would no longer price the same,
     * so the undo is refused.
     */
    private TradeResult executeUndo(TradeRequest request) {
        String marketId = request.getMarketId();
        String wallet = request.getWallet();
        Bet bet = ownedBet(request.getBetId(), wallet, marketId);
        requireOpen(marketId);

        if (bet.getStatus() == BetStatus.VOID) {
            throw new UndoNotAllowedException("Bet " + bet.getId() + " was already undone");
        }
        if (!bet.isOpen()) {
            throw new UndoNotAllowedException("Bet " + bet.getId() + " is " + bet.getStatus());
        }
        if (bet.isPartiallySold()) {
            throw new UndoNotAllowedException("Bet " + bet.getId() + " was partially sold");
        }
        MarketSnapshot current = marketStore.snapshot(marketId);
        if (current.sequence() != bet.getMarketSequence()) {
            throw new UndoNotAllowedException("Market " + marketId + " has traded since bet " + bet.getId());
        }

        Side side = bet.getSide();
        MarketSnapshot after = marketStore.restore(marketId, side, bet.getExposureBefore());

        Money refund = bet.amount();
        Money balanceAfter = ledgerService.credit(wallet, refund, LedgerEntryType.UNDO_REFUND, marketId,
                request.getRequestId(), bet.getId());

        bet.transitionTo(BetStatus.VOID, clock.millis());
        betStore.markModified(bet);

        log.info("Bet {} undone: refunded {} to {}", bet.getId(), refund, wallet);
        return completed(request, bet.getId(), bet.getShares(), bet.getAveragePrice(), refund, balanceAfter, after);
    }

    /**
     * Split a sale across the source bets oldest first. Proceeds follow the
     * shares taken from each bet; the last bet drawn gets the rounding remainder.
     */
    private static List<Allocation> allocate(List<Bet> sources, double shares, Money proceeds) {
        List<Allocation> allocations = new ArrayList<>();
        double remaining = shares;
        Money allocated = Money.ZERO;
        for (Bet bet : sources) {
            if (remaining <= 0) {
                break;
            }
            double take = Math.min(bet.getShares(), remaining);
            remaining -= take;
            Money share = remaining <= 0
                    ? proceeds.subtract(allocated)
                    : proceeds.multiply(take / shares);
            allocated = allocated.add(share);
            allocations.add(new Allocation(bet, take, share));
        }
        return allocations;
    }

    private void reverseCredits(String wallet, String marketId, String requestId, List<Allocation> credited,
            RuntimeException cause) {
        for (Allocation allocation : credited) {
            try {
                ledgerService.debit(wallet, allocation.proceeds(), LedgerEntryType.SELL_REVERSAL, marketId, requestId,
                        allocation.bet().getId());
            } catch (RuntimeException e) {
                cause.addSuppressed(e);
                log.error("Could not reverse sell credit of {} to {} for bet {}",
                        allocation.proceeds(), wallet, allocation.bet().getId(), e);
            }
        }
    }

    private Market requireOpen(String marketId) {
        Market market = marketStore.getMarket(marketId);
        if (!market.isOpen()) {
            throw new MarketClosedException("Market " + marketId + " is not open");
        }
        return market;
    }

    private Bet ownedBet(String betId, String wallet, String marketId) {
        return betStore.findBet(betId)
                .filter(bet -> bet.getWallet().equals(wallet) && bet.getMarketId().equals(marketId))
                .orElseThrow(() -> new NotFoundException("Bet not found: " + betId));
    }

    private TradeResult completed(TradeRequest request, String betId, double shares, double averagePrice,
            Money amount, Money balanceAfter, MarketSnapshot after) {
        var prices = pricingEngine.getPrices(after);
        return TradeResult.queued(request).toBuilder()
                .status(TradeStatus.DONE)
                .success(true)
                .betId(betId)
                .shares(shares)
                .averagePrice(averagePrice)
                .amount(amount.toBigDecimal())
                .balanceAfter(balanceAfter.toBigDecimal())
                .yesPrice(prices.yesPrice())
                .noPrice(prices.noPrice())
                .completedAt(clock.millis())
                .build();
    }

    private record Allocation(Bet bet, double shares, Money proceeds) {
    }

    private static double deltaYes(Side side, double shares) {
        return side == Side.YES ? shares : 0.0;
    }

    private static double deltaNo(Side side, double shares) {
        return side == Side.NO ? shares : 0.0;
    }
}
