package com.prediction.market.lmsr_engine.service;

import java.math.BigDecimal;
import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Map;
import java.util.UUID;
import java.util.function.Function;
import java.util.stream.Collectors;

import org.springframework.stereotype.Service;

import com.prediction.market.lmsr_engine.cache.BetStore;
import com.prediction.market.lmsr_engine.cache.MarketStore;
import com.prediction.market.lmsr_engine.config.MarketProperties;
import com.prediction.market.lmsr_engine.engine.PricingEngine;
import com.prediction.market.lmsr_engine.entity.Bet;
import com.prediction.market.lmsr_engine.entity.Market;
import com.prediction.market.lmsr_engine.entity.Side;
import com.prediction.market.lmsr_engine.entity.TradeKind;
import com.prediction.market.lmsr_engine.entity.TradeRequest;
import com.prediction.market.lmsr_engine.entity.TradeResult;
import com.prediction.market.lmsr_engine.exception.MarketClosedException;
import com.prediction.market.lmsr_engine.exception.NotFoundException;
import com.prediction.market.lmsr_engine.exception.ValidationException;
import com.prediction.market.lmsr_engine.execution.MarketExecutionRegistry;
import com.prediction.market.lmsr_engine.execution.TradeResultStore;
import com.prediction.market.lmsr_engine.model.BalanceView;
import com.prediction.market.lmsr_engine.model.BetView;
import com.prediction.market.lmsr_engine.model.BuyQuote;
import com.prediction.market.lmsr_engine.model.MarketSnapshot;
import com.prediction.market.lmsr_engine.model.PriceQuote;
import com.prediction.market.lmsr_engine.model.SellPreview;
import com.prediction.market.lmsr_engine.model.SellQuote;
import com.prediction.market.lmsr_engine.model.SlippageReport;
import com.prediction.market.lmsr_engine.model.TradeCommand;
import com.prediction.market.lmsr_engine.model.TradePreview;
import com.prediction.market.lmsr_engine.model.TradeTicket;
import com.prediction.market.lmsr_engine.ratelimit.SubmissionRateLimiter;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Entry point for traders.
 *
 * Submission validates synchronously and returns a ticket right away; the
 * trade itself runs later on the market's queue and its outcome is read with
 * {@link #pollResult(String)}. Previews and prices read the latest published
 * snapshot and never block on trades in flight.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class TradeService {

    private final TradeValidator tradeValidator;
    private final SubmissionRateLimiter rateLimiter;
    private final MarketStore marketStore;
    private final BetStore betStore;
    private final LedgerService ledgerService;
    private final PricingEngine pricingEngine;
    private final MarketExecutionRegistry registry;
    private final TradeResultStore resultStore;
    private final MarketProperties properties;
    private final Clock clock;

    /**
     * Validate and enqueue a trade intent.
     *
     * @throws ValidationException   malformed intent
     * @throws NotFoundException     unknown market
     * @throws MarketClosedException market is resolved
     * @throws com.prediction.market.lmsr_engine.ratelimit.RateLimitExceededException
     *                               wallet is submitting too fast
     */
    public TradeTicket submitTrade(TradeCommand command) {
        tradeValidator.requireValid(command);
        String wallet = LedgerService.normalize(command.wallet());
        rateLimiter.acquire(wallet);

        Market market = marketStore.getMarket(command.marketId());
        if (!market.isOpen()) {
            throw new MarketClosedException("Market " + market.getId() + " is not open");
        }

        TradeRequest request = TradeRequest.builder()
                .requestId(UUID.randomUUID().toString())
                .kind(command.kind())
                .wallet(wallet)
                .marketId(market.getId())
                .side(command.side() == null ? null : Side.parse(command.side()))
                .amount(command.amount())
                .shares(command.shares() == null ? 0.0 : command.shares())
                .betId(command.betId())
                .submittedAt(clock.millis())
                .build();

        int position = registry.submitTrade(request);
        log.info("Queued {} {} on market {} for {} at position {}",
                request.getKind(), request.getRequestId(), market.getId(), wallet, position);
        return new TradeTicket(request.getRequestId(), market.getId(), position);
    }

    public TradeResult pollResult(String requestId) {
        return resultStore.get(requestId);
    }

    /**
     * Quote a buy against the current state without changing anything.
     */
    public TradePreview previewTrade(String marketId, String side, BigDecimal amount) {
        Side parsedSide = Side.parse(side);
        requireAmount(amount);
        MarketSnapshot snapshot = marketStore.snapshot(marketStore.getMarket(marketId).getId());

        BuyQuote quote = pricingEngine.quoteBuy(snapshot, parsedSide, amount.doubleValue());
        return new TradePreview(marketId, parsedSide, amount.doubleValue(), quote.shares(), quote.averagePrice(),
                pricingEngine.getPrices(snapshot), quote.pricesAfter(), registry.pendingTrades(marketId));
    }

    public SellPreview previewSell(String marketId, String side, double shares) {
        Side parsedSide = Side.parse(side);
        MarketSnapshot snapshot = marketStore.snapshot(marketStore.getMarket(marketId).getId());

        SellQuote quote = pricingEngine.quoteSell(snapshot, parsedSide, shares);
        return new SellPreview(marketId, parsedSide, shares, quote.proceeds(), quote.averagePrice(),
                quote.pricesAfter(), registry.pendingTrades(marketId));
    }

    public PriceQuote getPrice(String marketId) {
        marketStore.getMarket(marketId);
        return pricingEngine.getPrices(marketStore.snapshot(marketId));
    }

    public BalanceView getBalance(String wallet) {
        return ledgerService.balanceOf(wallet);
    }

    /**
     * Every bet of a wallet, newest first. Open bets carry their current value
     * at the live price.
     */
    public List<BetView> getUserBets(String wallet) {
        String key = LedgerService.normalize(wallet);
        Map<String, Market> markets = marketStore.listMarkets(null).stream()
                .collect(Collectors.toMap(Market::getId, Function.identity()));

        return betStore.betsForWallet(key, markets.keySet()).stream()
                .sorted(Comparator.comparingLong(Bet::getCreatedAt).reversed())
                .map(bet -> {
                    String question = markets.get(bet.getMarketId()).getQuestion();
                    if (!bet.isOpen()) {
                        return BetView.settled(bet, question);
                    }
                    double price = getPrice(bet.getMarketId()).priceOf(bet.getSide());
                    return BetView.open(bet, question, price);
                })
                .toList();
    }

    /**
     * Compare a completed buy with what was previewed for it. A difference
     * beyond the slippage threshold means the price moved under the trade
     * while it was queued; the caller may choose to undo it.
     */
    public SlippageReport checkSlippage(String requestId, double previewedShares) {
        if (!Double.isFinite(previewedShares) || previewedShares <= 0) {
            throw new ValidationException("Previewed shares must be positive");
        }
        TradeResult result = resultStore.get(requestId);
        if (result.getKind() != TradeKind.BUY || !result.isDone() || !result.isSuccess()) {
            throw new ValidationException("Slippage is only defined for a completed, successful buy");
        }
        double difference = (result.getShares() - previewedShares) / previewedShares;
        boolean undoRecommended = Math.abs(difference) > properties.getSlippageThreshold();
        if (undoRecommended) {
            log.info("Slippage of {}% on {} exceeds threshold", String.format("%.2f", difference * 100), requestId);
        }
        return new SlippageReport(requestId, result.getBetId(), previewedShares, result.getShares(),
                difference, undoRecommended);
    }

    private void requireAmount(BigDecimal amount) {
        List<String> errors = new ArrayList<>();
        tradeValidator.validateAmount(amount, errors);
        if (!errors.isEmpty()) {
            throw new ValidationException(String.join("; ", errors));
        }
    }
}
