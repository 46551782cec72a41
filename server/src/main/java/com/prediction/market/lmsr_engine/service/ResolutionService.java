package com.prediction.market.lmsr_engine.service;

import java.time.Clock;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

import org.springframework.stereotype.Service;

import com.prediction.market.lmsr_engine.cache.BetStore;
import com.prediction.market.lmsr_engine.cache.MarketStore;
import com.prediction.market.lmsr_engine.config.MarketProperties;
import com.prediction.market.lmsr_engine.entity.Bet;
import com.prediction.market.lmsr_engine.entity.BetResult;
import com.prediction.market.lmsr_engine.entity.BetStatus;
import com.prediction.market.lmsr_engine.entity.LedgerEntryType;
import com.prediction.market.lmsr_engine.entity.Market;
import com.prediction.market.lmsr_engine.entity.MarketStatus;
import com.prediction.market.lmsr_engine.entity.Money;
import com.prediction.market.lmsr_engine.entity.PayoutStatus;
import com.prediction.market.lmsr_engine.entity.Side;
import com.prediction.market.lmsr_engine.exception.AlreadyResolvedException;
import com.prediction.market.lmsr_engine.exception.ValidationException;
import com.prediction.market.lmsr_engine.execution.MarketExecutionRegistry;
import com.prediction.market.lmsr_engine.model.BetView;
import com.prediction.market.lmsr_engine.model.PayoutFailure;
import com.prediction.market.lmsr_engine.model.PayoutReport;
import com.prediction.market.lmsr_engine.model.ResolutionSummary;
import com.prediction.market.lmsr_engine.model.WalletPayout;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Settles markets.
 *
 * Resolution runs under the market lock, so it never interleaves with a trade
 * on the same market. Afterwards the market's executor is released; trades
 * still queued behind the resolution fail as MARKET_CLOSED.
 *
 * Payout per open bet:
 * - winner: payout = shares × 1.0, loser: payout = 0
 * - profit = payout - amount (cost basis still held)
 * - fee = max(0, profit) × feeRate
 * - net credit = payout - fee
 *
 * Each credit stands alone. A failed credit is recorded on the bet and in the
 * summary and does not stop the remaining payouts; it can be re-run with
 * {@link #retryFailedPayouts(String)}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class ResolutionService {

    private final MarketStore marketStore;
    private final BetStore betStore;
    private final LedgerService ledgerService;
    private final MarketExecutionRegistry registry;
    private final MarketProperties properties;
    private final Clock clock;

    public ResolutionSummary resolveMarket(String marketId, String outcome) {
        return resolveMarket(marketId, Side.parse(outcome));
    }

    /**
     * @throws AlreadyResolvedException if the market was resolved before
     */
    public ResolutionSummary resolveMarket(String marketId, Side outcome) {
        ResolutionSummary resolved = marketStore.withLock(marketId, () -> {
            Market market = marketStore.getMarket(marketId);
            if (!market.isOpen()) {
                throw new AlreadyResolvedException(
                        "Market " + marketId + " already resolved as " + market.getResolution());
            }
            marketStore.markResolved(marketId, outcome);
            log.info("Resolving market {} as {}", marketId, outcome);

            List<Bet> openBets = betStore.betsForMarket(marketId).stream()
                    .filter(Bet::isOpen)
                    .toList();
            long now = clock.millis();
            openBets.forEach(bet -> settle(bet, outcome, now));

            ResolutionSummary summary = pay(marketId, outcome, openBets);
            log.info("Market {} resolved as {}: {} winning / {} losing bets, paid {} (fees {}), {} failures",
                    marketId, outcome, summary.winningBets(), summary.losingBets(),
                    summary.totalPayout(), summary.totalFees(), summary.failures().size());
            return summary;
        });
        registry.release(marketId);
        return resolved;
    }

    /**
     * Re-run credits that failed during resolution. Bets already credited are
     * never paid twice.
     */
    public ResolutionSummary retryFailedPayouts(String marketId) {
        return marketStore.withLock(marketId, () -> {
            Market market = requireResolved(marketId);
            List<Bet> failed = betStore.betsForMarket(marketId).stream()
                    .filter(bet -> bet.getPayoutStatus() == PayoutStatus.FAILED)
                    .toList();
            log.info("Retrying {} failed payouts on market {}", failed.size(), marketId);
            return pay(marketId, market.getResolution(), failed);
        });
    }

    /**
     * Per-wallet breakdown of a resolved market, largest net credit first.
     */
    public PayoutReport getPayoutReport(String marketId) {
        Market market = requireResolved(marketId);

        Map<String, List<Bet>> byWallet = new LinkedHashMap<>();
        for (Bet bet : betStore.betsForMarket(marketId)) {
            if (bet.getStatus() == BetStatus.RESOLVED) {
                byWallet.computeIfAbsent(bet.getWallet(), w -> new ArrayList<>()).add(bet);
            }
        }

        List<WalletPayout> wallets = new ArrayList<>();
        Money totalPayout = Money.ZERO;
        Money totalFees = Money.ZERO;
        for (Map.Entry<String, List<Bet>> entry : byWallet.entrySet()) {
            Money totalBet = Money.ZERO;
            Money gross = Money.ZERO;
            Money fees = Money.ZERO;
            Money net = Money.ZERO;
            double shares = 0.0;
            List<BetView> views = new ArrayList<>();
            for (Bet bet : entry.getValue()) {
                totalBet = totalBet.add(bet.amount());
                gross = gross.add(Money.ofNullable(bet.getPayout()));
                fees = fees.add(Money.ofNullable(bet.getFee()));
                net = net.add(Money.ofNullable(bet.getNetCredit()));
                shares += bet.getShares();
                views.add(BetView.settled(bet, market.getQuestion()));
            }
            totalPayout = totalPayout.add(net);
            totalFees = totalFees.add(fees);
            wallets.add(new WalletPayout(entry.getKey(), totalBet.toBigDecimal(), shares,
                    gross.toBigDecimal(), fees.toBigDecimal(), net.toBigDecimal(), views));
        }
        wallets.sort(Comparator.comparing(WalletPayout::netCredit).reversed());

        return new PayoutReport(marketId, market.getResolution(), totalPayout.toBigDecimal(),
                totalFees.toBigDecimal(), wallets);
    }

    private void settle(Bet bet, Side outcome, long now) {
        boolean won = bet.getSide() == outcome;
        Money payout = won ? Money.of(bet.getShares()) : Money.ZERO;
        Money profit = payout.subtract(bet.amount());
        Money fee = profit.isPositive() ? profit.multiply(properties.getFeeRate()) : Money.ZERO;
        Money net = payout.subtract(fee);

        bet.setResult(won ? BetResult.WON : BetResult.LOST);
        bet.setPayout(payout.toBigDecimal());
        bet.setProfit(profit.toBigDecimal());
        bet.setFee(fee.toBigDecimal());
        bet.setNetCredit(net.toBigDecimal());
        bet.transitionTo(BetStatus.RESOLVED, now);
        betStore.markModified(bet);
    }

    /**
     * Credit every settled bet with a positive net credit that has not been
     * credited yet.
     */
    private ResolutionSummary pay(String marketId, Side outcome, List<Bet> bets) {
        Money totalPayout = Money.ZERO;
        Money totalFees = Money.ZERO;
        Set<String> winners = new LinkedHashSet<>();
        List<PayoutFailure> failures = new ArrayList<>();
        int winningBets = 0;
        int losingBets = 0;

        for (Bet bet : bets) {
            if (bet.getResult() == BetResult.WON) {
                winningBets++;
            } else {
                losingBets++;
            }
            Money net = Money.ofNullable(bet.getNetCredit());
            if (bet.getPayoutStatus() == PayoutStatus.CREDITED || !net.isPositive()) {
                continue;
            }
            try {
                ledgerService.credit(bet.getWallet(), net, LedgerEntryType.PAYOUT, marketId, bet.getId(), bet.getId());
                bet.setPayoutStatus(PayoutStatus.CREDITED);
                bet.setPayoutError(null);
                totalPayout = totalPayout.add(net);
                totalFees = totalFees.add(Money.ofNullable(bet.getFee()));
                winners.add(bet.getWallet());
            } catch (RuntimeException e) {
                bet.setPayoutStatus(PayoutStatus.FAILED);
                bet.setPayoutError(e.getMessage());
                failures.add(new PayoutFailure(bet.getId(), bet.getWallet(), net.toBigDecimal(), e.getMessage()));
                log.error("Payout of {} to {} for bet {} failed", net, bet.getWallet(), bet.getId(), e);
            }
            betStore.markModified(bet);
        }

        return new ResolutionSummary(marketId, outcome, failures.isEmpty(), totalPayout.toBigDecimal(),
                totalFees.toBigDecimal(), winners.size(), winningBets, losingBets, failures);
    }

    private Market requireResolved(String marketId) {
        Market market = marketStore.getMarket(marketId);
        if (market.getStatus() != MarketStatus.RESOLVED) {
            throw new ValidationException("Market " + marketId + " is not resolved");
        }
        return market;
    }
}
