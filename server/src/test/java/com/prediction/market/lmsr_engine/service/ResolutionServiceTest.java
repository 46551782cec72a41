package com.prediction.market.lmsr_engine.service;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doCallRealMethod;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;

import java.math.BigDecimal;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import com.prediction.market.lmsr_engine.engine.MarketEngine;
import com.prediction.market.lmsr_engine.entity.Bet;
import com.prediction.market.lmsr_engine.entity.BetResult;
import com.prediction.market.lmsr_engine.entity.BetStatus;
import com.prediction.market.lmsr_engine.entity.LedgerEntry;
import com.prediction.market.lmsr_engine.entity.LedgerEntryType;
import com.prediction.market.lmsr_engine.entity.Money;
import com.prediction.market.lmsr_engine.entity.PayoutStatus;
import com.prediction.market.lmsr_engine.entity.Side;
import com.prediction.market.lmsr_engine.entity.TradeRequest;
import com.prediction.market.lmsr_engine.entity.TradeResult;
import com.prediction.market.lmsr_engine.exception.AlreadyResolvedException;
import com.prediction.market.lmsr_engine.exception.ErrorKind;
import com.prediction.market.lmsr_engine.exception.MarketClosedException;
import com.prediction.market.lmsr_engine.exception.ValidationException;
import com.prediction.market.lmsr_engine.execution.MarketExecutionRegistry;
import com.prediction.market.lmsr_engine.execution.TradeResultStore;
import com.prediction.market.lmsr_engine.model.PayoutReport;
import com.prediction.market.lmsr_engine.model.ResolutionSummary;
import com.prediction.market.lmsr_engine.model.WalletPayout;
import com.prediction.market.lmsr_engine.support.EngineFixture;

class ResolutionServiceTest {

    private static final String ALICE = "0xalice";
    private static final String BOB = "0xbob";
    private static final String CAROL = "0xcarol";

    private EngineFixture fixture;
    private MarketExecutionRegistry registry;
    private ResolutionService resolution;
    private String marketId;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture(Mockito::spy);
        registry = new MarketExecutionRegistry(fixture.marketEngine,
                new TradeResultStore(Duration.ofHours(1), 1000, fixture.clock), fixture.clock);
        resolution = new ResolutionService(fixture.marketStore, fixture.betStore, fixture.ledgerService,
                registry, fixture.properties, fixture.clock);
        marketId = fixture.openMarket().getId();
    }

    @AfterEach
    void tearDown() {
        registry.shutdown();
    }

    private Bet placeBet(String wallet, Side side, String amount, double shares) {
        Bet bet = Bet.builder()
            .id(UUID.randomUUID().toString())
            .marketId(marketId)
            .wallet(wallet)
            .side(side)
            .amount(new BigDecimal(amount))
            .originalAmount(new BigDecimal(amount))
            .shares(shares)
            .originalShares(shares)
            .averagePrice(Double.parseDouble(amount) / shares)
            .createdAt(fixture.clock.millis())
            .build();
        fixture.betStore.add(bet);
        return bet;
    }

    private BigDecimal balance(String wallet) {
        return fixture.ledgerService.balanceOf(wallet).balance();
    }

    @Test
    void winnerIsPaidSharesLessTwoPercentOfProfit() {
        Bet winner = placeBet(ALICE, Side.YES, "25", 50);
        Bet loser = placeBet(BOB, Side.NO, "40", 60);

        ResolutionSummary summary = resolution.resolveMarket(marketId, "yes");

        assertThat(winner.getResult()).isEqualTo(BetResult.WON);
        assertThat(winner.getPayout()).isEqualByComparingTo("50");
        assertThat(winner.getProfit()).isEqualByComparingTo("25");
        assertThat(winner.getFee()).isEqualByComparingTo("0.5");
        assertThat(winner.getNetCredit()).isEqualByComparingTo("49.5");
        assertThat(winner.getStatus()).isEqualTo(BetStatus.RESOLVED);
        assertThat(winner.getPayoutStatus()).isEqualTo(PayoutStatus.CREDITED);

        assertThat(loser.getResult()).isEqualTo(BetResult.LOST);
        assertThat(loser.getPayout()).isEqualByComparingTo("0");
        assertThat(loser.getFee()).isEqualByComparingTo("0");
        assertThat(loser.getProfit()).isEqualByComparingTo("-40");

        assertThat(summary.payoutsDistributed()).isTrue();
        assertThat(summary.outcome()).isEqualTo(Side.YES);
        assertThat(summary.totalPayout()).isEqualByComparingTo("49.5");
        assertThat(summary.totalFees()).isEqualByComparingTo("0.5");
        assertThat(summary.winningBets()).isEqualTo(1);
        assertThat(summary.losingBets()).isEqualTo(1);
        assertThat(balance(ALICE)).isEqualByComparingTo("1049.5");
        assertThat(balance(BOB)).isEqualByComparingTo("1000");
    }

    @Test
    void losingMoneyOnAWinningSideIsNotCharged() {
        Bet expensive = placeBet(ALICE, Side.NO, "95", 90);

        resolution.resolveMarket(marketId, Side.NO);

        assertThat(expensive.getProfit()).isEqualByComparingTo("-5");
        assertThat(expensive.getFee()).isEqualByComparingTo("0");
        assertThat(expensive.getNetCredit()).isEqualByComparingTo("90");
    }

    @Test
    void winnersAreCountedByDistinctWallet() {
        placeBet(ALICE, Side.YES, "10", 15);
        placeBet(ALICE, Side.YES, "10", 14);
        placeBet(CAROL, Side.YES, "10", 13);
        placeBet(BOB, Side.NO, "10", 20);

        ResolutionSummary summary = resolution.resolveMarket(marketId, Side.YES);

        assertThat(summary.winningBets()).isEqualTo(3);
        assertThat(summary.winnersCount()).isEqualTo(2);
    }

    @Test
    void secondResolutionIsRejectedAndPaysNothing() {
        placeBet(ALICE, Side.YES, "25", 50);
        resolution.resolveMarket(marketId, Side.YES);

        assertThatThrownBy(() -> resolution.resolveMarket(marketId, Side.NO))
            .isInstanceOf(AlreadyResolvedException.class);

        assertThat(fixture.marketStore.getMarket(marketId).getResolution()).isEqualTo(Side.YES);
        assertThat(balance(ALICE)).isEqualByComparingTo("1049.5");
    }

    @Test
    void unknownOutcomeIsAValidationError() {
        assertThatThrownBy(() -> resolution.resolveMarket(marketId, "maybe"))
            .isInstanceOf(ValidationException.class);
    }

    @Test
    void onlyOpenBetsAreSettled() {
        TradeResult undone = fixture.marketEngine.executeTrade(fixture.buy(marketId, ALICE, Side.YES, "20"));
        fixture.marketEngine.executeTrade(fixture.undo(marketId, ALICE, undone.getBetId()));
        TradeResult sold = fixture.marketEngine.executeTrade(fixture.buy(marketId, BOB, Side.YES, "20"));
        fixture.marketEngine.executeTrade(fixture.sellFromBet(marketId, BOB, sold.getBetId(), sold.getShares()));

        ResolutionSummary summary = resolution.resolveMarket(marketId, Side.YES);

        assertThat(summary.winningBets() + summary.losingBets()).isZero();
        assertThat(fixture.betStore.findBet(undone.getBetId()).orElseThrow().getStatus()).isEqualTo(BetStatus.VOID);
        assertThat(fixture.betStore.findBet(sold.getBetId()).orElseThrow().getStatus()).isEqualTo(BetStatus.CLOSED);
    }

    @Test
    void failedCreditIsIsolatedAndRetryable() {
        Bet alice = placeBet(ALICE, Side.YES, "25", 50);
        Bet bob = placeBet(BOB, Side.YES, "10", 30);
        Bet carol = placeBet(CAROL, Side.YES, "5", 8);
        doThrow(new IllegalStateException("ledger unavailable"))
            .when(fixture.ledgerService)
            .credit(eq(BOB), any(Money.class), eq(LedgerEntryType.PAYOUT), anyString(), anyString(), anyString());

        ResolutionSummary summary = resolution.resolveMarket(marketId, Side.YES);

        assertThat(summary.payoutsDistributed()).isFalse();
        assertThat(summary.failures()).singleElement().satisfies(failure -> {
            assertThat(failure.betId()).isEqualTo(bob.getId());
            assertThat(failure.wallet()).isEqualTo(BOB);
            assertThat(failure.reason()).isEqualTo("ledger unavailable");
        });
        assertThat(alice.getPayoutStatus()).isEqualTo(PayoutStatus.CREDITED);
        assertThat(carol.getPayoutStatus()).isEqualTo(PayoutStatus.CREDITED);
        assertThat(bob.getPayoutStatus()).isEqualTo(PayoutStatus.FAILED);
        assertThat(bob.getStatus()).isEqualTo(BetStatus.RESOLVED);
        assertThat(balance(BOB)).isEqualByComparingTo("1000");

        doCallRealMethod()
            .when(fixture.ledgerService)
            .credit(eq(BOB), any(Money.class), eq(LedgerEntryType.PAYOUT), anyString(), anyString(), anyString());
        ResolutionSummary retry = resolution.retryFailedPayouts(marketId);

        assertThat(retry.payoutsDistributed()).isTrue();
        assertThat(retry.winnersCount()).isEqualTo(1);
        assertThat(bob.getPayoutStatus()).isEqualTo(PayoutStatus.CREDITED);
        assertThat(bob.getPayoutError()).isNull();
        // 30 shares, profit 20, fee 0.4
        assertThat(balance(BOB)).isEqualByComparingTo("1029.6");
        assertThat(balance(ALICE)).isEqualByComparingTo("1049.5");
        verify(fixture.ledgerService, times(1))
            .credit(eq(ALICE), any(Money.class), eq(LedgerEntryType.PAYOUT), anyString(), anyString(), anyString());

        assertThat(resolution.retryFailedPayouts(marketId).winningBets()).isZero();
    }

    @Test
    void payoutsConserveMoneyAfterRealTrades() {
        fixture.marketEngine.executeTrade(fixture.buy(marketId, ALICE, Side.YES, "300"));
        fixture.marketEngine.executeTrade(fixture.buy(marketId, BOB, Side.NO, "200"));
        fixture.marketEngine.executeTrade(fixture.buy(marketId, CAROL, Side.YES, "150"));

        double winningShares = fixture.betStore.betsForMarket(marketId).stream()
            .filter(bet -> bet.getSide() == Side.YES)
            .mapToDouble(Bet::getShares)
            .sum();

        ResolutionSummary summary = resolution.resolveMarket(marketId, Side.YES);

        double paidPlusFees = summary.totalPayout().add(summary.totalFees()).doubleValue();
        assertThat(paidPlusFees).isCloseTo(winningShares, within(1e-6));
        assertThat(balance(BOB)).isEqualByComparingTo("800");
    }

    @Test
    void tradesQueuedBehindResolutionFailAsClosed() {
        resolution.resolveMarket(marketId, Side.NO);

        assertThatThrownBy(() -> fixture.marketEngine.executeTrade(fixture.buy(marketId, ALICE, Side.NO, "10")))
            .isInstanceOf(MarketClosedException.class);
    }

    @Test
    void payoutReportBreaksDownByWallet() {
        placeBet(ALICE, Side.YES, "25", 50);
        placeBet(ALICE, Side.YES, "10", 12);
        placeBet(BOB, Side.NO, "40", 60);

        assertThatThrownBy(() -> resolution.getPayoutReport(marketId))
            .isInstanceOf(ValidationException.class);

        resolution.resolveMarket(marketId, Side.YES);
        PayoutReport report = resolution.getPayoutReport(marketId);

        assertThat(report.outcome()).isEqualTo(Side.YES);
        assertThat(report.wallets()).extracting(WalletPayout::wallet).containsExactly(ALICE, BOB);
        WalletPayout alice = report.wallets().get(0);
        assertThat(alice.totalBet()).isEqualByComparingTo("35");
        assertThat(alice.totalShares()).isEqualTo(62.0);
        assertThat(alice.grossPayout()).isEqualByComparingTo("62");
        // fees: 25 * 0.02 + 2 * 0.02
        assertThat(alice.fees()).isEqualByComparingTo("0.54");
        assertThat(alice.netCredit()).isEqualByComparingTo("61.46");
        assertThat(alice.bets()).hasSize(2);
        assertThat(report.totalPayout()).isEqualByComparingTo("61.46");
        assertThat(report.wallets().get(1).netCredit()).isEqualByComparingTo("0");
    }

    @Test
    void payoutEntriesReferenceTheirBet() {
        Bet alice = placeBet(ALICE, Side.YES, "25", 50);

        resolution.resolveMarket(marketId, Side.YES);
        fixture.ledgerService.flushLedger();

        ArgumentCaptor<LedgerEntry> entries = ArgumentCaptor.forClass(LedgerEntry.class);
        verify(fixture.ledgerEntryRepository, atLeastOnce()).save(entries.capture());
        assertThat(entries.getAllValues())
            .filteredOn(entry -> entry.getType() == LedgerEntryType.PAYOUT)
            .singleElement()
            .satisfies(entry -> {
                assertThat(entry.getBetId()).isEqualTo(alice.getId());
                assertThat(entry.getMarketId()).isEqualTo(marketId);
                assertThat(entry.getAmount()).isEqualByComparingTo("49.5");
            });
    }

    @Test
    void resolvedMarketsReleaseTheirExecutors() throws Exception {
        List<String> markets = new ArrayList<>();
        for (int i = 0; i < 20; i++) {
            String id = fixture.openMarket().getId();
            markets.add(id);
            TradeResult bought = registry.submitTrackedTrade(fixture.buy(id, ALICE, Side.YES, "5"))
                .get(5, TimeUnit.SECONDS);
            assertThat(bought.isSuccess()).isTrue();
        }
        assertThat(registry.activeMarkets()).isEqualTo(20);

        markets.forEach(id -> resolution.resolveMarket(id, Side.NO));

        assertThat(registry.activeMarkets()).isZero();
        assertThat(liveExecutorThreads(markets)).isZero();
        assertThatThrownBy(() -> registry.submitTrade(fixture.buy(markets.get(0), ALICE, Side.YES, "5")))
            .isInstanceOf(MarketClosedException.class);
    }

    @Test
    void tradesStillQueuedWhenTheMarketResolvesFailAsClosed() throws Exception {
        CountDownLatch gate = new CountDownLatch(1);
        MarketEngine gated = new MarketEngine(fixture.marketStore, fixture.betStore, fixture.ledgerService,
                fixture.pricingEngine, fixture.clock) {
            @Override
            public TradeResult executeTrade(TradeRequest request) {
                try {
                    gate.await();
                } catch (InterruptedException e) {
                    Thread.currentThread().interrupt();
                }
                return super.executeTrade(request);
            }
        };
        MarketExecutionRegistry gatedRegistry = new MarketExecutionRegistry(gated,
                new TradeResultStore(Duration.ofHours(1), 1000, fixture.clock), fixture.clock);
        ResolutionService gatedResolution = new ResolutionService(fixture.marketStore, fixture.betStore,
                fixture.ledgerService, gatedRegistry, fixture.properties, fixture.clock);

        CompletableFuture<TradeResult> first = gatedRegistry.submitTrackedTrade(
            fixture.buy(marketId, ALICE, Side.YES, "10"));
        CompletableFuture<TradeResult> second = gatedRegistry.submitTrackedTrade(
            fixture.buy(marketId, BOB, Side.NO, "10"));
        CompletableFuture<ResolutionSummary> resolving = CompletableFuture.supplyAsync(
            () -> gatedResolution.resolveMarket(marketId, Side.YES));
        awaitResolved(marketId);
        gate.countDown();

        resolving.get(5, TimeUnit.SECONDS);
        assertThat(first.get(5, TimeUnit.SECONDS).getErrorKind()).isEqualTo(ErrorKind.MARKET_CLOSED);
        assertThat(second.get(5, TimeUnit.SECONDS).getErrorKind()).isEqualTo(ErrorKind.MARKET_CLOSED);
        assertThat(gatedRegistry.activeMarkets()).isZero();
        assertThat(balance(ALICE)).isEqualByComparingTo("1000");
        assertThat(balance(BOB)).isEqualByComparingTo("1000");
        gatedRegistry.shutdown();
    }

    private void awaitResolved(String id) throws InterruptedException {
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        while (fixture.marketStore.withLock(id, () -> fixture.marketStore.getMarket(id).isOpen())) {
            if (System.nanoTime() > deadline) {
                throw new AssertionError("Market " + id + " was not resolved");
            }
            Thread.sleep(5);
        }
    }

    private static long liveExecutorThreads(List<String> marketIds) throws InterruptedException {
        Set<String> names = marketIds.stream().map(id -> "market-" + id).collect(Collectors.toSet());
        long deadline = System.nanoTime() + TimeUnit.SECONDS.toNanos(5);
        long live;
        do {
            live = Thread.getAllStackTraces().keySet().stream()
                .filter(thread -> names.contains(thread.getName()) && thread.isAlive())
                .count();
            if (live == 0) {
                break;
            }
            Thread.sleep(10);
        } while (System.nanoTime() < deadline);
        return live;
    }
}
