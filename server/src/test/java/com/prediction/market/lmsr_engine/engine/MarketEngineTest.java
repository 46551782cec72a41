package com.prediction.market.lmsr_engine.engine;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.tuple;
import static org.assertj.core.api.Assertions.within;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.atLeastOnce;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.verify;

import java.math.BigDecimal;
import java.util.Random;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;
import org.mockito.ArgumentCaptor;
import org.mockito.Mockito;

import com.prediction.market.lmsr_engine.entity.Bet;
import com.prediction.market.lmsr_engine.entity.BetStatus;
import com.prediction.market.lmsr_engine.entity.LedgerEntry;
import com.prediction.market.lmsr_engine.entity.LedgerEntryType;
import com.prediction.market.lmsr_engine.entity.Money;
import com.prediction.market.lmsr_engine.entity.Side;
import com.prediction.market.lmsr_engine.entity.TradeResult;
import com.prediction.market.lmsr_engine.entity.TradeStatus;
import com.prediction.market.lmsr_engine.exception.InsufficientFundsException;
import com.prediction.market.lmsr_engine.exception.InsufficientSharesException;
import com.prediction.market.lmsr_engine.exception.MarketClosedException;
import com.prediction.market.lmsr_engine.exception.NotFoundException;
import com.prediction.market.lmsr_engine.exception.UndoNotAllowedException;
import com.prediction.market.lmsr_engine.model.MarketSnapshot;
import com.prediction.market.lmsr_engine.model.PriceQuote;
import com.prediction.market.lmsr_engine.support.EngineFixture;

class MarketEngineTest {

    private static final String ALICE = "0xalice";
    private static final String BOB = "0xbob";

    private EngineFixture fixture;
    private MarketEngine engine;
    private String marketId;

    @BeforeEach
    void setUp() {
        fixture = new EngineFixture();
        engine = fixture.marketEngine;
        marketId = fixture.openMarket().getId();
    }

    private BigDecimal balance(String wallet) {
        return fixture.ledgerService.balanceOf(wallet).balance();
    }

    private Bet bet(String betId) {
        return fixture.betStore.findBet(betId).orElseThrow();
    }

    @Test
    void buyDebitsTheAmountAndOpensABet() {
        TradeResult result = engine.executeTrade(fixture.buy(marketId, ALICE, Side.YES, "100"));

        assertThat(result.isSuccess()).isTrue();
        assertThat(result.getStatus()).isEqualTo(TradeStatus.DONE);
        assertThat(result.getBalanceAfter()).isEqualByComparingTo("900");
        assertThat(result.getShares()).isGreaterThan(100.0);
        assertThat(result.getYesPrice()).isGreaterThan(0.5);
        assertThat(result.getYesPrice() + result.getNoPrice()).isCloseTo(1.0, within(1e-12));

        Bet bet = bet(result.getBetId());
        assertThat(bet.getStatus()).isEqualTo(BetStatus.OPEN);
        assertThat(bet.getWallet()).isEqualTo(ALICE);
        assertThat(bet.getShares()).isEqualTo(result.getShares());
        assertThat(bet.getMarketSequence()).isEqualTo(1);
        assertThat(balance(ALICE)).isEqualByComparingTo("900");
    }

    @Test
    void buyOf2000MovesYesToAboutTwoThirds() {
        fixture.ledgerService.adminCredit(ALICE, Money.of("1000"));

        TradeResult result = engine.executeTrade(fixture.buy(marketId, ALICE, Side.YES, "2000"));

        assertThat(result.getShares()).isCloseTo(3424.7, within(0.1));
        assertThat(result.getYesPrice()).isCloseTo(0.6648, within(1e-3));
        assertThat(fixture.marketStore.snapshot(marketId).qYes()).isCloseTo(13424.7, within(0.1));
    }

    @Test
    void insufficientFundsLeavesMarketAndBalanceUntouched() {
        MarketSnapshot before = fixture.marketStore.snapshot(marketId);

        assertThatThrownBy(() -> engine.executeTrade(fixture.buy(marketId, ALICE, Side.NO, "1500")))
            .isInstanceOf(InsufficientFundsException.class);

        assertThat(fixture.marketStore.snapshot(marketId)).isEqualTo(before);
        assertThat(balance(ALICE)).isEqualByComparingTo("1000");
        assertThat(fixture.betStore.betsForMarket(marketId)).isEmpty();
    }

    @Test
    void buyThenUndoRestoresStateAndBalanceExactly() {
        MarketSnapshot before = fixture.marketStore.snapshot(marketId);
        PriceQuote pricesBefore = fixture.pricingEngine.getPrices(before);
        TradeResult buy = engine.executeTrade(fixture.buy(marketId, ALICE, Side.YES, "100"));

        TradeResult undo = engine.executeTrade(fixture.undo(marketId, ALICE, buy.getBetId()));

        MarketSnapshot after = fixture.marketStore.snapshot(marketId);
        assertThat(undo.isSuccess()).isTrue();
        assertThat(undo.getAmount()).isEqualByComparingTo("100");
        assertThat(after.qYes()).isEqualTo(before.qYes());
        assertThat(after.qNo()).isEqualTo(before.qNo());
        assertThat(fixture.pricingEngine.getPrices(after)).isEqualTo(pricesBefore);
        assertThat(balance(ALICE)).isEqualByComparingTo("1000");
        assertThat(bet(buy.getBetId()).getStatus()).isEqualTo(BetStatus.VOID);
    }

    @Test
    void undoOnAMovedMarketRestoresThatSideExactly() {
        engine.executeTrade(fixture.buy(marketId, BOB, Side.NO, "333.33"));
        MarketSnapshot before = fixture.marketStore.snapshot(marketId);
        TradeResult buy = engine.executeTrade(fixture.buy(marketId, ALICE, Side.YES, "77.7"));

        engine.executeTrade(fixture.undo(marketId, ALICE, buy.getBetId()));

        MarketSnapshot after = fixture.marketStore.snapshot(marketId);
        assertThat(after.qYes()).isEqualTo(before.qYes());
        assertThat(after.qNo()).isEqualTo(before.qNo());
    }

    @Test
    void undoAfterAnInterveningTradeIsRejected() {
        TradeResult aliceBuy = engine.executeTrade(fixture.buy(marketId, ALICE, Side.YES, "100"));
        engine.executeTrade(fixture.buy(marketId, BOB, Side.YES, "50"));
        MarketSnapshot before = fixture.marketStore.snapshot(marketId);

        assertThatThrownBy(() -> engine.executeTrade(fixture.undo(marketId, ALICE, aliceBuy.getBetId())))
            .isInstanceOf(UndoNotAllowedException.class)
            .hasMessageContaining("traded since");

        assertThat(fixture.marketStore.snapshot(marketId)).isEqualTo(before);
        assertThat(balance(ALICE)).isEqualByComparingTo("900");
        assertThat(bet(aliceBuy.getBetId()).getStatus()).isEqualTo(BetStatus.OPEN);
    }

    @Test
    void secondUndoOfTheSameBetIsRejected() {
        TradeResult buy = engine.executeTrade(fixture.buy(marketId, ALICE, Side.NO, "10"));
        engine.executeTrade(fixture.undo(marketId, ALICE, buy.getBetId()));

        assertThatThrownBy(() -> engine.executeTrade(fixture.undo(marketId, ALICE, buy.getBetId())))
            .isInstanceOf(UndoNotAllowedException.class)
            .hasMessageContaining("already undone");
        assertThat(balance(ALICE)).isEqualByComparingTo("1000");
    }

    @Test
    void undoOfAnotherWalletsBetIsNotFound() {
        TradeResult buy = engine.executeTrade(fixture.buy(marketId, ALICE, Side.NO, "10"));

        assertThatThrownBy(() -> engine.executeTrade(fixture.undo(marketId, BOB, buy.getBetId())))
            .isInstanceOf(NotFoundException.class);
    }

    @Test
    void partiallySoldBetCannotBeUndone() {
        TradeResult buy = engine.executeTrade(fixture.buy(marketId, ALICE, Side.YES, "100"));
        engine.executeTrade(fixture.sellFromBet(marketId, ALICE, buy.getBetId(), buy.getShares() / 2));

        assertThatThrownBy(() -> engine.executeTrade(fixture.undo(marketId, ALICE, buy.getBetId())))
            .isInstanceOf(UndoNotAllowedException.class);
    }

    @Test
    void sellingAllSharesReturnsTheAmountAndClosesTheBet() {
        TradeResult buy = engine.executeTrade(fixture.buy(marketId, ALICE, Side.YES, "100"));

        TradeResult sell = engine.executeTrade(fixture.sellFromBet(marketId, ALICE, buy.getBetId(), buy.getShares()));

        assertThat(sell.isSuccess()).isTrue();
        assertThat(sell.getAmount().doubleValue()).isCloseTo(100.0, within(1e-6));
        assertThat(balance(ALICE).doubleValue()).isCloseTo(1000.0, within(1e-6));
        Bet bet = bet(buy.getBetId());
        assertThat(bet.getStatus()).isEqualTo(BetStatus.CLOSED);
        assertThat(bet.getShares()).isZero();
        assertThat(bet.getRealizedProceeds()).isEqualByComparingTo(sell.getAmount());
        assertThat(fixture.marketStore.snapshot(marketId).qYes()).isCloseTo(10000.0, within(1e-9));
    }

    @Test
    void sellingMoreThanHeldIsRejected() {
        TradeResult buy = engine.executeTrade(fixture.buy(marketId, ALICE, Side.YES, "100"));
        MarketSnapshot before = fixture.marketStore.snapshot(marketId);

        assertThatThrownBy(() -> engine.executeTrade(fixture.sell(marketId, ALICE, Side.YES, buy.getShares() + 1)))
            .isInstanceOf(InsufficientSharesException.class);
        assertThatThrownBy(() -> engine.executeTrade(fixture.sell(marketId, ALICE, Side.NO, 1)))
            .isInstanceOf(InsufficientSharesException.class);
        assertThat(fixture.marketStore.snapshot(marketId)).isEqualTo(before);
    }

    @Test
    void sideSellDrawsFromOldestBetsFirst() {
        TradeResult first = engine.executeTrade(fixture.buy(marketId, ALICE, Side.NO, "100"));
        TradeResult second = engine.executeTrade(fixture.buy(marketId, ALICE, Side.NO, "50"));
        double secondShares = second.getShares();

        engine.executeTrade(fixture.sell(marketId, ALICE, Side.NO, first.getShares() + secondShares / 2));

        assertThat(bet(first.getBetId()).getStatus()).isEqualTo(BetStatus.CLOSED);
        Bet remaining = bet(second.getBetId());
        assertThat(remaining.getStatus()).isEqualTo(BetStatus.OPEN);
        assertThat(remaining.getShares()).isCloseTo(secondShares / 2, within(1e-6));
        assertThat(remaining.getAmount().doubleValue()).isCloseTo(25.0, within(1e-6));
    }

    @Test
    void tradesOnAResolvedMarketFailWithoutSideEffects() {
        TradeResult buy = engine.executeTrade(fixture.buy(marketId, ALICE, Side.YES, "100"));
        fixture.marketStore.withLock(marketId, () -> fixture.marketStore.markResolved(marketId, Side.YES));

        assertThatThrownBy(() -> engine.executeTrade(fixture.buy(marketId, ALICE, Side.YES, "10")))
            .isInstanceOf(MarketClosedException.class);
        assertThatThrownBy(() -> engine.executeTrade(fixture.sellFromBet(marketId, ALICE, buy.getBetId(), 1)))
            .isInstanceOf(MarketClosedException.class);
        assertThatThrownBy(() -> engine.executeTrade(fixture.undo(marketId, ALICE, buy.getBetId())))
            .isInstanceOf(MarketClosedException.class);
        assertThat(balance(ALICE)).isEqualByComparingTo("900");
    }

    @ParameterizedTest
    @ValueSource(longs = {1L, 7L, 42L, 2026L})
    void exposureStaysAboveTheBufferAcrossRandomTrading(long seed) {
        Random random = new Random(seed);
        String[] wallets = {ALICE, BOB, "0xcarol"};
        for (String wallet : wallets) {
            fixture.ledgerService.adminCredit(wallet, Money.of("100000"));
        }

        for (int step = 0; step < 300; step++) {
            String wallet = wallets[random.nextInt(wallets.length)];
            Side side = random.nextBoolean() ? Side.YES : Side.NO;
            double held = heldShares(wallet, side);
            if (held > 0 && random.nextInt(3) == 0) {
                double fraction = random.nextInt(4) == 0 ? 1.0 : 0.05 + 0.95 * random.nextDouble();
                engine.executeTrade(fixture.sell(marketId, wallet, side, held * fraction));
            } else {
                engine.executeTrade(fixture.buy(marketId, wallet, side, String.valueOf(1 + random.nextInt(400))));
            }
            assertWithinBuffer();
        }

        for (String wallet : wallets) {
            for (Side side : Side.values()) {
                double held = heldShares(wallet, side);
                if (held > 0) {
                    engine.executeTrade(fixture.sell(marketId, wallet, side, held));
                    assertWithinBuffer();
                }
                assertThat(fixture.betStore.openBets(marketId, wallet, side)).isEmpty();
            }
        }
        MarketSnapshot flat = fixture.marketStore.snapshot(marketId);
        assertThat(flat.qYes()).isCloseTo(10000.0, within(1e-6));
        assertThat(flat.qNo()).isCloseTo(10000.0, within(1e-6));
    }

    private double heldShares(String wallet, Side side) {
        return fixture.betStore.openBets(marketId, wallet, side).stream().mapToDouble(Bet::getShares).sum();
    }

    private void assertWithinBuffer() {
        MarketSnapshot snapshot = fixture.marketStore.snapshot(marketId);
        assertThat(snapshot.qYes()).isGreaterThanOrEqualTo(10000.0);
        assertThat(snapshot.qNo()).isGreaterThanOrEqualTo(10000.0);
        PriceQuote prices = fixture.pricingEngine.getPrices(snapshot);
        assertThat(prices.yesPrice() + prices.noPrice()).isCloseTo(1.0, within(1e-12));
    }

    @Test
    void ledgerEntriesCarryTheBetTheyBelongTo() {
        TradeResult kept = engine.executeTrade(fixture.buy(marketId, ALICE, Side.YES, "100"));
        engine.executeTrade(fixture.sellFromBet(marketId, ALICE, kept.getBetId(), kept.getShares() / 2));
        TradeResult undone = engine.executeTrade(fixture.buy(marketId, ALICE, Side.NO, "40"));
        engine.executeTrade(fixture.undo(marketId, ALICE, undone.getBetId()));

        fixture.ledgerService.flushLedger();

        ArgumentCaptor<LedgerEntry> entries = ArgumentCaptor.forClass(LedgerEntry.class);
        verify(fixture.ledgerEntryRepository, atLeastOnce()).save(entries.capture());
        assertThat(entries.getAllValues())
            .filteredOn(entry -> entry.getType() != LedgerEntryType.STARTING_CREDIT)
            .extracting(LedgerEntry::getType, LedgerEntry::getBetId)
            .containsExactly(
                tuple(LedgerEntryType.BUY, kept.getBetId()),
                tuple(LedgerEntryType.SELL, kept.getBetId()),
                tuple(LedgerEntryType.BUY, undone.getBetId()),
                tuple(LedgerEntryType.UNDO_REFUND, undone.getBetId()));
    }

    @Test
    void failedSellCreditPutsMarketBalanceAndBetsBack() {
        EngineFixture spied = new EngineFixture(Mockito::spy);
        String market = spied.openMarket().getId();
        TradeResult older = spied.marketEngine.executeTrade(spied.buy(market, ALICE, Side.YES, "100"));
        TradeResult newer = spied.marketEngine.executeTrade(spied.buy(market, ALICE, Side.YES, "50"));
        MarketSnapshot before = spied.marketStore.snapshot(market);
        BigDecimal balanceBefore = spied.ledgerService.balanceOf(ALICE).balance();
        doThrow(new IllegalStateException("ledger unavailable"))
            .when(spied.ledgerService)
            .credit(eq(ALICE), any(Money.class), eq(LedgerEntryType.SELL), anyString(), anyString(),
                eq(newer.getBetId()));

        double allShares = older.getShares() + newer.getShares();
        assertThatThrownBy(() -> spied.marketEngine.executeTrade(spied.sell(market, ALICE, Side.YES, allShares)))
            .isInstanceOf(IllegalStateException.class)
            .hasMessage("ledger unavailable");

        MarketSnapshot after = spied.marketStore.snapshot(market);
        assertThat(after.qYes()).isEqualTo(before.qYes());
        assertThat(after.qNo()).isEqualTo(before.qNo());
        assertThat(spied.ledgerService.balanceOf(ALICE).balance()).isEqualByComparingTo(balanceBefore);
        verify(spied.ledgerService).debit(eq(ALICE), any(Money.class), eq(LedgerEntryType.SELL_REVERSAL),
            anyString(), anyString(), eq(older.getBetId()));
        assertThat(spied.betStore.openBets(market, ALICE, Side.YES))
            .extracting(Bet::getShares)
            .containsExactly(older.getShares(), newer.getShares());
    }
}
