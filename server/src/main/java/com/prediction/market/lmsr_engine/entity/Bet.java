package com.prediction.market.lmsr_engine.entity;

import java.math.BigDecimal;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A position opened by a single buy.
 *
 * Lifecycle: OPEN → CLOSED (sold) / RESOLVED (market settled) / VOID (undone).
 * {@code shares} and {@code amount} describe what is still held; a partial sell
 * reduces both proportionally. The original values are kept for undo checks
 * and reporting.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder(toBuilder = true)
@Document(collection = "bets")
@CompoundIndex(name = "market_wallet_idx", def = "{'marketId':1,'wallet':1,'createdAt':1}")
public class Bet {
    // Below this a position is treated as fully sold.
    private static final double DUST_SHARES = 1e-9;

    @Id
    private String id;

    @Indexed
    private String marketId;

    @Indexed
    private String wallet;

    private Side side;

    /**
     * Cost basis of the shares still held.
     */
    private BigDecimal amount;
    private BigDecimal originalAmount;

    private double shares;
    private double originalShares;

    /**
     * originalAmount / originalShares at execution time.
     */
    private double averagePrice;

    @Builder.Default
    private BetStatus status = BetStatus.OPEN;

    @Builder.Default
    private BetResult result = BetResult.NOT_APPLICABLE;

    /**
     * Gross redemption value at resolution (winning shares × 1.0).
     */
    private BigDecimal payout;
    private BigDecimal fee;
    private BigDecimal netCredit;
    private BigDecimal profit;

    /**
     * Sum of proceeds received from sells of this bet.
     */
    private BigDecimal realizedProceeds;

    @Builder.Default
    private PayoutStatus payoutStatus = PayoutStatus.NONE;
    private String payoutError;

    /**
     * Market sequence right after this bet's buy was applied.
     */
    private long marketSequence;

    /**
     * Exposure of {@code side} just before the buy. An undo puts it back.
     */
    private double exposureBefore;

    private String requestId;
    private long createdAt;
    private long updatedAt;

    // ===== State Machine Methods =====

    public void transitionTo(BetStatus newStatus, long timestamp) {
        if (!this.status.canTransitionTo(newStatus)) {
            throw new IllegalStateException(
                String.format("Invalid bet state transition: %s → %s (betId=%s)",
                    this.status, newStatus, this.id)
            );
        }
        this.status = newStatus;
        this.updatedAt = timestamp;
    }

    public boolean isOpen() {
        return status == BetStatus.OPEN;
    }

    /**
     * True once any share of this bet has been sold.
     */
    public boolean isPartiallySold() {
        return shares < originalShares;
    }

    public Money amount() {
        return Money.ofNullable(amount);
    }

    /**
     * Remove sold shares and the matching share of cost basis.
     */
    public void reduce(double soldShares, Money proceeds, long timestamp) {
        if (soldShares <= 0 || soldShares > shares) {
            throw new IllegalArgumentException(
                String.format("Cannot reduce bet %s by %.8f shares (holding %.8f)", id, soldShares, shares));
        }
        double remaining = shares - soldShares;
        if (remaining <= DUST_SHARES) {
            remaining = 0.0;
        }
        Money remainingAmount = remaining <= 0
            ? Money.ZERO
            : amount().multiply(remaining / shares);

        this.shares = remaining;
        this.amount = remainingAmount.toBigDecimal();
        this.realizedProceeds = Money.ofNullable(realizedProceeds).add(proceeds).toBigDecimal();
        this.updatedAt = timestamp;

        if (remaining <= 0) {
            transitionTo(BetStatus.CLOSED, timestamp);
        }
    }
}
