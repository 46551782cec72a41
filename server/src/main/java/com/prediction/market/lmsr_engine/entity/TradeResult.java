package com.prediction.market.lmsr_engine.entity;

import java.math.BigDecimal;

import com.prediction.market.lmsr_engine.exception.ErrorKind;

import lombok.Builder;
import lombok.Value;

/**
 * Outcome of a trade request as seen by a polling caller. Immutable; the result
 * store replaces the whole value on every status change.
 */
@Value
@Builder(toBuilder = true)
public class TradeResult {
    String requestId;
    TradeKind kind;
    String marketId;
    String wallet;
    TradeStatus status;
    int queuePosition;

    boolean success;
    String betId;

    /**
     * Shares bought, sold or reversed.
     */
    double shares;

    /**
     * Average price per share of the executed trade.
     */
    double averagePrice;

    /**
     * Amount debited (BUY), credited (SELL) or refunded (UNDO).
     */
    BigDecimal amount;
    BigDecimal balanceAfter;

    double yesPrice;
    double noPrice;

    ErrorKind errorKind;
    String message;

    long submittedAt;
    Long completedAt;

    public boolean isDone() {
        return status == TradeStatus.DONE;
    }

    public static TradeResult queued(TradeRequest request) {
        return TradeResult.builder()
            .requestId(request.getRequestId())
            .kind(request.getKind())
            .marketId(request.getMarketId())
            .wallet(request.getWallet())
            .status(TradeStatus.QUEUED)
            .queuePosition(request.getQueuePosition())
            .submittedAt(request.getSubmittedAt())
            .build();
    }

    public TradeResult processing() {
        return toBuilder().status(TradeStatus.PROCESSING).build();
    }

    public TradeResult failed(ErrorKind errorKind, String message, long timestamp) {
        return toBuilder()
            .status(TradeStatus.DONE)
            .success(false)
            .errorKind(errorKind)
            .message(message)
            .completedAt(timestamp)
            .build();
    }
}
