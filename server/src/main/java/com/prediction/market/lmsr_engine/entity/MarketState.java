package com.prediction.market.lmsr_engine.entity;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Cumulative LMSR exposure of one market. Mutated only by
 * {@code MarketStore.apply} while the market lock is held.
 */
@Document(collection = "market_state")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class MarketState {
    @Id
    private String id;

    @Indexed(unique = true)
    private String marketId;
    private double qYes;
    private double qNo;
    private double liquidityB;
    private double bufferFloor;

    /**
     * Number of mutations applied so far. Lets undo detect intervening trades.
     */
    private long sequence;

    private long lastTradeTimestamp; // updated by MarketStore.apply
    private long lastPersistedTimestamp; // updated by MarketStore.flushIdleMarkets

    public double exposure(Side side) {
        return side == Side.YES ? qYes : qNo;
    }
}
