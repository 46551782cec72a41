package com.prediction.market.lmsr_engine.entity;

/**
 * Progress of a trade request through its market's queue.
 */
public enum TradeStatus {
    QUEUED,
    PROCESSING,
    DONE
}
