package com.prediction.market.lmsr_engine.entity;

public enum TradeKind {
    BUY,
    SELL,
    UNDO
}
