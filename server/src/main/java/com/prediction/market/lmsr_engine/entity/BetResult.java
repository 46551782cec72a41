package com.prediction.market.lmsr_engine.entity;

public enum BetResult {
    WON,
    LOST,
    NOT_APPLICABLE
}
