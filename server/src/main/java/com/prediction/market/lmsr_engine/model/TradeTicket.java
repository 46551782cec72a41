package com.prediction.market.lmsr_engine.model;

/**
 * Handle returned on submission. Poll the request id for the outcome.
 *
 * @param queuePosition intents ahead of this one on the same market at submission time
 */
public record TradeTicket(String requestId, String marketId, int queuePosition) {
}
