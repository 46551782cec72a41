package com.prediction.market.lmsr_engine.engine;

import com.prediction.market.lmsr_engine.entity.Side;
import com.prediction.market.lmsr_engine.exception.BufferViolationException;
import com.prediction.market.lmsr_engine.exception.ValidationException;
import com.prediction.market.lmsr_engine.model.BuyQuote;
import com.prediction.market.lmsr_engine.model.MarketSnapshot;
import com.prediction.market.lmsr_engine.model.PriceQuote;
import com.prediction.market.lmsr_engine.model.SellQuote;

/**
 * Pure LMSR math. No state, no I/O, safe to call from any thread.
 *
 * All exponentials are shifted by max(q_yes, q_no)/b so cumulative exposure of
 * any size stays finite.
 */
public class PricingEngine {

    public static final double MIN_PRICE = 0.01;
    public static final double MAX_PRICE = 0.99;
    // Same last-ulp allowance as MarketStore when a sell returns exposure to the floor.
    private static final double FLOOR_TOLERANCE = 1e-9;

    // Unclamped LMSR probability of YES.
    public double rawYesPrice(double qYes, double qNo, double liquidityB) {
        double maxQ = Math.max(qYes, qNo) / liquidityB;
        double expYes = Math.exp((qYes / liquidityB) - maxQ);
        double expNo = Math.exp((qNo / liquidityB) - maxQ);
        return expYes / (expYes + expNo);
    }

    /**
     * Display prices. YES is clamped to [0.01, 0.99] and NO is its complement,
     * so both are clamped and they always sum to one.
     */
    public PriceQuote getPrices(double qYes, double qNo, double liquidityB) {
        double yes = clamp(rawYesPrice(qYes, qNo, liquidityB));
        return new PriceQuote(yes, 1.0 - yes);
    }

    public PriceQuote getPrices(MarketSnapshot snapshot) {
        return getPrices(snapshot.qYes(), snapshot.qNo(), snapshot.liquidityB());
    }

    public double getPrice(double qYes, double qNo, Side side, double liquidityB) {
        return getPrices(qYes, qNo, liquidityB).priceOf(side);
    }

    // LMSR cost function C = b * ln(e^(qYes/b) + e^(qNo/b))
    public double cost(double qYes, double qNo, double liquidityB) {
        double maxQ = Math.max(qYes, qNo) / liquidityB;
        return liquidityB * Math.log(
            Math.exp(qYes / liquidityB - maxQ) + Math.exp(qNo / liquidityB - maxQ)
        ) + liquidityB * maxQ;
    }

    /**
     * Shares received for spending {@code amount} on {@code side}.
     *
     * Closed form of C(q', q_other) - C(q, q_other) = amount:
     * q'/b = m + a/b + ln(e^(q/b - m) + e^(q_other/b - m) * (1 - e^(-a/b)))
     * which is the textbook b*ln(e^(a/b)(e^(q/b)+e^(o/b)) - e^(o/b)) rearranged
     * so that nothing is exponentiated above zero.
     */
    public BuyQuote quoteBuy(MarketSnapshot state, Side side, double amount) {
        requirePositive(amount, "amount");
        double b = state.liquidityB();
        double q = state.exposure(side);
        double other = state.exposure(side.opposite());

        double m = Math.max(q, other) / b;
        double x = amount / b;
        double tail = Math.exp(q / b - m) + Math.exp(other / b - m) * -Math.expm1(-x);
        double newQ = b * (m + x + Math.log(tail));
        double shares = newQ - q;

        if (!Double.isFinite(shares) || shares <= 0) {
            throw new ValidationException("Amount too small to buy any shares: " + amount);
        }

        double qYesAfter = side == Side.YES ? newQ : state.qYes();
        double qNoAfter = side == Side.NO ? newQ : state.qNo();
        return new BuyQuote(side, amount, shares, amount / shares, newQ,
            getPrices(qYesAfter, qNoAfter, b));
    }

    /**
     * Proceeds for returning {@code shares} of {@code side} to the market.
     *
     * @throws BufferViolationException if the side's exposure would drop below the floor
     */
    public SellQuote quoteSell(MarketSnapshot state, Side side, double shares) {
        requirePositive(shares, "shares");
        double b = state.liquidityB();
        double q = state.exposure(side);
        double newQ = q - shares;
        double floor = state.bufferFloor();
        if (newQ < floor && floor - newQ <= FLOOR_TOLERANCE * Math.max(1.0, floor)) {
            newQ = floor;
        }
        if (newQ < floor) {
            throw new BufferViolationException(String.format(
                "Selling %.4f %s shares would drop exposure to %.4f, below the floor %.4f",
                shares, side, newQ, state.bufferFloor()));
        }

        double qYesAfter = side == Side.YES ? newQ : state.qYes();
        double qNoAfter = side == Side.NO ? newQ : state.qNo();
        double proceeds = cost(state.qYes(), state.qNo(), b) - cost(qYesAfter, qNoAfter, b);

        return new SellQuote(side, shares, proceeds, proceeds / shares, newQ,
            getPrices(qYesAfter, qNoAfter, b));
    }

    private static double clamp(double price) {
        return Math.max(MIN_PRICE, Math.min(MAX_PRICE, price));
    }

    private static void requirePositive(double value, String name) {
        if (!Double.isFinite(value) || value <= 0) {
            throw new ValidationException(name + " must be a positive number");
        }
    }
}
