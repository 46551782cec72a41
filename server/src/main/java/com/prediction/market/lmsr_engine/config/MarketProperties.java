package com.prediction.market.lmsr_engine.config;

import java.math.BigDecimal;
import java.time.Duration;

import org.springframework.boot.context.properties.ConfigurationProperties;

import lombok.Getter;
import lombok.Setter;

/**
 * Engine settings bound from the {@code market.*} namespace.
 *
 * Defaults:
 * - liquidity b = 5000, buffer = 10000 per side: a 2000 buy on a fresh market
 *   moves YES from 0.50 to about 0.66
 * - starting balance 1000 per new wallet
 * - 2% fee on positive profit at resolution
 * - trade results kept for 1 hour, at most 1000 completed results
 */
@Getter
@Setter
@ConfigurationProperties(prefix = "market")
public class MarketProperties {

    /**
     * LMSR liquidity parameter b. Higher means deeper, slower-moving markets.
     */
    private double liquidityB = 5000.0;

    /**
     * Initial and minimum exposure on each side.
     */
    private double buffer = 10000.0;

    private BigDecimal startingBalance = new BigDecimal("1000");

    /**
     * Fraction of positive profit withheld at payout.
     */
    private BigDecimal feeRate = new BigDecimal("0.02");

    private BigDecimal maxTradeAmount = new BigDecimal("1000000");

    /**
     * Optional regex every wallet must match. Empty accepts any non-blank key.
     */
    private String walletPattern = "";

    /**
     * Relative share difference above which an undo is recommended.
     */
    private double slippageThreshold = 0.05;

    private Duration resultTtl = Duration.ofHours(1);

    private int maxResults = 1000;

    private Duration resultPurgeInterval = Duration.ofMinutes(1);

    private Admission admission = new Admission();

    private Persistence persistence = new Persistence();

    @Getter
    @Setter
    public static class Admission {

        /**
         * Trade intents a single wallet may submit per second.
         */
        private int submissionsPerSecond = 10;

        /**
         * How long a producer may wait for an admission permit.
         */
        private Duration timeout = Duration.ofMillis(100);
    }

    @Getter
    @Setter
    public static class Persistence {

        /**
         * A market state is written back once it has been idle this long.
         */
        private Duration idleFlushThreshold = Duration.ofSeconds(1);
    }
}
