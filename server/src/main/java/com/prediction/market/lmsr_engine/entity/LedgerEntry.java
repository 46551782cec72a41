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
 * Append-only record of one balance change. Audit trail only; the wallet's
 * {@link User#getBalance()} is authoritative.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "transactions")
@CompoundIndex(name = "wallet_timestamp_idx", def = "{'wallet':1,'timestamp':-1}")
public class LedgerEntry {
    @Id
    private String id;

    @Indexed
    private String wallet;

    private String marketId;

    @Indexed(sparse = true)
    private String betId;
    private LedgerEntryType type;
    private BigDecimal amount; // positive for credit, negative for debit

    /**
     * Running balance after this entry: balanceAfter = balanceBefore + amount.
     */
    private BigDecimal balanceAfter;

    private long timestamp;
    private String reference; // request id or bet id that caused the change
}
