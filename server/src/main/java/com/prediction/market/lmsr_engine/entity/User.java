package com.prediction.market.lmsr_engine.entity;

import java.math.BigDecimal;

import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.mapping.Document;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Wallet balance record. Keyed by the lower-cased wallet identifier.
 */
@Document(collection = "users")
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class User {
    @Id
    private String wallet;

    private BigDecimal balance;

    /**
     * Wallet verification state; new wallets start {@code unverified}.
     */
    @Builder.Default
    private String authStatus = "unverified";

    private long createdAt;
    private long lastSeenAt;

    public Money balance() {
        return Money.ofNullable(balance);
    }

    public boolean hasSufficientBalance(Money amount) {
        return balance().isGreaterThanOrEqualTo(amount);
    }

    public void debit(Money amount) {
        Money updated = balance().subtract(amount);
        if (updated.isNegative()) {
            throw new IllegalStateException("Balance would go negative for wallet " + wallet);
        }
        this.balance = updated.toBigDecimal();
    }

    public void credit(Money amount) {
        this.balance = balance().add(amount).toBigDecimal();
    }
}
