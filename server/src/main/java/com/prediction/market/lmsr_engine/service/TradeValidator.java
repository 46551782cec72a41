package com.prediction.market.lmsr_engine.service;

import java.math.BigDecimal;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;

import com.prediction.market.lmsr_engine.config.MarketProperties;
import com.prediction.market.lmsr_engine.entity.Side;
import com.prediction.market.lmsr_engine.exception.ValidationException;
import com.prediction.market.lmsr_engine.model.TradeCommand;

import lombok.extern.slf4j.Slf4j;

/**
 * Shape checks for trade intents, run synchronously before anything is
 * queued. Read-only: market status and balances are checked elsewhere.
 */
@Slf4j
public class TradeValidator {

    private final MarketProperties properties;
    private final Pattern walletPattern;

    public TradeValidator(MarketProperties properties) {
        this.properties = properties;
        String pattern = properties.getWalletPattern();
        this.walletPattern = pattern == null || pattern.isBlank() ? null : Pattern.compile(pattern);
    }

    /**
     * Result of command validation.
     */
    public static class ValidationResult {
        private final boolean valid;
        private final List<String> errors;

        private ValidationResult(boolean valid, List<String> errors) {
            this.valid = valid;
            this.errors = errors;
        }

        public static ValidationResult valid() {
            return new ValidationResult(true, List.of());
        }

        public static ValidationResult invalid(List<String> errors) {
            return new ValidationResult(false, errors);
        }

        public boolean isValid() {
            return valid;
        }

        public List<String> getErrors() {
            return errors;
        }

        public String getErrorMessage() {
            return String.join("; ", errors);
        }
    }

    public ValidationResult validate(TradeCommand command) {
        List<String> errors = new ArrayList<>();
        if (command == null || command.kind() == null) {
            errors.add("trade kind is required");
            return ValidationResult.invalid(errors);
        }

        validateWallet(command.wallet(), errors);
        if (command.marketId() == null || command.marketId().isBlank()) {
            errors.add("marketId is required");
        }

        switch (command.kind()) {
            case BUY -> {
                validateSide(command.side(), errors);
                validateAmount(command.amount(), errors);
            }
            case SELL -> {
                if (command.betId() == null) {
                    validateSide(command.side(), errors);
                } else if (command.betId().isBlank()) {
                    errors.add("betId must not be blank");
                }
                validateShares(command.shares(), errors);
            }
            case UNDO -> {
                if (command.betId() == null || command.betId().isBlank()) {
                    errors.add("betId is required for undo");
                }
            }
        }

        if (errors.isEmpty()) {
            return ValidationResult.valid();
        }
        log.warn("Trade validation failed: {} (kind={}, wallet={})", errors, command.kind(), command.wallet());
        return ValidationResult.invalid(errors);
    }

    /**
     * @throws ValidationException listing every problem found
     */
    public void requireValid(TradeCommand command) {
        ValidationResult result = validate(command);
        if (!result.isValid()) {
            throw new ValidationException(result.getErrorMessage());
        }
    }

    public void validateAmount(BigDecimal amount, List<String> errors) {
        if (amount == null) {
            errors.add("amount is required");
            return;
        }
        if (amount.signum() <= 0) {
            errors.add("Amount must be positive");
        } else if (amount.compareTo(properties.getMaxTradeAmount()) > 0) {
            errors.add(String.format("Amount cannot exceed %s", properties.getMaxTradeAmount().toPlainString()));
        }
    }

    private void validateWallet(String wallet, List<String> errors) {
        if (wallet == null || wallet.isBlank()) {
            errors.add("wallet is required");
            return;
        }
        if (walletPattern != null && !walletPattern.matcher(wallet.trim()).matches()) {
            errors.add("Invalid wallet address format");
        }
    }

    private static void validateSide(String side, List<String> errors) {
        if (side == null || side.isBlank()) {
            errors.add("side is required");
            return;
        }
        try {
            Side.parse(side);
        } catch (ValidationException e) {
            errors.add(e.getMessage());
        }
    }

    private static void validateShares(Double shares, List<String> errors) {
        if (shares == null) {
            errors.add("shares is required");
        } else if (!Double.isFinite(shares) || shares <= 0) {
            errors.add("Shares must be a positive number");
        }
    }
}
