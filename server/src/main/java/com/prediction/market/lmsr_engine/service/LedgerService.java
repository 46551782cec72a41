package com.prediction.market.lmsr_engine.service;

import java.time.Clock;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Queue;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentLinkedQueue;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import com.prediction.market.lmsr_engine.config.MarketProperties;
import com.prediction.market.lmsr_engine.entity.LedgerEntry;
import com.prediction.market.lmsr_engine.entity.LedgerEntryType;
import com.prediction.market.lmsr_engine.entity.Money;
import com.prediction.market.lmsr_engine.entity.User;
import com.prediction.market.lmsr_engine.exception.InsufficientFundsException;
import com.prediction.market.lmsr_engine.exception.ValidationException;
import com.prediction.market.lmsr_engine.model.BalanceView;
import com.prediction.market.lmsr_engine.repositories.LedgerEntryRepository;
import com.prediction.market.lmsr_engine.repositories.UserRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Wallet balances.
 *
 * Balances live in memory and are guarded by one lock per wallet, so trades on
 * unrelated markets never wait on each other here. Every change appends a
 * {@link LedgerEntry} carrying the running balance; users and entries are
 * written to MongoDB by {@link #flushLedger()}.
 *
 * Hard invariant: a balance never goes negative. Every debit checks first.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class LedgerService {

    private final ConcurrentHashMap<String, User> users = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> walletLocks = new ConcurrentHashMap<>();
    private final Set<String> modifiedWallets = ConcurrentHashMap.newKeySet();
    private final Queue<LedgerEntry> pendingEntries = new ConcurrentLinkedQueue<>();

    private final UserRepository userRepository;
    private final LedgerEntryRepository ledgerEntryRepository;
    private final MarketProperties properties;
    private final Clock clock;

    /**
     * Current balance, provisioning the wallet with the starting credit on first access.
     *
     * @param wallet the wallet (case-insensitive)
     * @return balance and whether this call created the wallet
     */
    public BalanceView balanceOf(String wallet) {
        String key = normalize(wallet);
        return withWalletLock(key, () -> {
            LoadedUser loaded = loadOrProvision(key);
            loaded.user().setLastSeenAt(clock.millis());
            return new BalanceView(key, loaded.user().getBalance(), loaded.provisioned());
        });
    }

    /**
     * Atomically remove {@code amount} from the wallet.
     *
     * @return the balance after the debit
     * @throws InsufficientFundsException if the balance is lower than the amount;
     *                                    nothing is changed
     */
    public Money debit(String wallet, Money amount, LedgerEntryType type, String marketId, String reference) {
        return debit(wallet, amount, type, marketId, reference, null);
    }

    /**
     * As {@link #debit(String, Money, LedgerEntryType, String, String)}, with the
     * entry tied to the bet it pays for.
     */
    public Money debit(String wallet, Money amount, LedgerEntryType type, String marketId, String reference,
            String betId) {
        requireNonNegative(amount);
        String key = normalize(wallet);
        return withWalletLock(key, () -> {
            User user = loadOrProvision(key).user();
            if (!user.hasSufficientBalance(amount)) {
                throw new InsufficientFundsException(key, user.balance(), amount);
            }
            user.debit(amount);
            record(user, amount.negate(), type, marketId, reference, betId);
            return user.balance();
        });
    }

    /**
     * Atomically add {@code amount} to the wallet. Used for sells, refunds and payouts.
     *
     * @return the balance after the credit
     */
    public Money credit(String wallet, Money amount, LedgerEntryType type, String marketId, String reference) {
        return credit(wallet, amount, type, marketId, reference, null);
    }

    public Money credit(String wallet, Money amount, LedgerEntryType type, String marketId, String reference,
            String betId) {
        requireNonNegative(amount);
        String key = normalize(wallet);
        return withWalletLock(key, () -> {
            User user = loadOrProvision(key).user();
            user.credit(amount);
            record(user, amount, type, marketId, reference, betId);
            return user.balance();
        });
    }

    /**
     * Manual top-up by an operator.
     */
    public Money adminCredit(String wallet, Money amount) {
        if (!amount.isPositive()) {
            throw new ValidationException("Amount must be positive");
        }
        Money balance = credit(wallet, amount, LedgerEntryType.ADMIN_CREDIT, null, "admin");
        log.info("Admin credited {} with {}. New balance: {}", normalize(wallet), amount, balance);
        return balance;
    }

    /**
     * The wallet as stored, without provisioning it.
     */
    public Optional<User> findUser(String wallet) {
        String key = normalize(wallet);
        User cached = users.get(key);
        if (cached != null) {
            return Optional.of(snapshotOf(cached));
        }
        return userRepository.findById(key);
    }

    /**
     * Every known wallet, newest first. Cached balances win over persisted ones.
     */
    public List<User> allUsers() {
        Map<String, User> merged = new LinkedHashMap<>();
        userRepository.findAll().forEach(user -> merged.put(user.getWallet(), user));
        users.values().forEach(user -> merged.put(user.getWallet(), snapshotOf(user)));
        return merged.values().stream()
            .sorted(Comparator.comparingLong(User::getCreatedAt).reversed())
            .toList();
    }

    /**
     * Drop the wallet from the cache and from MongoDB. Ledger entries already
     * written are kept.
     */
    public void deleteWallet(String wallet) {
        String key = normalize(wallet);
        withWalletLock(key, () -> {
            users.remove(key);
            modifiedWallets.remove(key);
            userRepository.deleteById(key);
            return null;
        });
        log.info("Deleted wallet {}", key);
    }

    /**
     * Write modified wallets and pending ledger entries to MongoDB. Failed
     * writes are re-queued for the next run.
     */
    @Scheduled(fixedDelay = 1000)
    public void flushLedger() {
        for (String wallet : List.copyOf(modifiedWallets)) {
            modifiedWallets.remove(wallet);
            try {
                User snapshot = withWalletLock(wallet, () -> {
                    User user = users.get(wallet);
                    return user == null ? null : snapshotOf(user);
                });
                if (snapshot == null) {
                    continue; // deleted
                }
                userRepository.save(snapshot);
                if (!users.containsKey(wallet)) {
                    userRepository.deleteById(wallet); // deleted while the save was in flight
                }
            } catch (Exception e) {
                modifiedWallets.add(wallet);
                log.error("Failed to persist wallet {}: {}", wallet, e.getMessage(), e);
            }
        }

        LedgerEntry entry;
        while ((entry = pendingEntries.peek()) != null) {
            try {
                ledgerEntryRepository.save(entry);
                pendingEntries.poll();
            } catch (Exception e) {
                log.error("Failed to persist ledger entry for {}: {}", entry.getWallet(), e.getMessage(), e);
                return;
            }
        }
    }

    /**
     * Periodic reconciliation - checks persisted ledger entries against cached balances.
     * Runs every 5 minutes; drift is reported, never auto-corrected.
     */
    @Scheduled(fixedDelay = 300000) // 5 minutes
    public int reconcileBalances() {
        int drifted = 0;
        for (User user : users.values()) {
            if (modifiedWallets.contains(user.getWallet()) || hasPendingEntries(user.getWallet())) {
                continue; // not flushed yet
            }
            try {
                LedgerEntry latest = ledgerEntryRepository.findTopByWalletOrderByTimestampDesc(user.getWallet());
                if (latest == null) {
                    continue;
                }
                Money persisted = Money.ofNullable(latest.getBalanceAfter());
                Money cached = withWalletLock(user.getWallet(), user::balance);
                if (!persisted.equals(cached)) {
                    log.warn("Balance drift detected for wallet {}: cached={}, ledger={}",
                        user.getWallet(), cached, persisted);
                    drifted++;
                }
            } catch (Exception e) {
                log.error("Balance reconciliation failed for {}: {}", user.getWallet(), e.getMessage(), e);
            }
        }
        log.info("Balance reconciliation complete: {} wallets checked, {} drifted", users.size(), drifted);
        return drifted;
    }

    public static String normalize(String wallet) {
        if (wallet == null || wallet.trim().isEmpty()) {
            throw new ValidationException("Wallet is required");
        }
        return wallet.trim().toLowerCase();
    }

    private boolean hasPendingEntries(String wallet) {
        return pendingEntries.stream().anyMatch(entry -> entry.getWallet().equals(wallet));
    }

    private LoadedUser loadOrProvision(String wallet) {
        User cached = users.get(wallet);
        if (cached != null) {
            return new LoadedUser(cached, false);
        }
        User user = userRepository.findById(wallet).orElse(null);
        if (user != null) {
            users.put(wallet, user);
            return new LoadedUser(user, false);
        }
        long now = clock.millis();
        Money starting = Money.of(properties.getStartingBalance());
        user = User.builder()
            .wallet(wallet)
            .balance(starting.toBigDecimal())
            .createdAt(now)
            .lastSeenAt(now)
            .build();
        users.put(wallet, user);
        record(user, starting, LedgerEntryType.STARTING_CREDIT, null, "provision", null);
        log.info("Provisioned wallet {} with starting balance {}", wallet, starting);
        return new LoadedUser(user, true);
    }

    private void record(User user, Money signedAmount, LedgerEntryType type, String marketId, String reference,
            String betId) {
        pendingEntries.add(LedgerEntry.builder()
            .wallet(user.getWallet())
            .marketId(marketId)
            .betId(betId)
            .type(type)
            .amount(signedAmount.toBigDecimal())
            .balanceAfter(user.getBalance())
            .timestamp(clock.millis())
            .reference(reference)
            .build());
        modifiedWallets.add(user.getWallet());
    }

    private <T> T withWalletLock(String wallet, Supplier<T> action) {
        ReentrantLock lock = walletLocks.computeIfAbsent(wallet, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    private User snapshotOf(User user) {
        return withWalletLock(user.getWallet(), () -> User.builder()
            .wallet(user.getWallet())
            .balance(user.getBalance())
            .authStatus(user.getAuthStatus())
            .createdAt(user.getCreatedAt())
            .lastSeenAt(user.getLastSeenAt())
            .build());
    }

    private record LoadedUser(User user, boolean provisioned) {
    }

    private static void requireNonNegative(Money amount) {
        if (amount == null || amount.isNegative()) {
            throw new ValidationException("Amount must be non-negative");
        }
    }
}
