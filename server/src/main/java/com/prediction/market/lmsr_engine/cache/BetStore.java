package com.prediction.market.lmsr_engine.cache;

import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.CopyOnWriteArrayList;

import org.springframework.scheduling.annotation.Scheduled;

import com.prediction.market.lmsr_engine.entity.Bet;
import com.prediction.market.lmsr_engine.entity.Side;
import com.prediction.market.lmsr_engine.repositories.BetRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Bets indexed by id and by market. A market's bets are loaded from MongoDB
 * the first time that market is touched; modified bets are written back by
 * {@link #flushModifiedBets()}.
 *
 * Bets are only mutated while their market's lock is held; the flush copies
 * them under that lock before writing.
 */
@Slf4j
@RequiredArgsConstructor
public class BetStore {
    private final ConcurrentHashMap<String, Bet> bets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, List<Bet>> betsByMarket = new ConcurrentHashMap<>();
    private final Set<String> modified = ConcurrentHashMap.newKeySet();

    private final BetRepository betRepository;
    private final MarketStore marketStore;

    public List<Bet> betsForMarket(String marketId) {
        return betsByMarket.computeIfAbsent(marketId, id -> {
            List<Bet> loaded = new CopyOnWriteArrayList<>(betRepository.findByMarketIdOrderByCreatedAtAsc(id));
            loaded.forEach(bet -> bets.putIfAbsent(bet.getId(), bet));
            return loaded;
        });
    }

    public Optional<Bet> findBet(String betId) {
        if (betId == null) {
            return Optional.empty();
        }
        Bet cached = bets.get(betId);
        if (cached != null) {
            return Optional.of(cached);
        }
        return betRepository.findById(betId).map(persisted -> {
            betsForMarket(persisted.getMarketId());
            return bets.computeIfAbsent(betId, id -> persisted);
        });
    }

    /**
     * The wallet's OPEN bets on one side of a market, oldest first.
     */
    public List<Bet> openBets(String marketId, String wallet, Side side) {
        return betsForMarket(marketId).stream()
                .filter(Bet::isOpen)
                .filter(bet -> bet.getWallet().equals(wallet) && bet.getSide() == side)
                .toList();
    }

    public List<Bet> betsForWallet(String wallet, Collection<String> marketIds) {
        return marketIds.stream()
                .flatMap(marketId -> betsForMarket(marketId).stream())
                .filter(bet -> bet.getWallet().equals(wallet))
                .toList();
    }

    public void add(Bet bet) {
        betsForMarket(bet.getMarketId()).add(bet);
        bets.put(bet.getId(), bet);
        markModified(bet);
    }

    public void markModified(Bet bet) {
        modified.add(bet.getId());
    }

    /**
     * Forget every bet of the wallet, cached or persisted.
     *
     * @param marketIds markets whose bets should be checked in the cache
     * @return number of bets removed
     */
    public long removeWallet(String wallet, Collection<String> marketIds) {
        int cached = 0;
        for (String marketId : marketIds) {
            List<Bet> owned = marketStore.withLock(marketId, () -> {
                List<Bet> matching = betsForMarket(marketId).stream()
                        .filter(bet -> bet.getWallet().equals(wallet))
                        .toList();
                betsForMarket(marketId).removeAll(matching);
                for (Bet bet : matching) {
                    bets.remove(bet.getId());
                    modified.remove(bet.getId());
                }
                return matching;
            });
            cached += owned.size();
        }
        long persisted = betRepository.deleteByWallet(wallet);
        log.info("Removed bets of wallet {}: cached={}, persisted={}", wallet, cached, persisted);
        return Math.max(cached, persisted);
    }

    @Scheduled(fixedDelay = 1000)
    public void flushModifiedBets() {
        for (String betId : List.copyOf(modified)) {
            modified.remove(betId);
            Bet bet = bets.get(betId);
            if (bet == null) {
                continue;
            }
            try {
                Bet copy = marketStore.withLock(bet.getMarketId(),
                        () -> bets.get(betId) == bet ? bet.toBuilder().build() : null);
                if (copy == null) {
                    continue;
                }
                betRepository.save(copy);
                if (!bets.containsKey(betId)) {
                    betRepository.deleteById(betId);
                }
                log.debug("Persisted bet: {}", betId);
            } catch (Exception e) {
                modified.add(betId);
                log.error("Failed to persist bet: {}", betId, e);
            }
        }
    }
}
