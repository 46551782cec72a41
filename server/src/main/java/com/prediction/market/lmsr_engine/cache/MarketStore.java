package com.prediction.market.lmsr_engine.cache;

import java.time.Clock;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Supplier;

import org.springframework.scheduling.annotation.Scheduled;

import com.prediction.market.lmsr_engine.config.MarketProperties;
import com.prediction.market.lmsr_engine.entity.Market;
import com.prediction.market.lmsr_engine.entity.MarketState;
import com.prediction.market.lmsr_engine.entity.MarketStatus;
import com.prediction.market.lmsr_engine.entity.Side;
import com.prediction.market.lmsr_engine.exception.BufferViolationException;
import com.prediction.market.lmsr_engine.exception.NotFoundException;
import com.prediction.market.lmsr_engine.exception.ValidationException;
import com.prediction.market.lmsr_engine.model.MarketSnapshot;
import com.prediction.market.lmsr_engine.repositories.MarketRepository;
import com.prediction.market.lmsr_engine.repositories.MarketStateRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * In-memory owner of markets and their LMSR exposure, written back to MongoDB.
 *
 * Every mutation happens under the market's lock. Readers use the immutable
 * {@link MarketSnapshot} published after each mutation and never block.
 */
@Slf4j
@RequiredArgsConstructor
public class MarketStore {
    // Absorbs the last-ulp error of reversing a buy exactly onto the floor.
    private static final double FLOOR_TOLERANCE = 1e-9;

    private final ConcurrentHashMap<String, Market> markets = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, MarketState> states = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, MarketSnapshot> snapshots = new ConcurrentHashMap<>();
    private final ConcurrentHashMap<String, ReentrantLock> locks = new ConcurrentHashMap<>();

    private final MarketRepository marketRepository;
    private final MarketStateRepository marketStateRepository;
    private final MarketProperties properties;
    private final Clock clock;

    /**
     * Create an OPEN market with exposure (buffer, buffer), i.e. 50/50.
     */
    public Market createMarket(String question, String description, String category, String createdBy, Long endTime) {
        if (question == null || question.trim().isEmpty()) {
            throw new ValidationException("Question is required");
        }
        long now = clock.millis();
        String marketId = UUID.randomUUID().toString();

        Market market = Market.builder()
                .id(marketId)
                .question(question.trim())
                .description(description)
                .category(category)
                .createdBy(createdBy)
                .endTime(endTime)
                .status(MarketStatus.OPEN)
                .createdAt(now)
                .build();

        MarketState state = MarketState.builder()
                .id(marketId)
                .marketId(marketId)
                .qYes(properties.getBuffer())
                .qNo(properties.getBuffer())
                .liquidityB(properties.getLiquidityB())
                .bufferFloor(properties.getBuffer())
                .sequence(0)
                .lastTradeTimestamp(now)
                .lastPersistedTimestamp(now)
                .build();

        markets.put(marketId, market);
        states.put(marketId, state);
        snapshots.put(marketId, MarketSnapshot.of(state));

        // Persist immediately
        persistMarket(market);
        persistState(copyOf(state));
        log.info("Created market {}: {}", marketId, market.getQuestion());
        return market;
    }

    public Optional<Market> findMarket(String marketId) {
        if (marketId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(markets.computeIfAbsent(marketId,
                id -> marketRepository.findById(id).orElse(null)));
    }

    public Market getMarket(String marketId) {
        return findMarket(marketId)
                .orElseThrow(() -> new NotFoundException("Market not found: " + marketId));
    }

    /**
     * Current exposure of a market. Lock-free; may trail an in-flight trade.
     */
    public MarketSnapshot snapshot(String marketId) {
        MarketSnapshot snapshot = snapshots.get(marketId);
        if (snapshot != null) {
            return snapshot;
        }
        getMarket(marketId);
        return MarketSnapshot.of(loadState(marketId));
    }

    public List<Market> listMarkets(MarketStatus status) {
        return markets.values().stream()
                .filter(market -> status == null || market.getStatus() == status)
                .sorted(Comparator.comparingLong(Market::getCreatedAt).reversed())
                .toList();
    }

    /**
     * Run {@code action} while holding the market's lock. Trades and resolution
     * of the same market never interleave.
     */
    public <T> T withLock(String marketId, Supplier<T> action) {
        ReentrantLock lock = locks.computeIfAbsent(marketId, id -> new ReentrantLock());
        lock.lock();
        try {
            return action.get();
        } finally {
            lock.unlock();
        }
    }

    /**
     * Add the deltas to the market's exposure. The only mutator of MarketState.
     *
     * @throws BufferViolationException if either side would end below the floor;
     *                                  the state is left untouched
     * @throws IllegalStateException    if the caller does not hold the market lock
     */
    public MarketSnapshot apply(String marketId, double deltaYes, double deltaNo) {
        requireLockHeld(marketId);
        MarketState state = loadState(marketId);

        double floor = state.getBufferFloor();
        double newYes = withinFloor(state.getQYes() + deltaYes, floor, Side.YES, marketId);
        double newNo = withinFloor(state.getQNo() + deltaNo, floor, Side.NO, marketId);

        state.setQYes(newYes);
        state.setQNo(newNo);
        state.setSequence(state.getSequence() + 1);
        state.setLastTradeTimestamp(clock.millis());

        MarketSnapshot snapshot = MarketSnapshot.of(state);
        snapshots.put(marketId, snapshot);
        return snapshot;
    }

    /**
     * Put one side's exposure back to a value it held earlier. Compensates the
     * latest buy without the rounding an inverse delta would introduce.
     */
    public MarketSnapshot restore(String marketId, Side side, double exposure) {
        requireLockHeld(marketId);
        MarketState state = loadState(marketId);
        double value = withinFloor(exposure, state.getBufferFloor(), side, marketId);

        if (side == Side.YES) {
            state.setQYes(value);
        } else {
            state.setQNo(value);
        }
        state.setSequence(state.getSequence() + 1);
        state.setLastTradeTimestamp(clock.millis());

        MarketSnapshot snapshot = MarketSnapshot.of(state);
        snapshots.put(marketId, snapshot);
        return snapshot;
    }

    /**
     * Move the market to RESOLVED and persist it right away.
     */
    public Market markResolved(String marketId, Side outcome) {
        requireLockHeld(marketId);
        Market market = getMarket(marketId);
        market.resolve(outcome, clock.millis());
        persistMarket(market);
        return market;
    }

    /**
     * Load every persisted market and its state. Called once at startup.
     */
    public int warmUp() {
        List<Market> persisted = marketRepository.findAll();
        for (Market market : persisted) {
            markets.putIfAbsent(market.getId(), market);
            loadState(market.getId());
        }
        return persisted.size();
    }

    @Scheduled(fixedDelay = 1000)
    public void flushIdleMarkets() {
        long now = clock.millis();
        long idleThreshold = properties.getPersistence().getIdleFlushThreshold().toMillis();

        for (MarketState market : states.values()) {
            if (now - market.getLastTradeTimestamp() > idleThreshold &&
                    market.getLastPersistedTimestamp() < market.getLastTradeTimestamp()) {
                MarketState copy = withLock(market.getMarketId(), () -> copyOf(market));
                if (persistState(copy)) {
                    market.setLastPersistedTimestamp(copy.getLastTradeTimestamp());
                }
            }
        }
    }

    public void persistMarket(Market market) {
        try {
            marketRepository.save(market);
            log.debug("Persisted market: {}", market.getId());
        } catch (Exception e) {
            log.error("Failed to persist market: {}", market.getId(), e);
        }
    }

    private boolean persistState(MarketState state) {
        try {
            marketStateRepository.save(state);
            log.debug("Persisted market state: {} (seq={})", state.getMarketId(), state.getSequence());
            return true;
        } catch (Exception e) {
            log.error("Failed to persist market state: {}", state.getMarketId(), e);
            return false;
        }
    }

    private MarketState loadState(String marketId) {
        MarketState state = states.computeIfAbsent(marketId, id ->
                marketStateRepository.findByMarketId(id).orElseGet(() -> {
                    log.warn("Market state missing for {}. Initialising at buffer.", id);
                    return MarketState.builder()
                            .id(id)
                            .marketId(id)
                            .qYes(properties.getBuffer())
                            .qNo(properties.getBuffer())
                            .liquidityB(properties.getLiquidityB())
                            .bufferFloor(properties.getBuffer())
                            .build();
                }));
        snapshots.putIfAbsent(marketId, MarketSnapshot.of(state));
        return state;
    }

    private void requireLockHeld(String marketId) {
        ReentrantLock lock = locks.get(marketId);
        if (lock == null || !lock.isHeldByCurrentThread()) {
            throw new IllegalStateException("Market lock not held for " + marketId);
        }
    }

    private static double withinFloor(double value, double floor, Side side, String marketId) {
        if (value >= floor) {
            return value;
        }
        if (floor - value <= FLOOR_TOLERANCE * Math.max(1.0, floor)) {
            return floor;
        }
        throw new BufferViolationException(String.format(
                "%s exposure of market %s would drop to %.4f, below the floor %.4f",
                side, marketId, value, floor));
    }

    private static MarketState copyOf(MarketState state) {
        return MarketState.builder()
                .id(state.getId())
                .marketId(state.getMarketId())
                .qYes(state.getQYes())
                .qNo(state.getQNo())
                .liquidityB(state.getLiquidityB())
                .bufferFloor(state.getBufferFloor())
                .sequence(state.getSequence())
                .lastTradeTimestamp(state.getLastTradeTimestamp())
                .lastPersistedTimestamp(state.getLastPersistedTimestamp())
                .build();
    }
}
