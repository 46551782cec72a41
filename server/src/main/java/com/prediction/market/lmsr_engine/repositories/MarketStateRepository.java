package com.prediction.market.lmsr_engine.repositories;

import java.util.Optional;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.lmsr_engine.entity.MarketState;

@Repository
public interface MarketStateRepository extends MongoRepository<MarketState, String> {
    Optional<MarketState> findByMarketId(String marketId);

}
