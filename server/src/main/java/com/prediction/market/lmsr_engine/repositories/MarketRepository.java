package com.prediction.market.lmsr_engine.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.lmsr_engine.entity.Market;

@Repository
public interface MarketRepository extends MongoRepository<Market, String> {
}
