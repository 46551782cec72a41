package com.prediction.market.lmsr_engine.repositories;

import java.util.List;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.lmsr_engine.entity.Bet;

@Repository
public interface BetRepository extends MongoRepository<Bet, String> {

    /**
     * All bets of a market in creation order. Used to warm the bet cache.
     */
    List<Bet> findByMarketIdOrderByCreatedAtAsc(String marketId);

    long deleteByWallet(String wallet);
}
