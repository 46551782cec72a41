package com.prediction.market.lmsr_engine.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.lmsr_engine.entity.User;

/**
 * Wallet balances, keyed by wallet.
 *
 * NOTE: the in-memory copy held by LedgerService is authoritative while the
 * process runs. This repository is the write-behind target and the source for
 * lazily loading wallets after a restart.
 */
@Repository
public interface UserRepository extends MongoRepository<User, String> {
}
