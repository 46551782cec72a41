package com.prediction.market.lmsr_engine.repositories;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.prediction.market.lmsr_engine.entity.LedgerEntry;

@Repository
public interface LedgerEntryRepository extends MongoRepository<LedgerEntry, String> {
    /**
     * Find the most recent entry for a wallet.
     * Its balanceAfter is the wallet balance as of the last flush.
     *
     * @param wallet the wallet
     * @return the latest entry, or null if none exist
     */
    LedgerEntry findTopByWalletOrderByTimestampDesc(String wallet);
}
