package com.nft.market.nft_market.repositories;

import java.util.List;
import java.util.stream.Stream;

import org.springframework.data.mongodb.repository.MongoRepository;
import org.springframework.stereotype.Repository;

import com.nft.market.nft_market.entity.VaultTransaction;

/**
 * Append-only journal of claim vault and escrow movements.
 */
@Repository
public interface VaultTransactionRepository extends MongoRepository<VaultTransaction, String> {

    List<VaultTransaction> findByAccountAndCurrencyOrderBySequenceDesc(String account, String currency);

    List<VaultTransaction> findByReferenceIdOrderBySequenceAsc(String referenceId);

    /**
     * Whole journal in commit order, for rebuilding balances at startup.
     * Callers must close the stream.
     */
    Stream<VaultTransaction> streamAllByOrderBySequenceAsc();
}
