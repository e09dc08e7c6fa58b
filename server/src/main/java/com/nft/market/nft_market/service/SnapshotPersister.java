package com.nft.market.nft_market.service;

import java.util.List;

import org.springframework.scheduling.annotation.Async;
import org.springframework.stereotype.Service;

import com.nft.market.nft_market.entity.Auction;
import com.nft.market.nft_market.entity.Sale;
import com.nft.market.nft_market.entity.VaultTransaction;
import com.nft.market.nft_market.repositories.AuctionRepository;
import com.nft.market.nft_market.repositories.SaleRepository;
import com.nft.market.nft_market.repositories.VaultTransactionRepository;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Mirrors committed ledger state to MongoDB off the ledger's critical path.
 * Callers hand over detached copies; the in-memory ledger stays authoritative.
 * All writes share one single-threaded executor, so a later copy of a record
 * is never overwritten by an earlier one.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class SnapshotPersister {

    public static final String EXECUTOR = "snapshotExecutor";

    private final SaleRepository saleRepository;
    private final AuctionRepository auctionRepository;
    private final VaultTransactionRepository vaultTransactionRepository;

    @Async(EXECUTOR)
    public void persistSale(Sale sale) {
        try {
            saleRepository.save(sale);
            log.debug("Persisted sale: {}", sale.getId());
        } catch (Exception e) {
            log.error("Failed to persist sale: {}", sale.getId(), e);
        }
    }

    @Async(EXECUTOR)
    public void persistAuction(Auction auction) {
        try {
            auctionRepository.save(auction);
            log.debug("Persisted auction: {}", auction.getId());
        } catch (Exception e) {
            log.error("Failed to persist auction: {}", auction.getId(), e);
        }
    }

    @Async(EXECUTOR)
    public void appendJournal(List<VaultTransaction> entries) {
        try {
            vaultTransactionRepository.saveAll(entries);
            log.debug("Appended {} vault transactions", entries.size());
        } catch (Exception e) {
            log.error("Failed to append {} vault transactions (first sequence {})",
                    entries.size(), entries.isEmpty() ? -1 : entries.get(0).getSequence(), e);
        }
    }
}
