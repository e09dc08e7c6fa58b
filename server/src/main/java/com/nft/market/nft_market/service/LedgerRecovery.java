package com.nft.market.nft_market.service;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

import com.nft.market.nft_market.cache.AuctionStore;
import com.nft.market.nft_market.cache.SaleStore;
import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.entity.VaultTransaction;
import com.nft.market.nft_market.ledger.AuctionLedger;
import com.nft.market.nft_market.ledger.ClaimVault;
import com.nft.market.nft_market.payment.PaymentGateway;
import com.nft.market.nft_market.repositories.AuctionRepository;
import com.nft.market.nft_market.repositories.SaleRepository;
import com.nft.market.nft_market.repositories.VaultTransactionRepository;

import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Rebuilds the in-memory ledger from MongoDB before the first operation.
 *
 * Sales and auctions come back from their snapshots. Every vault entry and
 * every currency's escrow takes the {@code balanceAfter} of its latest
 * journal movement, and journal numbering continues after the highest stored
 * sequence.
 */
@Slf4j
@RequiredArgsConstructor
public class LedgerRecovery {

    private final SaleRepository saleRepository;
    private final AuctionRepository auctionRepository;
    private final VaultTransactionRepository vaultTransactionRepository;
    private final SaleStore saleStore;
    private final AuctionStore auctionStore;
    private final VaultJournal vaultJournal;
    private final ClaimVault claimVault;
    private final AuctionLedger auctionLedger;
    private final PaymentGateway paymentGateway;

    @PostConstruct
    public void recover() {
        saleStore.restore(saleRepository.findAll());
        auctionStore.restore(auctionRepository.findAll());

        // account -> currency -> latest balance
        Map<String, Map<String, Money>> vault = new HashMap<>();
        Map<String, Money> escrow = new HashMap<>();
        long lastSequence = 0;
        try (Stream<VaultTransaction> journal = vaultTransactionRepository.streamAllByOrderBySequenceAsc()) {
            for (VaultTransaction entry : (Iterable<VaultTransaction>) journal::iterator) {
                if (entry.getTransactionType().isEscrowMovement()) {
                    escrow.put(entry.getCurrency(), entry.getBalanceAfter());
                } else {
                    vault.computeIfAbsent(entry.getAccount(), a -> new HashMap<>())
                            .put(entry.getCurrency(), entry.getBalanceAfter());
                }
                lastSequence = Math.max(lastSequence, entry.getSequence());
            }
        }
        vaultJournal.resumeAfter(lastSequence);

        Map<String, Money> outstanding = new HashMap<>();
        vault.forEach((account, entries) -> entries.forEach((currency, balance) -> {
            claimVault.restore(account, currency, balance);
            outstanding.merge(currency, balance, Money::add);
        }));
        escrow.forEach((currency, amount) -> {
            auctionLedger.restoreEscrow(currency, amount);
            outstanding.merge(currency, amount, Money::add);
        });
        outstanding.forEach(paymentGateway::restoreOutstanding);

        Set<String> currencies = new TreeSet<>(outstanding.keySet());
        log.info("Ledger recovered: {} sales, {} auctions, journal at sequence {}, currencies {}",
                saleStore.count(), auctionStore.count(), lastSequence, currencies);
    }
}
