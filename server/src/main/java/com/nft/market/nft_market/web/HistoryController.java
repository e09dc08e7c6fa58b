package com.nft.market.nft_market.web;

import java.util.List;

import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PathVariable;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;

import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.Auction;
import com.nft.market.nft_market.entity.Sale;
import com.nft.market.nft_market.entity.VaultTransaction;
import com.nft.market.nft_market.repositories.AuctionRepository;
import com.nft.market.nft_market.repositories.SaleRepository;
import com.nft.market.nft_market.repositories.VaultTransactionRepository;

import lombok.RequiredArgsConstructor;

/**
 * Read-only views over the persisted snapshots and journal. These trail the
 * live ledger by the asynchronous persistence delay.
 */
@RestController
@RequiredArgsConstructor
public class HistoryController {

    private final SaleRepository saleRepository;
    private final AuctionRepository auctionRepository;
    private final VaultTransactionRepository vaultTransactionRepository;

    @GetMapping(value = "/sales", params = "seller")
    public List<Sale> salesBySeller(@RequestParam String seller) {
        return saleRepository.findBySellerOrderByIdDesc(Addresses.normalize(seller));
    }

    @GetMapping(value = "/auctions", params = "seller")
    public List<Auction> auctionsBySeller(@RequestParam String seller) {
        return auctionRepository.findBySellerOrderByIdDesc(Addresses.normalize(seller));
    }

    /**
     * Movements of one vault entry, newest first.
     */
    @GetMapping("/vault/{currency}/history")
    public List<VaultTransaction> vaultHistory(@PathVariable String currency, @RequestParam String account) {
        return vaultTransactionRepository.findByAccountAndCurrencyOrderBySequenceDesc(
                Addresses.normalize(account), Addresses.normalize(currency));
    }

    /**
     * Every movement caused by one listing, e.g. {@code sale:3} or {@code auction:7}.
     */
    @GetMapping("/journal/{referenceId}")
    public List<VaultTransaction> journal(@PathVariable String referenceId) {
        return vaultTransactionRepository.findByReferenceIdOrderBySequenceAsc(referenceId);
    }
}
