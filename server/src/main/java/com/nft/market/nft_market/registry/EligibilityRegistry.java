package com.nft.market.nft_market.registry;

import java.util.Collection;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.nft.market.nft_market.entity.Addresses;

import lombok.extern.slf4j.Slf4j;

/**
 * Allow-lists of listing contracts and settlement currencies.
 *
 * The ledgers themselves are listing contracts: removing a ledger's own
 * address deprecates it, and every sale or auction it holds reads CANCELLED.
 *
 * Setters are idempotent and report whether anything changed. Approving all
 * currencies is one-way.
 */
@Slf4j
public class EligibilityRegistry {

    private final Set<String> listingContracts = ConcurrentHashMap.newKeySet();
    private final Set<String> currencies = ConcurrentHashMap.newKeySet();
    private volatile boolean allCurrenciesApproved = false;

    public EligibilityRegistry() {
    }

    public EligibilityRegistry(Collection<String> approvedContracts, Collection<String> approvedCurrencies) {
        approvedContracts.forEach(contract -> listingContracts.add(Addresses.normalize(contract)));
        approvedCurrencies.forEach(currency -> currencies.add(Addresses.normalize(currency)));
    }

    public boolean isApprovedListingContract(String contract) {
        return listingContracts.contains(Addresses.normalize(contract));
    }

    public boolean isApprovedCurrency(String currency) {
        return allCurrenciesApproved || currencies.contains(Addresses.normalize(currency));
    }

    public boolean isAllCurrenciesApproved() {
        return allCurrenciesApproved;
    }

    /**
     * @return true if the approval status changed
     */
    public synchronized boolean setListingContractApproval(String contract, boolean approved) {
        String address = Addresses.normalize(contract);
        boolean changed = approved ? listingContracts.add(address) : listingContracts.remove(address);
        if (changed) {
            log.info("Listing contract {} {}", address, approved ? "approved" : "revoked");
        }
        return changed;
    }

    /**
     * @return true if the approval status changed
     */
    public synchronized boolean setCurrencyApproval(String currency, boolean approved) {
        String address = Addresses.normalize(currency);
        boolean changed = approved ? currencies.add(address) : currencies.remove(address);
        if (changed) {
            log.info("Currency {} {}", address, approved ? "approved" : "revoked");
        }
        return changed;
    }

    /**
     * Irreversible.
     *
     * @return true on the first call only
     */
    public synchronized boolean approveAllCurrencies() {
        if (allCurrenciesApproved) {
            return false;
        }
        allCurrenciesApproved = true;
        log.info("All currencies approved");
        return true;
    }
}
