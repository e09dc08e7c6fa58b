package com.nft.market.nft_market.ledger;

import com.nft.market.nft_market.asset.ItemTransfers;
import com.nft.market.nft_market.entity.ItemRef;
import com.nft.market.nft_market.error.MarketplaceException;
import com.nft.market.nft_market.registry.EligibilityRegistry;

/**
 * Preconditions shared by sale and auction creation.
 */
final class ListingChecks {

    private ListingChecks() {
    }

    static void requireEligible(EligibilityRegistry registry, ItemTransfers itemTransfers,
            String ledgerAddress, ItemRef item, String currency) {
        if (!registry.isApprovedListingContract(ledgerAddress)) {
            throw MarketplaceException.ineligible("Ledger %s is deprecated", ledgerAddress);
        }
        if (!registry.isApprovedListingContract(item.getContract())) {
            throw MarketplaceException.ineligible("Listing contract %s is not approved", item.getContract());
        }
        if (!registry.isApprovedCurrency(currency)) {
            throw MarketplaceException.ineligible("Currency %s is not approved", currency);
        }
        if (!itemTransfers.supportsRoyaltyInfo(item)) {
            throw MarketplaceException.ineligible("Contract %s does not support royalty info", item.getContract());
        }
    }

    static void requireWindow(long startTime, long endTime) {
        if (endTime <= startTime) {
            throw MarketplaceException.invalidParameters("End time %d must be after start time %d", endTime, startTime);
        }
    }

    static void requireItem(ItemRef item) {
        if (item == null || item.getContract() == null || item.getItemId() == null || item.getStandard() == null) {
            throw MarketplaceException.invalidParameters("Item contract, id and standard are required");
        }
        if (item.getItemId().signum() < 0) {
            throw MarketplaceException.invalidParameters("Item id cannot be negative: %s", item.getItemId());
        }
    }
}
