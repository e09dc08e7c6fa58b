package com.nft.market.nft_market.asset;

import java.math.BigInteger;

import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.entity.RoyaltyInfo;

/**
 * Item contracts, as seen from the marketplace.
 *
 * Transfer methods throw {@link com.nft.market.nft_market.error.TransferException}
 * when the contract refuses the transfer.
 */
public interface AssetGateway {

    /**
     * Whether the contract answers royalty-info queries. Checked before any
     * sale or auction referencing the contract is created.
     */
    boolean supportsRoyaltyInfo(String contract);

    /**
     * Royalty owed on a sale of saleAmount. Asked on every purchase and
     * settlement, never cached: terms belong to the item contract and may change.
     */
    RoyaltyInfo royaltyInfo(String contract, BigInteger itemId, Money saleAmount);

    void transferUniqueItem(String contract, String from, String to, BigInteger itemId);

    void transferQuantity(String contract, String from, String to, BigInteger itemId, long quantity);
}
