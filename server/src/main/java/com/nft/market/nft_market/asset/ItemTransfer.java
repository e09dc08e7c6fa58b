package com.nft.market.nft_market.asset;

import com.nft.market.nft_market.entity.ItemRef;
import com.nft.market.nft_market.entity.ItemStandard;

/**
 * Moves items according to one ownership model.
 */
public interface ItemTransfer {

    ItemStandard standard();

    /**
     * Whether quantity is a legal listing size under this ownership model.
     */
    boolean isValidQuantity(long quantity);

    void transfer(ItemRef item, String from, String to, long quantity);
}
