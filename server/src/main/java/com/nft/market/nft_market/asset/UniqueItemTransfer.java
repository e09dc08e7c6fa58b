package com.nft.market.nft_market.asset;

import com.nft.market.nft_market.entity.ItemRef;
import com.nft.market.nft_market.entity.ItemStandard;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class UniqueItemTransfer implements ItemTransfer {

    private final AssetGateway assetGateway;

    @Override
    public ItemStandard standard() {
        return ItemStandard.UNIQUE;
    }

    @Override
    public boolean isValidQuantity(long quantity) {
        return quantity == 1;
    }

    @Override
    public void transfer(ItemRef item, String from, String to, long quantity) {
        if (!isValidQuantity(quantity)) {
            throw new IllegalArgumentException("Unique items move one at a time, got " + quantity);
        }
        assetGateway.transferUniqueItem(item.getContract(), from, to, item.getItemId());
    }
}
