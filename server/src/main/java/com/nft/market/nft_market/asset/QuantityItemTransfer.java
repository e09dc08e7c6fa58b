package com.nft.market.nft_market.asset;

import com.nft.market.nft_market.entity.ItemRef;
import com.nft.market.nft_market.entity.ItemStandard;

import lombok.RequiredArgsConstructor;

@RequiredArgsConstructor
public class QuantityItemTransfer implements ItemTransfer {

    private final AssetGateway assetGateway;

    @Override
    public ItemStandard standard() {
        return ItemStandard.QUANTITY;
    }

    @Override
    public boolean isValidQuantity(long quantity) {
        return quantity > 0;
    }

    @Override
    public void transfer(ItemRef item, String from, String to, long quantity) {
        assetGateway.transferQuantity(item.getContract(), from, to, item.getItemId(), quantity);
    }
}
