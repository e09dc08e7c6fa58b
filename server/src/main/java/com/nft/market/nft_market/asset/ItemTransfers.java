package com.nft.market.nft_market.asset;

import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import com.nft.market.nft_market.entity.ItemRef;
import com.nft.market.nft_market.entity.ItemStandard;
import com.nft.market.nft_market.error.MarketplaceException;
import com.nft.market.nft_market.error.TransferException;
import com.nft.market.nft_market.execution.UnitOfWork;

import lombok.extern.slf4j.Slf4j;

/**
 * Custody moves for listed items, dispatched on the item's stored
 * {@link ItemStandard} tag.
 *
 * Deposits register a compensating return so a failed operation gives the
 * item back; releases are the last step of an operation and have none.
 */
@Slf4j
public class ItemTransfers {

    private final Map<ItemStandard, ItemTransfer> transfers = new EnumMap<>(ItemStandard.class);
    private final AssetGateway assetGateway;

    public ItemTransfers(AssetGateway assetGateway, List<ItemTransfer> variants) {
        this.assetGateway = assetGateway;
        for (ItemTransfer variant : variants) {
            transfers.put(variant.standard(), variant);
        }
    }

    public static ItemTransfers of(AssetGateway assetGateway) {
        return new ItemTransfers(assetGateway, List.of(
                new UniqueItemTransfer(assetGateway),
                new QuantityItemTransfer(assetGateway)));
    }

    public ItemTransfer forItem(ItemRef item) {
        ItemTransfer transfer = transfers.get(item.getStandard());
        if (transfer == null) {
            throw MarketplaceException.ineligible("Unsupported item standard: %s", item.getStandard());
        }
        return transfer;
    }

    public boolean supportsRoyaltyInfo(ItemRef item) {
        return assetGateway.supportsRoyaltyInfo(item.getContract());
    }

    /**
     * Move items from their owner into the custody address.
     */
    public void deposit(UnitOfWork unitOfWork, ItemRef item, String owner, String custody, long quantity) {
        ItemTransfer transfer = forItem(item);
        move(transfer, item, owner, custody, quantity);
        unitOfWork.onRollback(() -> transfer.transfer(item, custody, owner, quantity));
    }

    /**
     * Move items out of custody to their new holder.
     */
    public void release(ItemRef item, String custody, String to, long quantity) {
        move(forItem(item), item, custody, to, quantity);
    }

    private void move(ItemTransfer transfer, ItemRef item, String from, String to, long quantity) {
        try {
            transfer.transfer(item, from, to, quantity);
        } catch (TransferException e) {
            log.warn("Item transfer failed: item={}, from={}, to={}, qty={}, reason={}",
                    item, from, to, quantity, e.getMessage());
            throw MarketplaceException.transferFailure(e);
        }
    }
}
