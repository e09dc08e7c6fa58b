package com.nft.market.nft_market.engine;

import com.nft.market.nft_market.asset.AssetGateway;
import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.FeeInfo;
import com.nft.market.nft_market.entity.ItemRef;
import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.entity.ProceedsSplit;
import com.nft.market.nft_market.entity.RoyaltyInfo;
import com.nft.market.nft_market.error.MarketplaceException;

import lombok.RequiredArgsConstructor;

/**
 * Divides a gross payment into platform fee, artist royalty and seller proceeds.
 *
 * Royalty is looked up fresh from the item contract on every split. A seller
 * who is also the royalty receiver gets no separate royalty: the whole
 * non-fee remainder is theirs already.
 */
@RequiredArgsConstructor
public class ProceedsSplitter {

    private final FeePolicy feePolicy;
    private final AssetGateway assetGateway;

    public ProceedsSplit split(ItemRef item, String seller, Money gross) {
        FeeInfo fee = feePolicy.feeInfo(gross);
        RoyaltyInfo royaltyInfo = assetGateway.royaltyInfo(item.getContract(), item.getItemId(), gross);

        String artist = royaltyInfo.getReceiver() == null
                ? Addresses.ZERO
                : Addresses.normalize(royaltyInfo.getReceiver());
        Money royalty = royaltyInfo.getAmount() == null ? Money.ZERO : royaltyInfo.getAmount();
        if (Addresses.isZero(artist) || artist.equals(seller)) {
            royalty = Money.ZERO;
        }

        Money deductions = fee.getAmount().add(royalty);
        if (deductions.isGreaterThan(gross)) {
            throw MarketplaceException.ineligible(
                    "Fee %s plus royalty %s exceeds proceeds %s for %s", fee.getAmount(), royalty, gross, item);
        }

        return new ProceedsSplit(gross, fee.getRecipient(), fee.getAmount(),
                artist, royalty, seller, gross.subtract(deductions));
    }
}
