package com.nft.market.nft_market.entity;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * Royalty terms returned by an item contract for one sale amount.
 */
@Getter
@AllArgsConstructor
@ToString
public class RoyaltyInfo {
    private final String receiver;
    private final Money amount;

    public static RoyaltyInfo none() {
        return new RoyaltyInfo(Addresses.ZERO, Money.ZERO);
    }
}
