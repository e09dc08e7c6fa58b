package com.nft.market.nft_market.entity;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

/**
 * How one gross amount was divided between platform, artist and seller.
 * fee + royalty + sellerProceeds == gross.
 */
@Getter
@AllArgsConstructor
@ToString
public class ProceedsSplit {
    private final Money gross;
    private final String feeRecipient;
    private final Money fee;
    private final String artist;
    private final Money royalty;
    private final String seller;
    private final Money sellerProceeds;
}
