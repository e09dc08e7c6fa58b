package com.nft.market.nft_market.entity;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * A bidder's currently escrowed commitment to one auction.
 *
 * The amount is the running total after top-ups, not a single bid event.
 * It drops to zero when the bidder is outbid or the auction is cancelled,
 * the value having moved to the bidder's claimable balance.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
public class Bid {

    @Builder.Default
    private Money amount = Money.ZERO;

    /**
     * Epoch seconds of the last update.
     */
    private long timestamp;

    public static Bid empty() {
        return new Bid(Money.ZERO, 0L);
    }

    public Bid copy() {
        return new Bid(amount, timestamp);
    }
}
