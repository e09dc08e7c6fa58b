package com.nft.market.nft_market.entity;

import java.util.HashMap;
import java.util.Map;

import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * First-price ascending auction for one unit of one item, with a reserve.
 *
 * Exactly one bidder holds the highest standing bid at any time
 * (highestBidder, null until the first bid). Other bids are zero:
 * an outbid bidder's funds live in the claim vault, not here.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "auctions")
public class Auction {

    @MongoId
    private long id;

    private ItemRef item;

    @Indexed
    private String seller;

    private Money reservePrice;

    private String currency;

    private long startTime;
    private long endTime;

    @Builder.Default
    private boolean cancelled = false;

    /**
     * Set once the auction has been settled; makes it terminal.
     */
    @Builder.Default
    private boolean claimed = false;

    @Builder.Default
    private Map<String, Bid> bids = new HashMap<>();

    private String highestBidder;

    private long createdAt;

    public Bid bidOf(String bidder) {
        Bid bid = bids.get(bidder);
        return bid != null ? bid : Bid.empty();
    }

    public Money standingAmount(String bidder) {
        return bidOf(bidder).getAmount();
    }

    public Money getHighestAmount() {
        return highestBidder == null ? Money.ZERO : standingAmount(highestBidder);
    }

    public boolean hasBids() {
        return highestBidder != null;
    }

    public Auction copy() {
        Map<String, Bid> bidCopies = new HashMap<>();
        bids.forEach((bidder, bid) -> bidCopies.put(bidder, bid.copy()));
        return Auction.builder()
                .id(id)
                .item(item)
                .seller(seller)
                .reservePrice(reservePrice)
                .currency(currency)
                .startTime(startTime)
                .endTime(endTime)
                .cancelled(cancelled)
                .claimed(claimed)
                .bids(bidCopies)
                .highestBidder(highestBidder)
                .createdAt(createdAt)
                .build();
    }
}
