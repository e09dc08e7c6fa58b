package com.nft.market.nft_market.web.dto;

import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.Auction;
import com.nft.market.nft_market.entity.AuctionStatus;
import com.nft.market.nft_market.entity.ItemRef;
import com.nft.market.nft_market.entity.Money;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@AllArgsConstructor
@Builder
public class AuctionView {
    private long id;
    private ItemRef item;
    private String seller;
    private Money reservePrice;
    private String currency;
    private long startTime;
    private long endTime;
    private String highestBidder;
    private Money highestBid;
    private AuctionStatus status;

    public static AuctionView of(Auction auction, AuctionStatus status) {
        return AuctionView.builder()
                .id(auction.getId())
                .item(auction.getItem())
                .seller(auction.getSeller())
                .reservePrice(auction.getReservePrice())
                .currency(auction.getCurrency())
                .startTime(auction.getStartTime())
                .endTime(auction.getEndTime())
                .highestBidder(auction.hasBids() ? auction.getHighestBidder() : Addresses.ZERO)
                .highestBid(auction.getHighestAmount())
                .status(status)
                .build();
    }
}
