package com.nft.market.nft_market.web.dto;

import com.nft.market.nft_market.entity.Money;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BuyRequest {

    /**
     * Receiver of the items; defaults to the buyer.
     */
    private String recipient;

    private long quantity;

    /**
     * Part of the price taken from the buyer's claimable balance.
     */
    private Money amountFromBalance;
}
