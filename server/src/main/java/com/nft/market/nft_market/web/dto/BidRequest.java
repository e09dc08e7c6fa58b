package com.nft.market.nft_market.web.dto;

import com.nft.market.nft_market.entity.Money;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Raise of the caller's standing bid. For the native currency externalFunds
 * must match the attached value.
 */
@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class BidRequest {
    private Money amountFromBalance;
    private Money externalFunds;
}
