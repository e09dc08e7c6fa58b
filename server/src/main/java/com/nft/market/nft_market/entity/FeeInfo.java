package com.nft.market.nft_market.entity;

import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.ToString;

@Getter
@AllArgsConstructor
@ToString
public class FeeInfo {
    private final String recipient;
    private final Money amount;
}
