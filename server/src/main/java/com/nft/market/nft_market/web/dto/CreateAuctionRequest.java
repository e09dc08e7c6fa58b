package com.nft.market.nft_market.web.dto;

import com.nft.market.nft_market.entity.Money;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
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
public class CreateAuctionRequest {

    @Valid
    @NotNull
    private ItemRequest item;

    private long startTime;
    private long endTime;

    @NotNull
    private Money reservePrice;

    @NotBlank
    private String currency;
}
