package com.nft.market.nft_market.web.dto;

import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.PositiveOrZero;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

@Getter
@Setter
@NoArgsConstructor
@AllArgsConstructor
public class RoyaltyRequest {

    @NotBlank
    private String receiver;

    @PositiveOrZero
    @Max(10_000)
    private long basisPoints;
}
