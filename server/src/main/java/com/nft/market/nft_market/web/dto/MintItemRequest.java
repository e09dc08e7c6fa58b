package com.nft.market.nft_market.web.dto;

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
public class MintItemRequest {

    @Valid
    @NotNull
    private ItemRequest item;

    @NotBlank
    private String owner;

    /**
     * Ignored for unique items.
     */
    private long quantity;

    private boolean royaltySupport;
}
