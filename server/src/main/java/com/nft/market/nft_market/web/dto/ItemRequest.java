package com.nft.market.nft_market.web.dto;

import java.math.BigInteger;

import com.nft.market.nft_market.entity.ItemRef;
import com.nft.market.nft_market.entity.ItemStandard;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
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
public class ItemRequest {

    @NotBlank
    private String contract;

    @NotNull
    @PositiveOrZero
    private BigInteger itemId;

    @NotNull
    private ItemStandard standard;

    public ItemRef toItemRef() {
        return ItemRef.of(contract, itemId, standard);
    }
}
