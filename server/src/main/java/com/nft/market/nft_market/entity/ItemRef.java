package com.nft.market.nft_market.entity;

import java.math.BigInteger;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.EqualsAndHashCode;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.ToString;

/**
 * Reference to a listed item: its contract, id and ownership model.
 */
@Getter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@EqualsAndHashCode
@ToString
public class ItemRef {
    private String contract;
    private BigInteger itemId;
    private ItemStandard standard;

    public static ItemRef of(String contract, BigInteger itemId, ItemStandard standard) {
        return new ItemRef(Addresses.normalize(contract), itemId, standard);
    }
}
