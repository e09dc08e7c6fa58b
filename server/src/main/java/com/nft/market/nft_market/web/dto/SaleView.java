package com.nft.market.nft_market.web.dto;

import com.nft.market.nft_market.entity.ItemRef;
import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.entity.Sale;
import com.nft.market.nft_market.entity.SaleStatus;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;

@Getter
@AllArgsConstructor
@Builder
public class SaleView {
    private long id;
    private ItemRef item;
    private String seller;
    private Money price;
    private String currency;
    private long amount;
    private long purchased;
    private long remaining;
    private long startTime;
    private long endTime;
    private SaleStatus status;

    public static SaleView of(Sale sale, SaleStatus status) {
        return SaleView.builder()
                .id(sale.getId())
                .item(sale.getItem())
                .seller(sale.getSeller())
                .price(sale.getPrice())
                .currency(sale.getCurrency())
                .amount(sale.getAmount())
                .purchased(sale.getPurchased())
                .remaining(sale.getRemaining())
                .startTime(sale.getStartTime())
                .endTime(sale.getEndTime())
                .status(status)
                .build();
    }
}
