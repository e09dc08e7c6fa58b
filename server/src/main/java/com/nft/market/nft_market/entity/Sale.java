package com.nft.market.nft_market.entity;

import java.util.HashMap;
import java.util.Map;

import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;
import org.springframework.data.mongodb.core.mapping.MongoId;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Getter;
import lombok.NoArgsConstructor;
import lombok.Setter;

/**
 * Fixed-price offer of a quantity of one item.
 *
 * Lifecycle:
 * - created with purchased = 0
 * - purchased grows with every buy, and jumps to amount when the seller
 *   reclaims unsold stock
 * - cancelled is set at most once
 *
 * Invariant: 0 &lt;= purchased &lt;= amount. Never deleted.
 */
@Getter
@Setter
@NoArgsConstructor(access = AccessLevel.PROTECTED)
@AllArgsConstructor
@Builder
@Document(collection = "sales")
public class Sale {

    @MongoId
    private long id;

    private ItemRef item;

    @Indexed
    private String seller;

    /**
     * Price per unit, in the sale currency.
     */
    private Money price;

    private String currency;

    /**
     * Total quantity offered.
     */
    private long amount;

    @Builder.Default
    private long purchased = 0;

    private long startTime;
    private long endTime;

    @Builder.Default
    private boolean cancelled = false;

    /**
     * Quantity bought per buyer address.
     */
    @Builder.Default
    private Map<String, Long> purchasedBy = new HashMap<>();

    private long createdAt;

    public long getRemaining() {
        if (purchased > amount) {
            throw new IllegalStateException(
                String.format("Oversold sale: purchased %d > amount %d (saleId=%d)", purchased, amount, id));
        }
        return amount - purchased;
    }

    public long purchasedBy(String buyer) {
        return purchasedBy.getOrDefault(buyer, 0L);
    }

    /**
     * Record a purchase of quantity units by buyer.
     */
    public void recordPurchase(String buyer, long quantity) {
        if (quantity <= 0) {
            throw new IllegalArgumentException("Purchase quantity must be positive");
        }
        if (quantity > getRemaining()) {
            throw new IllegalStateException("Overfill: quantity exceeds remaining stock");
        }
        this.purchased += quantity;
        this.purchasedBy.merge(buyer, quantity, Long::sum);
    }

    /**
     * Reverse a purchase recorded in the same failed operation.
     */
    public void revertPurchase(String buyer, long quantity) {
        this.purchased -= quantity;
        long left = purchasedBy(buyer) - quantity;
        if (left == 0) {
            purchasedBy.remove(buyer);
        } else {
            purchasedBy.put(buyer, left);
        }
    }

    public Sale copy() {
        return Sale.builder()
                .id(id)
                .item(item)
                .seller(seller)
                .price(price)
                .currency(currency)
                .amount(amount)
                .purchased(purchased)
                .startTime(startTime)
                .endTime(endTime)
                .cancelled(cancelled)
                .purchasedBy(new HashMap<>(purchasedBy))
                .createdAt(createdAt)
                .build();
    }
}
