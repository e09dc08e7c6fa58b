package com.nft.market.nft_market.entity;

/**
 * Ownership model of a listed item, stored on every sale and auction record.
 * Selects which transfer variant moves the item in and out of custody.
 */
public enum ItemStandard {

    /**
     * One owner per item id; quantity is always 1.
     */
    UNIQUE,

    /**
     * Fungible balances per item id; any positive quantity.
     */
    QUANTITY
}
