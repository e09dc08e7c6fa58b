package com.nft.market.nft_market.entity;

/**
 * Why a claim vault or escrow balance moved.
 */
public enum VaultTransactionType {
    SALE_FEE,
    SALE_ROYALTY,
    SALE_PROCEEDS,
    SALE_PAYMENT_FROM_BALANCE,
    BID_FROM_BALANCE,
    BID_ESCROWED,
    OUTBID_REFUND,
    CANCEL_REFUND,
    RESERVE_NOT_MET_REFUND,
    ESCROW_RELEASED,
    AUCTION_FEE,
    AUCTION_ROYALTY,
    AUCTION_PROCEEDS,
    CLAIM;

    /**
     * Movements of auction escrow rather than of a vault entry.
     */
    public boolean isEscrowMovement() {
        return this == BID_ESCROWED || this == ESCROW_RELEASED;
    }
}
