package com.nft.market.nft_market.entity;

/**
 * Auction status, derived from the auction's fields and the current time.
 *
 * Precedence (first match wins):
 *
 * CANCELLED          cancelled flag set, or the auction ledger is deprecated
 * ENDED_AND_CLAIMED  claimed flag set (terminal, settlement done)
 * PENDING            now &lt; start
 * ACTIVE             start &lt;= now &lt; end
 * ENDED              now &gt;= end
 */
public enum AuctionStatus {

    PENDING,

    ACTIVE,

    ENDED,

    CANCELLED,

    /**
     * TERMINAL STATE - item delivered and payment (if any) processed.
     */
    ENDED_AND_CLAIMED;

    public boolean isCancellable() {
        return this == PENDING || this == ACTIVE;
    }

    /**
     * Statuses from which the auction may be settled.
     */
    public boolean isSettleable() {
        return this == ENDED || this == CANCELLED;
    }
}
