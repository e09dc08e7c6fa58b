package com.nft.market.nft_market.entity;

/**
 * Sale status, derived from the sale's fields and the current time.
 *
 * Precedence (first match wins):
 *
 * CANCELLED  cancelled flag set, or the sale ledger is deprecated
 * PENDING    now &lt; start
 * ACTIVE     start &lt;= now &lt; end and stock remains
 * ENDED      now &gt;= end, or all stock purchased
 *
 * Never stored: a stored copy could disagree with the flags it summarizes.
 */
public enum SaleStatus {

    PENDING,

    ACTIVE,

    ENDED,

    CANCELLED;

    /**
     * Statuses from which the seller may still cancel.
     */
    public boolean isCancellable() {
        return this == PENDING || this == ACTIVE;
    }

    /**
     * Statuses from which unsold stock may be reclaimed.
     */
    public boolean isClosed() {
        return this == ENDED || this == CANCELLED;
    }
}
