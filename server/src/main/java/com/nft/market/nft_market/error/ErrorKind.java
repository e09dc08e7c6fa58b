package com.nft.market.nft_market.error;

/**
 * Distinguishable failure kinds. Every rejected operation carries exactly one.
 */
public enum ErrorKind {

    /**
     * Sale or auction id outside the allocated range, or the zero sentinel.
     */
    NOT_FOUND,

    /**
     * Status precondition unmet, e.g. buying from a cancelled sale.
     */
    INVALID_STATE,

    /**
     * Caller lacks the required role (seller, administrator, winner).
     */
    UNAUTHORIZED,

    /**
     * Vault balance, attached payment or stock insufficient.
     */
    INSUFFICIENT_FUNDS,

    /**
     * Listing contract, currency or royalty capability not eligible.
     */
    INELIGIBLE_ASSET,

    /**
     * Malformed window, zero quantity and similar.
     */
    INVALID_PARAMETERS,

    /**
     * External payment collection or payout failed.
     */
    TRANSFER_FAILURE
}
