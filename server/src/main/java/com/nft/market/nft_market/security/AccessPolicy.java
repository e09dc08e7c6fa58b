package com.nft.market.nft_market.security;

/**
 * Who counts as a platform administrator. Deliberately opaque to the ledgers.
 */
public interface AccessPolicy {

    boolean isAdministrator(String account);
}
