package com.nft.market.nft_market.entity;

import java.util.Locale;

/**
 * Account, contract and currency addresses are plain lowercase strings.
 * The zero address doubles as the native-currency sentinel.
 */
public final class Addresses {

    public static final String ZERO = "0x0000000000000000000000000000000000000000";

    /**
     * Reserved currency address meaning "the chain's native currency".
     */
    public static final String NATIVE_CURRENCY = ZERO;

    private Addresses() {
    }

    public static String normalize(String address) {
        if (address == null || address.trim().isEmpty()) {
            throw new IllegalArgumentException("Address is required");
        }
        return address.trim().toLowerCase(Locale.ROOT);
    }

    public static boolean isZero(String address) {
        return address == null || ZERO.equals(normalize(address));
    }

    public static boolean isNative(String currency) {
        return NATIVE_CURRENCY.equals(normalize(currency));
    }
}
