package com.nft.market.nft_market.payment;

import com.nft.market.nft_market.entity.Money;

/**
 * Value movement between external accounts and the marketplace treasury.
 *
 * Every method throws {@link com.nft.market.nft_market.error.TransferException}
 * with the counterparty's reason when the movement fails.
 */
public interface PaymentRails {

    /**
     * Take native value attached to a call into the treasury.
     */
    void receiveNative(String from, Money amount);

    /**
     * Pull tokens from an owner using the allowance granted to the treasury.
     */
    void pullToken(String currency, String from, Money amount);

    void sendNative(String to, Money amount);

    void sendToken(String currency, String to, Money amount);
}
