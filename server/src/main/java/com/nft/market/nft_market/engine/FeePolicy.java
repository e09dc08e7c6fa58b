package com.nft.market.nft_market.engine;

import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.FeeInfo;
import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.error.MarketplaceException;

import lombok.extern.slf4j.Slf4j;

/**
 * Platform fee: fee = floor(gross * feeRate / feeScale), paid to feeRecipient.
 *
 * feeRate &lt;= feeScale is enforced on every update, so the fee never
 * exceeds the gross amount it is taken from.
 */
@Slf4j
public class FeePolicy {

    public static final long DEFAULT_FEE_RATE = 300;
    public static final long DEFAULT_FEE_SCALE = 10_000;

    private long feeRate;
    private long feeScale;
    private String feeRecipient;

    public FeePolicy(long feeRate, long feeScale, String feeRecipient) {
        validate(feeRate, feeScale);
        this.feeRate = feeRate;
        this.feeScale = feeScale;
        this.feeRecipient = requireRecipient(feeRecipient);
    }

    public synchronized FeeInfo feeInfo(Money gross) {
        return new FeeInfo(feeRecipient, gross.multiplyFloor(feeRate, feeScale));
    }

    /**
     * @return false when rate and scale were already set to these values
     */
    public synchronized boolean setFee(long newRate, long newScale) {
        validate(newRate, newScale);
        if (newRate == feeRate && newScale == feeScale) {
            return false;
        }
        log.info("Fee changed: {}/{} -> {}/{}", feeRate, feeScale, newRate, newScale);
        this.feeRate = newRate;
        this.feeScale = newScale;
        return true;
    }

    /**
     * @return false when the recipient is unchanged
     */
    public synchronized boolean setFeeRecipient(String newRecipient) {
        String recipient = requireRecipient(newRecipient);
        if (recipient.equals(feeRecipient)) {
            return false;
        }
        log.info("Fee recipient changed: {} -> {}", feeRecipient, recipient);
        this.feeRecipient = recipient;
        return true;
    }

    public synchronized long getFeeRate() {
        return feeRate;
    }

    public synchronized long getFeeScale() {
        return feeScale;
    }

    public synchronized String getFeeRecipient() {
        return feeRecipient;
    }

    private static void validate(long rate, long scale) {
        if (scale <= 0) {
            throw MarketplaceException.invalidParameters("Fee scale must be positive: %d", scale);
        }
        if (rate < 0 || rate > scale) {
            throw MarketplaceException.invalidParameters("Fee rate must be within [0, %d]: %d", scale, rate);
        }
    }

    private static String requireRecipient(String recipient) {
        if (recipient == null || Addresses.isZero(recipient)) {
            throw MarketplaceException.invalidParameters("Fee recipient cannot be the zero address");
        }
        return Addresses.normalize(recipient);
    }
}
