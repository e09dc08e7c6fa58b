package com.nft.market.nft_market.engine;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.Test;

import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.FeeInfo;
import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.error.ErrorKind;
import com.nft.market.nft_market.error.MarketplaceException;

class FeePolicyTest {

    private static final String RECIPIENT = "0xfee0000000000000000000000000000000000004";

    @Test
    void feeIsFlooredShareOfGross() {
        FeePolicy policy = new FeePolicy(300, 10_000, RECIPIENT);

        FeeInfo info = policy.feeInfo(Money.of(100));
        assertEquals(RECIPIENT, info.getRecipient());
        assertEquals(Money.of(3), info.getAmount());
        assertEquals(Money.ZERO, policy.feeInfo(Money.of(33)).getAmount());
        assertEquals(Money.of(29), policy.feeInfo(Money.of(999)).getAmount());
    }

    @Test
    void setFeeReportsChange() {
        FeePolicy policy = new FeePolicy(300, 10_000, RECIPIENT);

        assertFalse(policy.setFee(300, 10_000));
        assertTrue(policy.setFee(1, 2));
        assertEquals(Money.of(50), policy.feeInfo(Money.of(100)).getAmount());
    }

    @Test
    void rateAboveScaleIsRejected() {
        FeePolicy policy = new FeePolicy(300, 10_000, RECIPIENT);

        MarketplaceException e = assertThrows(MarketplaceException.class, () -> policy.setFee(3, 2));
        assertEquals(ErrorKind.INVALID_PARAMETERS, e.getKind());
        assertEquals(ErrorKind.INVALID_PARAMETERS,
                assertThrows(MarketplaceException.class, () -> policy.setFee(0, 0)).getKind());
        assertEquals(300, policy.getFeeRate());
        assertEquals(10_000, policy.getFeeScale());
    }

    @Test
    void fullRateTakesEverything() {
        FeePolicy policy = new FeePolicy(5, 5, RECIPIENT);
        assertEquals(Money.of(77), policy.feeInfo(Money.of(77)).getAmount());
    }

    @Test
    void recipientCannotBeZeroAddress() {
        FeePolicy policy = new FeePolicy(300, 10_000, RECIPIENT);

        assertThrows(MarketplaceException.class, () -> policy.setFeeRecipient(Addresses.ZERO));
        assertFalse(policy.setFeeRecipient(RECIPIENT.toUpperCase().replace("0X", "0x")));
        assertTrue(policy.setFeeRecipient("0xbeef"));
        assertEquals("0xbeef", policy.getFeeRecipient());
    }
}
