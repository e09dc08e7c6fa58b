package com.nft.market.nft_market.service;

import static com.nft.market.nft_market.support.MarketplaceFixture.ALICE;
import static com.nft.market.nft_market.support.MarketplaceFixture.BOB;
import static com.nft.market.nft_market.support.MarketplaceFixture.NATIVE;
import static com.nft.market.nft_market.support.MarketplaceFixture.SELLER;
import static com.nft.market.nft_market.support.MarketplaceFixture.TOKEN;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.nft.market.nft_market.entity.CallContext;
import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.entity.VaultTransactionType;
import com.nft.market.nft_market.service.ConservationAuditor.ConservationReport;
import com.nft.market.nft_market.support.MarketplaceFixture;

class ConservationAuditorTest {

    private MarketplaceFixture market;

    @BeforeEach
    void setUp() {
        market = new MarketplaceFixture();
    }

    @Test
    void tradingKeepsEveryCurrencyBalanced() {
        market.fund(ALICE, 1000);
        market.fund(BOB, 1000);
        long saleId = market.saleLedger.createSale(CallContext.of(SELLER), market.mintQuantity(1, SELLER, 10),
                10, 1000, 2000, Money.of(30), TOKEN);
        market.saleLedger.buy(CallContext.of(ALICE), saleId, null, 3, Money.ZERO);

        long auctionId = market.auctionLedger.createAuction(CallContext.of(SELLER), market.mintUnique(1, SELLER),
                1000, 2000, Money.of(10), NATIVE);
        market.auctionLedger.bid(CallContext.of(ALICE, Money.of(40)), auctionId, Money.ZERO, Money.of(40));
        market.auctionLedger.bid(CallContext.of(BOB, Money.of(60)), auctionId, Money.ZERO, Money.of(60));
        market.vault.claim(CallContext.of(ALICE), NATIVE);

        ConservationReport report = market.auditor.audit(NATIVE);
        assertEquals(NATIVE, report.getCurrency());
        assertEquals(Money.ZERO, report.getClaimable());
        assertEquals(Money.of(60), report.getEscrowed());
        assertEquals(Money.of(100), report.getReceived());
        assertEquals(Money.of(40), report.getPaidOut());
        assertTrue(report.isBalanced());
        assertEquals(0, market.auditor.reconcileAll());
    }

    @Test
    void unbackedCreditIsReported() {
        market.executor.run("mint", unitOfWork -> market.vault.credit(unitOfWork, ALICE, TOKEN, Money.of(5),
                VaultTransactionType.SALE_PROCEEDS, "unbacked"));

        assertFalse(market.auditor.audit(TOKEN).isBalanced());
        assertEquals(1, market.auditor.reconcileAll());
    }
}
