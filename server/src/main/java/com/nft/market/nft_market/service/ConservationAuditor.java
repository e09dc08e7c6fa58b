package com.nft.market.nft_market.service;

import java.util.Set;
import java.util.TreeSet;

import org.springframework.scheduling.annotation.Scheduled;

import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.execution.LedgerExecutor;
import com.nft.market.nft_market.ledger.AuctionLedger;
import com.nft.market.nft_market.ledger.ClaimVault;
import com.nft.market.nft_market.payment.PaymentGateway;

import lombok.AccessLevel;
import lombok.AllArgsConstructor;
import lombok.Getter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Checks that no value was created or destroyed.
 *
 * For every currency: claimable balances + auction escrow
 * == value received from outside - value paid out.
 */
@Slf4j
@RequiredArgsConstructor
public class ConservationAuditor {

    private final LedgerExecutor executor;
    private final ClaimVault claimVault;
    private final AuctionLedger auctionLedger;
    private final PaymentGateway paymentGateway;

    /**
     * Result of auditing one currency.
     */
    @Getter
    @AllArgsConstructor(access = AccessLevel.PRIVATE)
    public static class ConservationReport {
        private final String currency;
        private final Money claimable;
        private final Money escrowed;
        private final Money received;
        private final Money paidOut;

        public boolean isBalanced() {
            return received.compareTo(paidOut) >= 0
                    && claimable.add(escrowed).equals(received.subtract(paidOut));
        }

        @Override
        public String toString() {
            return String.format("%s: claimable=%s escrow=%s received=%s paidOut=%s",
                    currency, claimable, escrowed, received, paidOut);
        }
    }

    public ConservationReport audit(String currency) {
        String normalized = Addresses.normalize(currency);
        return executor.read(() -> new ConservationReport(
                normalized,
                claimVault.totalOf(normalized),
                auctionLedger.escrowOf(normalized),
                paymentGateway.totalReceived(normalized),
                paymentGateway.totalPaidOut(normalized)));
    }

    /**
     * Periodic reconciliation over every currency the ledger has seen.
     *
     * @return number of currencies out of balance
     */
    @Scheduled(fixedDelayString = "${marketplace.audit.interval-ms:300000}")
    public int reconcileAll() {
        Set<String> currencies = new TreeSet<>(paymentGateway.knownCurrencies());
        currencies.addAll(claimVault.currencies());
        currencies.addAll(auctionLedger.escrowCurrencies());

        int drifted = 0;
        for (String currency : currencies) {
            ConservationReport report = audit(currency);
            if (!report.isBalanced()) {
                log.error("Conservation violated for {}", report);
                drifted++;
            }
        }
        log.info("Conservation audit complete: {} currencies checked, {} out of balance",
                currencies.size(), drifted);
        return drifted;
    }
}
