package com.nft.market.nft_market.payment;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.CallContext;
import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.error.MarketplaceException;
import com.nft.market.nft_market.error.TransferException;
import com.nft.market.nft_market.execution.UnitOfWork;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Collects and pays out value over the payment rails.
 *
 * Native currency (the sentinel address) must be attached to the call in the
 * exact amount required; tokens are pulled by allowance and must not come
 * with attached native value.
 *
 * Keeps running totals of value received and paid out per currency: the
 * conservation audit compares them against vault and escrow balances.
 */
@Slf4j
@RequiredArgsConstructor
public class PaymentGateway {

    private final PaymentRails paymentRails;

    private final Map<String, Money> received = new ConcurrentHashMap<>();
    private final Map<String, Money> paidOut = new ConcurrentHashMap<>();

    /**
     * Collect amount of currency from the caller. Refunded if the operation
     * later rolls back.
     */
    public void collect(UnitOfWork unitOfWork, CallContext ctx, String currency, Money amount) {
        String payer = ctx.getCaller();
        if (Addresses.isNative(currency)) {
            if (!ctx.getAttachedValue().equals(amount)) {
                throw MarketplaceException.insufficientFunds(
                        "Attached value %s does not match required payment %s", ctx.getAttachedValue(), amount);
            }
            if (amount.isZero()) {
                return;
            }
            invoke(() -> paymentRails.receiveNative(payer, amount));
            unitOfWork.onRollback(() -> paymentRails.sendNative(payer, amount));
        } else {
            if (ctx.getAttachedValue().isPositive()) {
                throw MarketplaceException.invalidParameters(
                        "Native value attached to a payment in %s", currency);
            }
            if (amount.isZero()) {
                return;
            }
            invoke(() -> paymentRails.pullToken(currency, payer, amount));
            unitOfWork.onRollback(() -> paymentRails.sendToken(currency, payer, amount));
        }
        adjust(unitOfWork, received, currency, amount);
        log.debug("Collected {} {} from {}", amount, currency, payer);
    }

    /**
     * Pay amount of currency out of the treasury. Must be the last step of
     * an operation: a completed payout cannot be compensated.
     */
    public void payout(UnitOfWork unitOfWork, String to, String currency, Money amount) {
        if (Addresses.isNative(currency)) {
            invoke(() -> paymentRails.sendNative(to, amount));
        } else {
            invoke(() -> paymentRails.sendToken(currency, to, amount));
        }
        adjust(unitOfWork, paidOut, currency, amount);
        log.debug("Paid out {} {} to {}", amount, currency, to);
    }

    /**
     * Start the running totals of a recovered ledger: what it still holds
     * counts as received, nothing as paid out.
     */
    public void restoreOutstanding(String currency, Money outstanding) {
        String key = Addresses.normalize(currency);
        received.put(key, outstanding);
        paidOut.remove(key);
    }

    public Money totalReceived(String currency) {
        return received.getOrDefault(Addresses.normalize(currency), Money.ZERO);
    }

    public Money totalPaidOut(String currency) {
        return paidOut.getOrDefault(Addresses.normalize(currency), Money.ZERO);
    }

    public Set<String> knownCurrencies() {
        return Set.copyOf(received.keySet());
    }

    private void adjust(UnitOfWork unitOfWork, Map<String, Money> totals, String currency, Money amount) {
        String key = Addresses.normalize(currency);
        Money before = totals.getOrDefault(key, Money.ZERO);
        totals.put(key, before.add(amount));
        unitOfWork.onRollback(() -> totals.put(key, before));
    }

    private static void invoke(Runnable transfer) {
        try {
            transfer.run();
        } catch (TransferException e) {
            log.warn("Payment transfer failed: {}", e.getMessage());
            throw MarketplaceException.transferFailure(e);
        }
    }
}
