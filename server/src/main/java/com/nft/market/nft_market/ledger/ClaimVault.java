package com.nft.market.nft_market.ledger;

import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.CallContext;
import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.entity.VaultTransaction;
import com.nft.market.nft_market.entity.VaultTransactionType;
import com.nft.market.nft_market.error.MarketplaceException;
import com.nft.market.nft_market.execution.LedgerExecutor;
import com.nft.market.nft_market.execution.UnitOfWork;
import com.nft.market.nft_market.payment.PaymentGateway;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Claimable balances per (account, currency), shared by both ledgers.
 *
 * Credits and debits only happen inside a ledger operation (they need its
 * UnitOfWork); holders withdraw with {@link #claim}. No entry is ever negative.
 */
@Slf4j
@RequiredArgsConstructor
public class ClaimVault {

    // currency -> account -> balance
    private final Map<String, Map<String, Money>> balances = new ConcurrentHashMap<>();

    private final LedgerExecutor executor;
    private final PaymentGateway paymentGateway;

    public void credit(UnitOfWork unitOfWork, String account, String currency, Money amount,
            VaultTransactionType type, String referenceId) {
        if (amount.isZero()) {
            return;
        }
        Money after = set(unitOfWork, account, currency, balanceFor(account, currency).add(amount));
        unitOfWork.record(entry(unitOfWork, account, currency, type, true, amount, after, referenceId));
    }

    public void debit(UnitOfWork unitOfWork, String account, String currency, Money amount,
            VaultTransactionType type, String referenceId) {
        if (amount.isZero()) {
            return;
        }
        Money balance = balanceFor(account, currency);
        if (amount.isGreaterThan(balance)) {
            throw MarketplaceException.insufficientFunds(
                    "Claimable balance %s of %s in %s is below %s", balance, account, currency, amount);
        }
        Money after = set(unitOfWork, account, currency, balance.subtract(amount));
        unitOfWork.record(entry(unitOfWork, account, currency, type, false, amount, after, referenceId));
    }

    /**
     * Pay the caller's whole balance in currency out to them.
     *
     * The entry is zeroed before the payout is attempted, so a payout that
     * calls back in finds nothing left to claim. A failed payout rolls the
     * whole claim back, zeroing included.
     *
     * @return the amount paid out
     */
    public Money claim(CallContext ctx, String currency) {
        String account = ctx.getCaller();
        String normalizedCurrency = Addresses.normalize(currency);
        return executor.execute("claim", unitOfWork -> {
            Money amount = balanceFor(account, normalizedCurrency);
            if (amount.isZero()) {
                throw MarketplaceException.insufficientFunds(
                        "Nothing to claim for %s in %s", account, normalizedCurrency);
            }
            debit(unitOfWork, account, normalizedCurrency, amount, VaultTransactionType.CLAIM, "claim:" + account);
            paymentGateway.payout(unitOfWork, account, normalizedCurrency, amount);
            log.info("Claimed: account={}, currency={}, amount={}", account, normalizedCurrency, amount);
            return amount;
        });
    }

    public Money balanceOf(String account, String currency) {
        return executor.read(() -> balanceFor(Addresses.normalize(account), Addresses.normalize(currency)));
    }

    /**
     * Sum of all entries in currency.
     */
    public Money totalOf(String currency) {
        return executor.read(() -> balances.getOrDefault(Addresses.normalize(currency), Map.of())
                .values().stream()
                .reduce(Money.ZERO, Money::add));
    }

    public Set<String> currencies() {
        return Set.copyOf(balances.keySet());
    }

    /**
     * Seed an entry from the journal at startup.
     */
    public void restore(String account, String currency, Money balance) {
        executor.read(() -> balances.computeIfAbsent(Addresses.normalize(currency), c -> new ConcurrentHashMap<>())
                .put(Addresses.normalize(account), balance));
    }

    Money balanceFor(String account, String currency) {
        return balances.getOrDefault(currency, Map.of()).getOrDefault(account, Money.ZERO);
    }

    private Money set(UnitOfWork unitOfWork, String account, String currency, Money value) {
        Map<String, Money> entries = balances.computeIfAbsent(currency, c -> new ConcurrentHashMap<>());
        Money before = entries.getOrDefault(account, Money.ZERO);
        entries.put(account, value);
        unitOfWork.onRollback(() -> entries.put(account, before));
        return value;
    }

    private static VaultTransaction entry(UnitOfWork unitOfWork, String account, String currency,
            VaultTransactionType type, boolean credit, Money amount, Money after, String referenceId) {
        return VaultTransaction.builder()
                .account(account)
                .currency(currency)
                .transactionType(type)
                .credit(credit)
                .amount(amount)
                .balanceAfter(after)
                .referenceId(referenceId)
                .timestamp(unitOfWork.now())
                .build();
    }
}
