package com.nft.market.nft_market.payment;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.error.TransferException;

import lombok.extern.slf4j.Slf4j;

/**
 * Sandbox wallets held in memory. The treasury is an ordinary wallet per
 * currency; native value uses the native sentinel as its currency key.
 */
@Slf4j
public class InMemoryPaymentRails implements PaymentRails {

    private final String treasury;
    private final Map<String, Money> wallets = new ConcurrentHashMap<>();
    private final Map<String, Money> allowances = new ConcurrentHashMap<>();

    public InMemoryPaymentRails(String treasury) {
        this.treasury = Addresses.normalize(treasury);
    }

    public String getTreasury() {
        return treasury;
    }

    public void mint(String currency, String account, Money amount) {
        wallets.merge(key(currency, account), amount, Money::add);
    }

    /**
     * Set how much of currency the treasury may pull from owner.
     */
    public void approve(String currency, String owner, Money amount) {
        allowances.put(key(currency, owner), amount);
    }

    public Money balanceOf(String currency, String account) {
        return wallets.getOrDefault(key(currency, account), Money.ZERO);
    }

    public Money allowanceOf(String currency, String owner) {
        return allowances.getOrDefault(key(currency, owner), Money.ZERO);
    }

    @Override
    public synchronized void receiveNative(String from, Money amount) {
        move(Addresses.NATIVE_CURRENCY, from, treasury, amount);
    }

    @Override
    public synchronized void pullToken(String currency, String from, Money amount) {
        Money allowance = allowanceOf(currency, from);
        if (allowance.compareTo(amount) < 0) {
            throw new TransferException("Insufficient allowance: " + allowance + " < " + amount);
        }
        move(currency, from, treasury, amount);
        allowances.put(key(currency, from), allowance.subtract(amount));
    }

    @Override
    public synchronized void sendNative(String to, Money amount) {
        move(Addresses.NATIVE_CURRENCY, treasury, to, amount);
    }

    @Override
    public synchronized void sendToken(String currency, String to, Money amount) {
        move(currency, treasury, to, amount);
    }

    private void move(String currency, String from, String to, Money amount) {
        Money balance = balanceOf(currency, from);
        if (balance.compareTo(amount) < 0) {
            throw new TransferException("Insufficient " + currency + " balance for " + from);
        }
        wallets.put(key(currency, from), balance.subtract(amount));
        wallets.merge(key(currency, to), amount, Money::add);
        log.debug("Moved {} {} from {} to {}", amount, currency, from, to);
    }

    private static String key(String currency, String account) {
        return Addresses.normalize(currency) + ":" + Addresses.normalize(account);
    }
}
