package com.nft.market.nft_market.asset;

import java.math.BigInteger;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import com.nft.market.nft_market.entity.Addresses;
import com.nft.market.nft_market.entity.Money;
import com.nft.market.nft_market.entity.RoyaltyInfo;
import com.nft.market.nft_market.error.TransferException;

import lombok.extern.slf4j.Slf4j;

/**
 * Sandbox item contracts held in memory: unique-item owners, quantity
 * balances and per-contract royalty terms (basis points of the sale amount).
 */
@Slf4j
public class InMemoryAssetGateway implements AssetGateway {

    private static final long BASIS_POINTS = 10_000;

    private final Map<String, String> uniqueOwners = new ConcurrentHashMap<>();
    private final Map<String, Long> quantityBalances = new ConcurrentHashMap<>();
    private final Set<String> royaltyContracts = ConcurrentHashMap.newKeySet();
    private final Map<String, RoyaltyTerms> royaltyTerms = new ConcurrentHashMap<>();

    private static class RoyaltyTerms {
        private final String receiver;
        private final long basisPoints;

        RoyaltyTerms(String receiver, long basisPoints) {
            this.receiver = receiver;
            this.basisPoints = basisPoints;
        }
    }

    public void registerContract(String contract, boolean supportsRoyalties) {
        String address = Addresses.normalize(contract);
        if (supportsRoyalties) {
            royaltyContracts.add(address);
        } else {
            royaltyContracts.remove(address);
        }
    }

    public void setRoyalty(String contract, String receiver, long basisPoints) {
        royaltyTerms.put(Addresses.normalize(contract),
                new RoyaltyTerms(Addresses.normalize(receiver), basisPoints));
    }

    public void mintUnique(String contract, BigInteger itemId, String owner) {
        String key = key(contract, itemId);
        if (uniqueOwners.putIfAbsent(key, Addresses.normalize(owner)) != null) {
            throw new IllegalArgumentException("Item already minted: " + key);
        }
    }

    public void mintQuantity(String contract, BigInteger itemId, String owner, long quantity) {
        quantityBalances.merge(key(contract, itemId, owner), quantity, Long::sum);
    }

    public String ownerOf(String contract, BigInteger itemId) {
        return uniqueOwners.get(key(contract, itemId));
    }

    public long balanceOf(String contract, BigInteger itemId, String owner) {
        return quantityBalances.getOrDefault(key(contract, itemId, owner), 0L);
    }

    @Override
    public boolean supportsRoyaltyInfo(String contract) {
        return royaltyContracts.contains(Addresses.normalize(contract));
    }

    @Override
    public RoyaltyInfo royaltyInfo(String contract, BigInteger itemId, Money saleAmount) {
        RoyaltyTerms terms = royaltyTerms.get(Addresses.normalize(contract));
        if (terms == null) {
            return RoyaltyInfo.none();
        }
        return new RoyaltyInfo(terms.receiver, saleAmount.multiplyFloor(terms.basisPoints, BASIS_POINTS));
    }

    @Override
    public synchronized void transferUniqueItem(String contract, String from, String to, BigInteger itemId) {
        String key = key(contract, itemId);
        String owner = uniqueOwners.get(key);
        if (owner == null || !owner.equals(Addresses.normalize(from))) {
            throw new TransferException("Transfer of " + key + " not from owner");
        }
        uniqueOwners.put(key, Addresses.normalize(to));
        log.debug("Unique item {} moved {} -> {}", key, from, to);
    }

    @Override
    public synchronized void transferQuantity(String contract, String from, String to, BigInteger itemId, long quantity) {
        String fromKey = key(contract, itemId, from);
        long balance = quantityBalances.getOrDefault(fromKey, 0L);
        if (quantity <= 0 || balance < quantity) {
            throw new TransferException("Insufficient balance for transfer of " + quantity + " x " + key(contract, itemId));
        }
        quantityBalances.put(fromKey, balance - quantity);
        quantityBalances.merge(key(contract, itemId, to), quantity, Long::sum);
        log.debug("{} x {} moved {} -> {}", quantity, key(contract, itemId), from, to);
    }

    private static String key(String contract, BigInteger itemId) {
        return Addresses.normalize(contract) + "#" + itemId;
    }

    private static String key(String contract, BigInteger itemId, String owner) {
        return key(contract, itemId) + "@" + Addresses.normalize(owner);
    }
}
