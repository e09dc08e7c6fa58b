package com.nft.market.nft_market.cache;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.nft.market.nft_market.entity.Auction;
import com.nft.market.nft_market.execution.UnitOfWork;
import com.nft.market.nft_market.service.SnapshotPersister;

import lombok.RequiredArgsConstructor;

/**
 * Hot auction state, numbered independently of sales.
 */
@RequiredArgsConstructor
public class AuctionStore {
    private final ConcurrentHashMap<Long, Auction> auctions = new ConcurrentHashMap<>();
    private final SnapshotPersister snapshotPersister;

    private long lastId = 0;

    public Auction create(UnitOfWork unitOfWork, Auction auction) {
        long id = lastId + 1;
        auction.setId(id);
        auctions.put(id, auction);
        lastId = id;
        unitOfWork.onRollback(() -> {
            auctions.remove(id);
            lastId = id - 1;
        });
        markModified(unitOfWork, auction);
        return auction;
    }

    /**
     * Load persisted auctions before any operation runs; numbering continues after the highest id.
     */
    public void restore(Collection<Auction> stored) {
        if (!auctions.isEmpty()) {
            throw new IllegalStateException("Auction store already holds state");
        }
        for (Auction auction : stored) {
            auctions.put(auction.getId(), auction);
            lastId = Math.max(lastId, auction.getId());
        }
    }

    public Optional<Auction> find(long auctionId) {
        return Optional.ofNullable(auctions.get(auctionId));
    }

    public void markModified(UnitOfWork unitOfWork, Auction auction) {
        unitOfWork.afterCommit(() -> snapshotPersister.persistAuction(auction.copy()));
    }

    public long count() {
        return lastId;
    }
}
