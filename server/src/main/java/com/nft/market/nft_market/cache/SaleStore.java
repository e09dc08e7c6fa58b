package com.nft.market.nft_market.cache;

import java.util.Collection;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

import com.nft.market.nft_market.entity.Sale;
import com.nft.market.nft_market.execution.UnitOfWork;
import com.nft.market.nft_market.service.SnapshotPersister;

import lombok.RequiredArgsConstructor;

/**
 * Hot sale state. Ids are sequential from 1; 0 never names a sale.
 * Every change is mirrored to MongoDB once its operation commits.
 */
@RequiredArgsConstructor
public class SaleStore {
    private final ConcurrentHashMap<Long, Sale> sales = new ConcurrentHashMap<>();
    private final SnapshotPersister snapshotPersister;

    private long lastId = 0;

    public Sale create(UnitOfWork unitOfWork, Sale sale) {
        long id = lastId + 1;
        sale.setId(id);
        sales.put(id, sale);
        lastId = id;
        unitOfWork.onRollback(() -> {
            sales.remove(id);
            lastId = id - 1;
        });
        markModified(unitOfWork, sale);
        return sale;
    }

    /**
     * Load persisted sales before any operation runs; numbering continues after the highest id.
     */
    public void restore(Collection<Sale> stored) {
        if (!sales.isEmpty()) {
            throw new IllegalStateException("Sale store already holds state");
        }
        for (Sale sale : stored) {
            sales.put(sale.getId(), sale);
            lastId = Math.max(lastId, sale.getId());
        }
    }

    public Optional<Sale> find(long saleId) {
        return Optional.ofNullable(sales.get(saleId));
    }

    public void markModified(UnitOfWork unitOfWork, Sale sale) {
        unitOfWork.afterCommit(() -> snapshotPersister.persistSale(sale.copy()));
    }

    public long count() {
        return lastId;
    }
}
