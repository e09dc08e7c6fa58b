package com.nft.market.nft_market.execution;

import java.time.Clock;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

import com.nft.market.nft_market.error.MarketplaceException;
import com.nft.market.nft_market.service.VaultJournal;

import lombok.extern.slf4j.Slf4j;

/**
 * Single-writer execution for every state-changing ledger operation.
 *
 * - Serialized: one fair lock orders operations from all threads.
 * - Atomic: each operation runs against its own UnitOfWork and is rolled
 *   back completely when it throws.
 * - Reentrancy-guarded: an external transfer calling back into any ledger
 *   operation on the same thread is rejected before it can touch state.
 *
 * Queries take the same lock but may nest inside an operation.
 * Committed vault movements go to the {@link VaultJournal}.
 */
@Slf4j
public class LedgerExecutor {

    private final ReentrantLock lock = new ReentrantLock(true);
    private final Clock clock;
    private final VaultJournal vaultJournal;

    public LedgerExecutor(Clock clock, VaultJournal vaultJournal) {
        this.clock = clock;
        this.vaultJournal = vaultJournal;
    }

    public <T> T execute(String operation, Function<UnitOfWork, T> body) {
        lock.lock();
        try {
            if (lock.getHoldCount() > 1) {
                log.warn("Reentrant call rejected: {}", operation);
                throw MarketplaceException.invalidState("Reentrant call rejected: %s", operation);
            }

            UnitOfWork unitOfWork = new UnitOfWork(operation, clock.instant().getEpochSecond());
            T result;
            try {
                result = body.apply(unitOfWork);
            } catch (RuntimeException e) {
                unitOfWork.rollback(e);
                throw e;
            }
            unitOfWork.afterCommit(() -> vaultJournal.append(unitOfWork.getJournal()));
            unitOfWork.commit();
            return result;
        } finally {
            lock.unlock();
        }
    }

    public void run(String operation, Consumer<UnitOfWork> body) {
        execute(operation, unitOfWork -> {
            body.accept(unitOfWork);
            return null;
        });
    }

    public <T> T read(Supplier<T> query) {
        lock.lock();
        try {
            return query.get();
        } finally {
            lock.unlock();
        }
    }

    public long now() {
        return clock.instant().getEpochSecond();
    }
}
