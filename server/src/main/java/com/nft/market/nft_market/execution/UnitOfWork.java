package com.nft.market.nft_market.execution;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import com.nft.market.nft_market.entity.VaultTransaction;

import lombok.extern.slf4j.Slf4j;

/**
 * Undo log and commit hooks for one ledger operation.
 *
 * Every internal mutation registers its inverse, every external collection
 * registers a compensating payout. On failure the log is replayed newest
 * first, leaving the ledger exactly as it was before the operation began.
 * Commit hooks (snapshot persistence, journal append) only run on success.
 */
@Slf4j
public class UnitOfWork {

    private final String operation;
    private final long now;
    private final Deque<Runnable> undoLog = new ArrayDeque<>();
    private final List<Runnable> commitHooks = new ArrayList<>();
    private final List<VaultTransaction> journal = new ArrayList<>();

    UnitOfWork(String operation, long now) {
        this.operation = operation;
        this.now = now;
    }

    /**
     * Clock reading (epoch seconds) taken once at operation start.
     */
    public long now() {
        return now;
    }

    public void onRollback(Runnable undo) {
        undoLog.push(undo);
    }

    public void afterCommit(Runnable hook) {
        commitHooks.add(hook);
    }

    public void record(VaultTransaction entry) {
        journal.add(entry);
    }

    public List<VaultTransaction> getJournal() {
        return journal;
    }

    void rollback(RuntimeException failure) {
        log.debug("Rolling back {} ({} undo actions): {}", operation, undoLog.size(), failure.getMessage());
        while (!undoLog.isEmpty()) {
            Runnable undo = undoLog.pop();
            try {
                undo.run();
            } catch (RuntimeException undoFailure) {
                log.error("Undo action failed during rollback of {}", operation, undoFailure);
                failure.addSuppressed(undoFailure);
            }
        }
        journal.clear();
        commitHooks.clear();
    }

    void commit() {
        undoLog.clear();
        for (Runnable hook : commitHooks) {
            try {
                hook.run();
            } catch (RuntimeException e) {
                // state is already committed; hooks only mirror it outward
                log.error("Post-commit hook failed for {}: {}", operation, e.getMessage(), e);
            }
        }
    }
}
