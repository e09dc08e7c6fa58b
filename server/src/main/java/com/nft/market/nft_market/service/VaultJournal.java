package com.nft.market.nft_market.service;

import java.util.List;

import com.nft.market.nft_market.entity.VaultTransaction;

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;

/**
 * Numbers committed vault movements in commit order and hands them to
 * persistence. Only called from a committing operation.
 */
@Slf4j
@RequiredArgsConstructor
public class VaultJournal {

    private final SnapshotPersister snapshotPersister;

    private long lastSequence = 0;

    public synchronized void append(List<VaultTransaction> entries) {
        if (entries.isEmpty()) {
            return;
        }
        for (VaultTransaction entry : entries) {
            entry.setSequence(++lastSequence);
        }
        log.debug("Journaled {} vault movements up to sequence {}", entries.size(), lastSequence);
        snapshotPersister.appendJournal(List.copyOf(entries));
    }

    /**
     * Continue numbering after the highest sequence already stored.
     */
    public synchronized void resumeAfter(long storedSequence) {
        if (storedSequence < lastSequence) {
            throw new IllegalStateException("Journal already at sequence " + lastSequence);
        }
        lastSequence = storedSequence;
        log.info("Journal resumes after sequence {}", storedSequence);
    }

    public synchronized long getLastSequence() {
        return lastSequence;
    }
}
