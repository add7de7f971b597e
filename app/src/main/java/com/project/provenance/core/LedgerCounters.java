package com.project.provenance.core;

import java.util.concurrent.atomic.AtomicLong;

/**
 * Totals for reporting. Identities are caller-supplied, so these never allocate ids.
 */
public class LedgerCounters {

    private final AtomicLong totalAssets = new AtomicLong();
    private final AtomicLong totalModels = new AtomicLong();

    public long totalAssets() {
        return totalAssets.get();
    }

    public long totalModels() {
        return totalModels.get();
    }

    void addAssets(int count) {
        totalAssets.addAndGet(count);
    }

    void addModels(int count) {
        totalModels.addAndGet(count);
    }
}
