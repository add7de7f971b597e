package com.project.provenance.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Append-only log of completed transfers, keyed by (asset id, transfer index).
 */
public class HistoryLog {

    private final Map<HistoryEntry.Key, HistoryEntry> entries = new ConcurrentHashMap<>();

    public Optional<HistoryEntry> find(long assetId, long transferIndex) {
        return Optional.ofNullable(entries.get(new HistoryEntry.Key(assetId, transferIndex)));
    }

    /**
     * Entries of an asset for indices {@code 0 .. transferCount - 1}, oldest first.
     */
    public List<HistoryEntry> entriesFor(long assetId, long transferCount) {
        List<HistoryEntry> result = new ArrayList<>();
        for (long index = 0; index < transferCount; index++) {
            find(assetId, index).ifPresent(result::add);
        }
        return result;
    }

    public int size() {
        return entries.size();
    }

    void append(HistoryEntry entry) {
        HistoryEntry previous = entries.putIfAbsent(entry.key(), entry);
        if (previous != null) {
            throw new IllegalStateException(String.format("history slot (%d, %d) already used",
                    entry.assetId(), entry.transferIndex()));
        }
    }
}
