package com.project.provenance.core;

import com.project.provenance.eth.Principal;

import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Per-call context and staged-write buffer.
 *
 * Gates read committed state and stage their writes here. Nothing reaches the
 * stores until {@link #commit} runs, and commit checks every staged write
 * before applying any of them, so a rejected or failed call leaves no trace.
 */
public final class LedgerTransaction {

    private final String operation;
    private final Principal caller;
    private final Principal registryOwner;
    private final long blockHeight;

    private final List<AiModel> newModels = new ArrayList<>();
    private final List<VerifierGrant> grants = new ArrayList<>();
    private final List<ProvenanceRecord> newRecords = new ArrayList<>();
    private final List<RecordUpdate> recordUpdates = new ArrayList<>();
    private final List<HistoryEntry> historyEntries = new ArrayList<>();

    private boolean committed;

    private record RecordUpdate(ProvenanceRecord expected, ProvenanceRecord updated) {
    }

    LedgerTransaction(String operation, Principal caller, Principal registryOwner, long blockHeight) {
        this.operation = Objects.requireNonNull(operation, "operation must not be null");
        this.caller = InputValidator.requireNonNull(caller, "Caller");
        this.registryOwner = Objects.requireNonNull(registryOwner, "registryOwner must not be null");
        this.blockHeight = blockHeight;
    }

    public String operation() {
        return operation;
    }

    public Principal caller() {
        return caller;
    }

    /** Block height read once for this call; every timestamp it writes uses it. */
    public long blockHeight() {
        return blockHeight;
    }

    public boolean callerIsRegistryOwner() {
        return caller.equals(registryOwner);
    }

    void stageModel(AiModel model) {
        newModels.add(model);
    }

    void stageGrant(VerifierGrant grant) {
        grants.add(grant);
    }

    void stageNewRecord(ProvenanceRecord record) {
        newRecords.add(record);
    }

    void stageRecordUpdate(ProvenanceRecord expected, ProvenanceRecord updated) {
        if (expected.assetId() != updated.assetId()) {
            throw new IllegalArgumentException("record update must keep the asset id");
        }
        recordUpdates.add(new RecordUpdate(expected, updated));
    }

    void stageHistory(HistoryEntry entry) {
        historyEntries.add(entry);
    }

    int stagedWriteCount() {
        return newModels.size() + grants.size() + newRecords.size()
                + recordUpdates.size() + historyEntries.size();
    }

    /**
     * Apply all staged writes. Callers must hold the ledger's write lock.
     *
     * @throws IllegalStateException if committed state no longer matches what the
     *                               gates observed; nothing is applied in that case.
     */
    void commit(ModelRegistry models, VerifierRegistry verifiers, ProvenanceStore store,
                HistoryLog history, LedgerCounters counters) {
        if (committed) {
            throw new IllegalStateException("transaction already committed: " + operation);
        }

        for (AiModel model : newModels) {
            if (models.find(model.modelId()).isPresent()) {
                throw new IllegalStateException("model appeared during " + operation + ": " + model.modelId());
            }
        }
        for (ProvenanceRecord record : newRecords) {
            if (store.find(record.assetId()).isPresent()) {
                throw new IllegalStateException("asset appeared during " + operation + ": " + record.assetId());
            }
        }
        for (RecordUpdate update : recordUpdates) {
            boolean unchanged = store.find(update.expected().assetId())
                    .map(update.expected()::equals)
                    .orElse(false);
            if (!unchanged) {
                throw new IllegalStateException("asset changed during " + operation + ": " + update.expected().assetId());
            }
        }
        for (HistoryEntry entry : historyEntries) {
            if (history.find(entry.assetId(), entry.transferIndex()).isPresent()) {
                throw new IllegalStateException(String.format("history slot (%d, %d) already used",
                        entry.assetId(), entry.transferIndex()));
            }
        }

        newModels.forEach(models::insert);
        grants.forEach(verifiers::put);
        newRecords.forEach(store::insert);
        historyEntries.forEach(history::append);
        recordUpdates.forEach(update -> store.compareAndSet(update.expected(), update.updated()));

        counters.addModels(newModels.size());
        counters.addAssets(newRecords.size());
        committed = true;
    }
}
