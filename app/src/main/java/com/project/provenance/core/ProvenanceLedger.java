package com.project.provenance.core;

import com.project.provenance.core.InputValidator.InvalidInputException;
import com.project.provenance.eth.BlockClock;
import com.project.provenance.eth.Principal;
import com.project.provenance.log.LedgerLogger;

import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Consumer;
import java.util.function.Supplier;

/**
 * Provenance ledger for AI-attributed digital assets.
 *
 * Every mutating call runs alone under the write lock, reads the block clock
 * once, stages its writes in a {@link LedgerTransaction} and commits them only
 * after all gates pass. Queries hold the read lock, so they never see a
 * commit half applied.
 *
 * The registry owner is fixed at construction; the caller of each call is
 * passed in explicitly.
 */
public class ProvenanceLedger {

    private final Principal registryOwner;
    private final BlockClock clock;
    private final ReentrantReadWriteLock lock = new ReentrantReadWriteLock();

    private final ModelRegistry models;
    private final VerifierRegistry verifiers;
    private final ProvenanceStore store;
    private final HistoryLog history;
    private final TransferProtocol transfers;
    private final LedgerCounters counters = new LedgerCounters();

    public ProvenanceLedger(Principal registryOwner, BlockClock clock) {
        this(registryOwner, clock, new ModelRegistry(), new VerifierRegistry());
    }

    private ProvenanceLedger(Principal registryOwner, BlockClock clock,
                             ModelRegistry models, VerifierRegistry verifiers) {
        this(registryOwner, clock, models, verifiers, new ProvenanceStore(models, verifiers), new HistoryLog());
    }

    ProvenanceLedger(Principal registryOwner, BlockClock clock, ModelRegistry models,
                     VerifierRegistry verifiers, ProvenanceStore store, HistoryLog history) {
        this.registryOwner = Objects.requireNonNull(registryOwner, "registryOwner must not be null");
        this.clock = Objects.requireNonNull(clock, "clock must not be null");
        this.models = Objects.requireNonNull(models, "models must not be null");
        this.verifiers = Objects.requireNonNull(verifiers, "verifiers must not be null");
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.history = Objects.requireNonNull(history, "history must not be null");
        this.transfers = new TransferProtocol(store, models);
    }

    // ==================== Mutating calls ====================

    /**
     * Register a trusted AI model. Owner only.
     *
     * @throws ProvenanceException NotAuthorized, AlreadyRegistered or InvalidAuthenticityScore
     */
    public void registerModel(Principal caller, String modelId, String name, String version, int confidenceLevel) {
        execute("register-model", caller,
                tx -> models.register(tx, modelId, name, version, confidenceLevel),
                String.format("model '%s' v%s (confidence %d)", modelId, version, confidenceLevel));
    }

    /**
     * Grant a principal the right to correct scores. Owner only; repeating a grant changes nothing.
     *
     * @throws ProvenanceException NotAuthorized
     */
    public void authorizeVerifier(Principal caller, Principal verifier) {
        execute("authorize-verifier", caller,
                tx -> verifiers.authorize(tx, verifier),
                "verifier " + verifier);
    }

    /**
     * Register an asset owned and created by the caller.
     *
     * @throws ProvenanceException AlreadyRegistered, InvalidAiModel or InvalidAuthenticityScore
     */
    public void registerAsset(Principal caller, long assetId, String modelId, int initialScore) {
        execute("register-asset", caller,
                tx -> store.registerAsset(tx, assetId, modelId, initialScore),
                String.format("asset %d on model '%s' (score %d)", assetId, modelId, initialScore));
    }

    /**
     * Verifier correction of an asset's score.
     *
     * @throws ProvenanceException NftNotFound, NotAuthorized or InvalidAuthenticityScore
     */
    public void updateScore(Principal caller, long assetId, int newScore) {
        execute("update-score", caller,
                tx -> store.updateScore(tx, assetId, newScore),
                String.format("asset %d score -> %d", assetId, newScore));
    }

    /**
     * Transfer an asset to a new owner, recalculating its score.
     *
     * @throws ProvenanceException NftNotFound, NotAuthorized, TransferFailed or InvalidAiModel
     * @see TransferProtocol
     */
    public void transferAsset(Principal caller, long assetId, Principal newOwner, long price, String verificationHash) {
        execute("transfer-asset", caller,
                tx -> transfers.transfer(tx, assetId, newOwner, price, verificationHash),
                String.format("asset %d -> %s for %d", assetId, newOwner, price));
    }

    private void execute(String operation, Principal caller, Consumer<LedgerTransaction> gates, String summary) {
        Lock writeLock = lock.writeLock();
        writeLock.lock();
        try {
            long blockHeight;
            try {
                blockHeight = clock.currentHeight();
            } catch (RuntimeException e) {
                LedgerLogger.error(operation, "block height unavailable for " + summary, e);
                throw e;
            }

            LedgerTransaction tx;
            try {
                tx = new LedgerTransaction(operation, caller, registryOwner, blockHeight);
                gates.accept(tx);
            } catch (ProvenanceException | InvalidInputException e) {
                LedgerLogger.warn(operation, String.format("rejected %s from %s: %s", summary, caller, e.getMessage()));
                throw e;
            }

            try {
                tx.commit(models, verifiers, store, history, counters);
            } catch (RuntimeException e) {
                LedgerLogger.error(operation, "commit failed for " + summary, e);
                throw e;
            }
            LedgerLogger.info(operation, String.format("committed %s from %s at block %d (%d writes)",
                    summary, caller, tx.blockHeight(), tx.stagedWriteCount()));
        } finally {
            writeLock.unlock();
        }
    }

    private <T> T read(Supplier<T> query) {
        Lock readLock = lock.readLock();
        readLock.lock();
        try {
            return query.get();
        } finally {
            readLock.unlock();
        }
    }

    // ==================== Queries ====================

    public Principal owner() {
        return registryOwner;
    }

    public Optional<AiModel> getModel(String modelId) {
        return read(() -> models.find(modelId));
    }

    public boolean isActiveModel(String modelId) {
        return read(() -> models.isActiveModel(modelId));
    }

    public boolean isAuthorizedVerifier(Principal principal) {
        return read(() -> verifiers.isAuthorizedVerifier(principal));
    }

    public Optional<ProvenanceRecord> getProvenance(long assetId) {
        return read(() -> store.find(assetId));
    }

    public Optional<HistoryEntry> getHistoryEntry(long assetId, long transferIndex) {
        return read(() -> history.find(assetId, transferIndex));
    }

    /**
     * All transfers of an asset, oldest first. Empty for unknown assets.
     */
    public List<HistoryEntry> getHistory(long assetId) {
        return read(() -> store.find(assetId)
                .map(record -> history.entriesFor(assetId, record.transferCount()))
                .orElse(List.of()));
    }

    public long totalAssets() {
        return read(counters::totalAssets);
    }

    public long totalModels() {
        return read(counters::totalModels);
    }
}
