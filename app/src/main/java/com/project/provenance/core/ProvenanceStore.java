package com.project.provenance.core;

import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Current provenance record of every asset, one per asset id.
 *
 * Records are only ever inserted once and afterwards replaced by
 * compare-and-swap against the exact value a gate read.
 */
public class ProvenanceStore {

    private final Map<Long, ProvenanceRecord> records = new ConcurrentHashMap<>();
    private final ModelRegistry models;
    private final VerifierRegistry verifiers;

    public ProvenanceStore(ModelRegistry models, VerifierRegistry verifiers) {
        this.models = Objects.requireNonNull(models, "models must not be null");
        this.verifiers = Objects.requireNonNull(verifiers, "verifiers must not be null");
    }

    void registerAsset(LedgerTransaction tx, long assetId, String modelId, int initialScore) {
        InputValidator.validateModelReference(modelId);

        if (records.containsKey(assetId)) {
            throw new ProvenanceException(ProvenanceError.ALREADY_REGISTERED,
                    String.format("asset %d is already registered", assetId));
        }
        if (!models.isActiveModel(modelId)) {
            throw new ProvenanceException(ProvenanceError.INVALID_AI_MODEL,
                    String.format("model '%s' is not registered or not active", modelId));
        }
        if (!Scores.isValidScore(initialScore)) {
            throw new ProvenanceException(ProvenanceError.INVALID_AUTHENTICITY_SCORE,
                    String.format("initial score must be in [%d, %d]: got %d",
                            Scores.MIN_SCORE, Scores.MAX_SCORE, initialScore));
        }

        tx.stageNewRecord(ProvenanceRecord.created(assetId, tx.caller(), modelId, initialScore, tx.blockHeight()));
    }

    /**
     * Verifier score correction. Merges score and verification time into the
     * existing record; owner, creator, model, counters and flag are kept.
     */
    void updateScore(LedgerTransaction tx, long assetId, int newScore) {
        ProvenanceRecord current = records.get(assetId);
        if (current == null) {
            throw new ProvenanceException(ProvenanceError.NFT_NOT_FOUND,
                    String.format("asset %d does not exist", assetId));
        }
        if (!verifiers.isAuthorizedVerifier(tx.caller())) {
            throw new ProvenanceException(ProvenanceError.NOT_AUTHORIZED,
                    String.format("%s is not an authorized verifier", tx.caller()));
        }
        if (!Scores.isValidScore(newScore)) {
            throw new ProvenanceException(ProvenanceError.INVALID_AUTHENTICITY_SCORE,
                    String.format("score must be in [%d, %d]: got %d",
                            Scores.MIN_SCORE, Scores.MAX_SCORE, newScore));
        }

        tx.stageRecordUpdate(current, current.withScore(newScore, tx.blockHeight()));
    }

    public Optional<ProvenanceRecord> find(long assetId) {
        return Optional.ofNullable(records.get(assetId));
    }

    boolean insert(ProvenanceRecord record) {
        return records.putIfAbsent(record.assetId(), record) == null;
    }

    boolean compareAndSet(ProvenanceRecord expected, ProvenanceRecord updated) {
        return records.replace(expected.assetId(), expected, updated);
    }
}
