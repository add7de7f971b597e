package com.project.provenance.core;

import com.project.provenance.eth.Principal;

import java.util.Objects;

/**
 * Asset transfer with fraud detection.
 *
 * A transfer passes these gates in order, any of which rejects the whole call:
 * <ol>
 *   <li>the asset exists ({@code NftNotFound});</li>
 *   <li>the caller is its current owner ({@code NotAuthorized});</li>
 *   <li>the asset is not flagged ({@code TransferFailed});</li>
 *   <li>its AI model still exists ({@code InvalidAiModel});</li>
 *   <li>the recalculated score reaches {@value Scores#MIN_CONFIDENCE} ({@code TransferFailed}).</li>
 * </ol>
 * On success one history entry is written at the old transfer count and the
 * record moves to the new owner with the recalculated score.
 */
public class TransferProtocol {

    private final ProvenanceStore store;
    private final ModelRegistry models;

    public TransferProtocol(ProvenanceStore store, ModelRegistry models) {
        this.store = Objects.requireNonNull(store, "store must not be null");
        this.models = Objects.requireNonNull(models, "models must not be null");
    }

    void transfer(LedgerTransaction tx, long assetId, Principal newOwner, long price, String verificationHash) {
        InputValidator.requireNonNull(newOwner, "New owner");
        InputValidator.validateNonNegative(price, "Price");
        InputValidator.validateVerificationHash(verificationHash);

        ProvenanceRecord current = store.find(assetId)
                .orElseThrow(() -> new ProvenanceException(ProvenanceError.NFT_NOT_FOUND,
                        String.format("asset %d does not exist", assetId)));

        if (!tx.caller().equals(current.currentOwner())) {
            throw new ProvenanceException(ProvenanceError.NOT_AUTHORIZED,
                    String.format("%s does not own asset %d", tx.caller(), assetId));
        }
        if (current.flagged()) {
            throw new ProvenanceException(ProvenanceError.TRANSFER_FAILED,
                    String.format("asset %d is flagged for fraud review", assetId));
        }

        AiModel model = models.find(current.aiModelId())
                .orElseThrow(() -> new ProvenanceException(ProvenanceError.INVALID_AI_MODEL,
                        String.format("model '%s' of asset %d no longer exists", current.aiModelId(), assetId)));

        int updatedScore = Scores.recalculate(model.confidenceLevel(), current.authenticityScore());
        if (!Scores.meetsThreshold(updatedScore)) {
            throw new ProvenanceException(ProvenanceError.TRANSFER_FAILED,
                    String.format("recalculated score %d of asset %d is below %d",
                            updatedScore, assetId, Scores.MIN_CONFIDENCE));
        }

        long height = tx.blockHeight();
        tx.stageHistory(new HistoryEntry(assetId, current.transferCount(), current.currentOwner(),
                newOwner, height, price, verificationHash));
        tx.stageRecordUpdate(current, current.transferredTo(newOwner, updatedScore, height));
    }
}
