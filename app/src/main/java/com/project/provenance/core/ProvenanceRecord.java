package com.project.provenance.core;

import com.project.provenance.eth.Principal;

/**
 * Current provenance state of one asset.
 *
 * @param assetId           asset identifier.
 * @param currentOwner      principal allowed to transfer the asset.
 * @param creator           principal that registered the asset; never changes.
 * @param aiModelId         attribution model the asset references.
 * @param authenticityScore score in [0, 100].
 * @param creationTimestamp block height at registration; never changes.
 * @param lastVerified      block height of the last score change.
 * @param transferCount     completed transfers, also the next free history index.
 * @param flagged           fraud-suspicion marker; a flagged asset cannot transfer.
 */
public record ProvenanceRecord(
        long assetId,
        Principal currentOwner,
        Principal creator,
        String aiModelId,
        int authenticityScore,
        long creationTimestamp,
        long lastVerified,
        long transferCount,
        boolean flagged
) {

    public static ProvenanceRecord created(long assetId, Principal creator, String aiModelId,
                                           int initialScore, long blockHeight) {
        return new ProvenanceRecord(assetId, creator, creator, aiModelId, initialScore,
                blockHeight, blockHeight, 0, false);
    }

    /**
     * Score correction: only the score and verification time change.
     */
    public ProvenanceRecord withScore(int newScore, long blockHeight) {
        return new ProvenanceRecord(assetId, currentOwner, creator, aiModelId, newScore,
                creationTimestamp, blockHeight, transferCount, flagged);
    }

    public ProvenanceRecord transferredTo(Principal newOwner, int updatedScore, long blockHeight) {
        return new ProvenanceRecord(assetId, newOwner, creator, aiModelId, updatedScore,
                creationTimestamp, blockHeight, transferCount + 1, flagged);
    }

    public ProvenanceRecord withFlagged(boolean value) {
        return new ProvenanceRecord(assetId, currentOwner, creator, aiModelId, authenticityScore,
                creationTimestamp, lastVerified, transferCount, value);
    }
}
