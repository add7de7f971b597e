package com.project.provenance.core;

import com.project.provenance.eth.Principal;

/**
 * One completed transfer of an asset. Written once, never replaced.
 *
 * @param assetId          asset that moved.
 * @param transferIndex    transfer count of the asset before this transfer.
 * @param fromOwner        owner before the transfer.
 * @param toOwner          owner after the transfer.
 * @param timestamp        block height of the transfer.
 * @param price            agreed price, non-negative.
 * @param verificationHash caller-supplied hash, stored as given.
 */
public record HistoryEntry(
        long assetId,
        long transferIndex,
        Principal fromOwner,
        Principal toOwner,
        long timestamp,
        long price,
        String verificationHash
) {

    public Key key() {
        return new Key(assetId, transferIndex);
    }

    public record Key(long assetId, long transferIndex) {
    }
}
