package com.project.provenance.io;

import com.project.provenance.core.AiModel;
import com.project.provenance.core.HistoryEntry;
import com.project.provenance.core.ProvenanceError;
import com.project.provenance.core.ProvenanceException;
import com.project.provenance.core.ProvenanceLedger;
import com.project.provenance.core.ProvenanceRecord;

import java.time.Instant;
import java.util.List;

/**
 * Snapshot of one asset's provenance: current record, its model and every transfer.
 *
 * @param record     current provenance record.
 * @param model      referenced AI model, {@code null} if it no longer exists.
 * @param history    transfers, oldest first.
 * @param exportedAt wall-clock time the snapshot was taken.
 */
public record ProvenanceReport(
        ProvenanceRecord record,
        AiModel model,
        List<HistoryEntry> history,
        Instant exportedAt
) {

    public static ProvenanceReport of(ProvenanceLedger ledger, long assetId) {
        ProvenanceRecord record = ledger.getProvenance(assetId)
                .orElseThrow(() -> new ProvenanceException(ProvenanceError.NFT_NOT_FOUND,
                        String.format("asset %d does not exist", assetId)));
        return new ProvenanceReport(
                record,
                ledger.getModel(record.aiModelId()).orElse(null),
                ledger.getHistory(assetId),
                Instant.now()
        );
    }
}
