package com.project.provenance;

import com.project.provenance.core.HistoryEntry;
import com.project.provenance.core.ProvenanceLedger;
import com.project.provenance.core.ProvenanceRecord;
import com.project.provenance.crypto.VerificationHashes;
import com.project.provenance.eth.BlockClock;
import com.project.provenance.eth.LedgerConfig;
import com.project.provenance.eth.LedgerConfigRegistry;
import com.project.provenance.eth.ManualBlockClock;
import com.project.provenance.eth.Principal;
import com.project.provenance.eth.Web3jBlockClock;
import com.project.provenance.io.ProvenanceReport;
import com.project.provenance.io.ProvenanceReportWriter;
import com.project.provenance.log.LedgerLogger;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Demo: registers a model and an asset, transfers it once and exports the report.
 *
 * Configuration is resolved by {@link LedgerConfigRegistry} from
 * {@code deployments/<network>.json} and the environment.
 */
public class App {

    static final String DEFAULT_OWNER = "0x00000000000000000000000000000000000000a1";
    static final Principal BUYER = Principal.of("0x00000000000000000000000000000000000000b2");

    public static void main(String[] args) {
        BlockClock clock = null;
        try {
            LedgerConfig config = new LedgerConfigRegistry(Paths.get("deployments"), System.getenv())
                    .resolve(Principal.of(DEFAULT_OWNER));
            Principal owner = config.owner();
            clock = config.rpcUrl()
                    .<BlockClock>map(Web3jBlockClock::new)
                    .orElseGet(() -> new ManualBlockClock(1));
            System.out.println("Network: " + config.network() + " | registry owner: " + owner);

            ProvenanceLedger ledger = new ProvenanceLedger(owner, clock);
            ProvenanceRecord result = runScenario(ledger, clock, owner, BUYER);

            System.out.printf("Asset %d owner=%s score=%d transfers=%d%n",
                    result.assetId(), result.currentOwner(), result.authenticityScore(), result.transferCount());
            for (HistoryEntry entry : ledger.getHistory(result.assetId())) {
                System.out.printf("  #%d %s -> %s price=%d hash=%s (block %d)%n",
                        entry.transferIndex(), entry.fromOwner(), entry.toOwner(),
                        entry.price(), entry.verificationHash(), entry.timestamp());
            }
            System.out.printf("Totals: %d models, %d assets%n", ledger.totalModels(), ledger.totalAssets());

            ProvenanceReportWriter writer = new ProvenanceReportWriter(Paths.get("outbox"));
            Path output = writer.write(ProvenanceReport.of(ledger, result.assetId()));
            System.out.printf("Provenance report exported to: %s%n", output.toAbsolutePath());
        } catch (Exception e) {
            LedgerLogger.error("app", e.getMessage(), e);
            System.exit(1);
        } finally {
            closeClock(clock);
            LedgerLogger.close();
        }
    }

    static void closeClock(BlockClock clock) {
        if (clock instanceof Closeable closeable) {
            try {
                closeable.close();
            } catch (IOException e) {
                LedgerLogger.error("app", "Failed to close block clock: " + e.getMessage(), e);
            }
        }
    }

    /**
     * Register model M1 (confidence 80), register asset 1 at score 75 as
     * {@code creator}, then transfer it to {@code buyer} for 1000.
     */
    static ProvenanceRecord runScenario(ProvenanceLedger ledger, BlockClock clock, Principal creator, Principal buyer) {
        ledger.registerModel(ledger.owner(), "M1", "attribution-engine", "1.0.0", 80);
        advance(clock);
        ledger.registerAsset(creator, 1L, "M1", 75);
        advance(clock);
        String hash = VerificationHashes.keccakHex("asset-1:" + creator.address() + ":" + buyer.address());
        ledger.transferAsset(creator, 1L, buyer, 1000L, hash);
        return ledger.getProvenance(1L)
                .orElseThrow(() -> new IllegalStateException("asset 1 missing after transfer"));
    }

    private static void advance(BlockClock clock) {
        if (clock instanceof ManualBlockClock manual) {
            manual.advance();
        }
    }
}
