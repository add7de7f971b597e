package com.project.provenance.io;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.project.provenance.core.ProvenanceError;
import com.project.provenance.core.ProvenanceException;
import com.project.provenance.core.ProvenanceLedger;
import com.project.provenance.eth.ManualBlockClock;
import com.project.provenance.eth.Principal;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class ProvenanceReportWriterTest {

    static final Principal OWNER = Principal.of("0x00000000000000000000000000000000000000a1");
    static final Principal ALICE = Principal.of("0x5aaeb6053f3e94c9b9a09f33669435e7ef1beaed");
    static final Principal BOB = Principal.of("0x2222222222222222222222222222222222222222");

    @TempDir
    Path outbox;

    private ProvenanceLedger ledger;

    @BeforeEach
    void setUp() {
        ManualBlockClock clock = new ManualBlockClock(7);
        ledger = new ProvenanceLedger(OWNER, clock);
        ledger.registerModel(OWNER, "M1", "engine", "2.1", 80);
        ledger.registerAsset(ALICE, 42L, "M1", 75);
        clock.advance();
        ledger.transferAsset(ALICE, 42L, BOB, 1000L, "H1");
    }

    @Test
    @DisplayName("Report carries record, model and history as JSON")
    void writesReport() throws Exception {
        Path file = new ProvenanceReportWriter(outbox).write(ProvenanceReport.of(ledger, 42L));

        assertEquals("asset-42.json", file.getFileName().toString());
        assertTrue(Files.exists(file));

        JsonNode root = new ObjectMapper().readTree(file.toFile());
        JsonNode record = root.get("record");
        assertEquals(42, record.get("assetId").asLong());
        assertEquals(BOB.checksumAddress(), record.get("currentOwner").asText());
        assertEquals("0x5aAeb6053F3E94C9b9A09f33669435E7Ef1BeAed", record.get("creator").asText());
        assertEquals(78, record.get("authenticityScore").asInt());
        assertEquals(1, record.get("transferCount").asLong());
        assertFalse(record.get("flagged").asBoolean());

        assertEquals(80, root.get("model").get("confidenceLevel").asInt());

        JsonNode history = root.get("history");
        assertEquals(1, history.size());
        assertEquals(0, history.get(0).get("transferIndex").asLong());
        assertEquals(1000, history.get(0).get("price").asLong());
        assertEquals("H1", history.get(0).get("verificationHash").asText());
        assertEquals(8, history.get(0).get("timestamp").asLong());
        assertTrue(root.get("exportedAt").isTextual());
    }

    @Test
    @DisplayName("Unknown asset cannot be reported")
    void unknownAsset() {
        ProvenanceException e = assertThrows(ProvenanceException.class, () -> ProvenanceReport.of(ledger, 1L));
        assertEquals(ProvenanceError.NFT_NOT_FOUND, e.error());
    }
}
