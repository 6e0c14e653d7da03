package io.rebasing.core.storage;

import com.fasterxml.jackson.databind.node.ObjectNode;
import io.rebasing.core.config.LedgerConfig;
import io.rebasing.core.ledger.Ledger;
import io.rebasing.core.state.LedgerState;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.math.BigInteger;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class LedgerSnapshotJsonTest {

    @TempDir
    Path tempDir;

    @Test
    void exportedSnapshotReadsBack() {
        Ledger ledger = Ledger.inMemory(LedgerConfig.defaultLocal());
        ledger.mint("alice", BigInteger.valueOf(100));
        ledger.mint("bob", BigInteger.valueOf(100));
        ledger.optOut("alice");
        ledger.changeSupply(BigInteger.valueOf(301));
        LedgerState snapshot = ledger.snapshot();

        Path file = tempDir.resolve("out/snapshot.json");
        LedgerSnapshotJson.export(snapshot, file);
        assertTrue(Files.exists(file));

        LedgerState restored = LedgerSnapshotJson.read(file);
        assertEquals(snapshot.global(), restored.global());
        assertEquals(snapshot.accounts(), restored.accounts());
    }

    @Test
    void quantitiesAreWrittenAsDecimalStrings() {
        Ledger ledger = Ledger.inMemory(LedgerConfig.defaultLocal());
        ledger.mint("alice", BigInteger.TEN);

        ObjectNode json = LedgerSnapshotJson.toJson(ledger.snapshot());

        assertEquals("10", json.path("global").path("totalSupply").textValue());
        assertEquals("1000000000000000000", json.path("global").path("rebasingCreditsPerToken").textValue());
        assertFalse(json.path("accounts").path("alice").has("lockedCreditsPerToken"));
    }

    @Test
    void missingGlobalIsRejected() throws Exception {
        Path file = tempDir.resolve("broken.json");
        Files.writeString(file, "{\"accounts\":{}}");
        assertThrows(IllegalArgumentException.class, () -> LedgerSnapshotJson.read(file));
    }
}
