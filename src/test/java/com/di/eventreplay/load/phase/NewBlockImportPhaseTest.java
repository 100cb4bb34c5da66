package com.di.eventreplay.load.phase;

import com.di.eventreplay.config.ImportRunConfig;
import com.di.eventreplay.load.ImportContext;
import com.di.eventreplay.message.EventPath;
import com.di.eventreplay.message.JacksonCoreNodeMessageParser;
import com.di.eventreplay.store.InMemoryEventImportStore;
import com.di.eventreplay.tsv.TsvLines;
import com.di.eventreplay.util.ImportEventLogger;
import com.di.eventreplay.util.ImportMetrics;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

import static com.di.eventreplay.TestEvents.GENESIS;
import static com.di.eventreplay.TestEvents.burnBlock;
import static com.di.eventreplay.TestEvents.hash;
import static com.di.eventreplay.TestEvents.mempoolTx;
import static com.di.eventreplay.TestEvents.newBlock;
import static com.di.eventreplay.TestEvents.newBlockWithTransfer;
import static com.di.eventreplay.TestEvents.NEW_MEMPOOL_TX;
import static org.junit.jupiter.api.Assertions.*;

@DisplayName("NewBlockImportPhase Tests")
class NewBlockImportPhaseTest {

    @TempDir
    Path dir;

    private final InMemoryEventImportStore store = new InMemoryEventImportStore();
    private final NewBlockImportPhase phase = new NewBlockImportPhase(store, new JacksonCoreNodeMessageParser(),
            new ImportMetrics(new SimpleMeterRegistry()), new ImportEventLogger("test"));

    @Test
    @DisplayName("Should read only /new_block records and write blocks with their transactions")
    void testRun() throws Exception {
        Path preorg = dir.resolve("events.tsv-preorg");
        Files.write(preorg, List.of(
                TsvLines.formatPreorg(1, EventPath.NEW_BURN_BLOCK, burnBlock(hash("f1"), null, 100)),
                TsvLines.formatPreorg(2, EventPath.NEW_BLOCK, newBlock(hash("a1"), GENESIS, 1)),
                TsvLines.formatPreorg(3, NEW_MEMPOOL_TX, mempoolTx()),
                TsvLines.formatPreorg(5, EventPath.NEW_BLOCK,
                        newBlockWithTransfer(hash("a2"), hash("a1"), 2, "0xt1", "SPA", "SPB", 10))));

        PhaseResult result = phase.run(new ImportContext(preorg, 5, ImportRunConfig.defaults()));

        assertEquals(2, result.records());
        assertEquals(2, store.count("blocks"));
        assertEquals(1, store.count("txs"));
        assertEquals(1, store.count("stx_events"));
        assertEquals(2, store.count("principal_stx_txs"));
        assertEquals(0, store.count("burnchain_rewards"));
        assertEquals(List.of("insertTxs:1", "insertPrincipalStxTxs:2"),
                store.calls().stream().filter(c -> c.startsWith("insert")).toList());
    }

    @Test
    @DisplayName("Should list every table the phase writes")
    void testTables() {
        assertEquals(12, phase.tables().size());
        assertEquals("new-blocks", phase.name());
        assertTrue(phase.tables().containsAll(List.of("blocks", "txs", "principal_stx_txs", "namespaces")));
    }
}
