package com.di.eventreplay.util;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ImportMetrics Tests")
class ImportMetricsTest {

    private SimpleMeterRegistry registry;
    private ImportMetrics metrics;

    @BeforeEach
    void setUp() {
        registry = new SimpleMeterRegistry();
        metrics = new ImportMetrics(registry);
    }

    @Test
    @DisplayName("Should time operations under an operation tag")
    void testTrackAndMeasure() {
        boolean[] ran = {false};

        metrics.track("insertBlock", () -> ran[0] = true);
        metrics.track("insertBlock", () -> { });
        String value = metrics.measure("prepareArtifacts", () -> "done");

        assertTrue(ran[0]);
        assertEquals("done", value);
        assertEquals(2, registry.get(ImportMetrics.OPERATION_TIMER).tag("operation", "insertBlock").timer().count());
        assertEquals(List.of("insertBlock", "prepareArtifacts"), List.copyOf(metrics.durationsMs().keySet()));
    }

    @Test
    @DisplayName("Should time and rethrow failing operations")
    void testTrack_Failure() {
        assertThrows(IllegalStateException.class, () -> metrics.track("reindex.txs", () -> {
            throw new IllegalStateException("boom");
        }));

        assertEquals(1, registry.get(ImportMetrics.OPERATION_TIMER).tag("operation", "reindex.txs").timer().count());
    }

    @Test
    @DisplayName("Should count rows per table and ignore zero")
    void testRecordRows() {
        metrics.recordRows("txs", 3);
        metrics.recordRows("txs", 2);
        metrics.recordRows("blocks", 0);

        assertEquals(5, metrics.rows("txs"));
        assertEquals(0, metrics.rows("blocks"));
        assertEquals(5.0, registry.get(ImportMetrics.ROWS_COUNTER).tag("table", "txs").counter().count());
        assertFalse(metrics.rowsByTable().containsKey("blocks"));
    }

    @Test
    @DisplayName("Should log durations without failing when empty")
    void testLogDurations() {
        assertDoesNotThrow(metrics::logDurations);
        metrics.track("insertTxs", () -> { });
        assertDoesNotThrow(metrics::logDurations);
    }
}
