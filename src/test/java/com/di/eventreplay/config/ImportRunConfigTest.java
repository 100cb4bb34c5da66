package com.di.eventreplay.config;

import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.util.HashSet;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

@DisplayName("ImportRunConfig Tests")
class ImportRunConfigTest {

    @Test
    @DisplayName("Should provide defaults matching the property defaults")
    void testDefaults() {
        ImportRunConfig defaults = ImportRunConfig.defaults();

        assertEquals(ImportRunConfig.DEFAULT_READ_CHUNK_SIZE, defaults.readChunkSize());
        assertEquals(1000, defaults.txBatchSize());
        assertEquals(1000, defaults.principalBatchSize());
        assertEquals(20, defaults.progressStepPercent());
        assertTrue(defaults.excludedPaths().isEmpty());
        assertEquals(defaults, new ImportProperties().toRunConfig());
    }

    @Test
    @DisplayName("Should reject non-positive sizes and out-of-range steps")
    void testValidation() {
        assertThrows(IllegalArgumentException.class, () -> new ImportRunConfig(0, 1, 1, 20, Set.of()));
        assertThrows(IllegalArgumentException.class, () -> new ImportRunConfig(1, 0, 1, 20, Set.of()));
        assertThrows(IllegalArgumentException.class, () -> new ImportRunConfig(1, 1, -1, 20, Set.of()));
        assertThrows(IllegalArgumentException.class, () -> new ImportRunConfig(1, 1, 1, 0, Set.of()));
        assertThrows(IllegalArgumentException.class, () -> new ImportRunConfig(1, 1, 1, 101, Set.of()));
    }

    @Test
    @DisplayName("Should copy excluded paths and treat null as empty")
    void testExcludedPaths() {
        Set<String> paths = new HashSet<>(Set.of("/new_mempool_tx"));
        ImportRunConfig config = new ImportRunConfig(1, 1, 1, 10, paths);
        paths.add("/drop_mempool_tx");

        assertEquals(Set.of("/new_mempool_tx"), config.excludedPaths());
        assertTrue(new ImportRunConfig(1, 1, 1, 10, null).excludedPaths().isEmpty());
    }

    @Test
    @DisplayName("Should carry bound properties into the run config")
    void testToRunConfig() {
        ImportProperties props = new ImportProperties();
        props.setReadChunkSize(4096);
        props.setTxBatchSize(50);
        props.setPrincipalBatchSize(70);
        props.setProgressStepPercent(10);
        props.getExcludedPaths().add("/new_mempool_tx");

        ImportRunConfig config = props.toRunConfig();

        assertEquals(new ImportRunConfig(4096, 50, 70, 10, Set.of("/new_mempool_tx")), config);
    }
}
