package com.di.eventreplay.config;

import java.util.Set;

/**
 * Immutable settings for one import run.
 *
 * @param readChunkSize       bytes per read from the event log / preorg file
 * @param txBatchSize         rows per {@code txs} batch
 * @param principalBatchSize  rows per {@code principal_stx_txs} batch
 * @param progressStepPercent progress log granularity in percentage points
 * @param excludedPaths       event paths dropped from the preorg file
 */
public record ImportRunConfig(int readChunkSize,
                              int txBatchSize,
                              int principalBatchSize,
                              int progressStepPercent,
                              Set<String> excludedPaths) {

    public static final int DEFAULT_READ_CHUNK_SIZE = 64 * 1024;

    public ImportRunConfig {
        if (readChunkSize <= 0 || txBatchSize <= 0 || principalBatchSize <= 0) {
            throw new IllegalArgumentException("chunk and batch sizes must be positive");
        }
        if (progressStepPercent <= 0 || progressStepPercent > 100) {
            throw new IllegalArgumentException("progressStepPercent must be in 1..100, got " + progressStepPercent);
        }
        excludedPaths = excludedPaths == null ? Set.of() : Set.copyOf(excludedPaths);
    }

    public static ImportRunConfig defaults() {
        return new ImportRunConfig(DEFAULT_READ_CHUNK_SIZE, 1000, 1000, 20, Set.of());
    }
}
