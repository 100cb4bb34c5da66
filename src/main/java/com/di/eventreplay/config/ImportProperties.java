package com.di.eventreplay.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Event import settings bound from {@code application.yml} ({@code stacks.import.*}).
 * <p>
 * Only read once at startup: {@link #toRunConfig()} produces the immutable
 * {@link ImportRunConfig} that is handed to the pipeline.
 */
@Data
@Validated
@ConfigurationProperties(prefix = "stacks.import")
public class ImportProperties {

    /** TSV event log to import. Blank = nothing to do at startup. */
    private String eventsFile = "";

    /** Bytes read per chunk from the event log and the preorg file. */
    @Min(1024)
    private int readChunkSize = 64 * 1024;

    /** Rows per {@code txs} batch insert. */
    @Min(1)
    private int txBatchSize = 1000;

    /** Rows per {@code principal_stx_txs} batch insert. */
    @Min(1)
    private int principalBatchSize = 1000;

    /** Progress is logged each time this many percentage points are crossed. */
    @Min(1)
    @Max(100)
    private int progressStepPercent = 20;

    /** Event paths dropped while writing the preorg file (e.g. /new_mempool_tx). */
    private Set<String> excludedPaths = new LinkedHashSet<>();

    /** Applies classpath:db/event-replay-schema.sql before importing. */
    private boolean initSchema = false;

    @Valid
    private Datasource datasource = new Datasource();

    @Data
    public static class Datasource {
        @NotBlank
        private String jdbcUrl = "jdbc:postgresql://localhost:5432/stacks_blockchain_api";
        private String username = "postgres";
        private String password = "";
        private String driverClassName = "org.postgresql.Driver";
        @Min(1)
        private int maximumPoolSize = 4;
        @Min(0)
        private int minimumIdle = 1;
        private long idleTimeoutMs = 600_000L;
        private long connectionTimeoutMs = 30_000L;
        private long maxLifetimeMs = 1_800_000L;
    }

    public ImportRunConfig toRunConfig() {
        return new ImportRunConfig(readChunkSize, txBatchSize, principalBatchSize,
                progressStepPercent, Set.copyOf(excludedPaths));
    }
}
