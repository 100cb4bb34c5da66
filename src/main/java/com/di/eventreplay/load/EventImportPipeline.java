package com.di.eventreplay.load;

import com.di.eventreplay.config.ImportRunConfig;
import com.di.eventreplay.load.phase.AttachmentImportPhase;
import com.di.eventreplay.load.phase.BurnBlockImportPhase;
import com.di.eventreplay.load.phase.ImportPhase;
import com.di.eventreplay.load.phase.NewBlockImportPhase;
import com.di.eventreplay.load.phase.PhaseResult;
import com.di.eventreplay.load.phase.RawEventImportPhase;
import com.di.eventreplay.message.CoreNodeMessageParser;
import com.di.eventreplay.store.EventImportStore;
import com.di.eventreplay.tsv.PreorgArtifacts;
import com.di.eventreplay.tsv.PreparedImport;
import com.di.eventreplay.util.ImportEventLogger;
import com.di.eventreplay.util.ImportMetrics;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Top-level import of one event log.
 *
 * <pre>
 * ┌──────────────────────────────────────────────────────────────┐
 * │  PREPARE    <log>.entitydata  (canonical block hashes)       │
 * │             <log>-preorg      (canonical events only)        │
 * │             both reused when present                         │
 * ├──────────────────────────────────────────────────────────────┤
 * │  PHASE 1    /new_burn_block   → burnchain_rewards, slots     │
 * │  PHASE 2    /attachments/new  → zonefiles, subdomains        │
 * │  PHASE 3    every event       → event_observer_requests      │
 * │  PHASE 4    /new_block        → blocks, txs, events, ...     │
 * └──────────────────────────────────────────────────────────────┘
 * </pre>
 *
 * Phases run in this order, each in its own transaction. A failed phase stops
 * the run; phases committed before it stay committed.
 */
@Service
@Slf4j
public class EventImportPipeline {

    static final List<String> DIAGNOSTIC_SETTINGS = List.of("max_parallel_maintenance_workers", "maintenance_work_mem");

    private final EventImportStore  store;
    private final ImportRunConfig   config;
    private final ImportMetrics     metrics;
    private final ImportEventLogger events;
    private final PreorgArtifacts   artifacts;
    private final List<ImportPhase> phases;

    public EventImportPipeline(EventImportStore      store,
                               CoreNodeMessageParser parser,
                               ImportRunConfig       config,
                               ImportMetrics         metrics,
                               ImportEventLogger     events) {
        this.store     = store;
        this.config    = config;
        this.metrics   = metrics;
        this.events    = events;
        this.artifacts = new PreorgArtifacts(new ObjectMapper(), config);
        this.phases    = List.of(
                new BurnBlockImportPhase(store, parser, metrics, events),
                new AttachmentImportPhase(store, parser, metrics, events),
                new RawEventImportPhase(store, parser, metrics, events),
                new NewBlockImportPhase(store, parser, metrics, events));
    }

    public List<ImportPhase> phases() {
        return phases;
    }

    public ImportSummary importEvents(Path source) {
        long start = System.currentTimeMillis();
        log.info("[IMPORT] Importing {} (readChunkSize={}, txBatchSize={}, principalBatchSize={}, excludedPaths={})",
                source, config.readChunkSize(), config.txBatchSize(), config.principalBatchSize(), config.excludedPaths());

        PreparedImport prepared = metrics.measure("prepareArtifacts", () -> artifacts.prepare(source));
        events.importStarted(source.toString(), prepared.entityData().tsvLineCount(),
                prepared.scanned(), prepared.generated());
        logDiagnostics();

        ImportContext ctx = new ImportContext(prepared.preorgPath(), prepared.entityData().tsvLineCount(), config);
        ImportSummary.ImportSummaryBuilder summary = ImportSummary.builder().prepared(prepared);
        Map<String, Long> recordsByPhase = new LinkedHashMap<>();
        for (ImportPhase phase : phases) {
            PhaseResult result = phase.run(ctx);
            summary.phase(result);
            recordsByPhase.put(result.phase(), result.records());
        }

        long elapsed = System.currentTimeMillis() - start;
        metrics.logDurations();
        log.info("[IMPORT] Event import finished in {} ms, records per phase {}", elapsed, recordsByPhase);
        events.importCompleted(elapsed, recordsByPhase);
        return summary
                .rowsByTable(metrics.rowsByTable())
                .durationsMs(metrics.durationsMs())
                .elapsedMs(elapsed)
                .build();
    }

    private void logDiagnostics() {
        for (String setting : DIAGNOSTIC_SETTINGS) {
            try {
                store.showSetting(setting).ifPresent(v -> log.info("[DIAG] {} = {}", setting, v));
            } catch (RuntimeException e) {
                log.warn("[DIAG] Could not read {}: {}", setting, e.getMessage());
            }
        }
    }
}
