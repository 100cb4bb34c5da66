package com.di.eventreplay.load.phase;

import com.di.eventreplay.exception.EventImportException;
import com.di.eventreplay.exception.ImportErrorKind;
import com.di.eventreplay.load.ImportContext;
import com.di.eventreplay.load.ProgressTracker;
import com.di.eventreplay.message.CoreNodeMessageParser;
import com.di.eventreplay.store.EventImportStore;
import com.di.eventreplay.tsv.PreorgRecord;
import com.di.eventreplay.tsv.PreorgTsvReader;
import com.di.eventreplay.util.ImportEventLogger;
import com.di.eventreplay.util.ImportMetrics;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;

/**
 * One bulk-load pass over the preorg file.
 *
 * <pre>
 * ┌ transaction ───────────────────────────────────────────┐
 * │  beginBulkPhase(tables)                                 │
 * │  for each preorg record matching pathFilter():          │
 * │      writer.write(record)   progress every N percent    │
 * │  writer.flush()                                         │
 * │  endBulkPhase(tables)                                   │
 * └─────────────────────────────────────────────────────────┘
 *   reindexTable(t) for each table
 * </pre>
 *
 * Any exception inside the box rolls back the whole phase, index toggling included.
 */
@Slf4j
public abstract class ImportPhase {

    protected final EventImportStore      store;
    protected final CoreNodeMessageParser parser;
    protected final ImportMetrics         metrics;
    private   final ImportEventLogger     events;

    protected ImportPhase(EventImportStore store, CoreNodeMessageParser parser,
                          ImportMetrics metrics, ImportEventLogger events) {
        this.store   = store;
        this.parser  = parser;
        this.metrics = metrics;
        this.events  = events;
    }

    public abstract String name();

    /** Tables written by this phase, in bulk-load mode while it runs. */
    public abstract List<String> tables();

    /** Event path this phase reads, or {@code null} for every record. */
    protected abstract String pathFilter();

    /** Per-run state of the phase. */
    protected abstract PhaseWriter newWriter(ImportContext ctx);

    protected interface PhaseWriter {
        void write(PreorgRecord record);

        /** Sends whatever is still buffered. */
        default void flush() {
        }
    }

    public PhaseResult run(ImportContext ctx) {
        List<String> tables = tables();
        long start = System.currentTimeMillis();
        long[] records = {0};
        ProgressTracker progress = new ProgressTracker(ctx.tsvLineCount(), ctx.config().progressStepPercent());

        log.info("[PHASE] {} started, tables={}", name(), tables);
        events.phaseStarted(name(), tables);
        try {
            store.inTransaction(() -> {
                metrics.track("beginBulkPhase", () -> store.beginBulkPhase(tables));
                PhaseWriter writer = newWriter(ctx);
                try (PreorgTsvReader reader = PreorgTsvReader.open(ctx.preorgPath(), pathFilter(), ctx.config().readChunkSize())) {
                    while (reader.hasNext()) {
                        PreorgRecord record = reader.next();
                        write(writer, record);
                        records[0]++;
                        for (int percent : progress.update(record.readLineCount())) {
                            report(percent, record.readLineCount(), ctx.tsvLineCount(), start, records[0]);
                        }
                    }
                } catch (IOException e) {
                    throw EventImportException.io("Failed to close " + ctx.preorgPath(), e);
                } catch (UncheckedIOException e) {
                    throw EventImportException.io("Failed to read " + ctx.preorgPath(), e.getCause());
                }
                writer.flush();
                metrics.track("endBulkPhase", () -> store.endBulkPhase(tables));
            });
        } catch (RuntimeException e) {
            log.error("[PHASE] {} FAILED after {} records ({}), transaction rolled back: {}",
                    name(), records[0], ImportErrorKind.categorize(e), e.getMessage());
            events.phaseFailed(name(), e);
            throw e;
        }

        for (String table : tables) {
            log.info("[PHASE] {} reindexing {}", name(), table);
            metrics.track("reindex." + table, () -> store.reindexTable(table));
        }
        for (int percent : progress.finish()) {
            report(percent, ctx.tsvLineCount(), ctx.tsvLineCount(), start, records[0]);
        }

        long elapsed = System.currentTimeMillis() - start;
        log.info("[PHASE] {} completed: {} records in {} ms", name(), records[0], elapsed);
        events.phaseCompleted(name(), records[0], elapsed);
        return new PhaseResult(name(), records[0], elapsed);
    }

    private void write(PhaseWriter writer, PreorgRecord record) {
        try {
            writer.write(record);
        } catch (EventImportException e) {
            if (e.getKind() != ImportErrorKind.PARSE_ERROR) {
                throw e;
            }
            throw EventImportException.parse("Phase " + name() + ", " + record.path()
                    + " at readLineCount " + record.readLineCount() + ": " + e.getMessage(), e);
        }
    }

    private void report(int percent, long readLineCount, long total, long start, long records) {
        long elapsed = System.currentTimeMillis() - start;
        log.info("[PHASE] {} {}% ({} / {} lines, {} records, {} ms)",
                name(), percent, readLineCount, total, records, elapsed);
        events.phaseProgress(name(), percent, readLineCount, total, elapsed, records);
    }

    /** Times {@code work} as {@code operation} and counts {@code rows} against {@code table}. */
    protected void insert(String table, String operation, int rows, Runnable work) {
        if (rows == 0) {
            return;
        }
        metrics.track(operation, work);
        metrics.recordRows(table, rows);
    }
}
