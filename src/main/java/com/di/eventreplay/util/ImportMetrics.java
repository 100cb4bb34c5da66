package com.di.eventreplay.util;

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Timer;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

/**
 * Micrometer timers for store operations and row counters per table.
 * The import runs on one thread; meters are cached in insertion order so the
 * duration table lists operations in the order they first ran.
 */
@Slf4j
@Component
public class ImportMetrics {

    static final String OPERATION_TIMER = "event.import.operation.duration";
    static final String ROWS_COUNTER    = "event.import.rows";

    private final MeterRegistry        meterRegistry;
    private final Map<String, Timer>   timers   = new LinkedHashMap<>();
    private final Map<String, Counter> counters = new LinkedHashMap<>();

    public ImportMetrics(MeterRegistry meterRegistry) {
        this.meterRegistry = meterRegistry;
    }

    /** Times {@code work} under {@code operation}. Failures are timed too and rethrown. */
    public void track(String operation, Runnable work) {
        timer(operation).record(work);
    }

    public <T> T measure(String operation, Supplier<T> work) {
        return timer(operation).record(work);
    }

    public void recordRows(String table, long rows) {
        if (rows > 0) {
            counters.computeIfAbsent(table, t -> Counter.builder(ROWS_COUNTER)
                    .description("Rows written by the event import")
                    .tag("table", t)
                    .register(meterRegistry)).increment(rows);
        }
    }

    public long rows(String table) {
        Counter c = counters.get(table);
        return c == null ? 0 : (long) c.count();
    }

    public Map<String, Long> rowsByTable() {
        Map<String, Long> result = new LinkedHashMap<>();
        counters.forEach((table, c) -> result.put(table, (long) c.count()));
        return result;
    }

    /** Total milliseconds per operation. */
    public Map<String, Long> durationsMs() {
        Map<String, Long> result = new LinkedHashMap<>();
        timers.forEach((op, t) -> result.put(op, (long) t.totalTime(TimeUnit.MILLISECONDS)));
        return result;
    }

    /** Logs one line per operation, slowest first. */
    public void logDurations() {
        List<Map.Entry<String, Timer>> entries = new ArrayList<>(timers.entrySet());
        entries.sort(Comparator.comparingDouble((Map.Entry<String, Timer> e) -> e.getValue().totalTime(TimeUnit.MILLISECONDS)).reversed());
        log.info("[METRICS] {} | {} | {} | {}", pad("operation", 32), pad("calls", 10), pad("total ms", 12), "avg ms");
        for (Map.Entry<String, Timer> e : entries) {
            Timer t = e.getValue();
            log.info("[METRICS] {} | {} | {} | {}",
                    pad(e.getKey(), 32),
                    pad(String.valueOf(t.count()), 10),
                    pad(String.format("%.0f", t.totalTime(TimeUnit.MILLISECONDS)), 12),
                    String.format("%.3f", t.mean(TimeUnit.MILLISECONDS)));
        }
    }

    private Timer timer(String operation) {
        return timers.computeIfAbsent(operation, op -> Timer.builder(OPERATION_TIMER)
                .description("Time spent in one event import operation")
                .tag("operation", op)
                .register(meterRegistry));
    }

    private static String pad(String s, int width) {
        return s.length() >= width ? s : s + " ".repeat(width - s.length());
    }
}
