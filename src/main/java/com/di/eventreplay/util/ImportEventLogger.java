package com.di.eventreplay.util;

import com.di.eventreplay.exception.ImportErrorKind;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.time.format.DateTimeFormatter;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.UUID;

/**
 * Structured import events, one JSON object per log line:
 * {@code [IMPORT] EVENT: {"eventType":"PHASE_PROGRESS", ...}}.
 *
 * <p>Event types: {@code IMPORT_STARTED}, {@code PHASE_STARTED}, {@code PHASE_PROGRESS},
 * {@code PHASE_COMPLETED}, {@code PHASE_FAILED}, {@code IMPORT_COMPLETED}.
 */
@Slf4j
@Component
public class ImportEventLogger {

    private static final DateTimeFormatter ISO_FORMATTER = DateTimeFormatter.ISO_INSTANT;

    private final String       applicationId;
    private final ObjectMapper objectMapper = new ObjectMapper();

    public ImportEventLogger(@Value("${spring.application.name:event-replay}") String applicationName) {
        this.applicationId = applicationName + "-" + UUID.randomUUID().toString().substring(0, 8);
    }

    public void importStarted(String source, long tsvLineCount, boolean scanned, boolean generated) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("source", source);
        ctx.put("tsvLineCount", tsvLineCount);
        ctx.put("scanned", scanned);
        ctx.put("preorgGenerated", generated);
        logEvent("IMPORT_STARTED", ctx);
    }

    public void phaseStarted(String phase, List<String> tables) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("phase", phase);
        ctx.put("tables", tables);
        logEvent("PHASE_STARTED", ctx);
    }

    public void phaseProgress(String phase, int percent, long readLineCount, long total,
                              long elapsedMs, long records) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("phase", phase);
        ctx.put("percent", percent);
        ctx.put("readLineCount", readLineCount);
        ctx.put("total", total);
        ctx.put("elapsedMs", elapsedMs);
        ctx.put("rowsPerSec", elapsedMs > 0 ? records * 1000 / elapsedMs : records);
        logEvent("PHASE_PROGRESS", ctx);
    }

    public void phaseCompleted(String phase, long records, long elapsedMs) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("phase", phase);
        ctx.put("records", records);
        ctx.put("elapsedMs", elapsedMs);
        logEvent("PHASE_COMPLETED", ctx);
    }

    public void phaseFailed(String phase, Throwable error) {
        ImportErrorKind kind = ImportErrorKind.categorize(error);
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("phase", phase);
        ctx.put("errorKind", kind.name());
        ctx.put("errorType", error.getClass().getSimpleName());
        ctx.put("errorMessage", error.getMessage());
        logEvent("PHASE_FAILED", ctx);
    }

    public void importCompleted(long elapsedMs, Map<String, Long> recordsByPhase) {
        Map<String, Object> ctx = new LinkedHashMap<>();
        ctx.put("elapsedMs", elapsedMs);
        ctx.put("recordsByPhase", recordsByPhase);
        logEvent("IMPORT_COMPLETED", ctx);
    }

    void logEvent(String eventType, Map<String, Object> context) {
        Map<String, Object> event = new LinkedHashMap<>();
        event.put("eventType", eventType);
        event.put("timestamp", ISO_FORMATTER.format(Instant.now()));
        event.put("applicationId", applicationId);
        event.put("context", context);
        log.info("[IMPORT] EVENT: {}", format(event));
    }

    String format(Map<String, Object> event) {
        try {
            return objectMapper.writeValueAsString(event);
        } catch (JsonProcessingException e) {
            log.debug("[IMPORT] Falling back to toString for event {}: {}", event.get("eventType"), e.getMessage());
            return event.toString();
        }
    }
}
