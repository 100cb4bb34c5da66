package com.di.eventreplay.runner;

import com.di.eventreplay.config.ImportProperties;
import com.di.eventreplay.exception.ImportErrorKind;
import com.di.eventreplay.load.EventImportPipeline;
import com.di.eventreplay.load.ImportSummary;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.core.annotation.Order;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;
import org.springframework.stereotype.Component;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.List;

/**
 * Runs the import at startup when an events file is given, either as
 * {@code --events-file=<path>} or as {@code stacks.import.events-file}.
 * A failure is logged with its {@link ImportErrorKind} and rethrown so the
 * process exits non-zero.
 */
@Component
@Order(1)
@RequiredArgsConstructor
@Slf4j
public class EventImportRunner implements ApplicationRunner {

    static final String EVENTS_FILE_OPTION = "events-file";
    static final String SCHEMA_RESOURCE    = "db/event-replay-schema.sql";

    private final ImportProperties    properties;
    private final EventImportPipeline pipeline;
    private final DataSource          dataSource;

    @Override
    public void run(ApplicationArguments args) {
        String eventsFile = resolveEventsFile(args);
        if (eventsFile == null || eventsFile.isBlank()) {
            log.info("[RUNNER] No events file configured (--{} or stacks.import.events-file); nothing to import",
                    EVENTS_FILE_OPTION);
            return;
        }

        try {
            if (properties.isInitSchema()) {
                initSchema();
            }
            ImportSummary summary = pipeline.importEvents(Path.of(eventsFile));
            log.info("[RUNNER] Import of {} done in {} ms; rows per table {}",
                    eventsFile, summary.getElapsedMs(), summary.getRowsByTable());
        } catch (RuntimeException e) {
            ImportErrorKind kind = ImportErrorKind.categorize(e);
            log.error("[RUNNER] Import of {} FAILED [{}: {}]: {}",
                    eventsFile, kind, kind.getDescription(), e.getMessage(), e);
            throw e;
        }
    }

    String resolveEventsFile(ApplicationArguments args) {
        List<String> values = args.getOptionValues(EVENTS_FILE_OPTION);
        if (values != null && !values.isEmpty()) {
            return values.get(values.size() - 1);
        }
        return properties.getEventsFile();
    }

    private void initSchema() {
        log.info("[RUNNER] Applying {}", SCHEMA_RESOURCE);
        ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_RESOURCE));
        populator.execute(dataSource);
    }
}
