package com.di.eventreplay.runner;

import com.di.eventreplay.config.ImportProperties;
import com.di.eventreplay.exception.EventImportException;
import com.di.eventreplay.load.EventImportPipeline;
import com.di.eventreplay.load.ImportSummary;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.boot.DefaultApplicationArguments;

import javax.sql.DataSource;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@DisplayName("EventImportRunner Tests")
class EventImportRunnerTest {

    private ImportProperties properties;
    private EventImportPipeline pipeline;
    private DataSource dataSource;
    private EventImportRunner runner;

    @BeforeEach
    void setUp() {
        properties = new ImportProperties();
        pipeline = mock(EventImportPipeline.class);
        dataSource = mock(DataSource.class);
        runner = new EventImportRunner(properties, pipeline, dataSource);
    }

    private static ImportSummary summary() {
        return ImportSummary.builder().elapsedMs(12).rowsByTable(Map.of("blocks", 3L)).durationsMs(Map.of()).build();
    }

    @Test
    @DisplayName("Should do nothing without an events file")
    void testRun_NoFile() {
        runner.run(new DefaultApplicationArguments());

        verifyNoInteractions(pipeline, dataSource);
    }

    @Test
    @DisplayName("Should import the file given on the command line over the property")
    void testRun_CommandLineWins() {
        properties.setEventsFile("/data/from-config.tsv");
        when(pipeline.importEvents(any())).thenReturn(summary());

        runner.run(new DefaultApplicationArguments("--events-file=/data/from-args.tsv"));

        verify(pipeline).importEvents(Path.of("/data/from-args.tsv"));
    }

    @Test
    @DisplayName("Should fall back to the configured events file")
    void testRun_Property() {
        properties.setEventsFile("/data/from-config.tsv");
        when(pipeline.importEvents(any())).thenReturn(summary());

        runner.run(new DefaultApplicationArguments());

        verify(pipeline).importEvents(Path.of("/data/from-config.tsv"));
        verifyNoInteractions(dataSource);
    }

    @Test
    @DisplayName("Should rethrow import failures")
    void testRun_Failure() {
        properties.setEventsFile("/data/events.tsv");
        EventImportException failure = EventImportException.parse("Line 3: bad");
        when(pipeline.importEvents(any())).thenThrow(failure);

        EventImportException ex = assertThrows(EventImportException.class,
                () -> runner.run(new DefaultApplicationArguments()));

        assertSame(failure, ex);
    }

    @Test
    @DisplayName("Should use the last --events-file option")
    void testResolveEventsFile() {
        assertEquals("/b.tsv", runner.resolveEventsFile(
                new DefaultApplicationArguments("--events-file=/a.tsv", "--events-file=/b.tsv")));
        assertEquals("", runner.resolveEventsFile(new DefaultApplicationArguments()));
    }
}
