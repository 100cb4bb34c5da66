package com.di.eventreplay.load.phase;

import com.di.eventreplay.load.ImportContext;
import com.di.eventreplay.message.CoreNodeMessageParser;
import com.di.eventreplay.store.EventImportStore;
import com.di.eventreplay.util.ImportEventLogger;
import com.di.eventreplay.util.ImportMetrics;

import java.util.List;

/** Every canonical event, whatever its path, as a raw observer request. */
public class RawEventImportPhase extends ImportPhase {

    public RawEventImportPhase(EventImportStore store, CoreNodeMessageParser parser,
                               ImportMetrics metrics, ImportEventLogger events) {
        super(store, parser, metrics, events);
    }

    @Override
    public String name() {
        return "raw-events";
    }

    @Override
    public List<String> tables() {
        return List.of("event_observer_requests");
    }

    @Override
    protected String pathFilter() {
        return null;
    }

    @Override
    protected PhaseWriter newWriter(ImportContext ctx) {
        return record -> insert("event_observer_requests", "insertRawEventRequest", 1,
                () -> store.insertRawEventRequest(record.path(), record.payload()));
    }
}
