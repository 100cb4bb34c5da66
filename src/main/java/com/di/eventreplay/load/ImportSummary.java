package com.di.eventreplay.load;

import com.di.eventreplay.load.phase.PhaseResult;
import com.di.eventreplay.tsv.PreparedImport;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;
import java.util.Map;

/** Result of a completed import run. */
@Value
@Builder
public class ImportSummary {
    PreparedImport prepared;
    @Singular("phase")
    List<PhaseResult> phases;
    /** Rows written per table. */
    Map<String, Long> rowsByTable;
    /** Total milliseconds per store operation. */
    Map<String, Long> durationsMs;
    long elapsedMs;
}
