package com.di.eventreplay.load;

import com.di.eventreplay.config.ImportRunConfig;

import java.nio.file.Path;

/**
 * What a phase needs to know about the current run.
 *
 * @param preorgPath   canonical event file to load from
 * @param tsvLineCount line count of the original log, the 100% mark of progress
 * @param config       run settings
 */
public record ImportContext(Path preorgPath, long tsvLineCount, ImportRunConfig config) {
}
