package com.di.eventreplay.tsv;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Reads the preorg file back as {@link PreorgRecord}s, optionally restricted to a
 * single event path. Single pass; reopen to read again.
 */
public final class PreorgTsvReader implements Iterator<PreorgRecord>, Closeable {

    private final TsvLineReader lines;
    private final String pathFilter;
    private PreorgRecord next;

    private PreorgTsvReader(TsvLineReader lines, String pathFilter) {
        this.lines = lines;
        this.pathFilter = pathFilter;
    }

    /**
     * @param pathFilter event path to keep, or {@code null} for every record
     */
    public static PreorgTsvReader open(Path preorgFile, String pathFilter, int chunkSize) {
        return new PreorgTsvReader(TsvLineReader.open(preorgFile, chunkSize), pathFilter);
    }

    @Override
    public boolean hasNext() {
        while (next == null && lines.hasNext()) {
            String line = lines.next();
            if (line.isEmpty()) {
                continue;
            }
            PreorgRecord record = TsvLines.parsePreorg(line, lines.lineNumber());
            if (pathFilter == null || pathFilter.equals(record.path())) {
                next = record;
            }
        }
        return next != null;
    }

    @Override
    public PreorgRecord next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        PreorgRecord result = next;
        next = null;
        return result;
    }

    @Override
    public void close() throws IOException {
        lines.close();
    }
}
