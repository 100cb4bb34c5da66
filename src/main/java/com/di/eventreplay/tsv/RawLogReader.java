package com.di.eventreplay.tsv;

import java.io.Closeable;
import java.io.IOException;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Streams {@link RawLogLine}s from the raw event log. Blank lines are counted
 * (they keep ordinals aligned with the file) but not returned.
 */
public final class RawLogReader implements Iterator<RawLogLine>, Closeable {

    private final TsvLineReader lines;
    private RawLogLine next;

    private RawLogReader(TsvLineReader lines) {
        this.lines = lines;
    }

    public static RawLogReader open(Path path, int chunkSize) {
        return new RawLogReader(TsvLineReader.open(path, chunkSize));
    }

    @Override
    public boolean hasNext() {
        while (next == null && lines.hasNext()) {
            String line = lines.next();
            if (!line.isBlank()) {
                next = TsvLines.parseRaw(line, lines.lineNumber());
            }
        }
        return next != null;
    }

    @Override
    public RawLogLine next() {
        if (!hasNext()) {
            throw new NoSuchElementException();
        }
        RawLogLine result = next;
        next = null;
        return result;
    }

    /** Physical lines consumed so far, blank ones included. */
    public long linesRead() {
        return lines.lineNumber();
    }

    @Override
    public void close() throws IOException {
        lines.close();
    }
}
