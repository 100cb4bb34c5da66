package com.di.eventreplay.tsv;

import com.di.eventreplay.exception.EventImportException;

import java.io.BufferedReader;
import java.io.Closeable;
import java.io.IOException;
import java.io.InputStreamReader;
import java.io.UncheckedIOException;
import java.nio.charset.CharsetDecoder;
import java.nio.charset.CodingErrorAction;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Iterator;
import java.util.NoSuchElementException;

/**
 * Forward-only line iterator over a (possibly huge) UTF-8 text file.
 *
 * <p>The file is consumed in {@code chunkSize} reads; a line that straddles two
 * chunks is carried over by the underlying {@link BufferedReader}, so memory use
 * is bounded by the chunk size plus the longest line. Line terminators are
 * {@code \n}, {@code \r\n} or {@code \r}; a trailing newline does not produce an
 * extra empty line.
 *
 * <p>Opening fails fast: a missing or unreadable file raises an
 * {@link com.di.eventreplay.exception.ImportErrorKind#IO_ERROR IO_ERROR} from
 * {@link #open} before any line is consumed. Failures while iterating surface as
 * {@link UncheckedIOException}, including bytes that are not valid UTF-8.
 */
public final class TsvLineReader implements Iterator<String>, Closeable {

    private final Path path;
    private final BufferedReader reader;
    private String nextLine;
    private boolean fetched;
    private long lineNumber;

    private TsvLineReader(Path path, BufferedReader reader) {
        this.path = path;
        this.reader = reader;
    }

    public static TsvLineReader open(Path path, int chunkSize) {
        if (chunkSize <= 0) {
            throw new IllegalArgumentException("chunkSize must be positive, got " + chunkSize);
        }
        try {
            CharsetDecoder decoder = StandardCharsets.UTF_8.newDecoder()
                    .onMalformedInput(CodingErrorAction.REPORT)
                    .onUnmappableCharacter(CodingErrorAction.REPORT);
            BufferedReader reader = new BufferedReader(
                    new InputStreamReader(Files.newInputStream(path), decoder), chunkSize);
            return new TsvLineReader(path, reader);
        } catch (IOException e) {
            throw EventImportException.io("Cannot open " + path + ": " + e.getMessage(), e);
        }
    }

    @Override
    public boolean hasNext() {
        if (!fetched) {
            try {
                nextLine = reader.readLine();
            } catch (IOException e) {
                throw new UncheckedIOException("Read failed in " + path + " after line " + lineNumber, e);
            }
            fetched = true;
        }
        return nextLine != null;
    }

    @Override
    public String next() {
        if (!hasNext()) {
            throw new NoSuchElementException("End of " + path + " after " + lineNumber + " lines");
        }
        fetched = false;
        lineNumber++;
        return nextLine;
    }

    /** 1-based number of the line last returned by {@link #next()}; 0 before the first. */
    public long lineNumber() {
        return lineNumber;
    }

    public Path path() {
        return path;
    }

    @Override
    public void close() throws IOException {
        reader.close();
    }
}
