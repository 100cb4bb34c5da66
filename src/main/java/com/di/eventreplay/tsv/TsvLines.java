package com.di.eventreplay.tsv;

import com.di.eventreplay.exception.EventImportException;

/**
 * Field splitting for the raw log and the preorg file.
 *
 * <p>Raw log lines are {@code id \t timestamp \t path \t payload}; preorg lines are
 * {@code readLineCount \t path \t payload}. JSON never contains a literal tab, so
 * the payload is always the last field and the path the one before it.
 */
public final class TsvLines {

    public static final char SEPARATOR = '\t';

    private TsvLines() {
    }

    public static RawLogLine parseRaw(String line, long ordinal) {
        int payloadTab = line.lastIndexOf(SEPARATOR);
        if (payloadTab < 0) {
            throw EventImportException.parse("Line " + ordinal + ": expected tab-separated path and payload");
        }
        int pathTab = line.lastIndexOf(SEPARATOR, payloadTab - 1);
        String path = line.substring(pathTab + 1, payloadTab);
        if (path.isEmpty()) {
            throw EventImportException.parse("Line " + ordinal + ": empty event path");
        }
        return new RawLogLine(path, line.substring(payloadTab + 1), ordinal);
    }

    public static PreorgRecord parsePreorg(String line, long preorgLineNumber) {
        int first = line.indexOf(SEPARATOR);
        int second = first < 0 ? -1 : line.indexOf(SEPARATOR, first + 1);
        if (second < 0) {
            throw EventImportException.parse("Preorg line " + preorgLineNumber + ": expected 3 tab-separated fields");
        }
        long readLineCount;
        try {
            readLineCount = Long.parseLong(line.substring(0, first));
        } catch (NumberFormatException e) {
            throw EventImportException.parse("Preorg line " + preorgLineNumber + ": bad line count", e);
        }
        return new PreorgRecord(line.substring(first + 1, second), line.substring(second + 1), readLineCount);
    }

    public static String formatPreorg(long readLineCount, String path, String payload) {
        return readLineCount + String.valueOf(SEPARATOR) + path + SEPARATOR + payload;
    }
}
