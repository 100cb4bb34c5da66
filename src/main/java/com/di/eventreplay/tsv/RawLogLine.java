package com.di.eventreplay.tsv;

/**
 * One event from the raw observer log.
 *
 * @param httpPath event path, e.g. {@code /new_block}
 * @param payload  JSON body exactly as logged
 * @param ordinal  1-based line number in the source file
 */
public record RawLogLine(String httpPath, String payload, long ordinal) {
}
