package com.di.eventreplay.tsv;

/**
 * One canonical event read back from the preorg file.
 *
 * @param path          event path
 * @param payload       JSON body
 * @param readLineCount lines of the <em>original</em> log consumed up to and
 *                      including this event; drives progress reporting
 */
public record PreorgRecord(String path, String payload, long readLineCount) {
}
