package com.di.eventreplay.load.phase;

/**
 * Outcome of one committed phase.
 *
 * @param phase     phase name
 * @param records   preorg records consumed
 * @param elapsedMs wall time including reindexing
 */
public record PhaseResult(String phase, long records, long elapsedMs) {
}
