package com.di.eventreplay.load;

import java.util.ArrayList;
import java.util.List;

/**
 * Turns a monotonically increasing line count into progress boundaries
 * ({@code step}, {@code 2*step}, ... percent of {@code total}). Each boundary is
 * returned once, no matter how many lines a single record spans.
 */
public class ProgressTracker {

    private final long total;
    private final int  stepPercent;
    private int lastReported;

    public ProgressTracker(long total, int stepPercent) {
        if (stepPercent <= 0 || stepPercent > 100) {
            throw new IllegalArgumentException("stepPercent must be in 1..100, got " + stepPercent);
        }
        this.total       = total;
        this.stepPercent = stepPercent;
    }

    /** Boundaries crossed since the previous call, in increasing order. */
    public List<Integer> update(long readLineCount) {
        if (total <= 0) {
            return List.of();
        }
        long percent = Math.min(100, readLineCount * 100 / total);
        List<Integer> crossed = new ArrayList<>();
        for (int b = lastReported + stepPercent - lastReported % stepPercent; b <= percent; b += stepPercent) {
            crossed.add(b);
            lastReported = b;
        }
        return crossed;
    }

    /** {@code [100]} unless 100% was already reported. */
    public List<Integer> finish() {
        if (lastReported >= 100) {
            return List.of();
        }
        lastReported = 100;
        return List.of(100);
    }

    public int lastReported() {
        return lastReported;
    }
}
