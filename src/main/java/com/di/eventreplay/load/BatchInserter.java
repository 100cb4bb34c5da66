package com.di.eventreplay.load;

import java.util.ArrayList;
import java.util.List;
import java.util.function.Consumer;

/**
 * Buffers rows and hands them to an insert function in chunks of exactly
 * {@code batchSize}; {@link #flush()} sends the remainder. The insert function is
 * never called with an empty list and receives its own copy of each chunk.
 */
public class BatchInserter<T> {

    private final int               batchSize;
    private final Consumer<List<T>> insertFn;
    private final List<T>           buffer;
    private long batches;
    private long inserted;

    public BatchInserter(int batchSize, Consumer<List<T>> insertFn) {
        if (batchSize <= 0) {
            throw new IllegalArgumentException("batchSize must be positive, got " + batchSize);
        }
        this.batchSize = batchSize;
        this.insertFn  = insertFn;
        this.buffer    = new ArrayList<>(batchSize);
    }

    public void push(List<T> items) {
        buffer.addAll(items);
        while (buffer.size() >= batchSize) {
            List<T> head = buffer.subList(0, batchSize);
            List<T> chunk = new ArrayList<>(head);
            head.clear();
            send(chunk);
        }
    }

    public void flush() {
        if (buffer.isEmpty()) {
            return;
        }
        List<T> chunk = new ArrayList<>(buffer);
        buffer.clear();
        send(chunk);
    }

    private void send(List<T> chunk) {
        insertFn.accept(chunk);
        batches++;
        inserted += chunk.size();
    }

    public int pending() {
        return buffer.size();
    }

    public long batchesInserted() {
        return batches;
    }

    public long itemsInserted() {
        return inserted;
    }
}
