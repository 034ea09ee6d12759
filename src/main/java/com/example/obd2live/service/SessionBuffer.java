package com.example.obd2live.service;

import com.example.obd2live.model.DataPoint;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Function;

/**
 * Per-session pending queue plus the chain of batch writes drained from it.
 * Only {@link IngestionBuffer} touches this class.
 */
final class SessionBuffer {

    private final Object lock = new Object();
    private List<DataPoint> pending = new ArrayList<>();
    private CompletableFuture<Integer> tail = CompletableFuture.completedFuture(0);

    private final AtomicLong accepted = new AtomicLong();
    private final AtomicLong flushed = new AtomicLong();
    private final AtomicLong dropped = new AtomicLong();
    private final AtomicLong batches = new AtomicLong();

    /**
     * Appends one point. When the queue reaches {@code batchSize} it is swapped
     * out and its write chained behind earlier writes; the returned future
     * completes with the number persisted. Returns null while below the threshold.
     */
    CompletableFuture<Integer> append(DataPoint point, int batchSize,
                                      Function<List<DataPoint>, Integer> writer, Executor executor) {
        synchronized (lock) {
            pending.add(point);
            accepted.incrementAndGet();
            if (pending.size() < batchSize) {
                return null;
            }
            return chain(swap(), writer, executor);
        }
    }

    /**
     * Drains whatever is pending. With nothing pending, the future still waits
     * for writes already in flight and completes with 0.
     */
    CompletableFuture<Integer> drain(Function<List<DataPoint>, Integer> writer, Executor executor) {
        synchronized (lock) {
            if (pending.isEmpty()) {
                return tail.handle((n, e) -> 0);
            }
            return chain(swap(), writer, executor);
        }
    }

    /**
     * Completes with 0 once every write chained so far has finished.
     */
    CompletableFuture<Integer> inFlight() {
        synchronized (lock) {
            return tail.handle((n, e) -> 0);
        }
    }

    private CompletableFuture<Integer> chain(List<DataPoint> batch,
                                             Function<List<DataPoint>, Integer> writer, Executor executor) {
        CompletableFuture<Integer> next = tail
                .handle((n, e) -> batch)
                .thenApplyAsync(writer, executor);
        tail = next;
        return next;
    }

    private List<DataPoint> swap() {
        List<DataPoint> batch = pending;
        pending = new ArrayList<>();
        return batch;
    }

    int pendingSize() {
        synchronized (lock) {
            return pending.size();
        }
    }

    void recordFlushed(int count) {
        flushed.addAndGet(count);
        batches.incrementAndGet();
    }

    void recordDropped(int count) {
        dropped.addAndGet(count);
    }

    long acceptedCount() { return accepted.get(); }
    long flushedCount() { return flushed.get(); }
    long droppedCount() { return dropped.get(); }
    long batchCount() { return batches.get(); }
}
