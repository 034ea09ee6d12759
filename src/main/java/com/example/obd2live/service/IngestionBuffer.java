package com.example.obd2live.service;

import com.example.obd2live.config.Obd2Properties;
import com.example.obd2live.exception.ValidationException;
import com.example.obd2live.model.DataPoint;
import com.example.obd2live.store.StoreClient;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Batches incoming points per session and writes them to the store on a size
 * or time threshold. Callers of {@link #add} never wait for I/O.
 * <p>
 * A batch whose insert fails is dropped, not requeued: the failure is logged
 * and counted against the session's {@code ingestionErrorCount}.
 */
@Service
public class IngestionBuffer {

    private static final Logger logger = LoggerFactory.getLogger(IngestionBuffer.class);

    static final String DATA_POINT_COUNT = "dataPointCount";
    static final String INGESTION_ERROR_COUNT = "ingestionErrorCount";
    /** Returned by {@link #forceFlush} when the writes did not finish in time. */
    public static final int FLUSH_INCOMPLETE = -1;

    private final StoreClient store;
    private final SessionRegistry registry;
    private final Obd2Properties properties;
    private final Executor flushExecutor;

    @Autowired
    public IngestionBuffer(StoreClient store, SessionRegistry registry, Obd2Properties properties) {
        this(store, registry, properties, createExecutorService(properties.getBuffer().getFlushThreads()));
    }

    IngestionBuffer(StoreClient store, SessionRegistry registry, Obd2Properties properties, Executor flushExecutor) {
        this.store = store;
        this.registry = registry;
        this.properties = properties;
        this.flushExecutor = flushExecutor;
    }

    private static ExecutorService createExecutorService(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(threads, 1), r -> {
            Thread t = new Thread(r, "ingestion-flush-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Buffers one point. Reaching the batch size starts a write of exactly that
     * batch; the write runs on the flush pool.
     */
    public void add(String sessionId, DataPoint point) {
        SessionBuffer buffer = bufferFor(sessionId);
        CompletableFuture<Integer> write = buffer.append(point, properties.getBuffer().getBatchSize(),
                batch -> writeBatch(sessionId, buffer, batch), flushExecutor);
        if (write != null) {
            logger.debug("Batch size reached for session {}, flush scheduled", sessionId);
        }
    }

    /**
     * Drains the session's queue and writes it. Completes with the number of
     * points persisted by this drain, 0 when the queue was empty.
     */
    public CompletableFuture<Integer> flush(String sessionId) {
        return registry.find(sessionId)
                .map(runtime -> flush(sessionId, runtime.buffer()))
                .orElseGet(() -> CompletableFuture.completedFuture(0));
    }

    private CompletableFuture<Integer> flush(String sessionId, SessionBuffer buffer) {
        return buffer.drain(batch -> writeBatch(sessionId, buffer, batch), flushExecutor);
    }

    /**
     * Flushes now and waits for that write and every earlier one of the session.
     * Returns the points persisted by this drain, or {@link #FLUSH_INCOMPLETE}
     * when the writes are still running after the force-flush timeout.
     */
    public int forceFlush(String sessionId) {
        CompletableFuture<Integer> pending = flush(sessionId);
        long timeoutMs = properties.getBuffer().getForceFlushTimeout().toMillis();
        try {
            return pending.get(timeoutMs, TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            logger.warn("Forced flush for session {} did not finish within {}ms", sessionId, timeoutMs);
            return FLUSH_INCOMPLETE;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.warn("Interrupted while force-flushing session {}", sessionId);
            return FLUSH_INCOMPLETE;
        } catch (Exception e) {
            logger.error("Forced flush failed for session {}", sessionId, e);
            return FLUSH_INCOMPLETE;
        }
    }

    /**
     * Runs {@code action} once every write already queued for the session has
     * finished, successfully or not.
     */
    CompletableFuture<Void> afterQueuedWrites(SessionRuntime runtime, Runnable action) {
        return runtime.buffer().inFlight().thenRun(action);
    }

    /**
     * Points of this session persisted by this process so far.
     */
    public long flushedCount(String sessionId) {
        return registry.find(sessionId).map(runtime -> runtime.buffer().flushedCount()).orElse(0L);
    }

    @Scheduled(fixedDelayString = "${obd2.buffer.flush-interval-ms:5000}")
    public void flushAll() {
        for (SessionRuntime runtime : registry.all()) {
            try {
                if (runtime.buffer().pendingSize() > 0) {
                    flush(runtime.getSessionId(), runtime.buffer());
                }
            } catch (Exception e) {
                logger.error("Periodic flush failed for session {}", runtime.getSessionId(), e);
            }
        }
    }

    private int writeBatch(String sessionId, SessionBuffer buffer, List<DataPoint> batch) {
        try {
            store.insertBatch(sessionId, batch);
        } catch (Exception e) {
            buffer.recordDropped(batch.size());
            logger.error("Dropped batch of {} data points for session {}: insert failed", batch.size(), sessionId, e);
            recordIngestionError(sessionId, batch.size());
            return 0;
        }
        // count strictly after the insert so it can only under-report
        try {
            store.incrementSessionCounter(sessionId, DATA_POINT_COUNT, batch.size());
        } catch (Exception e) {
            logger.warn("Inserted {} data points for session {} but the count update failed: {}",
                    batch.size(), sessionId, e.getMessage());
        }
        buffer.recordFlushed(batch.size());
        logger.debug("Flushed {} data points for session {}", batch.size(), sessionId);
        return batch.size();
    }

    private void recordIngestionError(String sessionId, int dropped) {
        try {
            store.incrementSessionCounter(sessionId, INGESTION_ERROR_COUNT, dropped);
        } catch (Exception e) {
            logger.warn("Could not record ingestion error for session {}: {}", sessionId, e.getMessage());
        }
    }

    private SessionBuffer bufferFor(String sessionId) {
        return registry.find(sessionId)
                .map(SessionRuntime::buffer)
                .orElseThrow(() -> new ValidationException("Session " + sessionId + " is not hosted for ingestion"));
    }

    public Map<String, Object> getBufferStats() {
        Map<String, Object> sessions = new LinkedHashMap<>();
        long buffered = 0;
        for (SessionRuntime runtime : registry.all()) {
            SessionBuffer buffer = runtime.buffer();
            int pending = buffer.pendingSize();
            buffered += pending;
            sessions.put(runtime.getSessionId(), Map.of(
                    "buffered", pending,
                    "accepted", buffer.acceptedCount(),
                    "flushed", buffer.flushedCount(),
                    "dropped", buffer.droppedCount(),
                    "batches", buffer.batchCount()
            ));
        }
        Map<String, Object> stats = new LinkedHashMap<>();
        stats.put("activeSessions", sessions.size());
        stats.put("totalBuffered", buffered);
        stats.put("configuration", Map.of(
                "batchSize", properties.getBuffer().getBatchSize(),
                "flushIntervalMs", properties.getBuffer().getFlushIntervalMs()
        ));
        stats.put("sessions", sessions);
        return stats;
    }

    @PreDestroy
    public void shutdown() {
        for (SessionRuntime runtime : registry.all()) {
            forceFlush(runtime.getSessionId());
        }
        if (flushExecutor instanceof ExecutorService) {
            ((ExecutorService) flushExecutor).shutdown();
        }
    }
}
