package com.example.obd2live.service;

import com.example.obd2live.config.Obd2Properties;
import com.example.obd2live.exception.SessionNotFoundException;
import com.example.obd2live.model.AnalysisKind;
import com.example.obd2live.model.AnalysisRecord;
import com.example.obd2live.model.AnalysisStatus;
import com.example.obd2live.model.DiagnosticSession;
import com.example.obd2live.store.StoreClient;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Runs the final analysis of an ended session in the background, after
 * checking that the session's points are visible in the store.
 */
@Service
public class FinalAnalysisTrigger {

    private static final Logger logger = LoggerFactory.getLogger(FinalAnalysisTrigger.class);

    public static final String NO_DATA = "no data";
    public static final String UNVERIFIED = "data durability could not be verified";
    static final long COUNT_UNKNOWN = -1L;
    static final String FINAL_LABEL = "final";

    private final StoreClient store;
    private final AnalysisRunner runner;
    private final Obd2Properties properties;
    private final Executor analysisExecutor;

    @Autowired
    public FinalAnalysisTrigger(StoreClient store, AnalysisRunner runner, Obd2Properties properties) {
        this(store, runner, properties, createExecutorService(properties.getAnalysis().getThreads()));
    }

    FinalAnalysisTrigger(StoreClient store, AnalysisRunner runner, Obd2Properties properties, Executor analysisExecutor) {
        this.store = store;
        this.runner = runner;
        this.properties = properties;
        this.analysisExecutor = analysisExecutor;
    }

    private static ExecutorService createExecutorService(int threads) {
        AtomicInteger counter = new AtomicInteger();
        return Executors.newFixedThreadPool(Math.max(threads, 1), r -> {
            Thread t = new Thread(r, "final-analysis-" + counter.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
    }

    /**
     * Polls the data point count until it is non-zero and at least
     * {@code expectedMinimum}, re-polling at most {@code maxRetries} times. A
     * failed read counts as not yet visible. Returns the last successful count,
     * which may still be short of the minimum, or {@link #COUNT_UNKNOWN} when
     * no read succeeded.
     */
    public long awaitDurableCount(String sessionId, long expectedMinimum, int maxRetries, Duration retryDelay) {
        long count = readCount(sessionId, COUNT_UNKNOWN);
        int attempt = 0;
        while (!visible(count, expectedMinimum) && attempt < maxRetries) {
            attempt++;
            try {
                Thread.sleep(retryDelay.toMillis());
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                logger.warn("Interrupted while waiting for data of session {} to become visible", sessionId);
                break;
            }
            count = readCount(sessionId, count);
            logger.debug("Durable count for session {} is {} after retry {}/{}", sessionId, count, attempt, maxRetries);
        }
        if (!visible(count, expectedMinimum)) {
            logger.warn("Session {} shows {} persisted data points, expected at least {}", sessionId, count, expectedMinimum);
        }
        return count;
    }

    private long readCount(String sessionId, long previous) {
        try {
            return store.countDataPoints(sessionId);
        } catch (Exception e) {
            logger.warn("Could not count data points of session {}: {}", sessionId, e.getMessage());
            return previous;
        }
    }

    private static boolean visible(long count, long expectedMinimum) {
        return count > 0 && count >= expectedMinimum;
    }

    /**
     * Schedules the final analysis and returns immediately.
     */
    public CompletableFuture<FinalAnalysisOutcome> trigger(String sessionId, long expectedMinimum) {
        logger.info("Final analysis queued for session {}", sessionId);
        return CompletableFuture.supplyAsync(() -> runFinal(sessionId, expectedMinimum), analysisExecutor);
    }

    FinalAnalysisOutcome runFinal(String sessionId, long expectedMinimum) {
        try {
            long count = awaitDurableCount(sessionId, expectedMinimum,
                    properties.getConsistency().getMaxRetries(), properties.getConsistency().getRetryDelay());
            if (count == COUNT_UNKNOWN) {
                return markSkipped(sessionId, UNVERIFIED);
            }
            if (count == 0) {
                return markSkipped(sessionId, NO_DATA);
            }
            DiagnosticSession session = store.getSession(sessionId)
                    .orElseThrow(() -> SessionNotFoundException.forSession(sessionId));
            Instant end = session.getEndTime() != null ? session.getEndTime() : Instant.now();
            AnalysisRecord record = runner.run(sessionId, AnalysisKind.FINAL, FINAL_LABEL, session.getStartTime(), end, count);

            Map<String, Object> fields = new HashMap<>();
            fields.put("finalAnalysisId", record.getAnalysisId());
            fields.put("finalAnalysisStatus", record.getStatus());
            store.updateSession(sessionId, fields);
            return FinalAnalysisOutcome.ran(sessionId, record.getStatus(), record.getAnalysisId(), count);
        } catch (Exception e) {
            logger.error("Final analysis for session {} failed", sessionId, e);
            recordStatus(sessionId, AnalysisStatus.FAILED, e.getMessage());
            return FinalAnalysisOutcome.failed(sessionId, e.getMessage());
        }
    }

    /**
     * Marks the session's final analysis as skipped without calling the engine.
     */
    public FinalAnalysisOutcome markSkipped(String sessionId, String reason) {
        recordStatus(sessionId, AnalysisStatus.SKIPPED, reason);
        logger.info("Final analysis for session {} skipped: {}", sessionId, reason);
        return FinalAnalysisOutcome.skipped(sessionId, reason);
    }

    private void recordStatus(String sessionId, AnalysisStatus status, String reason) {
        Map<String, Object> fields = new HashMap<>();
        fields.put("finalAnalysisStatus", status);
        fields.put("finalAnalysisReason", reason);
        try {
            store.updateSession(sessionId, fields);
        } catch (Exception e) {
            logger.error("Could not record final analysis status {} for session {}", status, sessionId, e);
        }
    }

    @PreDestroy
    public void shutdown() {
        if (analysisExecutor instanceof ExecutorService) {
            ((ExecutorService) analysisExecutor).shutdown();
        }
    }
}
