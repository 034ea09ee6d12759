package com.example.obd2live.service;

import com.example.obd2live.analysis.AnalysisEngine;
import com.example.obd2live.analysis.AnalysisOutcome;
import com.example.obd2live.analysis.AnalysisRequest;
import com.example.obd2live.exception.AnalysisEngineException;
import com.example.obd2live.model.AnalysisKind;
import com.example.obd2live.model.AnalysisRecord;
import com.example.obd2live.model.AnalysisStatus;
import com.example.obd2live.store.StoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Drives one analysis run through PENDING, PROCESSING and a final state,
 * persisting the record at each step. Never throws: failures end up on the
 * record.
 */
@Component
public class AnalysisRunner {

    private static final Logger logger = LoggerFactory.getLogger(AnalysisRunner.class);
    private static final SecureRandom RANDOM = new SecureRandom();

    private final StoreClient store;
    private final AnalysisEngine engine;

    public AnalysisRunner(StoreClient store, AnalysisEngine engine) {
        this.store = store;
        this.engine = engine;
    }

    public AnalysisRecord run(String sessionId, AnalysisKind kind, String label,
                              Instant from, Instant to, long dataPointCount) {
        AnalysisRecord record = AnalysisRecord.builder()
                .analysisId(newAnalysisId())
                .sessionId(sessionId)
                .kind(kind)
                .label(label)
                .timestamp(Instant.now())
                .status(AnalysisStatus.PENDING)
                .timeRangeStart(from)
                .timeRangeEnd(to)
                .dataPointCount(dataPointCount)
                .build();
        persist(record);

        long started = System.currentTimeMillis();
        record.setStatus(AnalysisStatus.PROCESSING);
        persist(record);

        try {
            AnalysisOutcome outcome = engine.analyze(AnalysisRequest.builder()
                    .analysisId(record.getAnalysisId())
                    .sessionId(sessionId)
                    .kind(kind)
                    .label(label)
                    .timeRangeStart(from)
                    .timeRangeEnd(to)
                    .build());
            if (outcome.isFailed()) {
                record.setStatus(AnalysisStatus.FAILED);
                record.setErrorMessage(outcome.getError() != null ? outcome.getError() : "Analysis engine reported failure");
            } else {
                record.setStatus(AnalysisStatus.COMPLETED);
            }
            record.setResult(outcome.getResult());
            record.setArtifacts(outcome.getArtifacts());
        } catch (AnalysisEngineException e) {
            record.setStatus(AnalysisStatus.FAILED);
            record.setErrorMessage(e.getMessage());
            logger.warn("{} analysis {} for session {} failed ({}): {}", label, record.getAnalysisId(), sessionId,
                    e.isTransientFailure() ? "transient" : "permanent", e.getMessage());
        } catch (Exception e) {
            record.setStatus(AnalysisStatus.FAILED);
            record.setErrorMessage(e.getMessage());
            logger.error("{} analysis {} for session {} failed", label, record.getAnalysisId(), sessionId, e);
        }
        record.setDurationMs(System.currentTimeMillis() - started);
        persist(record);
        logger.info("{} analysis {} for session {} finished as {} in {}ms",
                label, record.getAnalysisId(), sessionId, record.getStatus(), record.getDurationMs());
        return record;
    }

    /**
     * Records a run that was not attempted, e.g. because no data was visible yet.
     */
    public AnalysisRecord skip(String sessionId, AnalysisKind kind, String label,
                               Instant from, Instant to, String reason) {
        AnalysisRecord record = AnalysisRecord.builder()
                .analysisId(newAnalysisId())
                .sessionId(sessionId)
                .kind(kind)
                .label(label)
                .timestamp(Instant.now())
                .status(AnalysisStatus.SKIPPED)
                .timeRangeStart(from)
                .timeRangeEnd(to)
                .dataPointCount(0)
                .errorMessage(reason)
                .build();
        persist(record);
        logger.info("{} analysis for session {} skipped: {}", label, sessionId, reason);
        return record;
    }

    /**
     * Compact view stored on the session document.
     */
    public static Map<String, Object> summarize(AnalysisRecord record) {
        Map<String, Object> summary = new LinkedHashMap<>();
        summary.put("analysisId", record.getAnalysisId());
        summary.put("status", record.getStatus().name());
        summary.put("timestamp", record.getTimestamp());
        summary.put("dataPointCount", record.getDataPointCount());
        if (record.getDurationMs() != null) summary.put("durationMs", record.getDurationMs());
        if (record.getErrorMessage() != null) summary.put("error", record.getErrorMessage());
        return summary;
    }

    static String newAnalysisId() {
        StringBuilder suffix = new StringBuilder(6);
        for (int i = 0; i < 6; i++) {
            suffix.append(Character.forDigit(RANDOM.nextInt(36), 36));
        }
        return "analysis_" + Long.toString(System.currentTimeMillis(), 36) + "_" + suffix;
    }

    private void persist(AnalysisRecord record) {
        try {
            store.saveAnalysis(record);
        } catch (Exception e) {
            logger.error("Could not persist analysis {} ({})", record.getAnalysisId(), record.getStatus(), e);
        }
    }
}
