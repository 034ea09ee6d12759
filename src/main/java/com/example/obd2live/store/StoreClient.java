package com.example.obd2live.store;

import com.example.obd2live.model.AnalysisKind;
import com.example.obd2live.model.AnalysisRecord;
import com.example.obd2live.model.DataPoint;
import com.example.obd2live.model.DiagnosticSession;
import com.example.obd2live.model.SharedSession;

import java.time.Instant;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * System of record for sessions, data points, analyses and shares. Failures to
 * reach the store surface as {@link com.example.obd2live.exception.TransientStoreException}.
 */
public interface StoreClient {
    DiagnosticSession saveSession(DiagnosticSession session);
    Optional<DiagnosticSession> getSession(String sessionId);
    /** Sets each field (dotted paths allowed) and bumps {@code updatedAt}. */
    void updateSession(String sessionId, Map<String, Object> fields);
    void incrementSessionCounter(String sessionId, String field, long delta);
    void deleteSessionCascade(String sessionId);

    void insertBatch(String sessionId, List<DataPoint> points);
    long countDataPoints(String sessionId);
    /** Points with a timestamp strictly after {@code since}, oldest first. */
    List<DataPoint> findDataPoints(String sessionId, Instant since, int limit);

    AnalysisRecord saveAnalysis(AnalysisRecord record);
    List<AnalysisRecord> findAnalyses(String sessionId, AnalysisKind kind);

    SharedSession saveSharedSession(SharedSession shared);
    Optional<SharedSession> findSharedSession(String shareCode);
    List<SharedSession> findActiveSharedSessions();
    void touchSharedClient(String shareCode, String clientId, Instant seenAt);
    void removeSharedClient(String shareCode, String clientId);
    long deactivateSharedSessions(String sessionId);

    void ping();
}
