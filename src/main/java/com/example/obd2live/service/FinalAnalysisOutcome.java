package com.example.obd2live.service;

import com.example.obd2live.model.AnalysisStatus;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Result of the end-of-session analysis trigger.
 */
public class FinalAnalysisOutcome {
    private final String sessionId;
    private final AnalysisStatus status;
    private final String analysisId;
    private final String reason;
    private final long observedCount;

    private FinalAnalysisOutcome(String sessionId, AnalysisStatus status, String analysisId, String reason, long observedCount) {
        this.sessionId = sessionId;
        this.status = status;
        this.analysisId = analysisId;
        this.reason = reason;
        this.observedCount = observedCount;
    }

    public static FinalAnalysisOutcome ran(String sessionId, AnalysisStatus status, String analysisId, long observedCount) {
        return new FinalAnalysisOutcome(sessionId, status, analysisId, null, observedCount);
    }

    public static FinalAnalysisOutcome skipped(String sessionId, String reason) {
        return new FinalAnalysisOutcome(sessionId, AnalysisStatus.SKIPPED, null, reason, 0);
    }

    public static FinalAnalysisOutcome failed(String sessionId, String reason) {
        return new FinalAnalysisOutcome(sessionId, AnalysisStatus.FAILED, null, reason, 0);
    }

    public String getSessionId() { return sessionId; }
    public AnalysisStatus getStatus() { return status; }
    public String getAnalysisId() { return analysisId; }
    public String getReason() { return reason; }
    public long getObservedCount() { return observedCount; }

    public boolean isSkipped() {
        return status == AnalysisStatus.SKIPPED;
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sessionId", sessionId);
        map.put("status", status.name());
        map.put("analysisId", analysisId);
        map.put("reason", reason);
        map.put("observedCount", observedCount);
        return map;
    }
}
