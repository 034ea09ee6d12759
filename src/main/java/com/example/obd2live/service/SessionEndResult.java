package com.example.obd2live.service;

import com.example.obd2live.model.AnalysisStatus;
import com.example.obd2live.model.SessionStatus;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

public class SessionEndResult {
    private final String sessionId;
    private final SessionStatus status;
    private final Instant endTime;
    private final long durationSeconds;
    private final long dataPointCount;
    private final AnalysisStatus finalAnalysis;
    private final String finalAnalysisReason;

    public SessionEndResult(String sessionId, SessionStatus status, Instant endTime, long durationSeconds,
                            long dataPointCount, AnalysisStatus finalAnalysis, String finalAnalysisReason) {
        this.sessionId = sessionId;
        this.status = status;
        this.endTime = endTime;
        this.durationSeconds = durationSeconds;
        this.dataPointCount = dataPointCount;
        this.finalAnalysis = finalAnalysis;
        this.finalAnalysisReason = finalAnalysisReason;
    }

    public String getSessionId() { return sessionId; }
    public SessionStatus getStatus() { return status; }
    public Instant getEndTime() { return endTime; }
    public long getDurationSeconds() { return durationSeconds; }
    public long getDataPointCount() { return dataPointCount; }
    public AnalysisStatus getFinalAnalysis() { return finalAnalysis; }
    public String getFinalAnalysisReason() { return finalAnalysisReason; }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sessionId", sessionId);
        map.put("status", status.name());
        map.put("endTime", endTime);
        map.put("durationSeconds", durationSeconds);
        map.put("dataPointCount", dataPointCount);
        map.put("finalAnalysis", finalAnalysis.name());
        if (finalAnalysisReason != null) {
            map.put("finalAnalysisReason", finalAnalysisReason);
        }
        return map;
    }
}
