package com.example.obd2live.mcp;

import com.example.obd2live.model.DataPoint;
import com.example.obd2live.model.DiagnosticSession;
import com.example.obd2live.model.SessionConfig;
import com.example.obd2live.model.SessionStatus;
import com.example.obd2live.model.SharedSession;
import com.example.obd2live.service.DiagnosticSessionService;
import com.example.obd2live.service.IngestionBuffer;
import com.example.obd2live.service.IntervalAnalysisScheduler;
import com.example.obd2live.service.LiveDataService;
import com.example.obd2live.service.SharedSessionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.springframework.ai.tool.annotation.Tool;
import org.springframework.stereotype.Service;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

@Service
public class DiagnosticSessionTools {

    private final DiagnosticSessionService sessionService;
    private final LiveDataService liveData;
    private final IntervalAnalysisScheduler intervalScheduler;
    private final SharedSessionService sharedSessions;
    private final IngestionBuffer ingestionBuffer;
    private final ObjectMapper objectMapper;

    public DiagnosticSessionTools(DiagnosticSessionService sessionService,
                                  LiveDataService liveData,
                                  IntervalAnalysisScheduler intervalScheduler,
                                  SharedSessionService sharedSessions,
                                  IngestionBuffer ingestionBuffer,
                                  ObjectMapper objectMapper) {
        this.sessionService = sessionService;
        this.liveData = liveData;
        this.intervalScheduler = intervalScheduler;
        this.sharedSessions = sharedSessions;
        this.ingestionBuffer = ingestionBuffer;
        this.objectMapper = objectMapper;
    }

    @Tool(description = "Start a live diagnostic session for a vehicle; interval analyses are armed automatically")
    public Map<String,Object> session_start(String userId, String vehicleId, String sessionName, List<String> tags) {
        DiagnosticSession session = sessionService.startSession(SessionConfig.builder()
                .userId(userId)
                .vehicleId(vehicleId)
                .sessionName(sessionName)
                .tags(tags)
                .build());
        return Map.of("sessionId", session.getId(), "status", session.getStatus().name(), "startTime", session.getStartTime());
    }

    @Tool(description = "End an active session; flushes buffered data and queues the final analysis")
    public Map<String,Object> session_end(String sessionId) {
        return sessionService.endSession(sessionId).toMap();
    }

    @Tool(description = "Get a session document by id")
    public DiagnosticSession session_get(String sessionId) {
        return sessionService.getSession(sessionId);
    }

    @Tool(description = "Change session status: active, paused, error or cancelled")
    public Map<String,Object> session_updateStatus(String sessionId, String status) {
        DiagnosticSession session = sessionService.updateStatus(sessionId, SessionStatus.valueOf(status.trim().toUpperCase()));
        return Map.of("sessionId", session.getId(), "status", session.getStatus().name());
    }

    @Tool(description = "Add one OBD2 data point (sensor name to value) to an active session")
    public Map<String,Object> session_addDataPoint(String sessionId, Map<String,Object> point) {
        sessionService.addDataPoint(sessionId, objectMapper.convertValue(point, DataPoint.class));
        return Map.of("ok", true);
    }

    @Tool(description = "Recent data points newer than sinceMillis (epoch ms), oldest first")
    public List<DataPoint> session_recent(String sessionId, Long sinceMillis, Integer limit) {
        return liveData.recentSince(sessionId, sinceMillis == null ? 0L : sinceMillis, limit == null ? 0 : limit);
    }

    @Tool(description = "Completed interval analyses of a session keyed by offset label")
    public Map<String,Object> session_intervalResults(String sessionId) {
        return new HashMap<>(intervalScheduler.getIntervalResults(sessionId));
    }

    @Tool(description = "Create or return the share code of a running session")
    public Map<String,Object> session_share(String sessionId, String hostId) {
        SharedSession shared = sharedSessions.createShare(sessionId, hostId);
        return Map.of("shareCode", shared.getShareCode(), "expiresAt", shared.getExpiresAt());
    }

    @Tool(description = "Ingestion buffer statistics per hosted session")
    public Map<String,Object> buffer_stats() {
        return ingestionBuffer.getBufferStats();
    }
}
