package com.example.obd2live.service;

import com.example.obd2live.exception.InvalidStateTransitionException;
import com.example.obd2live.exception.SessionNotFoundException;
import com.example.obd2live.exception.ValidationException;
import com.example.obd2live.model.AnalysisStatus;
import com.example.obd2live.model.DataPoint;
import com.example.obd2live.model.DiagnosticSession;
import com.example.obd2live.model.SessionConfig;
import com.example.obd2live.model.SessionStatus;
import com.example.obd2live.store.StoreClient;
import org.bson.types.ObjectId;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.time.Instant;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Owns session status transitions and coordinates the buffer, the interval
 * timers, live streams and shares at session boundaries.
 */
@Service
public class DiagnosticSessionService {

    private static final Logger logger = LoggerFactory.getLogger(DiagnosticSessionService.class);

    private final StoreClient store;
    private final SessionRegistry registry;
    private final IngestionBuffer ingestionBuffer;
    private final LiveDataService liveData;
    private final IntervalAnalysisScheduler intervalScheduler;
    private final FinalAnalysisTrigger finalTrigger;
    private final SharedSessionService sharedSessions;

    public DiagnosticSessionService(StoreClient store,
                                    SessionRegistry registry,
                                    IngestionBuffer ingestionBuffer,
                                    LiveDataService liveData,
                                    IntervalAnalysisScheduler intervalScheduler,
                                    FinalAnalysisTrigger finalTrigger,
                                    SharedSessionService sharedSessions) {
        this.store = store;
        this.registry = registry;
        this.ingestionBuffer = ingestionBuffer;
        this.liveData = liveData;
        this.intervalScheduler = intervalScheduler;
        this.finalTrigger = finalTrigger;
        this.sharedSessions = sharedSessions;
    }

    public DiagnosticSession startSession(SessionConfig config) {
        if (config == null) {
            throw new ValidationException("Session config is required");
        }
        Instant now = Instant.now();
        DiagnosticSession session = DiagnosticSession.builder()
                .id(new ObjectId().toHexString())
                .userId(config.getUserId())
                .vehicleId(config.getVehicleId())
                .sessionName(config.getSessionName() != null && !config.getSessionName().isBlank()
                        ? config.getSessionName()
                        : "Diagnostic Session " + now)
                .vehicleInfo(config.getVehicleInfo())
                .selectedPids(config.getSelectedPids())
                .tags(config.getTags())
                .sessionNotes(config.getSessionNotes())
                .startTime(now)
                .status(SessionStatus.ACTIVE)
                .dataPointCount(0)
                .ingestionErrorCount(0)
                .intervalAnalysis(new LinkedHashMap<>())
                .createdAt(now)
                .updatedAt(now)
                .build();
        DiagnosticSession saved = store.saveSession(session);
        registry.register(saved.getId(), now, SessionStatus.ACTIVE);
        intervalScheduler.start(saved.getId(), now);
        logger.info("Started session {} for vehicle {}", saved.getId(), saved.getVehicleId());
        return saved;
    }

    /**
     * Accepts one point for an active session. Returns once the point is
     * buffered and published; persistence happens in the background.
     */
    public void addDataPoint(String sessionId, DataPoint point) {
        validateSessionId(sessionId);
        if (point == null) {
            throw new ValidationException("Data point is required");
        }
        SessionRuntime runtime = attachForIngest(sessionId);
        synchronized (runtime.ingestLock()) {
            if (!runtime.isAccepting()) {
                throw new ValidationException("Session " + sessionId + " is " + runtime.getStatus() + " and not accepting data");
            }
            point.setId(null);
            point.setSessionId(sessionId);
            if (point.getTimestamp() == null) {
                point.setTimestamp(Instant.now());
            }
            ingestionBuffer.add(sessionId, point);
            liveData.publish(sessionId, point);
        }
    }

    public int addDataPoints(String sessionId, List<DataPoint> points) {
        if (points == null || points.isEmpty()) {
            throw new ValidationException("At least one data point is required");
        }
        for (DataPoint point : points) {
            addDataPoint(sessionId, point);
        }
        return points.size();
    }

    /**
     * Completes an active session. The final analysis runs in the background;
     * this call does not wait for it.
     */
    public SessionEndResult endSession(String sessionId) {
        validateSessionId(sessionId);
        SessionRuntime runtime = attachForEnd(sessionId);
        if (runtime.getStatus() != SessionStatus.ACTIVE) {
            throw new InvalidStateTransitionException(sessionId, runtime.getStatus(), SessionStatus.COMPLETED);
        }
        if (!runtime.beginEnding()) {
            throw new InvalidStateTransitionException(sessionId, runtime.getStatus(), SessionStatus.COMPLETED,
                    "Session " + sessionId + " is already ending");
        }

        Instant endTime = Instant.now();
        long durationSeconds = Duration.between(runtime.getStartTime(), endTime).getSeconds();
        long flushed = release(sessionId, runtime, SessionStatus.COMPLETED, endTime, durationSeconds);
        logger.info("Ended session {} after {}s with {} flushed data points", sessionId, durationSeconds, flushed);

        long persisted = countOrUnknown(sessionId);
        if (flushed == IngestionBuffer.FLUSH_INCOMPLETE) {
            // writes still running: let the background guard decide once they settle
            logger.warn("Session {} ended with writes still pending; final analysis deferred", sessionId);
            ingestionBuffer.afterQueuedWrites(runtime,
                            () -> finalTrigger.trigger(sessionId, runtime.buffer().flushedCount()))
                    .exceptionally(e -> {
                        logger.error("Deferred final analysis of session {} could not start", sessionId, e);
                        return null;
                    });
            return new SessionEndResult(sessionId, SessionStatus.COMPLETED, endTime, durationSeconds,
                    Math.max(0, persisted), AnalysisStatus.PENDING, null);
        }
        if (flushed == 0 && persisted == 0) {
            finalTrigger.markSkipped(sessionId, FinalAnalysisTrigger.NO_DATA);
            return new SessionEndResult(sessionId, SessionStatus.COMPLETED, endTime, durationSeconds, 0,
                    AnalysisStatus.SKIPPED, FinalAnalysisTrigger.NO_DATA);
        }
        finalTrigger.trigger(sessionId, flushed);
        return new SessionEndResult(sessionId, SessionStatus.COMPLETED, endTime, durationSeconds,
                Math.max(flushed, persisted), AnalysisStatus.PENDING, null);
    }

    /**
     * Moves a session among ACTIVE, PAUSED, ERROR and CANCELLED. COMPLETED is
     * only reachable through {@link #endSession}.
     */
    public DiagnosticSession updateStatus(String sessionId, SessionStatus newStatus) {
        validateSessionId(sessionId);
        if (newStatus == null) {
            throw new ValidationException("Status is required");
        }
        Optional<SessionRuntime> runtime = registry.find(sessionId);
        SessionStatus current = runtime.map(SessionRuntime::getStatus)
                .orElseGet(() -> requireSession(sessionId).getStatus());
        if (newStatus == SessionStatus.COMPLETED) {
            throw new InvalidStateTransitionException(sessionId, current, newStatus,
                    "Session " + sessionId + " can only be completed by ending it");
        }
        if (!current.canUpdateTo(newStatus)) {
            throw new InvalidStateTransitionException(sessionId, current, newStatus);
        }

        if (newStatus.isTerminal()) {
            terminate(sessionId, runtime.orElse(null), newStatus);
        } else if (runtime.isPresent()) {
            SessionRuntime hosted = runtime.get();
            synchronized (hosted.ingestLock()) {
                if (hosted.isEnding()) {
                    throw new InvalidStateTransitionException(sessionId, hosted.getStatus(), newStatus,
                            "Session " + sessionId + " is ending");
                }
                store.updateSession(sessionId, Map.of("status", newStatus));
                hosted.setStatus(newStatus);
            }
        } else {
            store.updateSession(sessionId, Map.of("status", newStatus));
            if (newStatus == SessionStatus.ACTIVE) {
                attach(requireSession(sessionId));
            }
        }
        logger.info("Session {} moved from {} to {}", sessionId, current, newStatus);
        return requireSession(sessionId);
    }

    public DiagnosticSession getSession(String sessionId) {
        validateSessionId(sessionId);
        return requireSession(sessionId);
    }

    /**
     * Deletes the session with its points, analyses and shares. A hosted
     * session is torn down first.
     */
    public void deleteSession(String sessionId) {
        validateSessionId(sessionId);
        requireSession(sessionId);
        registry.find(sessionId).ifPresent(runtime -> {
            if (runtime.beginEnding()) {
                synchronized (runtime.ingestLock()) {
                    runtime.setStatus(SessionStatus.CANCELLED);
                }
                intervalScheduler.stop(sessionId);
                ingestionBuffer.forceFlush(sessionId);
                liveData.close(sessionId, "deleted");
                registry.remove(sessionId);
            }
        });
        store.deleteSessionCascade(sessionId);
        liveData.evict(sessionId);
        logger.info("Deleted session {}", sessionId);
    }

    private void terminate(String sessionId, SessionRuntime runtime, SessionStatus status) {
        Instant endTime = Instant.now();
        if (runtime == null) {
            Map<String, Object> fields = new HashMap<>();
            fields.put("status", status);
            fields.put("endTime", endTime);
            store.updateSession(sessionId, fields);
            deactivateShares(sessionId);
            liveData.close(sessionId, status.name().toLowerCase());
            return;
        }
        if (!runtime.beginEnding()) {
            throw new InvalidStateTransitionException(sessionId, runtime.getStatus(), status,
                    "Session " + sessionId + " is already ending");
        }
        long durationSeconds = Duration.between(runtime.getStartTime(), endTime).getSeconds();
        release(sessionId, runtime, status, endTime, durationSeconds);
    }

    /**
     * Tears down a hosted session that the caller has claimed: timers first,
     * then the buffer, then the stored status, shares and live streams.
     * Returns the number of points this process persisted for it, or
     * {@link IngestionBuffer#FLUSH_INCOMPLETE} when writes are still running.
     */
    private long release(String sessionId, SessionRuntime runtime, SessionStatus status,
                         Instant endTime, long durationSeconds) {
        // waits for any add in progress; later adds see the new status
        synchronized (runtime.ingestLock()) {
            runtime.setStatus(status);
        }
        try {
            intervalScheduler.stop(sessionId);
            int drained = ingestionBuffer.forceFlush(sessionId);
            long flushed = drained == IngestionBuffer.FLUSH_INCOMPLETE
                    ? IngestionBuffer.FLUSH_INCOMPLETE
                    : runtime.buffer().flushedCount();

            Map<String, Object> fields = new HashMap<>();
            fields.put("status", status);
            fields.put("endTime", endTime);
            fields.put("durationSeconds", durationSeconds);
            store.updateSession(sessionId, fields);
            deactivateShares(sessionId);
            return flushed;
        } finally {
            liveData.close(sessionId, status.name().toLowerCase());
            registry.remove(sessionId);
        }
    }

    private void deactivateShares(String sessionId) {
        try {
            sharedSessions.deactivateForSession(sessionId);
        } catch (Exception e) {
            logger.error("Could not deactivate shares of session {}", sessionId, e);
        }
    }

    // -1 when the store cannot answer, so the background guard decides
    private long countOrUnknown(String sessionId) {
        try {
            return store.countDataPoints(sessionId);
        } catch (Exception e) {
            logger.warn("Could not count data points of session {}: {}", sessionId, e.getMessage());
            return -1;
        }
    }

    private SessionRuntime attachForIngest(String sessionId) {
        Optional<SessionRuntime> runtime = registry.find(sessionId);
        if (runtime.isPresent()) {
            return runtime.get();
        }
        DiagnosticSession session = requireSession(sessionId);
        if (session.getStatus() != SessionStatus.ACTIVE) {
            throw new ValidationException("Session " + sessionId + " is " + session.getStatus() + " and not accepting data");
        }
        return attach(session);
    }

    private SessionRuntime attachForEnd(String sessionId) {
        Optional<SessionRuntime> runtime = registry.find(sessionId);
        if (runtime.isPresent()) {
            return runtime.get();
        }
        DiagnosticSession session = requireSession(sessionId);
        if (session.getStatus() != SessionStatus.ACTIVE) {
            throw new InvalidStateTransitionException(sessionId, session.getStatus(), SessionStatus.COMPLETED);
        }
        return attach(session);
    }

    /**
     * Hosts a stored session that has no runtime in this process, e.g. after
     * a restart.
     */
    private SessionRuntime attach(DiagnosticSession session) {
        String sessionId = session.getId();
        Optional<SessionRuntime> created = registry.registerIfAbsent(sessionId, session.getStartTime(), session.getStatus());
        created.ifPresent(runtime -> {
            logger.info("Attached stored session {} ({})", sessionId, session.getStatus());
            if (session.getStatus() == SessionStatus.ACTIVE) {
                intervalScheduler.start(sessionId, session.getStartTime());
            }
        });
        return created.orElseGet(() -> registry.find(sessionId)
                .orElseThrow(() -> new ValidationException("Session " + sessionId + " was released concurrently")));
    }

    private DiagnosticSession requireSession(String sessionId) {
        return store.getSession(sessionId).orElseThrow(() -> SessionNotFoundException.forSession(sessionId));
    }

    private static void validateSessionId(String sessionId) {
        if (sessionId == null || !ObjectId.isValid(sessionId)) {
            throw new ValidationException("Invalid session id: " + sessionId);
        }
    }
}
