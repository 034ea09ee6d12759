package com.example.obd2live.controller;

import com.example.obd2live.config.Obd2Properties;
import com.example.obd2live.exception.ValidationException;
import com.example.obd2live.model.AnalysisRecord;
import com.example.obd2live.model.DataPoint;
import com.example.obd2live.model.DiagnosticSession;
import com.example.obd2live.model.SessionConfig;
import com.example.obd2live.model.SessionStatus;
import com.example.obd2live.model.SharedSession;
import com.example.obd2live.service.DiagnosticSessionService;
import com.example.obd2live.service.IntervalAnalysisScheduler;
import com.example.obd2live.service.LiveDataService;
import com.example.obd2live.service.LiveEvent;
import com.example.obd2live.service.SharedSessionService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.http.HttpStatus;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;

import java.time.Duration;
import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sessions")
public class LiveSessionController {

    private static final Logger logger = LoggerFactory.getLogger(LiveSessionController.class);

    private final DiagnosticSessionService sessionService;
    private final LiveDataService liveData;
    private final IntervalAnalysisScheduler intervalScheduler;
    private final SharedSessionService sharedSessions;
    private final Obd2Properties properties;

    public LiveSessionController(DiagnosticSessionService sessionService,
                                 LiveDataService liveData,
                                 IntervalAnalysisScheduler intervalScheduler,
                                 SharedSessionService sharedSessions,
                                 Obd2Properties properties) {
        this.sessionService = sessionService;
        this.liveData = liveData;
        this.intervalScheduler = intervalScheduler;
        this.sharedSessions = sharedSessions;
        this.properties = properties;
    }

    @PostMapping
    public ResponseEntity<DiagnosticSession> start(@RequestBody SessionConfig config) {
        return ResponseEntity.status(HttpStatus.CREATED).body(sessionService.startSession(config));
    }

    @GetMapping("/{sessionId}")
    public ResponseEntity<DiagnosticSession> get(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.getSession(sessionId));
    }

    @DeleteMapping("/{sessionId}")
    public ResponseEntity<Void> delete(@PathVariable String sessionId) {
        sessionService.deleteSession(sessionId);
        return ResponseEntity.noContent().build();
    }

    @PostMapping("/{sessionId}/end")
    public ResponseEntity<Map<String, Object>> end(@PathVariable String sessionId) {
        return ResponseEntity.ok(sessionService.endSession(sessionId).toMap());
    }

    @PutMapping("/{sessionId}/status")
    public ResponseEntity<DiagnosticSession> updateStatus(@PathVariable String sessionId,
                                                          @RequestBody Map<String, String> body) {
        return ResponseEntity.ok(sessionService.updateStatus(sessionId, parseStatus(body.get("status"))));
    }

    @PostMapping("/{sessionId}/data")
    public ResponseEntity<Map<String, Object>> ingest(@PathVariable String sessionId, @RequestBody DataPoint point) {
        sessionService.addDataPoint(sessionId, point);
        return ResponseEntity.accepted().body(Map.of("accepted", 1));
    }

    @PostMapping("/{sessionId}/data/batch")
    public ResponseEntity<Map<String, Object>> ingestBatch(@PathVariable String sessionId, @RequestBody List<DataPoint> points) {
        int accepted = sessionService.addDataPoints(sessionId, points);
        return ResponseEntity.accepted().body(Map.of("accepted", accepted));
    }

    @GetMapping(value = "/{sessionId}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<LiveEvent>> stream(@PathVariable String sessionId) {
        logger.info("Live stream opened for session {}", sessionId);
        return LiveEventStreams.toServerSentEvents(sessionId, liveData.subscribe(sessionId),
                        properties.getLive().getHeartbeatInterval())
                .doFinally(signal -> logger.info("Live stream for session {} closed ({})", sessionId, signal));
    }

    @GetMapping("/{sessionId}/recent")
    public ResponseEntity<List<DataPoint>> recent(@PathVariable String sessionId,
                                                  @RequestParam(defaultValue = "0") long since,
                                                  @RequestParam(defaultValue = "0") int limit) {
        return ResponseEntity.ok(liveData.recentSince(sessionId, since, limit));
    }

    @GetMapping("/{sessionId}/poll")
    public Mono<Map<String, Object>> poll(@PathVariable String sessionId,
                                          @RequestParam(defaultValue = "0") long since,
                                          @RequestParam(defaultValue = "0") int limit,
                                          @RequestParam(required = false) Long timeoutMs) {
        Duration max = properties.getLive().getPollTimeout();
        Duration timeout = timeoutMs == null || timeoutMs <= 0 || timeoutMs > max.toMillis()
                ? max
                : Duration.ofMillis(timeoutMs);
        return liveData.longPoll(sessionId, since, limit, timeout).map(result -> result.toMap());
    }

    @GetMapping("/{sessionId}/intervals")
    public ResponseEntity<Map<String, AnalysisRecord>> intervals(@PathVariable String sessionId) {
        return ResponseEntity.ok(intervalScheduler.getIntervalResults(sessionId));
    }

    @PostMapping("/{sessionId}/share")
    public ResponseEntity<SharedSession> share(@PathVariable String sessionId,
                                               @RequestBody(required = false) Map<String, String> body) {
        String hostId = body != null ? body.get("hostId") : null;
        return ResponseEntity.status(HttpStatus.CREATED).body(sharedSessions.createShare(sessionId, hostId));
    }

    private static SessionStatus parseStatus(String value) {
        if (value == null || value.isBlank()) {
            throw new ValidationException("Status is required");
        }
        try {
            return SessionStatus.valueOf(value.trim().toUpperCase());
        } catch (IllegalArgumentException e) {
            throw new ValidationException("Unknown status: " + value);
        }
    }
}
