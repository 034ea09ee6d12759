package com.example.obd2live.service;

import com.example.obd2live.config.Obd2Properties;
import com.example.obd2live.exception.SessionNotFoundException;
import com.example.obd2live.kv.KvClient;
import com.example.obd2live.model.DataPoint;
import com.example.obd2live.model.DiagnosticSession;
import com.example.obd2live.model.SessionStatus;
import com.example.obd2live.store.StoreClient;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;
import reactor.core.Disposable;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;
import reactor.core.scheduler.Schedulers;

import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

/**
 * Distributes ingested points to live consumers: the session's in-process feed
 * (stream subscribers and shared viewers), the fast-path cache for polling,
 * and the cache channel for consumers attached to another instance.
 */
@Service
public class LiveDataService {

    private static final Logger logger = LoggerFactory.getLogger(LiveDataService.class);

    private final KvClient kvClient;
    private final StoreClient store;
    private final SessionRegistry registry;
    private final Obd2Properties properties;
    private final ObjectMapper objectMapper;

    public LiveDataService(KvClient kvClient, StoreClient store, SessionRegistry registry,
                           Obd2Properties properties, ObjectMapper objectMapper) {
        this.kvClient = kvClient;
        this.store = store;
        this.registry = registry;
        this.properties = properties;
        this.objectMapper = objectMapper;
    }

    /**
     * Publishes one point. Cache failures are logged and never reach the
     * ingestion path.
     */
    public void publish(String sessionId, DataPoint point) {
        LiveEvent event = LiveEvent.data(sessionId, point);
        registry.find(sessionId).ifPresent(runtime -> runtime.getFeed().emit(event));
        try {
            kvClient.cachePoint(sessionId, point.getTimestamp().toEpochMilli(), objectMapper.writeValueAsString(point));
            kvClient.publish(sessionId, objectMapper.writeValueAsString(event));
        } catch (Exception e) {
            logger.warn("Fast-path publish failed for session {}: {}", sessionId, e.getMessage());
        }
    }

    /**
     * Push stream of a session's events. Ends with a {@code SESSION_ENDED}
     * event when the session ends, or when the caller cancels.
     */
    public Flux<LiveEvent> subscribe(String sessionId) {
        Optional<SessionRuntime> runtime = registry.find(sessionId);
        if (runtime.isPresent()) {
            return runtime.get().getFeed().events();
        }
        DiagnosticSession session = store.getSession(sessionId)
                .orElseThrow(() -> SessionNotFoundException.forSession(sessionId));
        if (session.getStatus() == SessionStatus.ACTIVE || session.getStatus() == SessionStatus.PAUSED) {
            logger.debug("Session {} not hosted here, following the cache channel", sessionId);
            return kvClient.subscribe(sessionId)
                    .flatMap(json -> Mono.justOrEmpty(decodeEvent(json)))
                    .takeUntil(LiveEvent::isTerminal)
                    .onBackpressureBuffer(properties.getLive().getSubscriberBufferSize(), BufferOverflowStrategy.DROP_OLDEST);
        }
        return Flux.just(LiveEvent.sessionEnded(sessionId, session.getStatus().name().toLowerCase()));
    }

    /**
     * Points newer than {@code sinceMillis}, oldest first, at most {@code limit}.
     * Reads the cache; falls back to the store when the cache is unreachable or
     * holds nothing for a session no longer hosted here.
     */
    public List<DataPoint> recentSince(String sessionId, long sinceMillis, int limit) {
        int bounded = boundLimit(limit);
        try {
            List<DataPoint> cached = decodePoints(kvClient.rangeSince(sessionId, sinceMillis, bounded));
            if (!cached.isEmpty() || registry.find(sessionId).isPresent()) {
                return cached;
            }
        } catch (Exception e) {
            logger.warn("Cache read failed for session {}, reading from store: {}", sessionId, e.getMessage());
        }
        return store.findDataPoints(sessionId, Instant.ofEpochMilli(sinceMillis), bounded);
    }

    /**
     * Returns at once when points newer than {@code sinceMillis} exist; otherwise
     * waits up to {@code timeout} for the next one. No data in time yields an
     * empty result with the timeout marker set.
     */
    public Mono<PollResult> longPoll(String sessionId, long sinceMillis, int limit, Duration timeout) {
        Duration wait = timeout != null ? timeout : properties.getLive().getPollTimeout();
        return Mono.defer(() -> {
            // watch before reading so a point published in between still wakes the poll
            Sinks.One<LiveEvent> next = Sinks.one();
            Disposable watch = Flux.defer(() -> subscribe(sessionId))
                    .filter(event -> event.getType() != LiveEvent.Type.HEARTBEAT)
                    .next()
                    .subscribe(next::tryEmitValue, next::tryEmitError, next::tryEmitEmpty);
            return Mono.fromCallable(() -> recentSince(sessionId, sinceMillis, limit))
                    .flatMap(points -> {
                        if (!points.isEmpty()) {
                            return Mono.just(PollResult.of(sessionId, points));
                        }
                        return next.asMono()
                                .map(event -> event.isTerminal()
                                        ? PollResult.ended(sessionId)
                                        : PollResult.of(sessionId, List.of(event.getPoint())))
                                .timeout(wait, Mono.fromSupplier(() -> PollResult.timeout(sessionId)))
                                .defaultIfEmpty(PollResult.ended(sessionId));
                    })
                    .doFinally(signal -> watch.dispose());
        }).subscribeOn(Schedulers.boundedElastic());
    }

    /**
     * Ends every stream of the session with a terminal event.
     */
    public void close(String sessionId, String reason) {
        registry.find(sessionId).ifPresent(runtime -> runtime.getFeed().close(reason));
        try {
            kvClient.publish(sessionId, objectMapper.writeValueAsString(LiveEvent.sessionEnded(sessionId, reason)));
        } catch (Exception e) {
            logger.warn("Could not broadcast end of session {}: {}", sessionId, e.getMessage());
        }
    }

    public boolean cacheHealthy() {
        return kvClient.health();
    }

    public void evict(String sessionId) {
        try {
            kvClient.evict(sessionId);
        } catch (Exception e) {
            logger.warn("Could not evict cached points of session {}: {}", sessionId, e.getMessage());
        }
    }

    int boundLimit(int limit) {
        if (limit <= 0) {
            return properties.getLive().getDefaultPollLimit();
        }
        return Math.min(limit, properties.getLive().getMaxPollLimit());
    }

    private List<DataPoint> decodePoints(List<String> values) {
        List<DataPoint> points = new ArrayList<>(values.size());
        for (String json : values) {
            try {
                points.add(objectMapper.readValue(json, DataPoint.class));
            } catch (JsonProcessingException e) {
                logger.warn("Skipping unreadable cached point: {}", e.getOriginalMessage());
            }
        }
        return points;
    }

    private Optional<LiveEvent> decodeEvent(String json) {
        try {
            return Optional.of(objectMapper.readValue(json, LiveEvent.class));
        } catch (JsonProcessingException e) {
            logger.warn("Skipping unreadable live event: {}", e.getOriginalMessage());
            return Optional.empty();
        }
    }
}
