package com.example.obd2live.service;

import com.example.obd2live.config.Obd2Properties;
import com.example.obd2live.model.SessionStatus;
import jakarta.annotation.PreDestroy;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ConcurrentMap;

/**
 * Process-wide map of hosted sessions. Created once by the container and
 * injected wherever runtime state is needed.
 */
@Component
public class SessionRegistry {

    private static final Logger logger = LoggerFactory.getLogger(SessionRegistry.class);

    private final ConcurrentMap<String, SessionRuntime> sessions = new ConcurrentHashMap<>();
    private final Obd2Properties properties;

    public SessionRegistry(Obd2Properties properties) {
        this.properties = properties;
    }

    /**
     * Returns the runtime for the session, creating it if absent.
     */
    public SessionRuntime register(String sessionId, Instant startTime, SessionStatus status) {
        return sessions.computeIfAbsent(sessionId, id -> {
            logger.debug("Registering runtime for session {} ({})", id, status);
            return new SessionRuntime(id, startTime, status, properties.getLive().getSubscriberBufferSize());
        });
    }

    /**
     * Registers a runtime only if none exists. Returns the new runtime, or
     * empty when another caller registered the session first.
     */
    public Optional<SessionRuntime> registerIfAbsent(String sessionId, Instant startTime, SessionStatus status) {
        SessionRuntime created = new SessionRuntime(sessionId, startTime, status, properties.getLive().getSubscriberBufferSize());
        SessionRuntime existing = sessions.putIfAbsent(sessionId, created);
        return existing == null ? Optional.of(created) : Optional.empty();
    }

    public Optional<SessionRuntime> find(String sessionId) {
        return Optional.ofNullable(sessions.get(sessionId));
    }

    public Optional<SessionRuntime> remove(String sessionId) {
        return Optional.ofNullable(sessions.remove(sessionId));
    }

    public Collection<SessionRuntime> all() {
        return new ArrayList<>(sessions.values());
    }

    public int size() {
        return sessions.size();
    }

    @PreDestroy
    public void shutdown() {
        List<SessionRuntime> remaining = new ArrayList<>(sessions.values());
        if (!remaining.isEmpty()) {
            logger.info("Releasing {} hosted sessions on shutdown", remaining.size());
        }
        for (SessionRuntime runtime : remaining) {
            runtime.timers().forEach(timer -> timer.cancel(false));
            runtime.getFeed().close("shutdown");
        }
        sessions.clear();
    }
}
