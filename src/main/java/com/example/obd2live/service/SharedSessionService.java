package com.example.obd2live.service;

import com.example.obd2live.config.Obd2Properties;
import com.example.obd2live.exception.SessionNotFoundException;
import com.example.obd2live.exception.ValidationException;
import com.example.obd2live.model.DiagnosticSession;
import com.example.obd2live.model.SessionStatus;
import com.example.obd2live.model.SharedSession;
import com.example.obd2live.store.StoreClient;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.scheduling.annotation.Scheduled;
import org.springframework.stereotype.Service;
import reactor.core.publisher.Flux;

import java.security.SecureRandom;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Share codes that let viewers follow a host's live session. Viewers attach to
 * the session's live feed, so ending the session ends every viewer stream.
 */
@Service
public class SharedSessionService {

    private static final Logger logger = LoggerFactory.getLogger(SharedSessionService.class);

    // no 0/O, 1/I/L
    private static final String CODE_ALPHABET = "ABCDEFGHJKMNPQRSTUVWXYZ23456789";
    private static final Pattern CLIENT_ID = Pattern.compile("[A-Za-z0-9_-]{1,64}");
    private static final int MAX_CODE_ATTEMPTS = 10;

    private final SecureRandom random = new SecureRandom();
    private final StoreClient store;
    private final LiveDataService liveData;
    private final Obd2Properties properties;

    public SharedSessionService(StoreClient store, LiveDataService liveData, Obd2Properties properties) {
        this.store = store;
        this.liveData = liveData;
        this.properties = properties;
    }

    /**
     * Opens a share for a running session. A live, unexpired share of the same
     * session is returned instead of creating a second one.
     */
    public SharedSession createShare(String sessionId, String hostId) {
        DiagnosticSession session = store.getSession(sessionId)
                .orElseThrow(() -> SessionNotFoundException.forSession(sessionId));
        if (session.getStatus() != SessionStatus.ACTIVE && session.getStatus() != SessionStatus.PAUSED) {
            throw new ValidationException("Session " + sessionId + " is " + session.getStatus() + " and cannot be shared");
        }
        Instant now = Instant.now();
        for (SharedSession existing : store.findActiveSharedSessions()) {
            if (sessionId.equals(existing.getSessionId()) && !existing.isExpired(now)) {
                return existing;
            }
        }
        SharedSession shared = SharedSession.builder()
                .shareCode(newShareCode())
                .sessionId(sessionId)
                .hostId(hostId != null ? hostId : session.getUserId())
                .connectedClients(new LinkedHashMap<>())
                .active(true)
                .createdAt(now)
                .expiresAt(now.plus(properties.getSharing().getExpiry()))
                .build();
        SharedSession saved = store.saveSharedSession(shared);
        logger.info("Session {} shared as {}", sessionId, saved.getShareCode());
        return saved;
    }

    public SharedSession join(String shareCode, String clientId) {
        validateClientId(clientId);
        SharedSession shared = requireUsable(shareCode);
        Instant now = Instant.now();
        store.touchSharedClient(shared.getShareCode(), clientId, now);
        if (shared.getConnectedClients() == null) {
            shared.setConnectedClients(new LinkedHashMap<>());
        }
        shared.getConnectedClients().put(clientId, now);
        logger.info("Client {} joined share {} of session {}", clientId, shared.getShareCode(), shared.getSessionId());
        return shared;
    }

    public void ping(String shareCode, String clientId) {
        validateClientId(clientId);
        SharedSession shared = requireUsable(shareCode);
        store.touchSharedClient(shared.getShareCode(), clientId, Instant.now());
    }

    public void leave(String shareCode, String clientId) {
        validateClientId(clientId);
        store.removeSharedClient(normalize(shareCode), clientId);
        logger.debug("Client {} left share {}", clientId, shareCode);
    }

    /**
     * Joins and returns the live stream of the shared session. The client is
     * removed from the share when its stream ends.
     */
    public Flux<LiveEvent> subscribeViewer(String shareCode, String clientId) {
        SharedSession shared = join(shareCode, clientId);
        String code = shared.getShareCode();
        return liveData.subscribe(shared.getSessionId())
                .doFinally(signal -> {
                    try {
                        store.removeSharedClient(code, clientId);
                    } catch (Exception e) {
                        logger.warn("Could not remove client {} from share {}: {}", clientId, code, e.getMessage());
                    }
                });
    }

    /**
     * Deactivates every share of the session. Returns how many were active.
     */
    public long deactivateForSession(String sessionId) {
        long deactivated = store.deactivateSharedSessions(sessionId);
        if (deactivated > 0) {
            logger.info("Deactivated {} shares of session {}", deactivated, sessionId);
        }
        return deactivated;
    }

    @Scheduled(fixedDelayString = "${obd2.sharing.cleanup-interval-ms:60000}")
    public void cleanup() {
        try {
            Instant now = Instant.now();
            Instant staleBefore = now.minus(properties.getSharing().getClientTimeout());
            int expired = 0;
            int staleClients = 0;
            for (SharedSession shared : store.findActiveSharedSessions()) {
                if (shared.isExpired(now)) {
                    shared.setActive(false);
                    store.saveSharedSession(shared);
                    expired++;
                    continue;
                }
                Map<String, Instant> clients = shared.getConnectedClients();
                if (clients == null) {
                    continue;
                }
                List<String> stale = new ArrayList<>();
                clients.forEach((clientId, lastSeen) -> {
                    if (lastSeen == null || lastSeen.isBefore(staleBefore)) {
                        stale.add(clientId);
                    }
                });
                for (String clientId : stale) {
                    store.removeSharedClient(shared.getShareCode(), clientId);
                }
                staleClients += stale.size();
            }
            if (expired > 0 || staleClients > 0) {
                logger.info("Share cleanup: {} expired, {} stale clients removed", expired, staleClients);
            }
        } catch (Exception e) {
            logger.error("Share cleanup failed", e);
        }
    }

    private SharedSession requireUsable(String shareCode) {
        SharedSession shared = store.findSharedSession(normalize(shareCode))
                .orElseThrow(() -> SessionNotFoundException.forShareCode(shareCode));
        if (!shared.isActive() || shared.isExpired(Instant.now())) {
            throw new ValidationException("Share code " + shareCode + " is no longer active");
        }
        return shared;
    }

    private String newShareCode() {
        int length = properties.getSharing().getCodeLength();
        for (int attempt = 0; attempt < MAX_CODE_ATTEMPTS; attempt++) {
            StringBuilder code = new StringBuilder(length);
            for (int i = 0; i < length; i++) {
                code.append(CODE_ALPHABET.charAt(random.nextInt(CODE_ALPHABET.length())));
            }
            if (store.findSharedSession(code.toString()).isEmpty()) {
                return code.toString();
            }
        }
        throw new IllegalStateException("Could not allocate a unique share code after " + MAX_CODE_ATTEMPTS + " attempts");
    }

    private static String normalize(String shareCode) {
        if (shareCode == null || shareCode.isBlank()) {
            throw new ValidationException("Share code is required");
        }
        return shareCode.trim().toUpperCase();
    }

    private static void validateClientId(String clientId) {
        if (clientId == null || !CLIENT_ID.matcher(clientId).matches()) {
            throw new ValidationException("Invalid client id: " + clientId);
        }
    }
}
