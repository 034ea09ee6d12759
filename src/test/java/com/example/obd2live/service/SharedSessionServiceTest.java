package com.example.obd2live.service;

import com.example.obd2live.config.Obd2Properties;
import com.example.obd2live.exception.SessionNotFoundException;
import com.example.obd2live.exception.ValidationException;
import com.example.obd2live.model.DiagnosticSession;
import com.example.obd2live.model.SessionStatus;
import com.example.obd2live.model.SharedSession;
import com.example.obd2live.store.InMemoryStoreClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class SharedSessionServiceTest {

    private static final String SESSION_ID = "65f1c0a2b3d4e5f601234567";

    @Mock
    private LiveDataService liveData;

    private InMemoryStoreClient store;
    private SharedSessionService sharedSessions;

    @BeforeEach
    void setUp() {
        store = new InMemoryStoreClient();
        sharedSessions = new SharedSessionService(store, liveData, new Obd2Properties());
        store.saveSession(DiagnosticSession.builder()
                .id(SESSION_ID)
                .userId("user-1")
                .status(SessionStatus.ACTIVE)
                .startTime(Instant.now())
                .build());
    }

    @Test
    void testCreateShare_CodeFromUnambiguousAlphabetAndExpiresInADay() {
        // Given
        Instant before = Instant.now();

        // When
        SharedSession share = sharedSessions.createShare(SESSION_ID, null);

        // Then
        assertTrue(share.getShareCode().matches("[ABCDEFGHJKMNPQRSTUVWXYZ23456789]{6}"), share.getShareCode());
        assertTrue(share.isActive());
        assertEquals("user-1", share.getHostId());
        assertFalse(share.getExpiresAt().isBefore(before.plus(Duration.ofHours(24))));
        assertTrue(share.getExpiresAt().isBefore(Instant.now().plus(Duration.ofHours(24)).plusSeconds(1)));
    }

    @Test
    void testCreateShare_ReusesLiveShareOfSameSession() {
        // Given
        SharedSession first = sharedSessions.createShare(SESSION_ID, "host-1");

        // When
        SharedSession second = sharedSessions.createShare(SESSION_ID, "host-2");

        // Then
        assertEquals(first.getShareCode(), second.getShareCode());
        assertEquals(1, store.findActiveSharedSessions().size());
    }

    @Test
    void testCreateShare_CompletedSessionRejected() {
        // Given
        store.updateSession(SESSION_ID, Map.of("status", SessionStatus.COMPLETED));

        // When / Then
        assertThrows(ValidationException.class, () -> sharedSessions.createShare(SESSION_ID, null));
        assertTrue(store.findActiveSharedSessions().isEmpty());
    }

    @Test
    void testCreateShare_UnknownSession_NotFound() {
        assertThrows(SessionNotFoundException.class, () -> sharedSessions.createShare("65f1c0a2b3d4e5f6ffffffff", null));
    }

    @Test
    void testJoin_NormalizesCodeAndTracksClient() {
        // Given
        SharedSession share = sharedSessions.createShare(SESSION_ID, null);

        // When
        SharedSession joined = sharedSessions.join("  " + share.getShareCode().toLowerCase() + " ", "viewer_1");

        // Then
        assertEquals(SESSION_ID, joined.getSessionId());
        assertTrue(store.findSharedSession(share.getShareCode()).orElseThrow()
                .getConnectedClients().containsKey("viewer_1"));

        sharedSessions.leave(share.getShareCode(), "viewer_1");
        assertTrue(store.findSharedSession(share.getShareCode()).orElseThrow().getConnectedClients().isEmpty());
    }

    @Test
    void testJoin_UnknownCode_NotFound() {
        assertThrows(SessionNotFoundException.class, () -> sharedSessions.join("ZZZZZZ", "viewer-1"));
    }

    @Test
    void testJoin_InvalidClientIdRejected() {
        // Given
        SharedSession share = sharedSessions.createShare(SESSION_ID, null);

        // When / Then
        assertThrows(ValidationException.class, () -> sharedSessions.join(share.getShareCode(), "bad id!"));
        assertThrows(ValidationException.class, () -> sharedSessions.join(share.getShareCode(), ""));
        assertThrows(ValidationException.class, () -> sharedSessions.join(share.getShareCode(), null));
    }

    @Test
    void testJoin_DeactivatedShareRejected() {
        // Given
        SharedSession share = sharedSessions.createShare(SESSION_ID, null);
        assertEquals(1, sharedSessions.deactivateForSession(SESSION_ID));

        // When / Then
        assertThrows(ValidationException.class, () -> sharedSessions.join(share.getShareCode(), "viewer-1"));
        assertThrows(ValidationException.class, () -> sharedSessions.ping(share.getShareCode(), "viewer-1"));
    }

    @Test
    void testSubscribeViewer_ClientRemovedWhenStreamEnds() {
        // Given
        SharedSession share = sharedSessions.createShare(SESSION_ID, null);
        LiveEvent ended = LiveEvent.sessionEnded(SESSION_ID, "completed");
        when(liveData.subscribe(SESSION_ID)).thenReturn(Flux.just(ended));

        // When
        List<LiveEvent> events = sharedSessions.subscribeViewer(share.getShareCode(), "viewer-1").collectList().block(Duration.ofSeconds(5));

        // Then
        assertEquals(List.of(ended), events);
        assertTrue(store.findSharedSession(share.getShareCode()).orElseThrow().getConnectedClients().isEmpty());
    }

    @Test
    void testCleanup_ExpiresOldSharesAndDropsStaleClients() {
        // Given
        Instant now = Instant.now();
        LinkedHashMap<String, Instant> clients = new LinkedHashMap<>();
        clients.put("fresh", now);
        clients.put("stale", now.minus(Duration.ofMinutes(5)));
        store.saveSharedSession(SharedSession.builder()
                .shareCode("ABCDEF").sessionId(SESSION_ID).active(true)
                .connectedClients(clients)
                .createdAt(now).expiresAt(now.plus(Duration.ofHours(1)))
                .build());
        store.saveSharedSession(SharedSession.builder()
                .shareCode("GHJKMN").sessionId(SESSION_ID).active(true)
                .connectedClients(new LinkedHashMap<>())
                .createdAt(now.minus(Duration.ofHours(25))).expiresAt(now.minus(Duration.ofHours(1)))
                .build());

        // When
        sharedSessions.cleanup();

        // Then
        SharedSession live = store.findSharedSession("ABCDEF").orElseThrow();
        assertEquals(List.of("fresh"), List.copyOf(live.getConnectedClients().keySet()));
        assertFalse(store.findSharedSession("GHJKMN").orElseThrow().isActive());
        assertEquals(List.of(live), store.findActiveSharedSessions());
    }
}
