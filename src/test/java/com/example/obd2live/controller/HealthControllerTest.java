package com.example.obd2live.controller;

import com.example.obd2live.exception.TransientStoreException;
import com.example.obd2live.service.IngestionBuffer;
import com.example.obd2live.service.LiveDataService;
import com.example.obd2live.service.SessionRegistry;
import com.example.obd2live.store.StoreClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class HealthControllerTest {

    @Mock
    private LiveDataService liveData;

    @Mock
    private StoreClient storeClient;

    @Mock
    private SessionRegistry registry;

    @Mock
    private IngestionBuffer ingestionBuffer;

    private HealthController healthController;

    @BeforeEach
    void setUp() {
        healthController = new HealthController(liveData, storeClient, registry, ingestionBuffer);
        when(registry.size()).thenReturn(2);
        when(ingestionBuffer.getBufferStats()).thenReturn(Map.of("totalBuffered", 7));
    }

    @Test
    void testHealth_AllUp() {
        // Given
        when(liveData.cacheHealthy()).thenReturn(true);

        // When
        Map<String, Object> health = healthController.health().getBody();

        // Then
        assertNotNull(health);
        assertEquals("UP", health.get("status"));
        assertEquals("UP", health.get("redis"));
        assertEquals("UP", health.get("mongodb"));
        assertEquals(2, health.get("hostedSessions"));
        assertEquals(7, health.get("buffer"));
    }

    @Test
    void testHealth_StoreDownIsDegraded() {
        // Given
        when(liveData.cacheHealthy()).thenReturn(false);
        doThrow(new TransientStoreException("Failed to ping", new RuntimeException("timeout"))).when(storeClient).ping();

        // When
        Map<String, Object> health = healthController.health().getBody();

        // Then
        assertNotNull(health);
        assertEquals("DEGRADED", health.get("status"));
        assertEquals("DOWN", health.get("redis"));
        assertEquals("DOWN", health.get("mongodb"));
        assertEquals("Failed to ping", health.get("mongodbError"));
    }
}
