package com.example.obd2live.controller;

import com.example.obd2live.service.IngestionBuffer;
import com.example.obd2live.service.LiveDataService;
import com.example.obd2live.service.SessionRegistry;
import com.example.obd2live.store.StoreClient;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.RestController;

import java.util.HashMap;
import java.util.Map;

@RestController
public class HealthController {

    private final LiveDataService liveData;
    private final StoreClient storeClient;
    private final SessionRegistry registry;
    private final IngestionBuffer ingestionBuffer;

    public HealthController(LiveDataService liveData, StoreClient storeClient,
                            SessionRegistry registry, IngestionBuffer ingestionBuffer) {
        this.liveData = liveData;
        this.storeClient = storeClient;
        this.registry = registry;
        this.ingestionBuffer = ingestionBuffer;
    }

    @GetMapping("/health")
    public ResponseEntity<Map<String, Object>> health() {
        Map<String, Object> health = new HashMap<>();
        health.put("status", "UP");
        health.put("service", "obd2-live-diagnostics");
        health.put("version", "0.1.0");
        health.put("hostedSessions", registry.size());

        // Redis is a fast path only; DOWN degrades polling, not ingestion
        health.put("redis", liveData.cacheHealthy() ? "UP" : "DOWN");

        try {
            storeClient.ping();
            health.put("mongodb", "UP");
        } catch (Exception e) {
            health.put("mongodb", "DOWN");
            health.put("mongodbError", e.getMessage());
            health.put("status", "DEGRADED");
        }

        health.put("buffer", ingestionBuffer.getBufferStats().get("totalBuffered"));
        return ResponseEntity.ok(health);
    }

    @GetMapping("/actuator/health")
    public ResponseEntity<Map<String, Object>> actuatorHealth() {
        return health();
    }
}
