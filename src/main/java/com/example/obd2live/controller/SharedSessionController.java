package com.example.obd2live.controller;

import com.example.obd2live.config.Obd2Properties;
import com.example.obd2live.model.SharedSession;
import com.example.obd2live.service.LiveEvent;
import com.example.obd2live.service.SharedSessionService;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.http.codec.ServerSentEvent;
import org.springframework.web.bind.annotation.*;
import reactor.core.publisher.Flux;

import java.util.Map;

@RestController
@RequestMapping("/api/shared")
public class SharedSessionController {

    private final SharedSessionService sharedSessions;
    private final Obd2Properties properties;

    public SharedSessionController(SharedSessionService sharedSessions, Obd2Properties properties) {
        this.sharedSessions = sharedSessions;
        this.properties = properties;
    }

    @PostMapping("/{shareCode}/join")
    public ResponseEntity<SharedSession> join(@PathVariable String shareCode, @RequestParam String clientId) {
        return ResponseEntity.ok(sharedSessions.join(shareCode, clientId));
    }

    @PostMapping("/{shareCode}/ping")
    public ResponseEntity<Map<String, Object>> ping(@PathVariable String shareCode, @RequestParam String clientId) {
        sharedSessions.ping(shareCode, clientId);
        return ResponseEntity.ok(Map.of("ok", true));
    }

    @PostMapping("/{shareCode}/leave")
    public ResponseEntity<Map<String, Object>> leave(@PathVariable String shareCode, @RequestParam String clientId) {
        sharedSessions.leave(shareCode, clientId);
        return ResponseEntity.ok(Map.of("ok", true));
    }

    @GetMapping(value = "/{shareCode}/stream", produces = MediaType.TEXT_EVENT_STREAM_VALUE)
    public Flux<ServerSentEvent<LiveEvent>> stream(@PathVariable String shareCode, @RequestParam String clientId) {
        Flux<LiveEvent> events = sharedSessions.subscribeViewer(shareCode, clientId);
        return LiveEventStreams.toServerSentEvents(shareCode, events, properties.getLive().getHeartbeatInterval());
    }
}
