package com.example.obd2live.controller;

import com.example.obd2live.service.LiveEvent;
import org.springframework.http.codec.ServerSentEvent;
import reactor.core.publisher.Flux;

import java.time.Duration;

final class LiveEventStreams {

    private LiveEventStreams() {
    }

    /**
     * Live events as SSE with periodic heartbeats; completes after the
     * terminal event.
     */
    static Flux<ServerSentEvent<LiveEvent>> toServerSentEvents(String streamId, Flux<LiveEvent> events, Duration heartbeatInterval) {
        Flux<LiveEvent> heartbeats = Flux.interval(heartbeatInterval)
                .map(tick -> LiveEvent.heartbeat(streamId));
        return Flux.merge(events, heartbeats)
                .takeUntil(LiveEvent::isTerminal)
                .map(event -> ServerSentEvent.<LiveEvent>builder()
                        .event(event.getType().name().toLowerCase())
                        .data(event)
                        .build());
    }
}
