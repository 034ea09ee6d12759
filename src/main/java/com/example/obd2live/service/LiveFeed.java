package com.example.obd2live.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import reactor.core.publisher.BufferOverflowStrategy;
import reactor.core.publisher.Flux;
import reactor.core.publisher.Mono;
import reactor.core.publisher.Sinks;

import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Fan-out of one session's events to any number of subscribers. Emission is
 * serialized so every subscriber sees ingestion order. Each subscriber gets its
 * own bounded buffer; a slow one loses its oldest events, never blocks the
 * producer or the other subscribers.
 */
public class LiveFeed {

    private static final Logger logger = LoggerFactory.getLogger(LiveFeed.class);

    private final String sessionId;
    private final int subscriberBufferSize;
    private final Sinks.Many<LiveEvent> sink = Sinks.many().multicast().directBestEffort();
    private volatile LiveEvent terminalEvent;

    LiveFeed(String sessionId, int subscriberBufferSize) {
        this.sessionId = sessionId;
        this.subscriberBufferSize = subscriberBufferSize;
    }

    public synchronized void emit(LiveEvent event) {
        if (terminalEvent != null) {
            return;
        }
        Sinks.EmitResult result = sink.tryEmitNext(event);
        if (result.isFailure() && result != Sinks.EmitResult.FAIL_ZERO_SUBSCRIBER) {
            logger.warn("Live event for session {} not delivered: {}", sessionId, result);
        }
    }

    /**
     * Sends the terminal event and completes every subscriber. Later calls are ignored.
     */
    public synchronized void close(String reason) {
        if (terminalEvent != null) {
            return;
        }
        terminalEvent = LiveEvent.sessionEnded(sessionId, reason);
        sink.tryEmitNext(terminalEvent);
        sink.tryEmitComplete();
        logger.debug("Closed live feed for session {} ({})", sessionId, reason);
    }

    /**
     * Every subscriber ends with the terminal event, including one that
     * subscribes while the feed is closing.
     */
    public Flux<LiveEvent> events() {
        return Flux.defer(() -> {
            LiveEvent terminal = terminalEvent;
            if (terminal != null) {
                return Flux.just(terminal);
            }
            AtomicBoolean terminalSeen = new AtomicBoolean();
            return sink.asFlux()
                    .onBackpressureBuffer(subscriberBufferSize,
                            dropped -> logger.debug("Dropped oldest live event for slow subscriber of session {}", sessionId),
                            BufferOverflowStrategy.DROP_OLDEST)
                    .doOnNext(event -> {
                        if (event.isTerminal()) {
                            terminalSeen.set(true);
                        }
                    })
                    .concatWith(Mono.fromSupplier(() -> terminalSeen.get() ? null : terminalEvent));
        });
    }

    public boolean isClosed() {
        return terminalEvent != null;
    }

    public int subscriberCount() {
        return sink.currentSubscriberCount();
    }
}
