package com.example.obd2live.service;

import com.example.obd2live.model.DataPoint;
import org.junit.jupiter.api.Test;
import reactor.core.publisher.Flux;

import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;

class LiveFeedTest {

    private static final String SESSION_ID = "65f1c0a2b3d4e5f601234567";

    private static DataPoint point(int i) {
        return DataPoint.builder()
                .sessionId(SESSION_ID)
                .timestamp(Instant.ofEpochMilli(1_700_000_000_000L + i))
                .rpm((double) i)
                .build();
    }

    @Test
    void testEvents_ClosedBeforeSubscription_EndsWithTerminalEvent() {
        // Given
        LiveFeed feed = new LiveFeed(SESSION_ID, 16);
        Flux<LiveEvent> events = feed.events();

        // When
        feed.close("completed");
        List<LiveEvent> received = events.collectList().block(Duration.ofSeconds(5));

        // Then
        assertNotNull(received);
        assertEquals(1, received.size());
        assertEquals(LiveEvent.Type.SESSION_ENDED, received.get(0).getType());
    }

    @Test
    void testEvents_SubscribedBeforeClose_TerminalEventDeliveredOnce() {
        // Given
        LiveFeed feed = new LiveFeed(SESSION_ID, 16);
        List<LiveEvent> received = new CopyOnWriteArrayList<>();
        feed.events().subscribe(received::add);

        // When
        feed.emit(LiveEvent.data(SESSION_ID, point(1)));
        feed.close("completed");
        feed.close("cancelled");

        // Then
        assertEquals(List.of(LiveEvent.Type.DATA, LiveEvent.Type.SESSION_ENDED),
                received.stream().map(LiveEvent::getType).collect(Collectors.toList()));
        assertTrue(feed.isClosed());
    }

    @Test
    void testEvents_AfterClose_OnlyTerminalEvent() {
        // Given
        LiveFeed feed = new LiveFeed(SESSION_ID, 16);
        feed.close("error");

        // When
        List<LiveEvent> received = feed.events().collectList().block(Duration.ofSeconds(5));

        // Then
        assertNotNull(received);
        assertEquals(1, received.size());
        assertTrue(received.get(0).isTerminal());
    }
}
