package com.example.obd2live.kv;

import reactor.core.publisher.Flux;

import java.util.List;

/**
 * Fast-path cache for recent points and cross-instance push. Not the system of
 * record: every read has a store fallback.
 */
public interface KvClient {
    /** Adds one serialized point to the session's recent set. */
    void cachePoint(String sessionId, long timestampMillis, String pointJson);
    /** Broadcasts one serialized live event to listeners on any instance. */
    void publish(String sessionId, String eventJson);
    /** Serialized points scored strictly after {@code sinceMillis}, oldest first. */
    List<String> rangeSince(String sessionId, long sinceMillis, int limit);
    Flux<String> subscribe(String sessionId);
    boolean health();
    void evict(String sessionId);
}
