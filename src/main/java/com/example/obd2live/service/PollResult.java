package com.example.obd2live.service;

import com.example.obd2live.model.DataPoint;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Outcome of a (long-)poll. An empty result with {@code timedOut} set is a
 * normal answer, not an error.
 */
public class PollResult {
    private final String sessionId;
    private final List<DataPoint> points;
    private final boolean timedOut;
    private final boolean sessionEnded;

    private PollResult(String sessionId, List<DataPoint> points, boolean timedOut, boolean sessionEnded) {
        this.sessionId = sessionId;
        this.points = points;
        this.timedOut = timedOut;
        this.sessionEnded = sessionEnded;
    }

    public static PollResult of(String sessionId, List<DataPoint> points) {
        return new PollResult(sessionId, List.copyOf(points), false, false);
    }

    public static PollResult timeout(String sessionId) {
        return new PollResult(sessionId, List.of(), true, false);
    }

    public static PollResult ended(String sessionId) {
        return new PollResult(sessionId, List.of(), false, true);
    }

    public String getSessionId() { return sessionId; }
    public List<DataPoint> getPoints() { return points; }
    public boolean isTimedOut() { return timedOut; }
    public boolean isSessionEnded() { return sessionEnded; }

    /**
     * Timestamp of the newest point, for the caller's next {@code since}.
     */
    public Long getLastTimestamp() {
        if (points.isEmpty()) return null;
        Instant ts = points.get(points.size() - 1).getTimestamp();
        return ts == null ? null : ts.toEpochMilli();
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sessionId", sessionId);
        map.put("points", points);
        map.put("count", points.size());
        map.put("timeout", timedOut);
        map.put("sessionEnded", sessionEnded);
        map.put("lastTimestamp", getLastTimestamp());
        return map;
    }
}
