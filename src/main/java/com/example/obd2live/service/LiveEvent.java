package com.example.obd2live.service;

import com.example.obd2live.model.DataPoint;
import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;

import java.time.Instant;

/**
 * One item on a session's live stream. The same shape travels over the
 * cross-instance channel as JSON.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@JsonInclude(JsonInclude.Include.NON_NULL)
public class LiveEvent {

    public enum Type { DATA, HEARTBEAT, SESSION_ENDED }

    private Type type;
    private String sessionId;
    private DataPoint point;
    private String reason;
    private Instant timestamp;

    public static LiveEvent data(String sessionId, DataPoint point) {
        return new LiveEvent(Type.DATA, sessionId, point, null, point.getTimestamp());
    }

    public static LiveEvent heartbeat(String sessionId) {
        return new LiveEvent(Type.HEARTBEAT, sessionId, null, null, Instant.now());
    }

    public static LiveEvent sessionEnded(String sessionId, String reason) {
        return new LiveEvent(Type.SESSION_ENDED, sessionId, null, reason, Instant.now());
    }

    @JsonIgnore
    public boolean isTerminal() {
        return type == Type.SESSION_ENDED;
    }
}
