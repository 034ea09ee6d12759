package com.example.obd2live.exception;

import com.example.obd2live.model.SessionStatus;

public class InvalidStateTransitionException extends DiagnosticsException {

    private final String sessionId;
    private final SessionStatus from;
    private final SessionStatus to;

    public InvalidStateTransitionException(String sessionId, SessionStatus from, SessionStatus to) {
        super("Session " + sessionId + " cannot move from " + from + " to " + to);
        this.sessionId = sessionId;
        this.from = from;
        this.to = to;
    }

    public InvalidStateTransitionException(String sessionId, SessionStatus from, SessionStatus to, String message) {
        super(message);
        this.sessionId = sessionId;
        this.from = from;
        this.to = to;
    }

    public String getSessionId() { return sessionId; }
    public SessionStatus getFrom() { return from; }
    public SessionStatus getTo() { return to; }
}
