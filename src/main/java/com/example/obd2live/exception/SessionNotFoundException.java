package com.example.obd2live.exception;

public class SessionNotFoundException extends DiagnosticsException {

    public SessionNotFoundException(String message) {
        super(message);
    }

    public static SessionNotFoundException forSession(String sessionId) {
        return new SessionNotFoundException("Session not found: " + sessionId);
    }

    public static SessionNotFoundException forShareCode(String shareCode) {
        return new SessionNotFoundException("Shared session not found: " + shareCode);
    }
}
