package com.example.obd2live.exception;

/**
 * Rejected input: malformed ids, data for a session that is not accepting it,
 * unknown share codes. Never retried.
 */
public class ValidationException extends DiagnosticsException {

    public ValidationException(String message) {
        super(message);
    }
}
