package com.example.obd2live.exception;

/**
 * Base type for every failure raised by the live diagnostics core.
 */
public class DiagnosticsException extends RuntimeException {

    public DiagnosticsException(String message) {
        super(message);
    }

    public DiagnosticsException(String message, Throwable cause) {
        super(message, cause);
    }
}
