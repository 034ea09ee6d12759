package com.example.obd2live.exception;

/**
 * The persistent store could not be reached or refused a write.
 */
public class TransientStoreException extends DiagnosticsException {

    public TransientStoreException(String message, Throwable cause) {
        super(message, cause);
    }
}
