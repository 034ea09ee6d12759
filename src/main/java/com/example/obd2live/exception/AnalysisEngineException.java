package com.example.obd2live.exception;

public class AnalysisEngineException extends DiagnosticsException {

    private final boolean transientFailure;

    public AnalysisEngineException(String message, boolean transientFailure) {
        super(message);
        this.transientFailure = transientFailure;
    }

    public AnalysisEngineException(String message, boolean transientFailure, Throwable cause) {
        super(message, cause);
        this.transientFailure = transientFailure;
    }

    public boolean isTransientFailure() {
        return transientFailure;
    }
}
