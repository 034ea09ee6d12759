package com.example.obd2live.analysis;

/**
 * External collaborator that computes statistics and anomalies for a slice of
 * a session. Implementations throw
 * {@link com.example.obd2live.exception.AnalysisEngineException} on failure,
 * flagged transient or permanent.
 */
public interface AnalysisEngine {
    AnalysisOutcome analyze(AnalysisRequest request);
}
