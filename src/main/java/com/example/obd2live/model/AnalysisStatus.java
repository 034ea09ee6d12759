package com.example.obd2live.model;

public enum AnalysisStatus {
    PENDING,
    PROCESSING,
    COMPLETED,
    FAILED,
    SKIPPED
}
