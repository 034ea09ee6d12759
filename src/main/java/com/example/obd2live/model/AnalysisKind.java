package com.example.obd2live.model;

public enum AnalysisKind {
    INTERVAL,
    FINAL
}
