package com.example.obd2live.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("sessions")
public class DiagnosticSession {
    @Id
    private String id;
    @Indexed
    private String userId;
    @Indexed
    private String vehicleId;
    private String sessionName;
    private Instant startTime;
    private Instant endTime;
    private Long durationSeconds;
    @Indexed
    private SessionStatus status;
    private long dataPointCount;
    private long ingestionErrorCount;
    private Map<String, Object> vehicleInfo;
    private List<String> selectedPids;
    private List<String> tags;
    private String sessionNotes;

    // label -> {analysisId, status, timestamp, durationMs}
    private Map<String, Object> intervalAnalysis;

    private String finalAnalysisId;
    private AnalysisStatus finalAnalysisStatus;
    private String finalAnalysisReason;

    private Instant createdAt;
    private Instant updatedAt;
}
