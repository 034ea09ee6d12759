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
@Builder(toBuilder = true)
@Document("analyses")
public class AnalysisRecord {
    @Id
    private String analysisId;
    @Indexed
    private String sessionId;
    private AnalysisKind kind;
    private String label; // "15s", "1m", ... or "final"
    private Instant timestamp;
    private AnalysisStatus status;
    private Instant timeRangeStart;
    private Instant timeRangeEnd;
    private long dataPointCount;
    private Map<String, Object> result;
    private List<AnalysisArtifact> artifacts;
    private Long durationMs;
    private String errorMessage;
}
