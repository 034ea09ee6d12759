package com.example.obd2live.analysis;

import com.example.obd2live.model.AnalysisKind;
import lombok.*;

import java.time.Instant;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalysisRequest {
    private String analysisId;
    private String sessionId;
    private AnalysisKind kind;
    private String label;
    private Instant timeRangeStart;
    private Instant timeRangeEnd;
}
