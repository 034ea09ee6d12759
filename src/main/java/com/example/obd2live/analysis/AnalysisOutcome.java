package com.example.obd2live.analysis;

import com.example.obd2live.model.AnalysisArtifact;
import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.*;

import java.util.List;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalysisOutcome {
    private String status;
    private Map<String, Object> result;
    private List<AnalysisArtifact> artifacts;
    private String error;

    @JsonIgnore
    public boolean isFailed() {
        return "failed".equalsIgnoreCase(status) || "error".equalsIgnoreCase(status);
    }
}
