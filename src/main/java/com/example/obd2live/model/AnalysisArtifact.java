package com.example.obd2live.model;

import lombok.*;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class AnalysisArtifact {
    private String filename;
    private String mimeType;
    private String description;
    private String base64;
}
