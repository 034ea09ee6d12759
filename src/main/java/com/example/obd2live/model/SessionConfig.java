package com.example.obd2live.model;

import lombok.*;

import java.util.List;
import java.util.Map;

/**
 * Input for starting a session. Stored as-is on the session document.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
public class SessionConfig {
    private String userId;
    private String vehicleId;
    private String sessionName;
    private Map<String, Object> vehicleInfo;
    private List<String> tags;
    private String sessionNotes;
    private List<String> selectedPids;
}
