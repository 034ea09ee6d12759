package com.example.obd2live.model;

import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.Indexed;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.Map;

@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder
@Document("shared_sessions")
public class SharedSession {
    @Id
    private String id;
    @Indexed(unique = true)
    private String shareCode;
    @Indexed
    private String sessionId;
    private String hostId;
    // clientId -> last seen
    private Map<String, Instant> connectedClients;
    private boolean active;
    private Instant createdAt;
    private Instant expiresAt;

    public boolean isExpired(Instant now) {
        return expiresAt != null && !now.isBefore(expiresAt);
    }
}
