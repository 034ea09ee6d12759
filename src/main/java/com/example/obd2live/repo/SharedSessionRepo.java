package com.example.obd2live.repo;

import com.example.obd2live.model.SharedSession;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;
import java.util.Optional;

public interface SharedSessionRepo extends MongoRepository<SharedSession, String> {
    Optional<SharedSession> findByShareCode(String shareCode);
    List<SharedSession> findBySessionIdAndActiveTrue(String sessionId);
    List<SharedSession> findByActiveTrue();
    long deleteBySessionId(String sessionId);
}
