package com.example.obd2live.repo;

import com.example.obd2live.model.DataPoint;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface DataPointRepo extends MongoRepository<DataPoint, String> {
    long countBySessionId(String sessionId);
    long deleteBySessionId(String sessionId);
}
