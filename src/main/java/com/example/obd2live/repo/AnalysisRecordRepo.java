package com.example.obd2live.repo;

import com.example.obd2live.model.AnalysisKind;
import com.example.obd2live.model.AnalysisRecord;
import org.springframework.data.mongodb.repository.MongoRepository;

import java.util.List;

public interface AnalysisRecordRepo extends MongoRepository<AnalysisRecord, String> {
    List<AnalysisRecord> findBySessionIdAndKindOrderByTimestampAsc(String sessionId, AnalysisKind kind);
    long deleteBySessionId(String sessionId);
}
