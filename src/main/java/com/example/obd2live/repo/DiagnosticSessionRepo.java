package com.example.obd2live.repo;

import com.example.obd2live.model.DiagnosticSession;
import org.springframework.data.mongodb.repository.MongoRepository;

public interface DiagnosticSessionRepo extends MongoRepository<DiagnosticSession, String> {}
