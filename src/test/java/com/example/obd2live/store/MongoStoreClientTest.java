package com.example.obd2live.store;

import com.example.obd2live.exception.TransientStoreException;
import com.example.obd2live.model.DiagnosticSession;
import com.example.obd2live.model.SessionStatus;
import com.example.obd2live.repo.AnalysisRecordRepo;
import com.example.obd2live.repo.DataPointRepo;
import com.example.obd2live.repo.DiagnosticSessionRepo;
import com.example.obd2live.repo.SharedSessionRepo;
import org.bson.Document;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.DataAccessResourceFailureException;
import org.springframework.data.mongodb.core.MongoTemplate;
import org.springframework.data.mongodb.core.query.Query;
import org.springframework.data.mongodb.core.query.Update;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class MongoStoreClientTest {

    private static final String SESSION_ID = "65f1c0a2b3d4e5f601234567";

    @Mock
    private MongoTemplate mongo;

    @Mock
    private DiagnosticSessionRepo sessionRepo;

    @Mock
    private DataPointRepo dataPointRepo;

    @Mock
    private AnalysisRecordRepo analysisRepo;

    @Mock
    private SharedSessionRepo sharedRepo;

    private MongoStoreClient storeClient;

    @BeforeEach
    void setUp() {
        storeClient = new MongoStoreClient(mongo, sessionRepo, dataPointRepo, analysisRepo, sharedRepo);
    }

    @Test
    void testUpdateSession_SetsEachFieldAndTouchesUpdatedAt() {
        // When
        storeClient.updateSession(SESSION_ID, Map.of("status", SessionStatus.PAUSED));

        // Then
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongo).updateFirst(any(Query.class), update.capture(), eq(DiagnosticSession.class));
        Document set = (Document) update.getValue().getUpdateObject().get("$set");
        assertEquals(SessionStatus.PAUSED, set.get("status"));
        assertTrue(set.containsKey("updatedAt"));
    }

    @Test
    void testIncrementSessionCounter_UsesInc() {
        // When
        storeClient.incrementSessionCounter(SESSION_ID, "dataPointCount", 10);

        // Then
        ArgumentCaptor<Update> update = ArgumentCaptor.forClass(Update.class);
        verify(mongo).updateFirst(any(Query.class), update.capture(), eq(DiagnosticSession.class));
        Document inc = (Document) update.getValue().getUpdateObject().get("$inc");
        assertEquals(10L, inc.get("dataPointCount"));
    }

    @Test
    void testCountDataPoints_DataAccessFailureIsTransient() {
        // Given
        when(dataPointRepo.countBySessionId(SESSION_ID))
                .thenThrow(new DataAccessResourceFailureException("connection refused"));

        // When / Then
        TransientStoreException e = assertThrows(TransientStoreException.class,
                () -> storeClient.countDataPoints(SESSION_ID));
        assertTrue(e.getMessage().contains(SESSION_ID));
    }

    @Test
    void testDeleteSessionCascade_RemovesDependentsBeforeSession() {
        // When
        storeClient.deleteSessionCascade(SESSION_ID);

        // Then
        verify(dataPointRepo).deleteBySessionId(SESSION_ID);
        verify(analysisRepo).deleteBySessionId(SESSION_ID);
        verify(sharedRepo).deleteBySessionId(SESSION_ID);
        verify(sessionRepo).deleteById(SESSION_ID);
    }
}
