package com.example.obd2live.service;

import com.example.obd2live.analysis.AnalysisEngine;
import com.example.obd2live.analysis.AnalysisOutcome;
import com.example.obd2live.analysis.AnalysisRequest;
import com.example.obd2live.exception.AnalysisEngineException;
import com.example.obd2live.model.AnalysisArtifact;
import com.example.obd2live.model.AnalysisKind;
import com.example.obd2live.model.AnalysisRecord;
import com.example.obd2live.model.AnalysisStatus;
import com.example.obd2live.store.StoreClient;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class AnalysisRunnerTest {

    private static final String SESSION_ID = "65f1c0a2b3d4e5f601234567";

    @Mock
    private StoreClient store;

    @Mock
    private AnalysisEngine engine;

    private AnalysisRunner runner;
    private List<AnalysisStatus> persistedStatuses;

    @BeforeEach
    void setUp() {
        runner = new AnalysisRunner(store, engine);
        persistedStatuses = new ArrayList<>();
    }

    private void recordPersistedStatuses() {
        when(store.saveAnalysis(any(AnalysisRecord.class))).thenAnswer(invocation -> {
            AnalysisRecord record = invocation.getArgument(0);
            persistedStatuses.add(record.getStatus());
            return record;
        });
    }

    @Test
    void testNewAnalysisId_Format() {
        String id = AnalysisRunner.newAnalysisId();
        assertTrue(id.matches("analysis_[0-9a-z]+_[0-9a-z]{6}"), id);
        assertNotEquals(id, AnalysisRunner.newAnalysisId());
    }

    @Test
    void testRun_Success_PassesThroughPendingAndProcessing() {
        // Given
        recordPersistedStatuses();
        Instant from = Instant.now().minusSeconds(60);
        Instant to = Instant.now();
        AnalysisArtifact plot = AnalysisArtifact.builder().filename("rpm.png").mimeType("image/png").build();
        when(engine.analyze(any(AnalysisRequest.class))).thenReturn(AnalysisOutcome.builder()
                .status("completed")
                .result(Map.of("avgRpm", 1500))
                .artifacts(List.of(plot))
                .build());

        // When
        AnalysisRecord record = runner.run(SESSION_ID, AnalysisKind.INTERVAL, "1m", from, to, 42);

        // Then
        assertEquals(List.of(AnalysisStatus.PENDING, AnalysisStatus.PROCESSING, AnalysisStatus.COMPLETED), persistedStatuses);
        assertEquals(AnalysisStatus.COMPLETED, record.getStatus());
        assertEquals(42, record.getDataPointCount());
        assertEquals(1500, record.getResult().get("avgRpm"));
        assertEquals(List.of(plot), record.getArtifacts());
        assertNotNull(record.getDurationMs());

        ArgumentCaptor<AnalysisRequest> request = ArgumentCaptor.forClass(AnalysisRequest.class);
        verify(engine).analyze(request.capture());
        assertEquals(record.getAnalysisId(), request.getValue().getAnalysisId());
        assertEquals(from, request.getValue().getTimeRangeStart());
        assertEquals(to, request.getValue().getTimeRangeEnd());
    }

    @Test
    void testRun_EngineException_RecordedAsFailed() {
        // Given
        recordPersistedStatuses();
        when(engine.analyze(any(AnalysisRequest.class)))
                .thenThrow(new AnalysisEngineException("Analysis engine returned 400 for x", false));

        // When
        AnalysisRecord record = runner.run(SESSION_ID, AnalysisKind.FINAL, "final", Instant.now(), Instant.now(), 3);

        // Then
        assertEquals(AnalysisStatus.FAILED, record.getStatus());
        assertEquals("Analysis engine returned 400 for x", record.getErrorMessage());
        assertEquals(AnalysisStatus.FAILED, persistedStatuses.get(persistedStatuses.size() - 1));
    }

    @Test
    void testRun_EngineReportsFailure_RecordedAsFailed() {
        // Given
        when(engine.analyze(any(AnalysisRequest.class))).thenReturn(AnalysisOutcome.builder()
                .status("failed")
                .error("not enough samples")
                .build());

        // When
        AnalysisRecord record = runner.run(SESSION_ID, AnalysisKind.INTERVAL, "15s", Instant.now(), Instant.now(), 1);

        // Then
        assertEquals(AnalysisStatus.FAILED, record.getStatus());
        assertEquals("not enough samples", record.getErrorMessage());
    }

    @Test
    void testRun_StoreFailureDoesNotEscape() {
        // Given
        when(store.saveAnalysis(any(AnalysisRecord.class))).thenThrow(new RuntimeException("store down"));
        when(engine.analyze(any(AnalysisRequest.class))).thenReturn(AnalysisOutcome.builder().status("completed").build());

        // When
        AnalysisRecord record = runner.run(SESSION_ID, AnalysisKind.INTERVAL, "2m", Instant.now(), Instant.now(), 1);

        // Then
        assertEquals(AnalysisStatus.COMPLETED, record.getStatus());
        verify(store, times(3)).saveAnalysis(any(AnalysisRecord.class));
    }

    @Test
    void testSkip_RecordsReasonWithoutEngineCall() {
        // When
        AnalysisRecord record = runner.skip(SESSION_ID, AnalysisKind.INTERVAL, "15s", Instant.now(), Instant.now(), "no data");

        // Then
        assertEquals(AnalysisStatus.SKIPPED, record.getStatus());
        assertEquals("no data", record.getErrorMessage());
        verify(store).saveAnalysis(record);
        verifyNoInteractions(engine);
    }

    @Test
    void testSummarize_OmitsAbsentFields() {
        // Given
        AnalysisRecord record = AnalysisRecord.builder()
                .analysisId("analysis_abc_123456")
                .status(AnalysisStatus.SKIPPED)
                .timestamp(Instant.now())
                .build();

        // When
        Map<String, Object> summary = AnalysisRunner.summarize(record);

        // Then
        assertEquals(List.of("analysisId", "status", "timestamp", "dataPointCount"),
                summary.keySet().stream().collect(Collectors.toList()));
        assertEquals("SKIPPED", summary.get("status"));
    }
}
