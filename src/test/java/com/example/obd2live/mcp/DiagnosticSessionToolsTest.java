package com.example.obd2live.mcp;

import com.example.obd2live.model.DataPoint;
import com.example.obd2live.model.DiagnosticSession;
import com.example.obd2live.model.SessionStatus;
import com.example.obd2live.service.DiagnosticSessionService;
import com.example.obd2live.service.IngestionBuffer;
import com.example.obd2live.service.IntervalAnalysisScheduler;
import com.example.obd2live.service.LiveDataService;
import com.example.obd2live.service.SharedSessionService;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

@ExtendWith(MockitoExtension.class)
class DiagnosticSessionToolsTest {

    private static final String SESSION_ID = "65f1c0a2b3d4e5f601234567";

    @Mock
    private DiagnosticSessionService sessionService;

    @Mock
    private LiveDataService liveData;

    @Mock
    private IntervalAnalysisScheduler intervalScheduler;

    @Mock
    private SharedSessionService sharedSessions;

    @Mock
    private IngestionBuffer ingestionBuffer;

    private DiagnosticSessionTools tools;

    @BeforeEach
    void setUp() {
        tools = new DiagnosticSessionTools(sessionService, liveData, intervalScheduler, sharedSessions,
                ingestionBuffer, new ObjectMapper().findAndRegisterModules());
    }

    @Test
    void testAddDataPoint_ConvertsSensorMapIntoDataPoint() {
        // When
        Map<String, Object> result = tools.session_addDataPoint(SESSION_ID,
                Map.of("rpm", 1800, "speed", 42.5, "oilPressure", 3.1));

        // Then
        assertEquals(true, result.get("ok"));
        ArgumentCaptor<DataPoint> point = ArgumentCaptor.forClass(DataPoint.class);
        verify(sessionService).addDataPoint(eq(SESSION_ID), point.capture());
        assertEquals(1800.0, point.getValue().getRpm());
        assertEquals(42.5, point.getValue().getSpeed());
        assertEquals(3.1, point.getValue().getAdditionalFields().get("oilPressure"));
    }

    @Test
    void testUpdateStatus_AcceptsLowercaseStatus() {
        // Given
        when(sessionService.updateStatus(SESSION_ID, SessionStatus.PAUSED)).thenReturn(DiagnosticSession.builder()
                .id(SESSION_ID)
                .status(SessionStatus.PAUSED)
                .build());

        // When
        Map<String, Object> result = tools.session_updateStatus(SESSION_ID, " paused ");

        // Then
        assertEquals("PAUSED", result.get("status"));
    }

    @Test
    void testRecent_DefaultsMissingArguments() {
        // When
        tools.session_recent(SESSION_ID, null, null);

        // Then
        verify(liveData).recentSince(SESSION_ID, 0L, 0);
    }
}
