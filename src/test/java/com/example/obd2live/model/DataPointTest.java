package com.example.obd2live.model;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.Test;

import java.time.Instant;

import static org.junit.jupiter.api.Assertions.*;

class DataPointTest {

    private final ObjectMapper objectMapper = new ObjectMapper().findAndRegisterModules();

    @Test
    void testUnknownParametersKeptAsAdditionalFields() throws Exception {
        // Given
        String json = "{\"timestamp\":\"2024-03-01T10:15:30Z\",\"rpm\":2100.5,\"oilPressure\":3.2,\"dtcCodes\":[\"P0300\"]}";

        // When
        DataPoint point = objectMapper.readValue(json, DataPoint.class);

        // Then
        assertEquals(Instant.parse("2024-03-01T10:15:30Z"), point.getTimestamp());
        assertEquals(2100.5, point.getRpm());
        assertNull(point.getSpeed());
        assertEquals(3.2, point.getAdditionalFields().get("oilPressure"));
        assertTrue(point.getAdditionalFields().containsKey("dtcCodes"));
    }

    @Test
    void testAdditionalFieldsSerializedFlatAndNullsOmitted() throws Exception {
        // Given
        DataPoint point = DataPoint.builder()
                .sessionId("s1")
                .rpm(800.0)
                .build();
        point.putAdditionalField("oilPressure", 3.2);

        // When
        JsonNode node = objectMapper.readTree(objectMapper.writeValueAsString(point));

        // Then
        assertEquals(800.0, node.get("rpm").asDouble());
        assertEquals(3.2, node.get("oilPressure").asDouble());
        assertFalse(node.has("additionalFields"));
        assertFalse(node.has("speed"));
    }
}
