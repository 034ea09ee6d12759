package com.example.obd2live.model;

import com.fasterxml.jackson.annotation.JsonAnyGetter;
import com.fasterxml.jackson.annotation.JsonAnySetter;
import com.fasterxml.jackson.annotation.JsonInclude;
import lombok.*;
import org.springframework.data.annotation.Id;
import org.springframework.data.mongodb.core.index.CompoundIndex;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One timestamped sensor snapshot. Parameters the vehicle does not report stay
 * null; anything outside the well-known set is kept in {@link #additionalFields}.
 */
@Data
@NoArgsConstructor
@AllArgsConstructor
@Builder(toBuilder = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
@Document("obd2_data_points")
@CompoundIndex(name = "session_ts", def = "{'sessionId': 1, 'timestamp': -1}")
public class DataPoint {
    @Id
    private String id;
    private String sessionId;
    private Instant timestamp;

    // Engine
    private Double rpm;
    private Double speed;
    private Double engineTemp;
    private Double intakeTemp;
    private Double ambientTemp;

    // Throttle and load
    private Double throttlePosition;
    private Double engineLoad;
    private Double absoluteLoad;

    // Fuel system
    private Double fuelLevel;
    private Double fuelRate;
    private Double fuelPressure;
    private Double fuelTrimShortB1;
    private Double fuelTrimLongB1;
    private Double fuelTrimShortB2;
    private Double fuelTrimLongB2;
    private String fuelSystemStatus;

    // Air flow and pressure
    private Double maf;
    private Double map;
    private Double barometricPressure;

    private Double batteryVoltage;
    private Double o2B1S1Voltage;
    private Double o2B1S2Voltage;
    private Double timingAdvance;
    private Double runtime;
    private Double catalystTempB1S1;

    @Builder.Default
    private Map<String, Object> additionalFields = new LinkedHashMap<>();

    @JsonAnySetter
    public void putAdditionalField(String name, Object value) {
        if (additionalFields == null) {
            additionalFields = new LinkedHashMap<>();
        }
        additionalFields.put(name, value);
    }

    @JsonAnyGetter
    public Map<String, Object> getAdditionalFields() {
        return additionalFields;
    }
}
