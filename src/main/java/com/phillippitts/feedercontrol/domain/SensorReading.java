package com.phillippitts.feedercontrol.domain;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Latest values reported by one named sensor on the device (e.g. {@code DHT22_FEEDER}).
 */
public record SensorReading(String sensorName, List<SensorValue> values, Instant updatedAt) {

    public SensorReading {
        values = List.copyOf(values);
    }

    public Optional<Double> valueOf(String type) {
        return values.stream()
                .filter(v -> type.equals(v.type()))
                .map(SensorValue::value)
                .findFirst();
    }
}
