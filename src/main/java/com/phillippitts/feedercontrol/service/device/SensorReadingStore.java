package com.phillippitts.feedercontrol.service.device;

import com.phillippitts.feedercontrol.domain.SensorReading;
import org.springframework.stereotype.Component;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Latest reading per sensor name.
 *
 * <p>Written by the device reader thread only. Readers always get a complete immutable snapshot,
 * possibly slightly stale.
 */
@Component
public class SensorReadingStore {

    private final AtomicReference<Map<String, SensorReading>> latest = new AtomicReference<>(Map.of());

    public void update(SensorReading reading) {
        latest.updateAndGet(previous -> {
            Map<String, SensorReading> next = new LinkedHashMap<>(previous);
            next.put(reading.sensorName(), reading);
            return Collections.unmodifiableMap(next);
        });
    }

    public Map<String, SensorReading> snapshot() {
        return latest.get();
    }

    public Optional<SensorReading> get(String sensorName) {
        return Optional.ofNullable(latest.get().get(sensorName));
    }

    /** Latest value of one measurement type of one sensor, if reported. */
    public Optional<Double> value(String sensorName, String type) {
        return get(sensorName).flatMap(r -> r.valueOf(type));
    }
}
