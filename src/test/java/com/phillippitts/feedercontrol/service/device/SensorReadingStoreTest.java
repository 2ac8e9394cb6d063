package com.phillippitts.feedercontrol.service.device;

import com.phillippitts.feedercontrol.domain.SensorReading;
import com.phillippitts.feedercontrol.domain.SensorValue;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class SensorReadingStoreTest {

    @Test
    void latestReadingPerSensorWins() {
        SensorReadingStore store = new SensorReadingStore();
        store.update(new SensorReading("DHT22_FEEDER", List.of(new SensorValue("humidity", "%", 60)), Instant.EPOCH));
        store.update(new SensorReading("DHT22_FEEDER", List.of(new SensorValue("humidity", "%", 65)), Instant.EPOCH));

        assertThat(store.value("DHT22_FEEDER", "humidity")).contains(65.0);
        assertThat(store.value("DHT22_FEEDER", "temperature")).isEmpty();
        assertThat(store.value("SOIL_MOISTURE", "soil_moisture")).isEmpty();
    }

    @Test
    void snapshotIsImmutableAndDetached() {
        SensorReadingStore store = new SensorReadingStore();
        store.update(new SensorReading("A", List.of(), Instant.EPOCH));
        Map<String, SensorReading> snapshot = store.snapshot();

        store.update(new SensorReading("B", List.of(), Instant.EPOCH));

        assertThat(snapshot).containsOnlyKeys("A");
        assertThatThrownBy(() -> snapshot.put("C", null)).isInstanceOf(UnsupportedOperationException.class);
    }
}
