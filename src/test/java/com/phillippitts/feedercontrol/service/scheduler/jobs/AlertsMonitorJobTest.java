package com.phillippitts.feedercontrol.service.scheduler.jobs;

import com.phillippitts.feedercontrol.config.properties.SchedulerProperties;
import com.phillippitts.feedercontrol.domain.SensorReading;
import com.phillippitts.feedercontrol.domain.SensorValue;
import com.phillippitts.feedercontrol.domain.Thresholds;
import com.phillippitts.feedercontrol.service.alert.AlertEvaluator;
import com.phillippitts.feedercontrol.service.alert.AlertMetric;
import com.phillippitts.feedercontrol.service.device.SensorReadingStore;
import com.phillippitts.feedercontrol.service.settings.ConfigSource;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

class AlertsMonitorJobTest {

    private SensorReadingStore readings;
    private ConfigSource configSource;
    private AlertEvaluator evaluator;
    private AlertsMonitorJob job;

    @BeforeEach
    void setUp() {
        readings = new SensorReadingStore();
        configSource = mock(ConfigSource.class);
        evaluator = mock(AlertEvaluator.class);
        job = new AlertsMonitorJob(readings, configSource, evaluator, new SchedulerProperties());
    }

    @Test
    void skipsCycleWithoutReadings() {
        job.run();

        verifyNoInteractions(evaluator, configSource);
    }

    @Test
    void evaluatesOnlyReportedMetrics() {
        Map<AlertMetric, Thresholds> thresholds = Map.of(AlertMetric.FOOD_WEIGHT, new Thresholds(3, 2));
        when(configSource.loadAlertThresholds()).thenReturn(thresholds);
        readings.update(new SensorReading("HX711_FEEDER", List.of(new SensorValue("weight", "kg", 2.5)), Instant.EPOCH));
        readings.update(new SensorReading("DHT22_FEEDER", List.of(new SensorValue("temperature", "C", 25)), Instant.EPOCH));

        job.run();

        verify(evaluator).evaluateAll(eq(Map.of(AlertMetric.FOOD_WEIGHT, 2.5)), eq(thresholds));
    }

    @Test
    void passesThresholdsFromConfig() {
        when(configSource.loadAlertThresholds()).thenReturn(Map.of());
        readings.update(new SensorReading("SOIL_MOISTURE", List.of(new SensorValue("soil_moisture", "%", 65)), Instant.EPOCH));

        job.run();

        verify(evaluator).evaluateAll(eq(Map.of(AlertMetric.SOIL_MOISTURE, 65.0)), anyMap());
    }
}
