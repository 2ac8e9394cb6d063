package com.phillippitts.feedercontrol.service.scheduler.jobs;

import com.phillippitts.feedercontrol.domain.SchedulerSettings;
import com.phillippitts.feedercontrol.domain.SensorReading;
import com.phillippitts.feedercontrol.domain.SensorValue;
import com.phillippitts.feedercontrol.service.device.SensorReadingStore;
import com.phillippitts.feedercontrol.service.remote.RemoteStore;
import com.phillippitts.feedercontrol.service.scheduler.PeriodicJob;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Pushes the latest sensor readings to {@code sensors}.
 */
@Component
public class SyncSensorsJob implements PeriodicJob {

    private static final Logger LOG = LogManager.getLogger(SyncSensorsJob.class);

    static final String SENSORS_PATH = "sensors";

    private final SensorReadingStore readings;
    private final RemoteStore remote;

    public SyncSensorsJob(SensorReadingStore readings, RemoteStore remote) {
        this.readings = readings;
        this.remote = remote;
    }

    @Override
    public String name() {
        return SchedulerSettings.SYNC_SENSORS;
    }

    @Override
    public int intervalSeconds(SchedulerSettings settings) {
        return settings.syncSensors();
    }

    @Override
    public void run() {
        Map<String, SensorReading> snapshot = readings.snapshot();
        if (snapshot.isEmpty()) {
            LOG.debug("No sensor readings yet; nothing to sync");
            return;
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        snapshot.forEach((name, reading) -> {
            Map<String, Object> sensor = new LinkedHashMap<>();
            List<Map<String, Object>> values = reading.values().stream().map(SensorValue::toMap).toList();
            sensor.put("values", values);
            sensor.put("last_updated", reading.updatedAt().toString());
            payload.put(name, sensor);
        });
        remote.set(SENSORS_PATH, payload);
        LOG.info("Synced {} sensor(s) to remote store", payload.size());
    }
}
