package com.phillippitts.feedercontrol.service.scheduler.jobs;

import com.phillippitts.feedercontrol.config.properties.DeviceLinkProperties;
import com.phillippitts.feedercontrol.config.properties.SchedulerProperties;
import com.phillippitts.feedercontrol.domain.SchedulerSettings;
import com.phillippitts.feedercontrol.service.device.CommandResult;
import com.phillippitts.feedercontrol.service.device.DeviceLink;
import com.phillippitts.feedercontrol.service.device.SensorReadingStore;
import com.phillippitts.feedercontrol.service.remote.RemoteStore;
import com.phillippitts.feedercontrol.service.scheduler.PeriodicJob;
import com.phillippitts.feedercontrol.service.settings.ConfigSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.Map;
import java.util.Optional;

/**
 * Mirrors {@code system_status} to the relays.
 *
 * <ul>
 *   <li>{@code is_fan_on} and {@code led_status} changes become {@code relay:fan:*} and
 *       {@code relay:led:*} commands.</li>
 *   <li>With {@code is_auto_temp_control} set, the fan follows the {@code DHT22_SYSTEM}
 *       temperature against {@code fan_activation_threshold}; the decision is written back to
 *       {@code system_status/is_fan_on}.</li>
 * </ul>
 */
@Component
public class SystemStatusMonitorJob implements PeriodicJob {

    private static final Logger LOG = LogManager.getLogger(SystemStatusMonitorJob.class);

    static final String SYSTEM_STATUS_PATH = "system_status";
    static final String FAN_PATH = "system_status/is_fan_on";

    private final RemoteStore remote;
    private final DeviceLink deviceLink;
    private final SensorReadingStore readings;
    private final SchedulerProperties props;
    private final DeviceLinkProperties deviceProps;

    // Relay states as last commanded; written by this job's worker only
    private volatile boolean fanOn;
    private volatile boolean ledOn;

    public SystemStatusMonitorJob(RemoteStore remote, DeviceLink deviceLink, SensorReadingStore readings,
                                  SchedulerProperties props, DeviceLinkProperties deviceProps) {
        this.remote = remote;
        this.deviceLink = deviceLink;
        this.readings = readings;
        this.props = props;
        this.deviceProps = deviceProps;
    }

    @Override
    public String name() {
        return "systemStatusMonitor";
    }

    @Override
    public int intervalSeconds(SchedulerSettings settings) {
        return props.getStatusMonitorInterval();
    }

    @Override
    public void run() {
        Map<String, Object> status = remote.getMap(SYSTEM_STATUS_PATH);
        if (status.isEmpty()) {
            LOG.debug("No system_status in remote store");
            return;
        }

        boolean wantFan = Boolean.TRUE.equals(status.get("is_fan_on"));
        if (wantFan != fanOn) {
            LOG.info("Fan status changed: {} -> {}", fanOn, wantFan);
            fanOn = wantFan;
            sendRelay("fan", wantFan);
        }

        boolean wantLed = Boolean.TRUE.equals(status.get("led_status"));
        if (wantLed != ledOn) {
            LOG.info("LED status changed: {} -> {}", ledOn, wantLed);
            ledOn = wantLed;
            sendRelay("led", wantLed);
        }

        if (Boolean.TRUE.equals(status.get("is_auto_temp_control"))) {
            autoTemperatureControl(ConfigSource.fanActivationThreshold(status));
        }
    }

    boolean isFanOn() {
        return fanOn;
    }

    boolean isLedOn() {
        return ledOn;
    }

    private void autoTemperatureControl(double threshold) {
        Optional<Double> temperature = readings.value("DHT22_SYSTEM", "temperature");
        if (temperature.isEmpty()) {
            LOG.debug("Auto temperature control: no DHT22_SYSTEM temperature yet");
            return;
        }
        boolean shouldBeOn = temperature.get() >= threshold;
        if (shouldBeOn == fanOn) {
            return;
        }
        LOG.info("Auto temperature control: fan {} (temp={}, threshold={})",
                shouldBeOn ? "ON" : "OFF", temperature.get(), threshold);
        remote.set(FAN_PATH, shouldBeOn);
        fanOn = shouldBeOn;
        sendRelay("fan", shouldBeOn);
    }

    private void sendRelay(String relay, boolean on) {
        String command = "relay:" + relay + ":" + (on ? "on" : "off");
        CommandResult result = deviceLink.sendCommandAwaitResponse(command, deviceProps.getCommandTimeout());
        if (result.success()) {
            LOG.info("Sent {}: {}", command, result.responses());
        } else {
            LOG.warn("Command {} not confirmed: {}", command, result.error());
        }
    }
}
