package com.phillippitts.feedercontrol.service.feeder;

import com.phillippitts.feedercontrol.service.device.DeviceLink;
import com.phillippitts.feedercontrol.service.settings.ConfigSource;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

/**
 * Sends {@code feeder:start:<size>,<blower>,<tolerance>} to the device. The firmware runs the
 * whole routine (open until the weight drops by the feed size, close, blow) on its own.
 */
@Component
public class DeviceFeederActuator implements FeederActuator {

    private static final Logger LOG = LogManager.getLogger(DeviceFeederActuator.class);

    private final DeviceLink deviceLink;
    private final ConfigSource configSource;

    public DeviceFeederActuator(DeviceLink deviceLink, ConfigSource configSource) {
        this.deviceLink = deviceLink;
        this.configSource = configSource;
    }

    @Override
    public boolean startFeeding(int feedSizeGrams, int blowerDurationSeconds) {
        if (feedSizeGrams <= 0) {
            LOG.warn("Ignoring feed request with non-positive size {}g", feedSizeGrams);
            return false;
        }
        int tolerance = configSource.feederWeightTolerance();
        String command = "feeder:start:" + feedSizeGrams + "," + Math.max(0, blowerDurationSeconds) + "," + tolerance;
        boolean sent = deviceLink.sendCommand(command);
        if (sent) {
            LOG.info("Feeding started: size={}g, blower={}s, tolerance={}g", feedSizeGrams, blowerDurationSeconds, tolerance);
        } else {
            LOG.error("Feeding command not delivered: {}", command);
        }
        return sent;
    }
}
