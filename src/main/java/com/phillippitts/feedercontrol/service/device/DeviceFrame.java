package com.phillippitts.feedercontrol.service.device;

import com.phillippitts.feedercontrol.domain.SensorReading;

/**
 * One parsed line from the device. Produced only by {@link DeviceFrameParser}.
 */
public sealed interface DeviceFrame permits DeviceFrame.DataFrame, DeviceFrame.InfoLine, DeviceFrame.Unrecognized {

    /** Structured sensor data. */
    record DataFrame(SensorReading reading) implements DeviceFrame {
    }

    /** Info or command-response text, prefix removed. */
    record InfoLine(String text) implements DeviceFrame {
    }

    /** Anything else, kept for debug logging only. */
    record Unrecognized(String raw, String reason) implements DeviceFrame {
    }
}
