package com.phillippitts.feedercontrol.service.device;

import com.phillippitts.feedercontrol.exception.DeviceConnectionException;

import java.time.Duration;
import java.util.List;

/**
 * Abstraction over the native serial library to enable hermetic testing of the device link.
 *
 * <p>Production code uses {@link JSerialCommPortProvider}. Tests provide a fake that enumerates
 * scripted ports and hands out in-memory connections.
 */
public interface SerialPortProvider {

    /**
     * Enumerates the serial ports currently present, in the order the OS reports them.
     */
    List<PortDescriptor> listPorts();

    /**
     * Opens a port.
     *
     * @throws DeviceConnectionException when the port is busy, missing, or access is denied
     */
    SerialConnection open(String address, int baudRate, Duration readTimeout);
}
