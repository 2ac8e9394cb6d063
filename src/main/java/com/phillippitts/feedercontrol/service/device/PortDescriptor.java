package com.phillippitts.feedercontrol.service.device;

/**
 * One enumerated serial port.
 *
 * @param systemPath OS path used to open the port (e.g. {@code /dev/ttyUSB0}, {@code COM3})
 * @param description human-readable description reported by the driver; may be empty
 * @param vendorId USB vendor id, or {@code -1} when unknown
 */
public record PortDescriptor(String systemPath, String description, int vendorId) {

    public PortDescriptor {
        description = description == null ? "" : description;
    }
}
