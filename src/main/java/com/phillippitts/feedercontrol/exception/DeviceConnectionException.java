package com.phillippitts.feedercontrol.exception;

/**
 * Thrown when the serial link to the device cannot be opened or reopened
 * (port busy, missing, or permission denied), or when a command needs an open link and none exists.
 *
 * <p>Recoverable: the device reader retries with bounded backoff.
 */
public class DeviceConnectionException extends FeederControlException {

    private final String address;

    public DeviceConnectionException(String message) {
        super(message);
        this.address = null;
    }

    public DeviceConnectionException(String message, String address) {
        super(message + " (address: " + address + ")");
        this.address = address;
    }

    public DeviceConnectionException(String message, String address, Throwable cause) {
        super(message + " (address: " + address + ")", cause);
        this.address = address;
    }

    /**
     * @return serial address involved, or {@code null} when no address was known
     */
    public String getAddress() {
        return address;
    }
}
