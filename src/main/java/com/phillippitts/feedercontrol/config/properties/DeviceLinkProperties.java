package com.phillippitts.feedercontrol.config.properties;

import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.Positive;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

import java.time.Duration;

/**
 * Configuration properties for the serial link to the feeder microcontroller.
 *
 * <p>Example application.properties:
 * <pre>
 * device.address=/dev/ttyUSB0
 * device.baud-rate=9600
 * device.max-reconnect-attempts=5
 * device.reconnect-delay=2s
 * device.reconnect-cooldown=60s
 * </pre>
 */
@ConfigurationProperties(prefix = "device")
@Validated
public class DeviceLinkProperties {

    /** Start the reader thread with the application. */
    private boolean enabled = true;

    /** Preferred serial address; blank means discover on startup. */
    private String address = "";

    @Positive(message = "Baud rate must be positive")
    private int baudRate = 9600;

    /** Bound on a single blocking read so the reader can observe shutdown. */
    @NotNull
    private Duration readTimeout = Duration.ofSeconds(1);

    /** Consecutive reconnect attempts before the reader cools down. */
    @Positive(message = "Max reconnect attempts must be positive")
    private int maxReconnectAttempts = 5;

    @NotNull
    private Duration reconnectDelay = Duration.ofSeconds(2);

    @NotNull
    private Duration reconnectCooldown = Duration.ofSeconds(60);

    /** Marker of structured-data lines, followed by one JSON object. */
    @NotBlank
    private String dataPrefix = "[SEND]";

    /** Marker of info/response lines. */
    @NotBlank
    private String infoPrefix = "[INFO]";

    /** Default wait for command responses. */
    @NotNull
    private Duration commandTimeout = Duration.ofSeconds(3);

    /** Lines longer than this are cut and treated as unrecognized. */
    @Positive
    private int maxLineLength = 4096;

    public boolean isEnabled() {
        return enabled;
    }

    public void setEnabled(boolean enabled) {
        this.enabled = enabled;
    }

    public String getAddress() {
        return address;
    }

    public void setAddress(String address) {
        this.address = address;
    }

    public int getBaudRate() {
        return baudRate;
    }

    public void setBaudRate(int baudRate) {
        this.baudRate = baudRate;
    }

    public Duration getReadTimeout() {
        return readTimeout;
    }

    public void setReadTimeout(Duration readTimeout) {
        this.readTimeout = readTimeout;
    }

    public int getMaxReconnectAttempts() {
        return maxReconnectAttempts;
    }

    public void setMaxReconnectAttempts(int maxReconnectAttempts) {
        this.maxReconnectAttempts = maxReconnectAttempts;
    }

    public Duration getReconnectDelay() {
        return reconnectDelay;
    }

    public void setReconnectDelay(Duration reconnectDelay) {
        this.reconnectDelay = reconnectDelay;
    }

    public Duration getReconnectCooldown() {
        return reconnectCooldown;
    }

    public void setReconnectCooldown(Duration reconnectCooldown) {
        this.reconnectCooldown = reconnectCooldown;
    }

    public String getDataPrefix() {
        return dataPrefix;
    }

    public void setDataPrefix(String dataPrefix) {
        this.dataPrefix = dataPrefix;
    }

    public String getInfoPrefix() {
        return infoPrefix;
    }

    public void setInfoPrefix(String infoPrefix) {
        this.infoPrefix = infoPrefix;
    }

    public Duration getCommandTimeout() {
        return commandTimeout;
    }

    public void setCommandTimeout(Duration commandTimeout) {
        this.commandTimeout = commandTimeout;
    }

    public int getMaxLineLength() {
        return maxLineLength;
    }

    public void setMaxLineLength(int maxLineLength) {
        this.maxLineLength = maxLineLength;
    }
}
