package com.phillippitts.feedercontrol.service.health;

import com.phillippitts.feedercontrol.config.properties.DeviceLinkProperties;
import com.phillippitts.feedercontrol.service.device.DeviceLink;
import com.phillippitts.feedercontrol.service.device.LinkState;
import com.phillippitts.feedercontrol.service.device.LinkStatus;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.HealthIndicator;
import org.springframework.stereotype.Component;

/**
 * Health indicator for the serial link to the feeder device.
 *
 * <p>Reports:
 * <ul>
 *   <li>UP: connected</li>
 *   <li>DEGRADED: connecting or reconnecting</li>
 *   <li>DOWN: disconnected</li>
 *   <li>UNKNOWN: link disabled by configuration</li>
 * </ul>
 *
 * <p>Exposed via /actuator/health as {@code deviceLink}.
 */
@Component("deviceLink")
public class DeviceLinkHealthIndicator implements HealthIndicator {

    private final DeviceLink deviceLink;
    private final DeviceLinkProperties props;

    public DeviceLinkHealthIndicator(DeviceLink deviceLink, DeviceLinkProperties props) {
        this.deviceLink = deviceLink;
        this.props = props;
    }

    @Override
    public Health health() {
        if (!props.isEnabled()) {
            return Health.unknown().withDetail("status", "Device link disabled").build();
        }
        LinkStatus status = deviceLink.status();
        Health.Builder builder;
        if (status.state() == LinkState.CONNECTED) {
            builder = Health.up();
        } else if (status.state() == LinkState.CONNECTING) {
            builder = Health.status("DEGRADED");
        } else {
            builder = Health.down();
        }
        builder.withDetail("state", status.state().name())
                .withDetail("address", status.address() == null ? "unknown" : status.address())
                .withDetail("reconnectAttempts", status.reconnectAttempts())
                .withDetail("pendingCommands", status.pendingCommands());
        if (status.lastError() != null) {
            builder.withDetail("lastError", status.lastError());
        }
        if (status.lastFrameAt() != null) {
            builder.withDetail("lastFrameAt", status.lastFrameAt().toString());
        }
        return builder.build();
    }
}
