package com.phillippitts.feedercontrol.service.health;

import com.phillippitts.feedercontrol.config.properties.DeviceLinkProperties;
import com.phillippitts.feedercontrol.service.device.DeviceLink;
import com.phillippitts.feedercontrol.service.device.LinkState;
import com.phillippitts.feedercontrol.service.device.LinkStatus;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.boot.actuate.health.Health;
import org.springframework.boot.actuate.health.Status;

import static org.assertj.core.api.Assertions.assertThat;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.when;

class DeviceLinkHealthIndicatorTest {

    private DeviceLink deviceLink;
    private DeviceLinkProperties props;
    private DeviceLinkHealthIndicator indicator;

    @BeforeEach
    void setUp() {
        deviceLink = mock(DeviceLink.class);
        props = new DeviceLinkProperties();
        indicator = new DeviceLinkHealthIndicator(deviceLink, props);
    }

    @Test
    void shouldReportUpWhenConnected() {
        when(deviceLink.status()).thenReturn(new LinkStatus(LinkState.CONNECTED, "/dev/ttyUSB0", true, 0, null, 1, null));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.UP);
        assertThat(health.getDetails()).containsEntry("address", "/dev/ttyUSB0");
        assertThat(health.getDetails()).containsEntry("pendingCommands", 1);
        assertThat(health.getDetails()).doesNotContainKey("lastError");
    }

    @Test
    void shouldReportDegradedWhileConnecting() {
        when(deviceLink.status()).thenReturn(new LinkStatus(LinkState.CONNECTING, "/dev/ttyUSB0", false, 2, "busy", 0, null));

        assertThat(indicator.health().getStatus()).isEqualTo(new Status("DEGRADED"));
    }

    @Test
    void shouldReportDownWithLastError() {
        when(deviceLink.status()).thenReturn(new LinkStatus(LinkState.DISCONNECTED, null, false, 5, "No serial device found", 0, null));

        Health health = indicator.health();

        assertThat(health.getStatus()).isEqualTo(Status.DOWN);
        assertThat(health.getDetails()).containsEntry("address", "unknown");
        assertThat(health.getDetails()).containsEntry("lastError", "No serial device found");
    }

    @Test
    void shouldReportUnknownWhenDisabled() {
        props.setEnabled(false);

        assertThat(indicator.health().getStatus()).isEqualTo(Status.UNKNOWN);
    }
}
