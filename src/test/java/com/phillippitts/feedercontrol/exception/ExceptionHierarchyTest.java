package com.phillippitts.feedercontrol.exception;

import org.junit.jupiter.api.Test;

import java.io.IOException;
import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class ExceptionHierarchyTest {

    @Test
    void feederControlExceptionShouldIncludeCause() {
        IOException cause = new IOException("IO failure");
        FeederControlException ex = new FeederControlException("wrapper error", cause);

        assertThat(ex.getMessage()).isEqualTo("wrapper error");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void deviceConnectionExceptionShouldIncludeAddress() {
        DeviceConnectionException ex = new DeviceConnectionException("Serial port not found", "/dev/ttyUSB0");

        assertThat(ex.getMessage()).contains("/dev/ttyUSB0");
        assertThat(ex.getAddress()).isEqualTo("/dev/ttyUSB0");
    }

    @Test
    void commandTimeoutExceptionShouldIncludeCommandAndTimeout() {
        CommandTimeoutException ex = new CommandTimeoutException("sensors:status", Duration.ofSeconds(5));

        assertThat(ex.getMessage()).contains("sensors:status").contains("5000ms");
        assertThat(ex.getCommand()).isEqualTo("sensors:status");
        assertThat(ex.getTimeout()).isEqualTo(Duration.ofSeconds(5));
    }

    @Test
    void configUnavailableExceptionShouldIncludePath() {
        ConfigUnavailableException ex = new ConfigUnavailableException("app_setting/duration", "timeout");

        assertThat(ex.getMessage()).contains("app_setting/duration").contains("timeout");
        assertThat(ex.getPath()).isEqualTo("app_setting/duration");
    }

    @Test
    void settingsValidationExceptionShouldIncludeField() {
        SettingsValidationException ex = new SettingsValidationException("syncSensors", "must not be negative");

        assertThat(ex.getField()).isEqualTo("syncSensors");
        assertThat(ex.getMessage()).contains("syncSensors");
    }

    @Test
    void transientJobExceptionShouldIncludeJobName() {
        RuntimeException cause = new RuntimeException("boom");
        TransientJobException ex = new TransientJobException("syncSensors", cause);

        assertThat(ex.getJobName()).isEqualTo("syncSensors");
        assertThat(ex.getCause()).isEqualTo(cause);
    }

    @Test
    void allExceptionsExtendFeederControlException() {
        assertThat(new DeviceConnectionException("x")).isInstanceOf(FeederControlException.class);
        assertThat(new CommandTimeoutException("c", Duration.ZERO)).isInstanceOf(FeederControlException.class);
        assertThat(new ConfigUnavailableException("p", "r")).isInstanceOf(FeederControlException.class);
        assertThat(new SettingsValidationException("f", "r")).isInstanceOf(FeederControlException.class);
        assertThat(new TransientJobException("j", new RuntimeException())).isInstanceOf(RuntimeException.class);
    }
}
