package com.phillippitts.feedercontrol.presentation.exception;

import com.phillippitts.feedercontrol.exception.CommandTimeoutException;
import com.phillippitts.feedercontrol.exception.DeviceConnectionException;
import com.phillippitts.feedercontrol.exception.SettingsValidationException;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.http.HttpStatus;
import org.springframework.http.ResponseEntity;

import java.time.Duration;

import static org.assertj.core.api.Assertions.assertThat;

class GlobalExceptionHandlerTest {

    private GlobalExceptionHandler handler;

    @BeforeEach
    void setUp() {
        handler = new GlobalExceptionHandler();
    }

    @Test
    void invalidSettingsReturns400WithField() {
        SettingsValidationException ex = new SettingsValidationException("syncSensors", "must not be negative");

        ResponseEntity<?> response = handler.handleInvalidSettings(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.BAD_REQUEST);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("SettingsValidationException")
                .contains("Invalid scheduler settings")
                .contains("syncSensors");
    }

    @Test
    void deviceUnavailableReturns503WithoutAddress() {
        DeviceConnectionException ex = new DeviceConnectionException("Serial port not found", "/dev/ttyUSB7");

        ResponseEntity<?> response = handler.handleDeviceUnavailable(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.SERVICE_UNAVAILABLE);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("Feeder device unavailable")
                .doesNotContain("/dev/ttyUSB7");
    }

    @Test
    void commandTimeoutReturns504() {
        CommandTimeoutException ex = new CommandTimeoutException("sensors:status", Duration.ofMillis(5000));

        ResponseEntity<?> response = handler.handleCommandTimeout(ex);

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.GATEWAY_TIMEOUT);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString()).contains("No complete response within 5000ms");
    }

    @Test
    void unexpectedErrorDoesNotLeakMessage() {
        ResponseEntity<?> response = handler.handleUnexpected(new IllegalStateException("secret internals"));

        assertThat(response.getStatusCode()).isEqualTo(HttpStatus.INTERNAL_SERVER_ERROR);
        assertThat(response.getBody()).isNotNull();
        assertThat(response.getBody().toString())
                .contains("InternalServerError")
                .doesNotContain("secret internals");
        assertThat(response.getBody().toString()).matches(".*timestamp=\\d{4}-\\d{2}-\\d{2}T.*");
    }
}
