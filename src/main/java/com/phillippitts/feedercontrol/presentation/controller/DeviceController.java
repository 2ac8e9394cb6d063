package com.phillippitts.feedercontrol.presentation.controller;

import com.phillippitts.feedercontrol.config.properties.DeviceLinkProperties;
import com.phillippitts.feedercontrol.service.device.CommandResult;
import com.phillippitts.feedercontrol.service.device.DeviceLink;
import com.phillippitts.feedercontrol.service.device.LinkStatus;
import com.phillippitts.feedercontrol.service.device.SensorServiceStatus;
import jakarta.validation.Valid;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.Pattern;
import jakarta.validation.constraints.Positive;
import org.springframework.http.ResponseEntity;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RestController;

import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * REST adapter over {@link DeviceLink}: link status, ad-hoc commands and the sensor service query.
 */
@RestController
@RequestMapping("/api/device")
class DeviceController {

    private final DeviceLink deviceLink;
    private final DeviceLinkProperties props;

    DeviceController(DeviceLink deviceLink, DeviceLinkProperties props) {
        this.deviceLink = deviceLink;
        this.props = props;
    }

    @GetMapping("/status")
    ResponseEntity<LinkStatus> status() {
        return ResponseEntity.ok(deviceLink.status());
    }

    /**
     * Sends a command and waits for its response lines.
     *
     * <p>503 when the device is not connected, 504 when no complete response arrived in time.
     */
    @PostMapping("/command")
    ResponseEntity<Map<String, Object>> command(@Valid @RequestBody CommandRequest request) {
        Duration timeout = request.timeoutMs() == null
                ? props.getCommandTimeout()
                : Duration.ofMillis(request.timeoutMs());
        CommandResult result = deviceLink.sendCommandAwaitResponse(request.command().trim(), timeout);
        List<String> responses = result.orThrow();
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("command", result.command());
        body.put("responses", responses);
        return ResponseEntity.ok(body);
    }

    @GetMapping("/sensors/status")
    ResponseEntity<SensorServiceStatus> sensorsStatus() {
        return ResponseEntity.ok(deviceLink.sensorsStatus());
    }

    /**
     * @param timeoutMs optional wait, defaults to {@code device.command-timeout}
     */
    record CommandRequest(
            @NotBlank @Pattern(regexp = "\\s*[^:\\s].*", message = "must start with a command family, e.g. relay:fan:on")
            String command,
            @Positive @Max(60_000) Long timeoutMs) {
    }
}
