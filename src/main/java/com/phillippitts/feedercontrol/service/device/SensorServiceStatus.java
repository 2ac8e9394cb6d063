package com.phillippitts.feedercontrol.service.device;

import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsed reply to {@code sensors:status}.
 *
 * <p>The device answers with lines such as {@code Sensor service status: ACTIVE} and
 * {@code Print interval: 1000ms}.
 *
 * @param status {@code ACTIVE}, {@code INACTIVE} or {@code UNKNOWN}
 * @param intervalMs print interval, {@code null} if not reported
 */
public record SensorServiceStatus(
        boolean success,
        String status,
        boolean running,
        Integer intervalMs,
        List<String> rawResponses,
        String error
) {

    private static final Pattern INTERVAL = Pattern.compile("(\\d{1,9})ms");

    static SensorServiceStatus from(CommandResult result) {
        if (!result.success()) {
            return new SensorServiceStatus(false, "UNKNOWN", false, null, result.responses(), result.error());
        }
        String status = "UNKNOWN";
        Integer interval = null;
        for (String line : result.responses()) {
            if (line.contains("Sensor service status:")) {
                if (line.endsWith("INACTIVE")) {
                    status = "INACTIVE";
                } else if (line.endsWith("ACTIVE")) {
                    status = "ACTIVE";
                }
            } else if (line.contains("Print interval:")) {
                Matcher m = INTERVAL.matcher(line);
                if (m.find()) {
                    interval = Integer.parseInt(m.group(1));
                }
            }
        }
        return new SensorServiceStatus(true, status, "ACTIVE".equals(status), interval, result.responses(), null);
    }
}
