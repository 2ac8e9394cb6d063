package com.phillippitts.feedercontrol.domain;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Append-only audit entry written under {@code alerts/logs} on every logged transition.
 *
 * @param alertId id of the alert; {@code null} for a trigger, whose id is the key of the entry itself
 */
public record AlertLogEntry(
        String alertId,
        String sensorKey,
        AlertLevel level,
        double value,
        Thresholds thresholds,
        Instant timestamp,
        AlertAction action
) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        if (alertId != null) {
            map.put("alert_id", alertId);
        }
        map.put("sensorKey", sensorKey);
        map.put("level", level.wireName());
        map.put("value", value);
        map.put("thresholds", thresholds.toMap());
        map.put("timestamp", timestamp.toString());
        map.put("action", action.wireName());
        return map;
    }
}
