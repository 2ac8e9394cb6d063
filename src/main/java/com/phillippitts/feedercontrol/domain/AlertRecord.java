package com.phillippitts.feedercontrol.domain;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Projection of an active alert as stored under {@code alerts/active/<sensorKey>}.
 * Instances are immutable; each evaluation produces a new one.
 */
public record AlertRecord(
        String sensorKey,
        AlertLevel level,
        double value,
        Thresholds thresholds,
        String alertId,
        boolean acknowledged,
        Instant firstSeenAt,
        Instant lastUpdatedAt
) {

    public AlertRecord withEvaluation(AlertLevel newLevel, double newValue, Thresholds newThresholds,
                                      boolean ack, Instant now) {
        return new AlertRecord(sensorKey, newLevel, newValue, newThresholds, alertId, ack, firstSeenAt, now);
    }

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("sensorKey", sensorKey);
        map.put("level", level.wireName());
        map.put("value", value);
        map.put("thresholds", thresholds.toMap());
        map.put("alert_id", alertId);
        map.put("acknowledged", acknowledged);
        map.put("timestamp_first_seen", firstSeenAt.toString());
        map.put("last_updated", lastUpdatedAt.toString());
        return map;
    }

    /**
     * Rebuilds a record from its stored form. Returns {@code null} when the entry is not a map
     * or carries no alert id, which the evaluator treats as "no active alert".
     */
    public static AlertRecord fromMap(String sensorKey, Object raw, Instant now) {
        if (!(raw instanceof Map<?, ?> map)) {
            return null;
        }
        Object id = map.get("alert_id");
        if (id == null || id.toString().isBlank()) {
            return null;
        }
        Thresholds thresholds = new Thresholds(0, 0);
        if (map.get("thresholds") instanceof Map<?, ?> t) {
            thresholds = new Thresholds(number(t.get("warning")), number(t.get("critical")));
        }
        return new AlertRecord(
                sensorKey,
                AlertLevel.fromWire(map.get("level")),
                number(map.get("value")),
                thresholds,
                id.toString(),
                Boolean.TRUE.equals(map.get("acknowledged")),
                instant(map.get("timestamp_first_seen"), now),
                instant(map.get("last_updated"), now));
    }

    private static double number(Object raw) {
        return raw instanceof Number n ? n.doubleValue() : 0.0;
    }

    private static Instant instant(Object raw, Instant fallback) {
        if (raw == null) {
            return fallback;
        }
        try {
            return Instant.parse(raw.toString());
        } catch (RuntimeException e) {
            return fallback;
        }
    }
}
