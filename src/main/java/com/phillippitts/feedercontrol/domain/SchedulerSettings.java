package com.phillippitts.feedercontrol.domain;

import com.phillippitts.feedercontrol.exception.SettingsValidationException;

import java.math.BigInteger;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Interval settings, in seconds, for the jobs whose cadence is tunable at runtime.
 *
 * <p>An interval of {@code 0} disables the job. Instances are immutable, so handing one out to a
 * reader is already a copy.
 *
 * @param syncSensors interval of the sensor push job
 * @param syncSchedule interval of the feed schedule pull job
 * @param syncFeedPreset interval of the feed preset pull job
 */
public record SchedulerSettings(int syncSensors, int syncSchedule, int syncFeedPreset) {

    public static final String SYNC_SENSORS = "syncSensors";
    public static final String SYNC_SCHEDULE = "syncSchedule";
    public static final String SYNC_FEED_PRESET = "syncFeedPreset";

    /** Keys in display order. */
    public static final List<String> KEYS = List.of(SYNC_SENSORS, SYNC_SCHEDULE, SYNC_FEED_PRESET);

    public static final int DEFAULT_INTERVAL_SECONDS = 10;

    public SchedulerSettings {
        requireNonNegative(SYNC_SENSORS, syncSensors);
        requireNonNegative(SYNC_SCHEDULE, syncSchedule);
        requireNonNegative(SYNC_FEED_PRESET, syncFeedPreset);
    }

    public static SchedulerSettings defaults() {
        return new SchedulerSettings(DEFAULT_INTERVAL_SECONDS, DEFAULT_INTERVAL_SECONDS, DEFAULT_INTERVAL_SECONDS);
    }

    public int intervalFor(String key) {
        return switch (key) {
            case SYNC_SENSORS -> syncSensors;
            case SYNC_SCHEDULE -> syncSchedule;
            case SYNC_FEED_PRESET -> syncFeedPreset;
            default -> throw new IllegalArgumentException("Unknown settings key: " + key);
        };
    }

    public SchedulerSettings with(String key, int seconds) {
        return switch (key) {
            case SYNC_SENSORS -> new SchedulerSettings(seconds, syncSchedule, syncFeedPreset);
            case SYNC_SCHEDULE -> new SchedulerSettings(syncSensors, seconds, syncFeedPreset);
            case SYNC_FEED_PRESET -> new SchedulerSettings(syncSensors, syncSchedule, seconds);
            default -> throw new IllegalArgumentException("Unknown settings key: " + key);
        };
    }

    public Map<String, Integer> toMap() {
        Map<String, Integer> map = new LinkedHashMap<>();
        for (String key : KEYS) {
            map.put(key, intervalFor(key));
        }
        return map;
    }

    /**
     * Validates a partial update and applies it on top of this instance.
     *
     * <p>Every provided key must be known and carry a non-negative integer. Validation happens
     * before anything is applied, so a rejected update never yields a half-merged result.
     *
     * @param partial provided fields only (may be empty)
     * @return merged settings
     * @throws SettingsValidationException on the first unknown key or invalid value
     */
    public SchedulerSettings mergedWith(Map<String, ?> partial) {
        Map<String, Integer> accepted = new LinkedHashMap<>();
        for (Map.Entry<String, ?> entry : partial.entrySet()) {
            String key = entry.getKey();
            if (!KEYS.contains(key)) {
                throw new SettingsValidationException(key, "unknown setting");
            }
            Integer value = strictInteger(entry.getValue());
            if (value == null || value < 0) {
                throw new SettingsValidationException(key, "must be a non-negative integer");
            }
            accepted.put(key, value);
        }
        SchedulerSettings merged = this;
        for (Map.Entry<String, Integer> entry : accepted.entrySet()) {
            merged = merged.with(entry.getKey(), entry.getValue());
        }
        return merged;
    }

    /**
     * Lenient read used for values coming back from the remote store or the cache file:
     * any whole number is taken, anything else keeps the fallback field.
     */
    public static SchedulerSettings fromMap(Map<String, ?> values, SchedulerSettings fallback) {
        SchedulerSettings result = fallback;
        if (values == null) {
            return result;
        }
        for (String key : KEYS) {
            Object raw = values.get(key);
            if (raw instanceof Number n && n.doubleValue() >= 0 && n.doubleValue() == Math.floor(n.doubleValue())) {
                result = result.with(key, n.intValue());
            }
        }
        return result;
    }

    private static Integer strictInteger(Object value) {
        if (value instanceof Integer i) {
            return i;
        }
        if (value instanceof Long || value instanceof Short || value instanceof Byte) {
            long l = ((Number) value).longValue();
            return l > Integer.MAX_VALUE || l < Integer.MIN_VALUE ? null : (int) l;
        }
        if (value instanceof BigInteger big) {
            return big.bitLength() < 32 ? big.intValue() : null;
        }
        return null;
    }

    private static void requireNonNegative(String key, int value) {
        if (value < 0) {
            throw new IllegalArgumentException(key + " must be >= 0 but was " + value);
        }
    }
}
