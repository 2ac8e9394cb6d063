package com.phillippitts.feedercontrol.domain;

import java.util.Locale;

/**
 * Severity of a metric relative to its thresholds.
 */
public enum AlertLevel {
    NORMAL,
    WARNING,
    CRITICAL;

    /** Lower-case form used in the remote store. */
    public String wireName() {
        return name().toLowerCase(Locale.ROOT);
    }

    /** Parses the stored form; anything unknown or missing counts as {@link #NORMAL}. */
    public static AlertLevel fromWire(Object raw) {
        if (raw == null) {
            return NORMAL;
        }
        try {
            return valueOf(raw.toString().trim().toUpperCase(Locale.ROOT));
        } catch (IllegalArgumentException e) {
            return NORMAL;
        }
    }
}
