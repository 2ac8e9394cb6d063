package com.phillippitts.feedercontrol.domain;

/**
 * Direction in which a metric becomes alarming.
 */
public enum AlertMode {
    /** Alert when the value is at or above the threshold (humidity, moisture). */
    HIGH,
    /** Alert when the value is at or below the threshold (remaining food weight). */
    LOW
}
