package com.phillippitts.feedercontrol.service.alert;

import com.phillippitts.feedercontrol.domain.AlertMode;
import com.phillippitts.feedercontrol.domain.Thresholds;

/**
 * Metrics watched by the alerts monitor, with the sensor value each one reads and its built-in
 * thresholds.
 */
public enum AlertMetric {

    /** Feeder hopper humidity, percent. */
    DHT22_FEEDER_HUMIDITY("dht22_feeder_humidity", "DHT22_FEEDER", "humidity", AlertMode.HIGH,
            new Thresholds(70, 85), false),

    SOIL_MOISTURE("soil_moisture", "SOIL_MOISTURE", "soil_moisture", AlertMode.HIGH,
            new Thresholds(60, 80), false),

    /** Remaining food, kilograms. Absolute value, the load cell can read slightly negative. */
    FOOD_WEIGHT("food_weight", "HX711_FEEDER", "weight", AlertMode.LOW,
            new Thresholds(3.0, 2.0), true);

    private final String key;
    private final String sensorName;
    private final String valueType;
    private final AlertMode mode;
    private final Thresholds defaults;
    private final boolean absolute;

    AlertMetric(String key, String sensorName, String valueType, AlertMode mode, Thresholds defaults, boolean absolute) {
        this.key = key;
        this.sensorName = sensorName;
        this.valueType = valueType;
        this.mode = mode;
        this.defaults = defaults;
        this.absolute = absolute;
    }

    /** Key under {@code app_setting/alert} and {@code alerts/active}. */
    public String key() {
        return key;
    }

    public String sensorName() {
        return sensorName;
    }

    public String valueType() {
        return valueType;
    }

    public AlertMode mode() {
        return mode;
    }

    public Thresholds defaults() {
        return defaults;
    }

    public double normalize(double raw) {
        return absolute ? Math.abs(raw) : raw;
    }
}
