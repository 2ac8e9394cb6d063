package com.phillippitts.feedercontrol.domain;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * One typed measurement inside a device data frame, e.g. {@code humidity % 45.2}.
 */
public record SensorValue(String type, String unit, double value) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("type", type);
        map.put("unit", unit);
        map.put("value", value);
        return map;
    }
}
