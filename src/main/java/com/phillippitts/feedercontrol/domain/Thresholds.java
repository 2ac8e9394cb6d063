package com.phillippitts.feedercontrol.domain;

import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Warning and critical thresholds of one metric. For {@link AlertMode#HIGH} critical is expected
 * above warning; for {@link AlertMode#LOW} below it.
 */
public record Thresholds(double warning, double critical) {

    public Map<String, Object> toMap() {
        Map<String, Object> map = new LinkedHashMap<>();
        map.put("warning", warning);
        map.put("critical", critical);
        return map;
    }
}
