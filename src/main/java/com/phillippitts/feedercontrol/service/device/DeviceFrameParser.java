package com.phillippitts.feedercontrol.service.device;

import com.phillippitts.feedercontrol.domain.SensorReading;
import com.phillippitts.feedercontrol.domain.SensorValue;
import org.json.JSONArray;
import org.json.JSONException;
import org.json.JSONObject;

import java.time.Clock;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;

/**
 * Turns raw device lines into {@link DeviceFrame}s.
 *
 * <p>Expected data frame, after the data prefix or as a bare JSON line:
 * <pre>
 * {"name": "DHT22_FEEDER", "value": [{"type": "humidity", "unit": "%", "value": 45.2}]}
 * </pre>
 * Safe against malformed input: anything that does not parse becomes {@link DeviceFrame.Unrecognized}.
 */
final class DeviceFrameParser {

    private final String dataPrefix;
    private final String infoPrefix;
    private final Clock clock;

    DeviceFrameParser(String dataPrefix, String infoPrefix, Clock clock) {
        this.dataPrefix = Objects.requireNonNull(dataPrefix, "dataPrefix");
        this.infoPrefix = Objects.requireNonNull(infoPrefix, "infoPrefix");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    DeviceFrame parse(String line) {
        String trimmed = line == null ? "" : line.trim();
        if (trimmed.isEmpty()) {
            return new DeviceFrame.Unrecognized("", "blank line");
        }
        if (trimmed.startsWith(dataPrefix)) {
            return parseData(trimmed, trimmed.substring(dataPrefix.length()).trim());
        }
        if (trimmed.startsWith(infoPrefix)) {
            return new DeviceFrame.InfoLine(trimmed.substring(infoPrefix.length()).trim());
        }
        if (trimmed.startsWith("{")) {
            return parseData(trimmed, trimmed);
        }
        return new DeviceFrame.Unrecognized(trimmed, "no known prefix");
    }

    private DeviceFrame parseData(String raw, String json) {
        try {
            JSONObject obj = new JSONObject(json);
            String name = obj.optString("name", "").trim();
            JSONArray values = obj.optJSONArray("value");
            if (name.isEmpty() || values == null) {
                return new DeviceFrame.Unrecognized(raw, "data frame without name or value array");
            }
            List<SensorValue> parsed = new ArrayList<>();
            for (int i = 0; i < values.length(); i++) {
                JSONObject v = values.optJSONObject(i);
                if (v == null) {
                    continue;
                }
                double value = v.optDouble("value", Double.NaN);
                String type = v.optString("type", "");
                if (type.isBlank() || Double.isNaN(value)) {
                    continue;
                }
                parsed.add(new SensorValue(type, v.optString("unit", ""), value));
            }
            return new DeviceFrame.DataFrame(new SensorReading(name, parsed, clock.instant()));
        } catch (JSONException e) {
            return new DeviceFrame.Unrecognized(raw, "malformed JSON");
        }
    }
}
