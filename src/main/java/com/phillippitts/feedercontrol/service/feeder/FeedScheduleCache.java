package com.phillippitts.feedercontrol.service.feeder;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.Collection;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Last feed schedules and presets pulled from the remote store.
 *
 * <p>The remote lists may arrive as JSON arrays or as key-to-entry maps; both are accepted.
 * Malformed entries are skipped.
 */
@Component
public class FeedScheduleCache {

    private static final Logger LOG = LogManager.getLogger(FeedScheduleCache.class);

    private final AtomicReference<List<FeedSchedule>> schedules = new AtomicReference<>(List.of());
    private final AtomicReference<List<FeedPreset>> presets = new AtomicReference<>(List.of());

    public List<FeedSchedule> schedules() {
        return schedules.get();
    }

    public List<FeedPreset> presets() {
        return presets.get();
    }

    public Optional<FeedPreset> preset(String id) {
        return presets.get().stream().filter(p -> p.id().equals(id)).findFirst();
    }

    /** @return number of schedules kept */
    public int replaceSchedules(Object raw) {
        List<FeedSchedule> parsed = new ArrayList<>();
        for (Object item : entries(raw)) {
            if (item instanceof Map<?, ?> m && m.get("id") != null) {
                parsed.add(new FeedSchedule(
                        m.get("id").toString(),
                        m.get("time") == null ? "" : m.get("time").toString(),
                        m.get("presetId") == null ? "" : m.get("presetId").toString(),
                        Boolean.TRUE.equals(m.get("enabled"))));
            }
        }
        schedules.set(List.copyOf(parsed));
        LOG.debug("Feed schedules replaced: {}", parsed.size());
        return parsed.size();
    }

    /** @return number of presets kept */
    public int replacePresets(Object raw) {
        List<FeedPreset> parsed = new ArrayList<>();
        for (Object item : entries(raw)) {
            if (item instanceof Map<?, ?> m && m.get("id") != null) {
                int blower = 0;
                if (m.get("timing") instanceof Map<?, ?> timing) {
                    blower = intValue(timing.get("blowerDuration"));
                }
                parsed.add(new FeedPreset(m.get("id").toString(), intValue(m.get("amount")), blower));
            }
        }
        presets.set(List.copyOf(parsed));
        LOG.debug("Feed presets replaced: {}", parsed.size());
        return parsed.size();
    }

    private static Collection<?> entries(Object raw) {
        if (raw instanceof List<?> list) {
            return list;
        }
        if (raw instanceof Map<?, ?> map) {
            return map.values();
        }
        return List.of();
    }

    private static int intValue(Object raw) {
        if (raw instanceof Number n) {
            return n.intValue();
        }
        if (raw instanceof String s) {
            try {
                return (int) Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return 0;
            }
        }
        return 0;
    }
}
