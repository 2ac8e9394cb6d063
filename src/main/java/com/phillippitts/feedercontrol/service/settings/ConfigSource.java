package com.phillippitts.feedercontrol.service.settings;

import com.phillippitts.feedercontrol.config.properties.SchedulerProperties;
import com.phillippitts.feedercontrol.domain.SchedulerSettings;
import com.phillippitts.feedercontrol.domain.Thresholds;
import com.phillippitts.feedercontrol.exception.ConfigUnavailableException;
import com.phillippitts.feedercontrol.service.alert.AlertMetric;
import com.phillippitts.feedercontrol.service.remote.RemoteStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.json.JSONException;
import org.json.JSONObject;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardCopyOption;
import java.time.Clock;
import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Source of interval settings and alert thresholds.
 *
 * <p>Lookup order: remote store ({@code app_setting}), then the local cache file, then built-in
 * defaults. Missing fields fall back one by one. Every successful remote read refreshes the
 * cache file, which looks like:
 * <pre>
 * {
 *   "app_settings": {"duration": {"syncSensors": 10, ...}, "alert": {...}},
 *   "last_updated": "2024-05-01T08:00:00Z",
 *   "source": "remote"
 * }
 * </pre>
 *
 * <p>Remote failures never escape: they are logged and the next source is used.
 */
@Component
public class ConfigSource {

    private static final Logger LOG = LogManager.getLogger(ConfigSource.class);

    static final String APP_SETTING = "app_setting";
    static final String DURATION = "duration";
    static final String ALERT = "alert";
    static final String WEIGHT_TOLERANCE_PATH = "app_setting/feeder/weight_tolerance";

    public static final int DEFAULT_WEIGHT_TOLERANCE = 5;
    public static final double DEFAULT_FAN_ACTIVATION_THRESHOLD = 30.0;

    private final RemoteStore remote;
    private final Path cacheFile;
    private final Clock clock;
    private final Object fileLock = new Object();
    private volatile Map<String, Object> lastCachedAlert = Map.of();

    public ConfigSource(RemoteStore remote, SchedulerProperties props, Clock clock) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.cacheFile = Path.of(props.getSettingsCacheFile());
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Loads interval settings. Never throws.
     */
    public SchedulerSettings loadSettings() {
        Map<String, Object> appSetting = readRemoteAppSetting();
        if (appSetting != null && appSetting.get(DURATION) instanceof Map<?, ?> duration) {
            writeCache(appSetting);
            return SchedulerSettings.fromMap(asStringMap(duration), SchedulerSettings.defaults());
        }
        Map<String, Object> cached = readCache();
        if (cached.get(DURATION) instanceof Map<?, ?> duration) {
            LOG.info("Using cached interval settings from {}", cacheFile);
            return SchedulerSettings.fromMap(asStringMap(duration), SchedulerSettings.defaults());
        }
        LOG.info("No interval settings available; using defaults");
        return SchedulerSettings.defaults();
    }

    /**
     * Loads alert thresholds for every {@link AlertMetric}. Never throws.
     */
    public Map<AlertMetric, Thresholds> loadAlertThresholds() {
        Map<String, Object> alert;
        try {
            alert = remote.getMap(APP_SETTING + "/" + ALERT);
            if (!alert.isEmpty() && !alert.equals(lastCachedAlert)) {
                mergeIntoCache(ALERT, alert);
                lastCachedAlert = alert;
            }
        } catch (ConfigUnavailableException e) {
            LOG.warn("Alert thresholds unavailable remotely, using cache/defaults: {}", e.getMessage());
            alert = readCache().get(ALERT) instanceof Map<?, ?> m ? asStringMap(m) : Map.of();
        }
        Map<AlertMetric, Thresholds> result = new EnumMap<>(AlertMetric.class);
        for (AlertMetric metric : AlertMetric.values()) {
            Map<String, Object> raw = alert.get(metric.key()) instanceof Map<?, ?> m ? asStringMap(m) : Map.of();
            result.put(metric, new Thresholds(
                    number(raw.get("warning"), metric.defaults().warning()),
                    number(raw.get("critical"), metric.defaults().critical())));
        }
        return result;
    }

    /**
     * Merges the settings into the remote {@code app_setting/duration} and refreshes the cache.
     *
     * @return {@code true} if the remote store accepted the update; the cache is written either way
     */
    public boolean saveSettings(SchedulerSettings settings) {
        Map<String, Object> appSetting;
        boolean remoteSynced = false;
        try {
            appSetting = new LinkedHashMap<>(remote.getMap(APP_SETTING));
            Map<String, Object> duration = appSetting.get(DURATION) instanceof Map<?, ?> d
                    ? new LinkedHashMap<>(asStringMap(d)) : new LinkedHashMap<>();
            duration.putAll(settings.toMap());
            appSetting.put(DURATION, duration);
            remote.set(APP_SETTING, appSetting);
            remoteSynced = true;
            LOG.info("Interval settings synced to remote store: {}", settings.toMap());
        } catch (ConfigUnavailableException e) {
            LOG.warn("Failed to sync interval settings to remote store: {}", e.getMessage());
            appSetting = new LinkedHashMap<>(readCache());
            appSetting.put(DURATION, new LinkedHashMap<>(settings.toMap()));
        }
        writeCache(appSetting, remoteSynced ? "remote" : "local");
        return remoteSynced;
    }

    /**
     * Weight tolerance in grams passed to the feeding routine. Defaults to 5.
     */
    public int feederWeightTolerance() {
        try {
            return remote.get(WEIGHT_TOLERANCE_PATH)
                    .map(v -> (int) number(v, DEFAULT_WEIGHT_TOLERANCE))
                    .orElse(DEFAULT_WEIGHT_TOLERANCE);
        } catch (ConfigUnavailableException e) {
            LOG.warn("Weight tolerance unavailable, using {}: {}", DEFAULT_WEIGHT_TOLERANCE, e.getMessage());
            return DEFAULT_WEIGHT_TOLERANCE;
        }
    }

    /**
     * Temperature at or above which automatic control turns the fan on.
     */
    public static double fanActivationThreshold(Map<String, Object> systemStatus) {
        return number(systemStatus.get("fan_activation_threshold"), DEFAULT_FAN_ACTIVATION_THRESHOLD);
    }

    private Map<String, Object> readRemoteAppSetting() {
        try {
            Map<String, Object> appSetting = remote.getMap(APP_SETTING);
            if (appSetting.isEmpty()) {
                LOG.warn("Remote store has no {} node", APP_SETTING);
                return null;
            }
            return appSetting;
        } catch (ConfigUnavailableException e) {
            LOG.warn("Interval settings unavailable remotely, falling back to cache: {}", e.getMessage());
            return null;
        }
    }

    /** Cached {@code app_setting} subtree, empty when the file is missing or unreadable. */
    Map<String, Object> readCache() {
        synchronized (fileLock) {
            if (!Files.isRegularFile(cacheFile)) {
                return Map.of();
            }
            try {
                String content = Files.readString(cacheFile, StandardCharsets.UTF_8).trim();
                if (content.isEmpty()) {
                    LOG.warn("Settings cache {} is empty", cacheFile);
                    return Map.of();
                }
                JSONObject root = new JSONObject(content);
                JSONObject appSettings = root.optJSONObject("app_settings");
                return appSettings == null ? Map.of() : appSettings.toMap();
            } catch (IOException | JSONException e) {
                LOG.error("Failed to read settings cache {}: {}", cacheFile, e.toString());
                return Map.of();
            }
        }
    }

    private void mergeIntoCache(String key, Map<String, Object> value) {
        synchronized (fileLock) {
            Map<String, Object> appSetting = new LinkedHashMap<>(readCache());
            appSetting.put(key, value);
            writeCache(appSetting);
        }
    }

    private void writeCache(Map<String, Object> appSetting) {
        writeCache(appSetting, "remote");
    }

    private void writeCache(Map<String, Object> appSetting, String source) {
        synchronized (fileLock) {
            JSONObject root = new JSONObject();
            root.put("app_settings", new JSONObject(appSetting));
            root.put("last_updated", clock.instant().toString());
            root.put("source", source);
            try {
                Path parent = cacheFile.toAbsolutePath().getParent();
                if (parent != null) {
                    Files.createDirectories(parent);
                }
                Path tmp = cacheFile.resolveSibling(cacheFile.getFileName() + ".tmp");
                Files.writeString(tmp, root.toString(2), StandardCharsets.UTF_8);
                Files.move(tmp, cacheFile, StandardCopyOption.REPLACE_EXISTING);
            } catch (IOException e) {
                LOG.error("Failed to write settings cache {}: {}", cacheFile, e.toString());
            }
        }
    }

    private static double number(Object raw, double fallback) {
        if (raw instanceof Number n) {
            return n.doubleValue();
        }
        if (raw instanceof String s) {
            try {
                return Double.parseDouble(s.trim());
            } catch (NumberFormatException e) {
                return fallback;
            }
        }
        return fallback;
    }

    private static Map<String, Object> asStringMap(Map<?, ?> raw) {
        Map<String, Object> result = new LinkedHashMap<>();
        raw.forEach((k, v) -> result.put(String.valueOf(k), v));
        return result;
    }
}
