package com.phillippitts.feedercontrol.service.alert;

import com.phillippitts.feedercontrol.domain.AlertAction;
import com.phillippitts.feedercontrol.domain.AlertLevel;
import com.phillippitts.feedercontrol.domain.AlertLogEntry;
import com.phillippitts.feedercontrol.domain.AlertMode;
import com.phillippitts.feedercontrol.domain.AlertRecord;
import com.phillippitts.feedercontrol.domain.Thresholds;
import com.phillippitts.feedercontrol.exception.ConfigUnavailableException;
import com.phillippitts.feedercontrol.service.metrics.FeederMetrics;
import com.phillippitts.feedercontrol.service.remote.RemoteStore;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Per-metric alert state machine over the remote alert maps.
 *
 * <p>Transitions:
 * <ul>
 *   <li>normal to warning/critical: create the active record, append {@code trigger}</li>
 *   <li>warning to critical: update the record, append {@code escalate}, mark it acknowledged</li>
 *   <li>critical to warning: update the record in place, no log entry</li>
 *   <li>warning/critical to normal: remove the record, append {@code resolve}</li>
 * </ul>
 * Re-evaluating the same level appends nothing and keeps the first-seen time. Every evaluation
 * of an existing alert at critical rewrites its acknowledgement entry, so an alert triggered
 * directly at critical gets one on its next cycle.
 *
 * <p>Remote read/write failures propagate as {@link ConfigUnavailableException}; a failed log
 * append is logged and does not stop the transition.
 */
@Component
public class AlertEvaluator {

    private static final Logger LOG = LogManager.getLogger(AlertEvaluator.class);

    static final String ACTIVE_PATH = "alerts/active";
    static final String ACKNOWLEDGED_PATH = "alerts/acknowledged";
    static final String LOGS_PATH = "alerts/logs";

    private final RemoteStore remote;
    private final FeederMetrics metrics;
    private final Clock clock;

    public AlertEvaluator(RemoteStore remote, FeederMetrics metrics, Clock clock) {
        this.remote = Objects.requireNonNull(remote, "remote");
        this.metrics = Objects.requireNonNull(metrics, "metrics");
        this.clock = Objects.requireNonNull(clock, "clock");
    }

    /**
     * Level of a value: critical if the critical threshold is crossed, else warning if the warning
     * threshold is, else normal. Crossing means {@code >=} for HIGH and {@code <=} for LOW.
     */
    public static AlertLevel classify(double value, Thresholds thresholds, AlertMode mode) {
        if (crosses(value, thresholds.critical(), mode)) {
            return AlertLevel.CRITICAL;
        }
        if (crosses(value, thresholds.warning(), mode)) {
            return AlertLevel.WARNING;
        }
        return AlertLevel.NORMAL;
    }

    /**
     * Evaluates a single metric against the stored alert state and persists the outcome.
     *
     * @return the new level
     */
    public AlertLevel evaluate(String metricKey, double value, Thresholds thresholds, AlertMode mode) {
        Map<String, Object> active = new LinkedHashMap<>(remote.getMap(ACTIVE_PATH));
        Map<String, Object> acknowledged = new LinkedHashMap<>(remote.getMap(ACKNOWLEDGED_PATH));
        AlertLevel level = apply(active, acknowledged, metricKey, value, thresholds, mode, clock.instant());
        remote.set(ACTIVE_PATH, active);
        remote.set(ACKNOWLEDGED_PATH, acknowledged);
        return level;
    }

    /**
     * One monitoring cycle: reads the active and acknowledged maps once, evaluates every metric
     * that has a value, and writes both maps back once.
     *
     * @param values current value per metric; metrics without a value are left untouched
     * @param thresholds thresholds per metric; the metric's defaults are used when missing
     * @return level per evaluated metric key
     */
    public Map<String, AlertLevel> evaluateAll(Map<AlertMetric, Double> values, Map<AlertMetric, Thresholds> thresholds) {
        Map<String, Object> active = new LinkedHashMap<>(remote.getMap(ACTIVE_PATH));
        Map<String, Object> acknowledged = new LinkedHashMap<>(remote.getMap(ACKNOWLEDGED_PATH));
        Instant now = clock.instant();
        Map<String, AlertLevel> levels = new LinkedHashMap<>();
        for (AlertMetric metric : AlertMetric.values()) {
            Double raw = values.get(metric);
            if (raw == null) {
                continue;
            }
            Thresholds t = thresholds.getOrDefault(metric, metric.defaults());
            levels.put(metric.key(), apply(active, acknowledged, metric.key(), metric.normalize(raw), t, metric.mode(), now));
        }
        remote.set(ACTIVE_PATH, active);
        remote.set(ACKNOWLEDGED_PATH, acknowledged);
        return levels;
    }

    AlertLevel apply(Map<String, Object> active, Map<String, Object> acknowledged, String key,
                     double value, Thresholds thresholds, AlertMode mode, Instant now) {
        AlertLevel level = classify(value, thresholds, mode);
        AlertRecord previous = AlertRecord.fromMap(key, active.get(key), now);

        if (level == AlertLevel.NORMAL) {
            if (previous != null && previous.level() != AlertLevel.NORMAL) {
                appendLog(new AlertLogEntry(previous.alertId(), key, AlertLevel.NORMAL, value, thresholds, now,
                        AlertAction.RESOLVE));
                LOG.info("Alert resolved: metric={}, value={}, id={}", key, value, previous.alertId());
            }
            active.remove(key);
            return level;
        }

        if (previous == null || previous.level() == AlertLevel.NORMAL) {
            String logKey = appendLog(new AlertLogEntry(null, key, level, value, thresholds, now, AlertAction.TRIGGER));
            String alertId = logKey != null ? logKey : key + "-" + now.getEpochSecond();
            AlertRecord created = new AlertRecord(key, level, value, thresholds, alertId, false, now, now);
            active.put(key, created.toMap());
            LOG.warn("Alert triggered: metric={}, level={}, value={}, id={}", key, level.wireName(), value, alertId);
            return level;
        }

        boolean ack = previous.acknowledged();
        if (previous.level() == AlertLevel.WARNING && level == AlertLevel.CRITICAL) {
            appendLog(new AlertLogEntry(previous.alertId(), key, level, value, thresholds, now, AlertAction.ESCALATE));
            ack = true;
            LOG.warn("Alert escalated: metric={}, value={}, id={}", key, value, previous.alertId());
        } else if (previous.level() == AlertLevel.CRITICAL && level == AlertLevel.WARNING) {
            LOG.info("Alert de-escalated to warning: metric={}, value={}, id={}", key, value, previous.alertId());
        }
        if (level == AlertLevel.CRITICAL) {
            // refreshed on every critical evaluation of an existing alert, not only on escalation
            Map<String, Object> entry = new LinkedHashMap<>();
            entry.put("alert_id", previous.alertId());
            entry.put("acknowledged", true);
            entry.put("level", level.wireName());
            entry.put("timestamp", now.toString());
            acknowledged.put(key, entry);
        }
        active.put(key, previous.withEvaluation(level, value, thresholds, ack, now).toMap());
        return level;
    }

    /** @return generated log key, or {@code null} when the append failed */
    private String appendLog(AlertLogEntry entry) {
        try {
            String logKey = remote.push(LOGS_PATH, entry.toMap());
            metrics.incrementAlertLog(entry.action().wireName());
            return logKey == null || logKey.isBlank() ? null : logKey;
        } catch (ConfigUnavailableException e) {
            LOG.error("Failed writing alert log ({} {}): {}", entry.action().wireName(), entry.sensorKey(), e.getMessage());
            return null;
        }
    }

    private static boolean crosses(double value, double threshold, AlertMode mode) {
        return mode == AlertMode.HIGH ? value >= threshold : value <= threshold;
    }
}
