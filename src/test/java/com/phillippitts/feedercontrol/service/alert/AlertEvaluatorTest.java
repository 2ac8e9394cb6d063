package com.phillippitts.feedercontrol.service.alert;

import com.phillippitts.feedercontrol.domain.AlertLevel;
import com.phillippitts.feedercontrol.domain.AlertMode;
import com.phillippitts.feedercontrol.domain.Thresholds;
import com.phillippitts.feedercontrol.exception.ConfigUnavailableException;
import com.phillippitts.feedercontrol.service.metrics.FeederMetrics;
import com.phillippitts.feedercontrol.service.remote.InMemoryRemoteStore;
import com.phillippitts.feedercontrol.testutil.MutableClock;
import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class AlertEvaluatorTest {

    private static final String HUMIDITY = "dht22_feeder_humidity";
    private static final Thresholds HUMIDITY_T = new Thresholds(70, 85);

    private InMemoryRemoteStore remote;
    private MutableClock clock;
    private SimpleMeterRegistry registry;
    private AlertEvaluator evaluator;

    @BeforeEach
    void setUp() {
        remote = new InMemoryRemoteStore();
        clock = new MutableClock(Instant.parse("2026-03-01T08:00:00Z"), ZoneOffset.UTC);
        registry = new SimpleMeterRegistry();
        evaluator = new AlertEvaluator(remote, new FeederMetrics(registry), clock);
    }

    @Test
    void classifiesHighMode() {
        assertThat(AlertEvaluator.classify(69.9, HUMIDITY_T, AlertMode.HIGH)).isEqualTo(AlertLevel.NORMAL);
        assertThat(AlertEvaluator.classify(70, HUMIDITY_T, AlertMode.HIGH)).isEqualTo(AlertLevel.WARNING);
        assertThat(AlertEvaluator.classify(85, HUMIDITY_T, AlertMode.HIGH)).isEqualTo(AlertLevel.CRITICAL);
    }

    @Test
    void classifiesLowMode() {
        Thresholds food = new Thresholds(3.0, 2.0);

        assertThat(AlertEvaluator.classify(3.5, food, AlertMode.LOW)).isEqualTo(AlertLevel.NORMAL);
        assertThat(AlertEvaluator.classify(3.0, food, AlertMode.LOW)).isEqualTo(AlertLevel.WARNING);
        assertThat(AlertEvaluator.classify(2.5, food, AlertMode.LOW)).isEqualTo(AlertLevel.WARNING);
        assertThat(AlertEvaluator.classify(2.0, food, AlertMode.LOW)).isEqualTo(AlertLevel.CRITICAL);
    }

    @Test
    void highModeSequenceLogsTriggerEscalateResolve() {
        List<AlertLevel> levels = new ArrayList<>();
        for (double value : new double[]{60, 75, 75, 90, 60}) {
            levels.add(evaluator.evaluate(HUMIDITY, value, HUMIDITY_T, AlertMode.HIGH));
            clock.advance(Duration.ofSeconds(1));
        }

        assertThat(levels).containsExactly(AlertLevel.NORMAL, AlertLevel.WARNING, AlertLevel.WARNING,
                AlertLevel.CRITICAL, AlertLevel.NORMAL);
        List<Map<String, Object>> logs = logs();
        assertThat(logs).extracting(e -> e.get("action")).containsExactly("trigger", "escalate", "resolve");
        String triggerKey = remote.getMap("alerts/logs").keySet().iterator().next();
        assertThat(logs.get(0)).doesNotContainKey("alert_id");
        assertThat(logs.get(1)).containsEntry("alert_id", triggerKey).containsEntry("level", "critical");
        assertThat(logs.get(2)).containsEntry("alert_id", triggerKey).containsEntry("level", "normal");
        assertThat(remote.getMap("alerts/active")).isEmpty();
    }

    @Test
    void repeatedLevelKeepsFirstSeenAndLogsNothing() {
        evaluator.evaluate(HUMIDITY, 75, HUMIDITY_T, AlertMode.HIGH);
        clock.advance(Duration.ofMinutes(1));
        evaluator.evaluate(HUMIDITY, 78, HUMIDITY_T, AlertMode.HIGH);

        Map<String, Object> record = activeRecord(HUMIDITY);
        assertThat(record)
                .containsEntry("level", "warning")
                .containsEntry("value", 78.0)
                .containsEntry("timestamp_first_seen", "2026-03-01T08:00:00Z")
                .containsEntry("last_updated", "2026-03-01T08:01:00Z")
                .containsEntry("acknowledged", false);
        assertThat(logs()).hasSize(1);
    }

    @Test
    void escalationAcknowledgesAlert() {
        evaluator.evaluate(HUMIDITY, 75, HUMIDITY_T, AlertMode.HIGH);
        evaluator.evaluate(HUMIDITY, 86, HUMIDITY_T, AlertMode.HIGH);

        String alertId = (String) activeRecord(HUMIDITY).get("alert_id");
        assertThat(activeRecord(HUMIDITY)).containsEntry("acknowledged", true);
        assertThat(remote.getMap("alerts/acknowledged").get(HUMIDITY))
                .isEqualTo(Map.of("alert_id", alertId, "acknowledged", true, "level", "critical",
                        "timestamp", "2026-03-01T08:00:00Z"));
    }

    @Test
    void criticalTriggerIsAcknowledgedFromItsSecondCycle() {
        evaluator.evaluate(HUMIDITY, 90, HUMIDITY_T, AlertMode.HIGH);

        assertThat(remote.getMap("alerts/acknowledged")).doesNotContainKey(HUMIDITY);
        assertThat(activeRecord(HUMIDITY)).containsEntry("acknowledged", false);

        clock.advance(Duration.ofSeconds(1));
        evaluator.evaluate(HUMIDITY, 91, HUMIDITY_T, AlertMode.HIGH);
        clock.advance(Duration.ofSeconds(1));
        evaluator.evaluate(HUMIDITY, 92, HUMIDITY_T, AlertMode.HIGH);

        String alertId = (String) activeRecord(HUMIDITY).get("alert_id");
        assertThat(remote.getMap("alerts/acknowledged").get(HUMIDITY))
                .isEqualTo(Map.of("alert_id", alertId, "acknowledged", true, "level", "critical",
                        "timestamp", "2026-03-01T08:00:02Z"));
        assertThat(logs()).extracting(e -> e.get("action")).containsExactly("trigger");
    }

    @Test
    void deEscalationUpdatesInPlaceWithoutLog() {
        evaluator.evaluate(HUMIDITY, 90, HUMIDITY_T, AlertMode.HIGH);
        evaluator.evaluate(HUMIDITY, 75, HUMIDITY_T, AlertMode.HIGH);

        assertThat(activeRecord(HUMIDITY)).containsEntry("level", "warning");
        assertThat(logs()).extracting(e -> e.get("action")).containsExactly("trigger");
    }

    @Test
    void lowModeSequenceForFoodWeight() {
        Map<AlertMetric, Thresholds> thresholds = new EnumMap<>(AlertMetric.class);
        List<AlertLevel> levels = new ArrayList<>();
        for (double kg : new double[]{3.5, 2.8, -1.5, 4.0}) {
            levels.add(evaluator.evaluateAll(Map.of(AlertMetric.FOOD_WEIGHT, kg), thresholds).get("food_weight"));
        }

        assertThat(levels).containsExactly(AlertLevel.NORMAL, AlertLevel.WARNING, AlertLevel.CRITICAL, AlertLevel.NORMAL);
        assertThat(logs()).extracting(e -> e.get("action")).containsExactly("trigger", "escalate", "resolve");
        assertThat(logs().get(1)).containsEntry("value", 1.5);
    }

    @Test
    void evaluateAllSkipsMetricsWithoutValues() {
        remote.set("alerts/active/soil_moisture", Map.of("alert_id", "keep-me", "level", "warning"));

        Map<String, AlertLevel> levels = evaluator.evaluateAll(
                Map.of(AlertMetric.DHT22_FEEDER_HUMIDITY, 72.0),
                Map.of(AlertMetric.DHT22_FEEDER_HUMIDITY, HUMIDITY_T));

        assertThat(levels).containsOnlyKeys(HUMIDITY);
        assertThat(remote.getMap("alerts/active")).containsKeys(HUMIDITY, "soil_moisture");
        assertThat(activeRecord("soil_moisture")).containsEntry("alert_id", "keep-me");
    }

    @Test
    void storedNormalRecordCountsAsNoAlert() {
        remote.set("alerts/active/" + HUMIDITY, Map.of("alert_id", "stale", "level", "normal"));

        evaluator.evaluate(HUMIDITY, 75, HUMIDITY_T, AlertMode.HIGH);

        assertThat(activeRecord(HUMIDITY).get("alert_id")).isNotEqualTo("stale");
        assertThat(logs()).extracting(e -> e.get("action")).containsExactly("trigger");
    }

    @Test
    void failedLogAppendStillRecordsAlert() {
        InMemoryRemoteStore noLogs = new InMemoryRemoteStore() {
            @Override
            public synchronized String push(String path, Map<String, Object> value) {
                throw new ConfigUnavailableException(path, "write refused");
            }
        };
        AlertEvaluator withoutLogs = new AlertEvaluator(noLogs, new FeederMetrics(registry), clock);

        AlertLevel level = withoutLogs.evaluate(HUMIDITY, 80, HUMIDITY_T, AlertMode.HIGH);

        assertThat(level).isEqualTo(AlertLevel.WARNING);
        Map<?, ?> record = (Map<?, ?>) noLogs.getMap("alerts/active").get(HUMIDITY);
        assertThat(record.get("alert_id")).isEqualTo(HUMIDITY + "-" + clock.instant().getEpochSecond());
    }

    @Test
    void countsLogEntriesByAction() {
        evaluator.evaluate(HUMIDITY, 75, HUMIDITY_T, AlertMode.HIGH);
        evaluator.evaluate(HUMIDITY, 50, HUMIDITY_T, AlertMode.HIGH);

        assertThat(registry.counter("feeder.alert.log", "action", "trigger").count()).isEqualTo(1.0);
        assertThat(registry.counter("feeder.alert.log", "action", "resolve").count()).isEqualTo(1.0);
    }

    @SuppressWarnings("unchecked")
    private Map<String, Object> activeRecord(String key) {
        return (Map<String, Object>) remote.getMap("alerts/active").get(key);
    }

    @SuppressWarnings("unchecked")
    private List<Map<String, Object>> logs() {
        List<Map<String, Object>> entries = new ArrayList<>();
        remote.getMap("alerts/logs").values().forEach(v -> entries.add((Map<String, Object>) v));
        return entries;
    }
}
